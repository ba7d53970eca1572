package quest.gekko.dataflag.service.voting;

import quest.gekko.dataflag.domain.DataFlag;
import quest.gekko.dataflag.domain.DataFlagOpinion;

import java.util.List;

/**
 * What a strategy decided for the opinions of one LSD. Every opinion gets a vote; the votes
 * point at {@code newFlag} once created, at {@code existingFlag}, or at nothing.
 */
public record VoteOutcome(int lsd, List<DataFlagOpinion> opinions, FlagDraft newFlag, DataFlag existingFlag) {

    public static VoteOutcome noFlag(int lsd, List<DataFlagOpinion> opinions) {
        return new VoteOutcome(lsd, opinions, null, null);
    }

    public static VoteOutcome newFlag(int lsd, List<DataFlagOpinion> opinions, FlagDraft draft) {
        return new VoteOutcome(lsd, opinions, draft, null);
    }

    public static VoteOutcome existingFlag(int lsd, List<DataFlagOpinion> opinions, DataFlag flag) {
        return new VoteOutcome(lsd, opinions, null, flag);
    }

    public boolean createsFlag() {
        return newFlag != null;
    }
}
