package quest.gekko.dataflag.service.voting;

import java.util.List;

public interface VotingStrategy {
    VotingMode mode();

    /**
     * Decide what this round does with the opinions it finds. Must not write anything; the
     * returned outcomes are recorded one LSD at a time by the caller.
     */
    List<VoteOutcome> evaluate(VotingRound round);
}
