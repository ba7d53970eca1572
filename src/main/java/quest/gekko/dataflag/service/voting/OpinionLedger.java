package quest.gekko.dataflag.service.voting;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.dataflag.domain.DataFlag;
import quest.gekko.dataflag.domain.DataFlagOpinion;
import quest.gekko.dataflag.domain.DataRevision;
import quest.gekko.dataflag.domain.Decision;
import quest.gekko.dataflag.repository.DataFlagOpinionRepository;
import quest.gekko.dataflag.repository.DataFlagVoteRepository;

import java.util.List;
import java.util.Optional;

/**
 * Read side of opinions and votes used by the voting strategies.
 */
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OpinionLedger {
    private final DataFlagOpinionRepository opinionRepository;
    private final DataFlagVoteRepository voteRepository;

    /**
     * Time of the last vote in this mode (of any revision) minus the grace window, or 0 if the
     * mode never voted.
     */
    public double lowWaterMark(VotingMode mode, double graceWindowSeconds) {
        Double lastVoteTime = voteRepository.findLastVoteTime(mode.modeName());
        return lastVoteTime == null ? 0 : lastVoteTime - graceWindowSeconds;
    }

    /**
     * Opinions of the revision edited at or after {@code minLastEdit} that no vote of this mode
     * has considered since their last edit.
     */
    public List<DataFlagOpinion> listOpinions(DataRevision revision, double minLastEdit, VotingMode mode) {
        return opinionRepository.findUnconsidered(revision, minLastEdit, mode.modeName());
    }

    /** Opinions on the same LSD and revision whose decision differs from {@code excludeDecision}. */
    public long countConflicting(int lsd, DataRevision revision, Decision excludeDecision) {
        return opinionRepository.countConflicting(lsd, revision, excludeDecision);
    }

    /** The flag an earlier vote of this mode produced for the LSD, if any. */
    public Optional<DataFlag> findVotedFlag(VotingMode mode, DataRevision revision, int lsd) {
        return voteRepository.findVotedFlags(mode.modeName(), revision, lsd).stream().findFirst();
    }
}
