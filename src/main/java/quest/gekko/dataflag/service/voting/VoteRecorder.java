package quest.gekko.dataflag.service.voting;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.dataflag.domain.*;
import quest.gekko.dataflag.repository.*;
import quest.gekko.dataflag.service.core.FlagService;

import java.util.Optional;

/**
 * Writes the outcome for one LSD: the flag (if any), one vote per opinion and the vote-opinion
 * links, all in their own transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VoteRecorder {
    private final FlagService flagService;
    private final DataFlagRepository flagRepository;
    private final DataFlagTypeRepository flagTypeRepository;
    private final DataFlagClientRepository clientRepository;
    private final DataRevisionRepository revisionRepository;
    private final DataFlagOpinionRepository opinionRepository;
    private final DataFlagVoteRepository voteRepository;
    private final DataFlagVoteOpinionRepository voteOpinionRepository;

    /**
     * @return the flag created for this outcome, empty if none was created
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<DataFlag> record(VotingRound round, VoteOutcome outcome, DataFlagType flagType, DataFlagClient client) {
        DataFlag flag = null;
        if (outcome.createsFlag()) {
            FlagDraft draft = outcome.newFlag();
            DataFlagType type = flagTypeRepository.findById(flagType.getId()).orElseThrow();
            flag = flagService.createFlag(type, draft.startTime(), draft.finishTime(), draft.metadata());
        } else if (outcome.existingFlag() != null) {
            flag = flagRepository.getReferenceById(outcome.existingFlag().getId());
        }

        DataFlagClient voteClient = clientRepository.getReferenceById(client.getId());
        DataRevision revision = revisionRepository.getReferenceById(round.revision().getId());
        for (DataFlagOpinion opinion : outcome.opinions()) {
            DataFlagVote vote = new DataFlagVote();
            vote.setTime(round.timestamp());
            vote.setMode(round.mode().modeName());
            vote.setClient(voteClient);
            vote.setRevision(revision);
            vote.setFlag(flag);
            vote.setLsd(outcome.lsd());
            vote = voteRepository.save(vote);
            markConsidered(opinion, vote);
        }

        log.debug("Recorded {} vote(s) on LSD {} of revision {}{}", outcome.opinions().size(), outcome.lsd(),
                round.revision().getName(), flag == null ? "" : " for flag " + flag.getId());
        return outcome.createsFlag() ? Optional.of(flag) : Optional.empty();
    }

    private void markConsidered(DataFlagOpinion opinion, DataFlagVote vote) {
        voteOpinionRepository.save(new DataFlagVoteOpinion(vote, opinionRepository.getReferenceById(opinion.getId())));
    }
}
