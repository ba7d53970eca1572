package quest.gekko.dataflag.service.voting;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import quest.gekko.dataflag.config.DataFlagProperties;
import quest.gekko.dataflag.domain.DataFlag;
import quest.gekko.dataflag.domain.DataFlagClient;
import quest.gekko.dataflag.domain.DataFlagType;
import quest.gekko.dataflag.domain.DataRevision;
import quest.gekko.dataflag.exception.DataFlagPersistenceException;
import quest.gekko.dataflag.exception.InvalidConfigurationException;
import quest.gekko.dataflag.service.core.CatalogService;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates opinions to data flags.
 * <p>
 * A run asks the mode's strategy what to do with the opinions of a revision and records every
 * outcome, one LSD per transaction. Nothing is kept between runs: the low-water mark is read
 * from the votes already stored. Runs for the same mode must not overlap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VotingJudge {
    private final Map<VotingMode, VotingStrategy> strategiesByMode;
    private final OpinionLedger ledger;
    private final VoteRecorder recorder;
    private final CatalogService catalogService;
    private final DataFlagProperties.Voting voting;
    private final RetryTemplate voteRetryTemplate;
    private final Clock clock;

    /**
     * Run a vote by mode and revision name.
     *
     * @return the flags created by this run
     */
    public List<DataFlag> runVote(String modeName, String revisionName) {
        VotingMode mode = VotingMode.fromName(modeName);
        DataRevision revision = catalogService.getRevision(revisionName);
        return runVote(mode, revision);
    }

    public List<DataFlag> runVote(VotingMode mode, DataRevision revision) {
        VotingStrategy strategy = strategiesByMode.get(mode);
        if (strategy == null) {
            throw new InvalidConfigurationException("No strategy registered for mode '" + mode.modeName() + "'.");
        }

        double timestamp = clock.millis() / 1000.0;
        double lowWaterMark = ledger.lowWaterMark(mode, voting.graceWindowSeconds());
        VotingRound round = new VotingRound(mode, revision, timestamp, lowWaterMark);

        List<VoteOutcome> outcomes = strategy.evaluate(round);
        if (outcomes.isEmpty()) {
            log.info("No new opinions on revision {} for {} vote", revision.getName(), mode.modeName());
            return List.of();
        }

        DataFlagClient client = catalogService.resolveClient(voting.clientName(), voting.clientVersion());
        DataFlagType flagType = outcomes.stream().anyMatch(VoteOutcome::createsFlag)
                ? catalogService.getFlagType(voting.flagType())
                : null;

        List<DataFlag> flags = new ArrayList<>();
        int votes = 0;
        for (VoteOutcome outcome : outcomes) {
            record(round, outcome, flagType, client).ifPresent(flags::add);
            votes += outcome.opinions().size();
        }
        log.info("{} vote on revision {}: {} vote(s) over {} LSD(s), {} new flag(s)", mode.modeName(),
                revision.getName(), votes, outcomes.size(), flags.size());
        return flags;
    }

    private Optional<DataFlag> record(VotingRound round, VoteOutcome outcome, DataFlagType flagType, DataFlagClient client) {
        try {
            return voteRetryTemplate.execute(ctx -> {
                if (ctx.getRetryCount() > 0) {
                    log.warn("Retrying votes on LSD {} (attempt {})", outcome.lsd(), ctx.getRetryCount() + 1);
                }
                return recorder.record(round, outcome, flagType, client);
            });
        } catch (DataAccessException | TransactionException e) {
            throw new DataFlagPersistenceException("Failed to record votes on LSD " + outcome.lsd() + " of revision "
                    + round.revision().getName() + "; earlier LSDs of this run are kept.", e);
        }
    }
}
