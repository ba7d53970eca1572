package quest.gekko.dataflag.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.dataflag.config.DataFlagProperties;
import quest.gekko.dataflag.exception.DataFlagException;
import quest.gekko.dataflag.service.voting.VotingJudge;

/**
 * Runs the configured vote over each configured revision. Disabled unless
 * {@code dataflag.voting.schedule.cron} is set.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VotingScheduler {
    private final VotingJudge votingJudge;
    private final DataFlagProperties.Voting voting;

    @Scheduled(cron = "${dataflag.voting.schedule.cron:-}", zone = "UTC")
    public void runScheduledVotes() {
        runConfiguredVotes();
    }

    /**
     * @return number of flags created over all configured revisions
     */
    public int runConfiguredVotes() {
        DataFlagProperties.Schedule schedule = voting.schedule();
        int created = 0;
        for (String revision : schedule.revisions()) {
            try {
                created += votingJudge.runVote(schedule.mode(), revision).size();
            } catch (DataFlagException e) {
                // the next revision still gets its vote
                log.error("Scheduled {} vote on revision {} failed", schedule.mode(), revision, e);
            }
        }
        log.info("Scheduled {} votes over {} revision(s) created {} flag(s)", schedule.mode(),
                schedule.revisions().size(), created);
        return created;
    }
}
