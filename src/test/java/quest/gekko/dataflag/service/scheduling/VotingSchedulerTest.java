package quest.gekko.dataflag.service.scheduling;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.dataflag.config.DataFlagProperties;
import quest.gekko.dataflag.domain.DataFlag;
import quest.gekko.dataflag.exception.NotFoundException;
import quest.gekko.dataflag.service.voting.VotingJudge;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VotingSchedulerTest {

    @Mock
    private VotingJudge votingJudge;

    @Test
    void votesOnEveryConfiguredRevision() {
        VotingScheduler scheduler = new VotingScheduler(votingJudge, voting("rev_00", "rev_01"));
        when(votingJudge.runVote("hypnotoad", "rev_00")).thenReturn(List.of(new DataFlag(), new DataFlag()));
        when(votingJudge.runVote("hypnotoad", "rev_01")).thenReturn(List.of(new DataFlag()));

        assertThat(scheduler.runConfiguredVotes()).isEqualTo(3);
    }

    @Test
    void failingRevisionDoesNotStopTheOthers() {
        VotingScheduler scheduler = new VotingScheduler(votingJudge, voting("gone", "rev_00"));
        when(votingJudge.runVote("hypnotoad", "gone")).thenThrow(NotFoundException.of("Revision", "gone"));
        when(votingJudge.runVote("hypnotoad", "rev_00")).thenReturn(List.of(new DataFlag()));

        scheduler.runScheduledVotes();

        verify(votingJudge).runVote("hypnotoad", "rev_00");
    }

    @Test
    void nothingConfiguredNothingRun() {
        VotingScheduler scheduler = new VotingScheduler(votingJudge, voting());

        assertThat(scheduler.runConfiguredVotes()).isZero();
        verifyNoInteractions(votingJudge);
    }

    private static DataFlagProperties.Voting voting(String... revisions) {
        return new DataFlagProperties.Voting(Duration.ofSeconds(60), "vote", "data-flag-voting", "0.1.0", 3,
                Duration.ofMillis(1), new DataFlagProperties.Schedule("0 0 * * * *", "hypnotoad", List.of(revisions)));
    }
}
