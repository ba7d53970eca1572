package quest.gekko.dataflag.service.voting;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.retry.support.RetryTemplate;
import quest.gekko.dataflag.config.DataFlagProperties;
import quest.gekko.dataflag.domain.*;
import quest.gekko.dataflag.exception.DataFlagPersistenceException;
import quest.gekko.dataflag.exception.InvalidConfigurationException;
import quest.gekko.dataflag.exception.NotFoundException;
import quest.gekko.dataflag.exception.UnknownModeException;
import quest.gekko.dataflag.service.core.CatalogService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VotingJudgeTest {

    @Mock
    private VotingStrategy strategy;
    @Mock
    private OpinionLedger ledger;
    @Mock
    private VoteRecorder recorder;
    @Mock
    private CatalogService catalogService;

    private final DataFlagProperties.Voting voting = new DataFlagProperties.Voting(Duration.ofSeconds(60), "vote",
            "data-flag-voting", "0.1.0", 3, Duration.ofMillis(1),
            new DataFlagProperties.Schedule("-", "hypnotoad", List.of()));
    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(1_700_000_000), ZoneOffset.UTC);

    private VotingJudge judge;
    private DataRevision revision;
    private DataFlagClient client;
    private DataFlagType flagType;

    @BeforeEach
    void setUp() {
        RetryTemplate retryTemplate = RetryTemplate.builder()
                .maxAttempts(voting.maxAttempts())
                .fixedBackoff(1)
                .retryOn(TransientDataAccessException.class)
                .build();
        judge = new VotingJudge(Map.of(VotingMode.HYPNOTOAD, strategy), ledger, recorder, catalogService, voting,
                retryTemplate, clock);

        revision = new DataRevision();
        revision.setId(1L);
        revision.setName("rev_00");
        client = new DataFlagClient();
        client.setId(5L);
        flagType = new DataFlagType();
        flagType.setId(6L);
        flagType.setName("vote");
    }

    @Test
    void roundCarriesClockAndLowWaterMark() {
        when(ledger.lowWaterMark(VotingMode.HYPNOTOAD, 60.0)).thenReturn(1234.5);
        when(strategy.evaluate(any())).thenReturn(List.of());

        assertThat(judge.runVote(VotingMode.HYPNOTOAD, revision)).isEmpty();

        ArgumentCaptor<VotingRound> round = ArgumentCaptor.forClass(VotingRound.class);
        verify(strategy).evaluate(round.capture());
        assertThat(round.getValue().timestamp()).isEqualTo(1_700_000_000.0);
        assertThat(round.getValue().lowWaterMark()).isEqualTo(1234.5);
        assertThat(round.getValue().revision()).isSameAs(revision);
        verifyNoInteractions(recorder);
        verify(catalogService, never()).resolveClient(any(), any());
    }

    @Test
    void returnsOnlyNewlyCreatedFlags() {
        DataFlag created = new DataFlag();
        DataFlag reused = new DataFlag();
        VoteOutcome fresh = VoteOutcome.newFlag(1, List.of(new DataFlagOpinion()), new FlagDraft(1, 2.0, Map.of()));
        VoteOutcome again = VoteOutcome.existingFlag(2, List.of(new DataFlagOpinion()), reused);
        VoteOutcome none = VoteOutcome.noFlag(3, List.of(new DataFlagOpinion(), new DataFlagOpinion()));
        when(strategy.evaluate(any())).thenReturn(List.of(fresh, again, none));
        when(catalogService.resolveClient("data-flag-voting", "0.1.0")).thenReturn(client);
        when(catalogService.getFlagType("vote")).thenReturn(flagType);
        when(recorder.record(any(), eq(fresh), eq(flagType), eq(client))).thenReturn(Optional.of(created));
        when(recorder.record(any(), eq(again), eq(flagType), eq(client))).thenReturn(Optional.empty());
        when(recorder.record(any(), eq(none), eq(flagType), eq(client))).thenReturn(Optional.empty());

        assertThat(judge.runVote(VotingMode.HYPNOTOAD, revision)).containsExactly(created);
    }

    @Test
    void flagTypeIsOnlyNeededWhenAFlagIsCreated() {
        VoteOutcome none = VoteOutcome.noFlag(3, List.of(new DataFlagOpinion()));
        when(strategy.evaluate(any())).thenReturn(List.of(none));
        when(catalogService.resolveClient(any(), any())).thenReturn(client);
        when(recorder.record(any(), eq(none), isNull(), eq(client))).thenReturn(Optional.empty());

        assertThat(judge.runVote(VotingMode.HYPNOTOAD, revision)).isEmpty();
        verify(catalogService, never()).getFlagType(any());
    }

    @Test
    void missingFlagTypeFailsBeforeAnyWrite() {
        VoteOutcome fresh = VoteOutcome.newFlag(1, List.of(new DataFlagOpinion()), new FlagDraft(1, 2.0, Map.of()));
        when(strategy.evaluate(any())).thenReturn(List.of(fresh));
        when(catalogService.resolveClient(any(), any())).thenReturn(client);
        when(catalogService.getFlagType("vote")).thenThrow(NotFoundException.of("Flag type", "vote"));

        assertThatThrownBy(() -> judge.runVote(VotingMode.HYPNOTOAD, revision)).isInstanceOf(NotFoundException.class);
        verifyNoInteractions(recorder);
    }

    @Test
    void transientFailuresAreRetried() {
        DataFlag created = new DataFlag();
        VoteOutcome fresh = VoteOutcome.newFlag(1, List.of(new DataFlagOpinion()), new FlagDraft(1, 2.0, Map.of()));
        when(strategy.evaluate(any())).thenReturn(List.of(fresh));
        when(catalogService.resolveClient(any(), any())).thenReturn(client);
        when(catalogService.getFlagType("vote")).thenReturn(flagType);
        when(recorder.record(any(), eq(fresh), eq(flagType), eq(client)))
                .thenThrow(new TransientDataAccessResourceException("serialization failure"))
                .thenReturn(Optional.of(created));

        assertThat(judge.runVote(VotingMode.HYPNOTOAD, revision)).containsExactly(created);
        verify(recorder, times(2)).record(any(), eq(fresh), eq(flagType), eq(client));
    }

    @Test
    void persistentFailureStopsTheRunAndKeepsEarlierLsds() {
        VoteOutcome first = VoteOutcome.noFlag(1, List.of(new DataFlagOpinion()));
        VoteOutcome second = VoteOutcome.noFlag(2, List.of(new DataFlagOpinion()));
        VoteOutcome third = VoteOutcome.noFlag(3, List.of(new DataFlagOpinion()));
        when(strategy.evaluate(any())).thenReturn(List.of(first, second, third));
        when(catalogService.resolveClient(any(), any())).thenReturn(client);
        when(recorder.record(any(), eq(first), isNull(), eq(client))).thenReturn(Optional.empty());
        when(recorder.record(any(), eq(second), isNull(), eq(client)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThatThrownBy(() -> judge.runVote(VotingMode.HYPNOTOAD, revision))
                .isInstanceOf(DataFlagPersistenceException.class)
                .hasMessageContaining("LSD 2")
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
        verify(recorder, times(1)).record(any(), eq(second), isNull(), eq(client));
        verify(recorder, never()).record(any(), eq(third), any(), any());
    }

    @Test
    void unknownModeFailsBeforeTouchingTheLedger() {
        assertThatThrownBy(() -> judge.runVote("majority", "rev_00")).isInstanceOf(UnknownModeException.class);
        assertThatThrownBy(() -> judge.runVote("m".repeat(40), "rev_00")).isInstanceOf(InvalidConfigurationException.class);
        verifyNoInteractions(ledger, recorder, catalogService, strategy);
    }

    @Test
    void modeWithoutStrategyIsAConfigurationError() {
        VotingJudge unconfigured = new VotingJudge(Map.of(), ledger, recorder, catalogService, voting,
                new RetryTemplate(), clock);

        assertThatThrownBy(() -> unconfigured.runVote(VotingMode.HYPNOTOAD, revision))
                .isInstanceOf(InvalidConfigurationException.class);
        verifyNoInteractions(ledger, recorder);
    }
}
