package quest.gekko.dataflag.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import quest.gekko.dataflag.domain.DataFlagVote;
import quest.gekko.dataflag.exception.InvalidConfigurationException;
import quest.gekko.dataflag.service.voting.SiderealCalendar;
import quest.gekko.dataflag.service.voting.VotingMode;
import quest.gekko.dataflag.service.voting.VotingStrategy;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Configuration
public class VotingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SiderealCalendar siderealCalendar(DataFlagProperties.Sidereal sidereal) {
        return new SiderealCalendar(sidereal.epoch(), sidereal.dayLength());
    }

    /** Every mode must have exactly one strategy and a name that fits the vote table. */
    @Bean
    public Map<VotingMode, VotingStrategy> strategiesByMode(List<VotingStrategy> strategies) {
        Map<VotingMode, VotingStrategy> byMode = strategies.stream()
                .collect(Collectors.toMap(VotingStrategy::mode, Function.identity(),
                        (a, b) -> {
                            throw new InvalidConfigurationException("Two strategies for mode '" + a.mode().modeName() + "'.");
                        },
                        () -> new EnumMap<>(VotingMode.class)));
        for (VotingMode mode : VotingMode.values()) {
            if (mode.modeName().length() > DataFlagVote.MAX_MODE_LENGTH) {
                throw new InvalidConfigurationException("Mode name '" + mode.modeName() + "' is longer than "
                        + DataFlagVote.MAX_MODE_LENGTH + " characters.");
            }
            if (!byMode.containsKey(mode)) {
                throw new InvalidConfigurationException("No strategy registered for mode '" + mode.modeName() + "'.");
            }
        }
        return byMode;
    }

    @Bean
    public RetryTemplate voteRetryTemplate(DataFlagProperties.Voting voting) {
        return RetryTemplate.builder()
                .maxAttempts(voting.maxAttempts())
                .fixedBackoff(voting.retryBackoff().toMillis())
                .retryOn(TransientDataAccessException.class)
                .build();
    }
}
