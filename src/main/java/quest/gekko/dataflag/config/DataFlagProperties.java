package quest.gekko.dataflag.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for voting, the sidereal calendar and admin access
 */
@Configuration
@EnableConfigurationProperties({
        DataFlagProperties.Voting.class,
        DataFlagProperties.Sidereal.class,
        DataFlagProperties.Security.class
})
public class DataFlagProperties {

    /**
     * @param graceWindow   how far before the last vote a run still looks for edited opinions
     * @param flagType      flag type given to flags created by votes
     * @param clientName    client recorded on votes
     * @param clientVersion client version recorded on votes
     * @param maxAttempts   attempts per LSD when the database reports a transient failure
     * @param retryBackoff  pause between those attempts
     */
    @ConfigurationProperties("dataflag.voting")
    public record Voting(@DefaultValue("60s") Duration graceWindow,
                         @DefaultValue("vote") String flagType,
                         @DefaultValue("data-flag-voting") String clientName,
                         @DefaultValue("0.1.0") String clientVersion,
                         @DefaultValue("3") int maxAttempts,
                         @DefaultValue("500ms") Duration retryBackoff,
                         @DefaultValue Schedule schedule) {

        public double graceWindowSeconds() {
            return graceWindow.toMillis() / 1000.0;
        }
    }

    /** Scheduled runs; a cron of "-" disables them. */
    public record Schedule(@DefaultValue("-") String cron,
                           @DefaultValue("hypnotoad") String mode,
                           @DefaultValue List<String> revisions) {}

    /** LSD zero as a UNIX time, and the length of one sidereal day in seconds. */
    @ConfigurationProperties("dataflag.sidereal")
    public record Sidereal(@DefaultValue("1384489290.908534") double epoch,
                           @DefaultValue("86164.0905") double dayLength) {}

    @ConfigurationProperties("security.admin")
    public record Security(String username, String password) {}
}
