package quest.gekko.dataflag.service.voting;

import quest.gekko.dataflag.domain.DataFlagVote;
import quest.gekko.dataflag.exception.InvalidConfigurationException;
import quest.gekko.dataflag.exception.UnknownModeException;

import java.util.Arrays;
import java.util.List;

/**
 * The registered voting modes. Each mode is implemented by exactly one {@link VotingStrategy}
 * bean; adding a mode means adding a constant here and a strategy for it.
 * <p>
 * Mode names are stored on every vote, so they can't be longer than
 * {@value DataFlagVote#MAX_MODE_LENGTH} characters.
 */
public enum VotingMode {
    /** Unanimity: a single opinion is enough, a single disagreeing one vetoes the flag. */
    HYPNOTOAD("hypnotoad");

    private final String modeName;

    VotingMode(String modeName) {
        this.modeName = modeName;
    }

    public String modeName() {
        return modeName;
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(VotingMode::modeName).toList();
    }

    /**
     * Look up a mode by the name stored on votes.
     *
     * @throws InvalidConfigurationException if the name can't be stored on a vote
     * @throws UnknownModeException          if no such mode is registered
     */
    public static VotingMode fromName(String name) {
        if (name != null && name.length() > DataFlagVote.MAX_MODE_LENGTH) {
            throw new InvalidConfigurationException("Mode can't be longer than " + DataFlagVote.MAX_MODE_LENGTH
                    + " characters (len(" + name + ") is " + name.length() + ").");
        }
        return Arrays.stream(values())
                .filter(m -> m.modeName.equals(name))
                .findFirst()
                .orElseThrow(() -> new UnknownModeException("Invalid value '" + name + "' for 'mode' (choose one of "
                        + names() + ")."));
    }
}
