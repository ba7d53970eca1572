package quest.gekko.dataflag.exception;

/**
 * Voting set up in a way that can never work, e.g. a mode name that does not fit the vote table.
 */
public class InvalidConfigurationException extends DataFlagException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
