package quest.gekko.dataflag.exception;

/**
 * A write failed and its transaction was rolled back.
 */
public class DataFlagPersistenceException extends DataFlagException {

    public DataFlagPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
