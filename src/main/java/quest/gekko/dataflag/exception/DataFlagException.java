package quest.gekko.dataflag.exception;

/**
 * Base class of all errors raised by the flag, opinion and voting services.
 */
public class DataFlagException extends RuntimeException {

    public DataFlagException(String message) {
        super(message);
    }

    public DataFlagException(String message, Throwable cause) {
        super(message, cause);
    }
}
