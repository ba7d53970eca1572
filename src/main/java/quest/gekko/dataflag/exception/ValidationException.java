package quest.gekko.dataflag.exception;

/**
 * Input rejected before anything was written.
 */
public class ValidationException extends DataFlagException {

    public ValidationException(String message) {
        super(message);
    }
}
