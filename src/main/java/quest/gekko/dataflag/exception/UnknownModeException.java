package quest.gekko.dataflag.exception;

public class UnknownModeException extends DataFlagException {

    public UnknownModeException(String message) {
        super(message);
    }
}
