package quest.gekko.dataflag.exception;

public class NotFoundException extends DataFlagException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String what, Object key) {
        return new NotFoundException(what + " '" + key + "' not found.");
    }
}
