package quest.gekko.dataflag.domain;

import quest.gekko.dataflag.exception.ValidationException;

import java.util.Arrays;

/**
 * Instruments a flag can be restricted to, with the size of their input (feed) mask.
 */
public enum Instrument {
    CHIME("chime", 2048),
    PATHFINDER("pathfinder", 256);

    private final String value;
    private final int inputCount;

    Instrument(String value, int inputCount) {
        this.value = value;
        this.inputCount = inputCount;
    }

    public String value() {
        return value;
    }

    public int inputCount() {
        return inputCount;
    }

    public static Instrument fromValue(String value) {
        return Arrays.stream(values())
                .filter(i -> i.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown instrument '" + value + "'. Choose one of "
                        + Arrays.stream(values()).map(Instrument::value).toList()));
    }
}
