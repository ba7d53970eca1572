package quest.gekko.dataflag.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import quest.gekko.dataflag.exception.ValidationException;

import java.util.Arrays;
import java.util.List;

public enum Decision {
    GOOD("good"),
    BAD("bad"),
    UNSURE("unsure");

    private final String value;

    Decision(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(Decision::value).toList();
    }

    @JsonCreator
    public static Decision fromValue(String value) {
        if (value != null) {
            for (Decision d : values()) {
                if (d.value.equals(value)) {
                    return d;
                }
            }
        }
        throw new ValidationException("Invalid value '" + value + "' for 'decision'. Choose one of " + names());
    }
}
