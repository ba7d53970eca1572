package quest.gekko.dataflag.domain;

import quest.gekko.dataflag.exception.ValidationException;

import java.math.BigInteger;
import java.util.*;

/**
 * Schema helpers for the free-form metadata map stored on flags and opinions.
 * <p>
 * Recognised keys are {@code instrument}, {@code freq}, {@code inputs}, {@code description} and
 * {@code user}. Anything else is passed through untouched.
 */
public final class FlagMetadata {
    public static final String INSTRUMENT = "instrument";
    public static final String FREQ = "freq";
    public static final String INPUTS = "inputs";
    public static final String DESCRIPTION = "description";
    public static final String USER = "user";

    /** Number of frequency channels a freq mask covers. */
    public static final int FREQ_COUNT = 1024;

    private FlagMetadata() {
    }

    /**
     * Validate the recognised keys and return a normalised copy (index lists become sorted,
     * de-duplicated lists of integers).
     */
    public static Map<String, Object> validate(Map<String, Object> metadata) {
        if (metadata == null) {
            return null;
        }
        Map<String, Object> result = new LinkedHashMap<>(metadata);

        Instrument instrument = null;
        Object rawInstrument = metadata.get(INSTRUMENT);
        if (rawInstrument != null) {
            if (!(rawInstrument instanceof String s)) {
                throw new ValidationException("instrument (" + rawInstrument + ") must be a string.");
            }
            instrument = Instrument.fromValue(s);
        }

        if (metadata.containsKey(FREQ) && metadata.get(FREQ) != null) {
            result.put(FREQ, indexList(FREQ, metadata.get(FREQ), FREQ_COUNT));
        }
        if (metadata.containsKey(INPUTS) && metadata.get(INPUTS) != null) {
            int bound = instrument == null ? Integer.MAX_VALUE : instrument.inputCount();
            result.put(INPUTS, indexList(INPUTS, metadata.get(INPUTS), bound));
        }
        return result;
    }

    /**
     * Lay the explicitly given keys over {@code base}. Returns {@code null} when there is nothing
     * to store at all.
     */
    public static Map<String, Object> compose(Map<String, Object> base, String instrument,
                                              List<Integer> freq, List<Integer> inputs) {
        Map<String, Object> result = base == null ? new LinkedHashMap<>() : new LinkedHashMap<>(base);
        if (instrument != null) {
            result.put(INSTRUMENT, instrument);
        }
        if (freq != null) {
            result.put(FREQ, freq);
        }
        if (inputs != null) {
            result.put(INPUTS, inputs);
        }
        return result.isEmpty() && base == null ? null : result;
    }

    public static String instrument(Map<String, Object> metadata) {
        return metadata == null ? null : (String) metadata.get(INSTRUMENT);
    }

    public static List<Integer> freq(Map<String, Object> metadata) {
        return intList(metadata, FREQ);
    }

    public static List<Integer> inputs(Map<String, Object> metadata) {
        return intList(metadata, INPUTS);
    }

    /**
     * Whether a flag with {@code metadata} applies to everything {@code wanted} describes. A missing
     * instrument, freq or inputs entry on the flag covers all of them.
     */
    public static boolean covers(Map<String, Object> metadata, Map<String, Object> wanted) {
        String instrument = instrument(metadata);
        if (instrument != null && !instrument.equals(instrument(wanted))) {
            return false;
        }
        return coversIndices(freq(metadata), freq(wanted))
                && (instrument == null || coversIndices(inputs(metadata), inputs(wanted)));
    }

    private static boolean coversIndices(List<Integer> have, List<Integer> wanted) {
        return have == null || (wanted != null && have.containsAll(wanted));
    }

    /** Frequencies flagged ({@code true} where the flag applies); all frequencies when none are listed. */
    public static boolean[] freqMask(Map<String, Object> metadata) {
        return mask(FREQ_COUNT, freq(metadata));
    }

    /** Inputs flagged, or {@code null} when the flag is not restricted to an instrument. */
    public static boolean[] inputMask(Map<String, Object> metadata) {
        String instrument = instrument(metadata);
        if (instrument == null) {
            return null;
        }
        return mask(Instrument.fromValue(instrument).inputCount(), inputs(metadata));
    }

    private static boolean[] mask(int size, List<Integer> indices) {
        boolean[] mask = new boolean[size];
        if (indices == null) {
            Arrays.fill(mask, true);
            return mask;
        }
        for (int index : indices) {
            mask[index] = true;
        }
        return mask;
    }

    private static List<Integer> intList(Map<String, Object> metadata, String key) {
        if (metadata == null || metadata.get(key) == null) {
            return null;
        }
        return ((List<?>) metadata.get(key)).stream()
                .map(v -> ((Number) v).intValue())
                .toList();
    }

    private static List<Integer> indexList(String key, Object raw, int bound) {
        if (!(raw instanceof Collection<?> values)) {
            throw new ValidationException(key + " argument (" + raw + ") must be list.");
        }
        SortedSet<Integer> indices = new TreeSet<>();
        for (Object value : values) {
            if (!(value instanceof Integer || value instanceof Long || value instanceof Short
                    || value instanceof Byte || value instanceof BigInteger)) {
                throw new ValidationException("Not all values of " + key + " were integers: " + raw);
            }
            long index = ((Number) value).longValue();
            if (index < 0 || index >= bound) {
                throw new ValidationException(key + " index " + index + " is out of range [0, " + bound + ").");
            }
            indices.add((int) index);
        }
        return new ArrayList<>(indices);
    }
}
