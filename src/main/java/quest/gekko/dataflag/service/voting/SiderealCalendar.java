package quest.gekko.dataflag.service.voting;

/**
 * Converts local sidereal days to UNIX time with a fixed epoch (the start of LSD 0) and a fixed
 * sidereal day length.
 */
public class SiderealCalendar {
    private final double epoch;
    private final double dayLength;

    public SiderealCalendar(double epoch, double dayLength) {
        if (dayLength <= 0) {
            throw new IllegalArgumentException("Sidereal day length must be positive, got " + dayLength);
        }
        this.epoch = epoch;
        this.dayLength = dayLength;
    }

    /** UNIX time at which the (possibly fractional) LSD starts. */
    public double toUnix(double lsd) {
        return epoch + lsd * dayLength;
    }
}
