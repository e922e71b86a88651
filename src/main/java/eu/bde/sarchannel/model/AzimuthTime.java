package eu.bde.sarchannel.model;

import java.io.Serializable;
import java.util.Locale;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

/**
 * Absolute azimuth time with sub-nanosecond resolution.
 * <p>
 * Stored as whole seconds since {@link #REFERENCE_EPOCH} plus a fractional second in [0, 1),
 * so that adding a multiple of the line step to a burst start time and taking it away again
 * gives back the same value.
 */
public final class AzimuthTime implements Comparable<AzimuthTime>, Serializable {

    private static final long serialVersionUID = 1L;

    public static final DateTime REFERENCE_EPOCH = new DateTime(1985, 1, 1, 0, 0, 0, 0, DateTimeZone.UTC);

    private static final DateTimeFormatter UTC_FORMAT = DateTimeFormat.forPattern("dd-MMM-yyyy HH:mm:ss")
            .withZoneUTC().withLocale(Locale.ENGLISH);

    private final long seconds;
    private final double fraction;

    private AzimuthTime(long seconds, double fraction) {
        double whole = Math.floor(fraction);
        long s = seconds + (long) whole;
        double f = fraction - whole;
        if (f >= 1.0) {
            s += 1;
            f -= 1.0;
        }
        this.seconds = s;
        this.fraction = f;
    }

    public static AzimuthTime of(long seconds, double fraction) {
        if (Double.isNaN(fraction) || Double.isInfinite(fraction)) {
            throw new IllegalArgumentException("fraction must be finite: " + fraction);
        }
        return new AzimuthTime(seconds, fraction);
    }

    /**
     * @param secondsFromEpoch seconds elapsed since the 1985-01-01 reference epoch
     */
    public static AzimuthTime fromSeconds(double secondsFromEpoch) {
        return of(0L, 0.0).plus(secondsFromEpoch);
    }

    public static AzimuthTime fromDateTime(DateTime dateTime) {
        long millis = dateTime.getMillis() - REFERENCE_EPOCH.getMillis();
        return new AzimuthTime(Math.floorDiv(millis, 1000L), Math.floorMod(millis, 1000L) / 1000.0);
    }

    /**
     * Parses UTC strings of the form {@code 01-JAN-2000 00:00:01.000000}.
     */
    public static AzimuthTime parse(String utc) {
        String text = utc.trim();
        String fractionDigits = null;
        int dot = text.lastIndexOf('.');
        if (dot > text.lastIndexOf(':')) {
            fractionDigits = text.substring(dot + 1);
            text = text.substring(0, dot);
        }
        DateTime dateTime = UTC_FORMAT.parseDateTime(text);
        AzimuthTime time = fromDateTime(dateTime);
        if (fractionDigits != null && !fractionDigits.isEmpty()) {
            time = time.plus(Double.parseDouble("0." + fractionDigits));
        }
        return time;
    }

    public AzimuthTime plus(double deltaSeconds) {
        double whole = Math.floor(deltaSeconds);
        return new AzimuthTime(seconds + (long) whole, fraction + (deltaSeconds - whole));
    }

    /**
     * @return this time minus {@code other}, in seconds
     */
    public double minus(AzimuthTime other) {
        return (seconds - other.seconds) + (fraction - other.fraction);
    }

    public boolean isBefore(AzimuthTime other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(AzimuthTime other) {
        return compareTo(other) > 0;
    }

    public long getSeconds() {
        return seconds;
    }

    public double getFraction() {
        return fraction;
    }

    public DateTime toDateTime() {
        return REFERENCE_EPOCH.plus(seconds * 1000L + Math.round(fraction * 1000.0));
    }

    @Override
    public int compareTo(AzimuthTime other) {
        int cmp = Long.compare(seconds, other.seconds);
        return cmp != 0 ? cmp : Double.compare(fraction, other.fraction);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AzimuthTime)) {
            return false;
        }
        AzimuthTime that = (AzimuthTime) o;
        return seconds == that.seconds && Double.compare(fraction, that.fraction) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(seconds) + Double.hashCode(fraction);
    }

    @Override
    public String toString() {
        String digits = String.format(Locale.ROOT, "%.12f", fraction);
        // fraction is < 1, but rounding to 12 digits may still carry
        if (digits.startsWith("1")) {
            return REFERENCE_EPOCH.plus((seconds + 1) * 1000L).toString(UTC_FORMAT).toUpperCase(Locale.ROOT)
                    + ".000000000000";
        }
        return REFERENCE_EPOCH.plus(seconds * 1000L).toString(UTC_FORMAT).toUpperCase(Locale.ROOT)
                + digits.substring(1);
    }
}
