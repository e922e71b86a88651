package eu.bde.sarchannel.model;

import java.io.Serializable;

/**
 * An (azimuth time, range time) pair. Range time is the two-way slant range time in seconds.
 */
public final class TimeCoordinate implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AzimuthTime azimuthTime;
    private final double rangeTime;

    public TimeCoordinate(AzimuthTime azimuthTime, double rangeTime) {
        this.azimuthTime = azimuthTime;
        this.rangeTime = rangeTime;
    }

    public AzimuthTime getAzimuthTime() {
        return azimuthTime;
    }

    public double getRangeTime() {
        return rangeTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeCoordinate)) {
            return false;
        }
        TimeCoordinate that = (TimeCoordinate) o;
        return azimuthTime.equals(that.azimuthTime) && Double.compare(rangeTime, that.rangeTime) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * azimuthTime.hashCode() + Double.hashCode(rangeTime);
    }

    @Override
    public String toString() {
        return "(" + azimuthTime + ", " + rangeTime + ")";
    }
}
