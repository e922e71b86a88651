package eu.bde.sarchannel.model;

import java.io.Serializable;

/**
 * Extent of one burst in (azimuth time, range time) space: {@code [azimuthStart, azimuthStop) x [rangeStart, rangeStop)}.
 */
public final class BurstRectangle implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int index;
    private final AzimuthTime azimuthStart;
    private final AzimuthTime azimuthStop;
    private final double rangeStart;
    private final double rangeStop;

    public BurstRectangle(int index, AzimuthTime azimuthStart, AzimuthTime azimuthStop, double rangeStart,
            double rangeStop) {
        this.index = index;
        this.azimuthStart = azimuthStart;
        this.azimuthStop = azimuthStop;
        this.rangeStart = rangeStart;
        this.rangeStop = rangeStop;
    }

    public boolean contains(TimeCoordinate coordinate) {
        return contains(coordinate.getAzimuthTime(), coordinate.getRangeTime());
    }

    public boolean contains(AzimuthTime azimuthTime, double rangeTime) {
        return azimuthTime.compareTo(azimuthStart) >= 0 && azimuthTime.isBefore(azimuthStop)
                && rangeTime >= rangeStart && rangeTime < rangeStop;
    }

    public TimeCoordinate getCenter() {
        double azimuthHalf = azimuthStop.minus(azimuthStart) / 2;
        return new TimeCoordinate(azimuthStart.plus(azimuthHalf), (rangeStop - rangeStart) / 2 + rangeStart);
    }

    public int getIndex() {
        return index;
    }

    public AzimuthTime getAzimuthStart() {
        return azimuthStart;
    }

    public AzimuthTime getAzimuthStop() {
        return azimuthStop;
    }

    public double getRangeStart() {
        return rangeStart;
    }

    public double getRangeStop() {
        return rangeStop;
    }

    @Override
    public String toString() {
        return "burst " + index + " [" + azimuthStart + ", " + azimuthStop + ") x [" + rangeStart + ", " + rangeStop + ")";
    }
}
