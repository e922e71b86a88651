package eu.bde.sarchannel.model;

import java.io.Serializable;

/**
 * Raster position with sub-pixel precision.
 */
public final class PixelCoordinate implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double azimuthIndex;
    private final double rangeIndex;

    public PixelCoordinate(double azimuthIndex, double rangeIndex) {
        this.azimuthIndex = azimuthIndex;
        this.rangeIndex = rangeIndex;
    }

    public double getAzimuthIndex() {
        return azimuthIndex;
    }

    public double getRangeIndex() {
        return rangeIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PixelCoordinate)) {
            return false;
        }
        PixelCoordinate that = (PixelCoordinate) o;
        return Double.compare(azimuthIndex, that.azimuthIndex) == 0 && Double.compare(rangeIndex, that.rangeIndex) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(azimuthIndex) + Double.hashCode(rangeIndex);
    }

    @Override
    public String toString() {
        return "(" + azimuthIndex + ", " + rangeIndex + ")";
    }
}
