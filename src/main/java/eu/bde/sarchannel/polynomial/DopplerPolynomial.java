package eu.bde.sarchannel.polynomial;

import eu.bde.sarchannel.model.AzimuthTime;

/**
 * Doppler centroid (Hz) or Doppler rate (Hz/s) surface of a channel.
 */
public class DopplerPolynomial implements CoordinateFunction {

    private static final long serialVersionUID = 1L;

    private final SortedPolyList sortedPoly;

    public DopplerPolynomial(SortedPolyList sortedPoly) {
        this.sortedPoly = sortedPoly;
    }

    @Override
    public double evaluate(AzimuthTime azimuthTime, double rangeTime) {
        return sortedPoly.evaluate(azimuthTime, rangeTime);
    }

    public SortedPolyList getSortedPoly() {
        return sortedPoly;
    }
}
