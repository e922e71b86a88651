package eu.bde.sarchannel.calibration;

import org.apache.commons.math3.util.FastMath;

import eu.bde.sarchannel.model.AzimuthTime;

/**
 * Incidence angle given by the product as a polynomial in degrees of the range pixel index,
 * constant along azimuth.
 */
public class PolynomialIncidenceAngleProvider implements IncidenceAngleProvider {

	private static final long serialVersionUID = 1L;

	private final double[] coefficients;

	public PolynomialIncidenceAngleProvider(double[] coefficients) {
		if (coefficients == null || coefficients.length == 0) {
			throw new IllegalArgumentException("incidence angle polynomial needs at least one coefficient");
		}
		this.coefficients = coefficients.clone();
	}

	@Override
	public double[] getIncidenceAngles(AzimuthTime azimuthTime, int firstSample, int samples) {
		final double[] angles = new double[samples];
		for (int i = 0; i < samples; i++) {
			final double x = firstSample + i;
			// Horner
			double degrees = 0.0;
			for (int k = coefficients.length - 1; k >= 0; k--) {
				degrees = degrees * x + coefficients[k];
			}
			angles[i] = FastMath.toRadians(degrees);
		}
		return angles;
	}

	public double[] getCoefficients() {
		return coefficients.clone();
	}
}
