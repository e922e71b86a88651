package eu.bde.sarchannel.calibration;

import org.apache.commons.math3.util.FastMath;

import eu.bde.sarchannel.geometry.DegenerateGeometryException;
import eu.bde.sarchannel.metadata.RadiometricQuantity;
import eu.bde.sarchannel.model.SampleWindow;

/**
 * Beta, sigma and gamma nought conversion on amplitude samples.
 * <pre>
 *   sigma0 = beta0 * sin(theta)
 *   gamma0 = beta0 * tan(theta)
 * </pre>
 * The relations hold for intensities, so amplitudes are scaled by the square root of the factor.
 */
public class IncidenceAngleRadiometricConverter implements RadiometricConverter {

	private static final long serialVersionUID = 1L;

	@Override
	public SampleWindow convert(SampleWindow window, double[] incidenceAngles, RadiometricQuantity input,
			RadiometricQuantity output) {
		if (input == output) {
			return window;
		}
		if (incidenceAngles.length != window.getSamples()) {
			throw new IllegalArgumentException("expected " + window.getSamples() + " incidence angles, got "
					+ incidenceAngles.length);
		}
		final double[] factors = new double[incidenceAngles.length];
		for (int i = 0; i < factors.length; i++) {
			final double theta = incidenceAngles[i];
			if (Double.isNaN(theta) || theta <= 0 || theta >= FastMath.PI / 2) {
				throw new DegenerateGeometryException("incidence angle " + theta + " at range sample "
						+ (window.getFirstSample() + i));
			}
			factors[i] = FastMath.sqrt(toBetaNought(input, theta) * fromBetaNought(output, theta));
		}
		return window.scaleBySample(factors);
	}

	/**
	 * Intensity factor from {@code quantity} to beta nought.
	 */
	static double toBetaNought(RadiometricQuantity quantity, double theta) {
		switch (quantity) {
		case SIGMA_NOUGHT:
			return 1.0 / FastMath.sin(theta);
		case GAMMA_NOUGHT:
			return 1.0 / FastMath.tan(theta);
		default:
			return 1.0;
		}
	}

	static double fromBetaNought(RadiometricQuantity quantity, double theta) {
		switch (quantity) {
		case SIGMA_NOUGHT:
			return FastMath.sin(theta);
		case GAMMA_NOUGHT:
			return FastMath.tan(theta);
		default:
			return 1.0;
		}
	}
}
