package eu.bde.sarchannel.polynomial;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/**
 * Azimuth antenna steering rate, {@code k0 + k1 dt + k2 dt^2} (rad/s) with dt in seconds from the
 * start of the burst.
 */
public class SteeringRatePolynomial implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final SteeringRatePolynomial ZERO = new SteeringRatePolynomial(new double[] { 0.0, 0.0, 0.0 });

    private final double[] coefficients;

    public SteeringRatePolynomial(double[] coefficients) {
        checkArgument(coefficients.length == 3, "steering rate needs 3 coefficients, got %s", coefficients.length);
        this.coefficients = coefficients.clone();
    }

    public double evaluate(double relativeTime) {
        return coefficients[0] + coefficients[1] * relativeTime + coefficients[2] * relativeTime * relativeTime;
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }
}
