package eu.bde.sarchannel.polynomial;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.apache.commons.math3.util.FastMath;

import eu.bde.sarchannel.model.AzimuthTime;

/**
 * 2-D polynomial in azimuth and range, expanded around a reference point:
 * <pre>
 *   p(t, r) = sum_k c_k * (t - t_ref)^a_k * (r - r_ref)^b_k
 * </pre>
 * with {@code t - t_ref} in seconds.
 */
public class GenericPoly implements CoordinateFunction {

    private static final long serialVersionUID = 1L;

    private final AzimuthTime referenceAzimuthTime;
    private final double referenceRange;
    private final double[] coefficients;
    private final int[] azimuthPowers;
    private final int[] rangePowers;

    /**
     * @param powers one {azimuth power, range power} pair per coefficient
     */
    public GenericPoly(AzimuthTime referenceAzimuthTime, double referenceRange, double[] coefficients, int[][] powers) {
        this.referenceAzimuthTime = checkNotNull(referenceAzimuthTime, "referenceAzimuthTime");
        checkArgument(coefficients.length == powers.length, "%s coefficients but %s power pairs", coefficients.length,
                powers.length);
        this.referenceRange = referenceRange;
        this.coefficients = coefficients.clone();
        this.azimuthPowers = new int[powers.length];
        this.rangePowers = new int[powers.length];
        for (int k = 0; k < powers.length; k++) {
            checkArgument(powers[k].length == 2 && powers[k][0] >= 0 && powers[k][1] >= 0,
                    "invalid power pair at %s", k);
            azimuthPowers[k] = powers[k][0];
            rangePowers[k] = powers[k][1];
        }
    }

    /**
     * Polynomial in range only: {@code c_0 + c_1 (r - r_ref) + c_2 (r - r_ref)^2 + ...}.
     */
    public static GenericPoly rangePolynomial(AzimuthTime referenceAzimuthTime, double referenceRange,
            double... coefficients) {
        int[][] powers = new int[coefficients.length][];
        for (int k = 0; k < coefficients.length; k++) {
            powers[k] = new int[] { 0, k };
        }
        return new GenericPoly(referenceAzimuthTime, referenceRange, coefficients, powers);
    }

    @Override
    public double evaluate(AzimuthTime azimuthTime, double rangeTime) {
        final double dt = azimuthTime.minus(referenceAzimuthTime);
        final double dr = rangeTime - referenceRange;
        double value = 0.0;
        for (int k = 0; k < coefficients.length; k++) {
            if (coefficients[k] == 0.0) {
                continue;
            }
            value += coefficients[k] * FastMath.pow(dt, azimuthPowers[k]) * FastMath.pow(dr, rangePowers[k]);
        }
        return value;
    }

    public AzimuthTime getReferenceAzimuthTime() {
        return referenceAzimuthTime;
    }

    public double getReferenceRange() {
        return referenceRange;
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }
}
