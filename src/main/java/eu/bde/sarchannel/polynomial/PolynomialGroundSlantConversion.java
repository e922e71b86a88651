package eu.bde.sarchannel.polynomial;

import static com.google.common.base.Preconditions.checkArgument;

import eu.bde.sarchannel.model.AzimuthTime;

/**
 * Ground/slant conversion given by two sets of time-tagged range polynomials, one per direction
 * (ground-to-slant coefficients in ground meters, slant-to-ground coefficients in slant range time).
 */
public class PolynomialGroundSlantConversion implements GroundSlantConversion {

    private static final long serialVersionUID = 1L;

    private final SortedPolyList groundToSlant;
    private final SortedPolyList slantToGround;

    public PolynomialGroundSlantConversion(SortedPolyList groundToSlant, SortedPolyList slantToGround) {
        checkArgument(!groundToSlant.isEmpty(), "no ground to slant polynomial");
        checkArgument(!slantToGround.isEmpty(), "no slant to ground polynomial");
        this.groundToSlant = groundToSlant;
        this.slantToGround = slantToGround;
    }

    @Override
    public double groundToSlant(AzimuthTime azimuthTime, double groundRange) {
        return groundToSlant.evaluate(azimuthTime, groundRange);
    }

    @Override
    public double slantToGround(AzimuthTime azimuthTime, double slantRangeTime) {
        return slantToGround.evaluate(azimuthTime, slantRangeTime);
    }
}
