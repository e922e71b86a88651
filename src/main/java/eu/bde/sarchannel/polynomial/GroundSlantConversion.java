package eu.bde.sarchannel.polynomial;

import java.io.Serializable;

import eu.bde.sarchannel.model.AzimuthTime;

/**
 * Conversion between ground range (meters) and two-way slant range time (seconds) at a given azimuth time.
 */
public interface GroundSlantConversion extends Serializable {

    double groundToSlant(AzimuthTime azimuthTime, double groundRange);

    double slantToGround(AzimuthTime azimuthTime, double slantRangeTime);
}
