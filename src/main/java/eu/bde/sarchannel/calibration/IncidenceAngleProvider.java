package eu.bde.sarchannel.calibration;

import java.io.Serializable;

import eu.bde.sarchannel.model.AzimuthTime;

/**
 * Incidence angle, in radians, along a line of the raster.
 */
public interface IncidenceAngleProvider extends Serializable {

	double[] getIncidenceAngles(AzimuthTime azimuthTime, int firstSample, int samples);
}
