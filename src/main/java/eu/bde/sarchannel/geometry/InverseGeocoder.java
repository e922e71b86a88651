package eu.bde.sarchannel.geometry;

import java.io.Serializable;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.TimeCoordinate;

/**
 * Finds the azimuth/range times at which a sensor on {@code trajectory} observes a ground point
 * under the given Doppler centroid.
 */
public interface InverseGeocoder extends Serializable {

    TimeCoordinate solve(Trajectory trajectory, Vector3D groundPoint, double dopplerCentroid, double wavelength,
            AzimuthTime initialGuess) throws GeocodingException;
}
