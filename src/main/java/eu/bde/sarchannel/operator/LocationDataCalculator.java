package eu.bde.sarchannel.operator;

import java.io.Serializable;

import org.apache.commons.math3.util.FastMath;

import eu.bde.sarchannel.geometry.DegenerateGeometryException;
import eu.bde.sarchannel.geometry.SarGeometry;
import eu.bde.sarchannel.geometry.Trajectory;
import eu.bde.sarchannel.metadata.SarProjection;
import eu.bde.sarchannel.metadata.SideLooking;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.LocationData;

/**
 * Incidence and look angle, ground velocity and metric sample spacing at a location of the swath.
 * The look angle is taken at the swath mid range time, the incidence angle at the requested range time.
 */
public class LocationDataCalculator implements Serializable {

	private static final long serialVersionUID = 1L;

	private final SarGeometry geometry;
	private final Trajectory trajectory;
	private final SideLooking side;
	private final SarProjection projection;
	private final double azimuthStepSeconds;
	private final double rangeStepMeters;
	private final double midRangeTime;

	/**
	 * @param rangeStepMeters sample step in meters: slant for slant range rasters, ground otherwise
	 */
	public LocationDataCalculator(SarGeometry geometry, Trajectory trajectory, SideLooking side,
			SarProjection projection, double azimuthStepSeconds, double rangeStepMeters, double midRangeTime) {
		this.geometry = geometry;
		this.trajectory = trajectory;
		this.side = side;
		this.projection = projection;
		this.azimuthStepSeconds = azimuthStepSeconds;
		this.rangeStepMeters = rangeStepMeters;
		this.midRangeTime = midRangeTime;
	}

	public LocationData compute(AzimuthTime azimuthTime, double rangeTime) {
		final double incidence = geometry.incidenceAngle(trajectory, azimuthTime, rangeTime, side);
		final double look = geometry.lookAngle(trajectory, azimuthTime, midRangeTime, side);
		final double groundVelocity = geometry.groundVelocity(trajectory, azimuthTime, look, side);

		final double sinIncidence = FastMath.sin(incidence);
		if (Double.isNaN(sinIncidence) || sinIncidence <= 0) {
			throw new DegenerateGeometryException("incidence angle " + incidence + " at " + azimuthTime + ", "
					+ rangeTime);
		}

		final double slantStep;
		final double groundStep;
		if (projection == SarProjection.GROUND_RANGE) {
			groundStep = rangeStepMeters;
			slantStep = rangeStepMeters * sinIncidence;
		} else {
			slantStep = rangeStepMeters;
			groundStep = rangeStepMeters / sinIncidence;
		}
		return new LocationData(azimuthTime, rangeTime, incidence, look, groundVelocity,
				azimuthStepSeconds * groundVelocity, slantStep, groundStep);
	}
}
