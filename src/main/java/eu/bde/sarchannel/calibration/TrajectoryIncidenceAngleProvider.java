package eu.bde.sarchannel.calibration;

import eu.bde.sarchannel.geometry.SarGeometry;
import eu.bde.sarchannel.geometry.Trajectory;
import eu.bde.sarchannel.metadata.SideLooking;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.operator.PixelTimeConverter;

/**
 * Incidence angles from the sensor trajectory, one direct geocoding per range sample.
 */
public class TrajectoryIncidenceAngleProvider implements IncidenceAngleProvider {

	private static final long serialVersionUID = 1L;

	private final SarGeometry geometry;
	private final Trajectory trajectory;
	private final SideLooking side;
	private final PixelTimeConverter converter;

	public TrajectoryIncidenceAngleProvider(SarGeometry geometry, Trajectory trajectory, SideLooking side,
			PixelTimeConverter converter) {
		this.geometry = geometry;
		this.trajectory = trajectory;
		this.side = side;
		this.converter = converter;
	}

	@Override
	public double[] getIncidenceAngles(AzimuthTime azimuthTime, int firstSample, int samples) {
		final double[] angles = new double[samples];
		for (int i = 0; i < samples; i++) {
			final double rangeTime = converter.rangeIndexToRangeTime(firstSample + i);
			angles[i] = geometry.incidenceAngle(trajectory, azimuthTime, rangeTime, side);
		}
		return angles;
	}
}
