package eu.bde.sarchannel;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.util.FastMath;

import eu.bde.sarchannel.geometry.GeocodingException;
import eu.bde.sarchannel.geometry.InverseGeocoder;
import eu.bde.sarchannel.geometry.StateVector;
import eu.bde.sarchannel.geometry.StateVectorTrajectory;
import eu.bde.sarchannel.geometry.Trajectory;
import eu.bde.sarchannel.metadata.BurstInfo;
import eu.bde.sarchannel.metadata.ChannelMetadata;
import eu.bde.sarchannel.metadata.RasterInfo;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.TimeCoordinate;

/**
 * Synthetic channels and orbits shared by the tests.
 */
public final class ChannelFixtures {

	public static final AzimuthTime T0 = AzimuthTime.parse("01-JAN-2020 00:00:00.000000");

	public static final double EARTH_GM = 3.986004418e14;
	public static final double ORBIT_RADIUS = 7071000.0;

	private ChannelFixtures() {
	}

	/**
	 * 1000 lines x 50 samples, 0.1 s steps, samples from 0.5 s.
	 */
	public static RasterInfo raster() {
		return new RasterInfo(1000, 50, 0.1, 0.1, T0, 0.5);
	}

	public static BurstInfo singleBurst() {
		return new BurstInfo(1, 1000, new AzimuthTime[] { T0 });
	}

	/**
	 * Three contiguous bursts of 100 lines (10 s) each.
	 */
	public static BurstInfo contiguousBursts() {
		return new BurstInfo(3, 100, new AzimuthTime[] { T0, T0.plus(10.0), T0.plus(20.0) });
	}

	public static RasterInfo contiguousBurstsRaster() {
		return new RasterInfo(300, 50, 0.1, 0.1, T0, 0.5);
	}

	/**
	 * Two bursts of 100 lines whose azimuth spans overlap by 2 s.
	 */
	public static BurstInfo overlappingBursts() {
		return new BurstInfo(2, 100, new AzimuthTime[] { T0, T0.plus(8.0) });
	}

	public static RasterInfo overlappingBurstsRaster() {
		return new RasterInfo(200, 50, 0.1, 0.1, T0, 0.5);
	}

	public static ChannelMetadata.Builder channel(RasterInfo raster, BurstInfo bursts) {
		return ChannelMetadata.builder().channelId("ch0").swathName("S1").rasterInfo(raster).burstInfo(bursts)
				.carrierFrequency(5.405e9).pulse(1000.0, 30.0);
	}

	/**
	 * Circular polar orbit, sampled every 10 s from 200 s before {@link #T0} to 1200 s after it.
	 */
	public static Trajectory circularOrbit() {
		final double omega = FastMath.sqrt(EARTH_GM / (ORBIT_RADIUS * ORBIT_RADIUS * ORBIT_RADIUS));
		final List<StateVector> stateVectors = new ArrayList<>();
		for (int t = -200; t <= 1200; t += 10) {
			final double angle = omega * t;
			final Vector3D position = new Vector3D(ORBIT_RADIUS * FastMath.cos(angle), 0.0,
					ORBIT_RADIUS * FastMath.sin(angle));
			final Vector3D velocity = new Vector3D(-ORBIT_RADIUS * omega * FastMath.sin(angle), 0.0,
					ORBIT_RADIUS * omega * FastMath.cos(angle));
			stateVectors.add(new StateVector(T0.plus(t), position, velocity));
		}
		return new StateVectorTrajectory(stateVectors);
	}

	/**
	 * Geocoder reading the answer off the point: x = seconds after {@link #T0}, y = range time.
	 * Points with negative z do not converge.
	 */
	public static class ProjectingGeocoder implements InverseGeocoder {

		private static final long serialVersionUID = 1L;

		@Override
		public TimeCoordinate solve(Trajectory trajectory, Vector3D groundPoint, double dopplerCentroid,
				double wavelength, AzimuthTime initialGuess) throws GeocodingException {
			if (groundPoint.getZ() < 0) {
				throw new GeocodingException("no convergence for " + groundPoint);
			}
			return new TimeCoordinate(T0.plus(groundPoint.getX()), groundPoint.getY());
		}
	}

	public static Vector3D observedAt(double secondsAfterT0, double rangeTime) {
		return new Vector3D(secondsAfterT0, rangeTime, 0.0);
	}

	public static Vector3D unreachable() {
		return new Vector3D(1.0, 1.0, -1.0);
	}
}
