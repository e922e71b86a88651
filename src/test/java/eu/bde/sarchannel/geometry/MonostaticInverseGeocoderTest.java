package eu.bde.sarchannel.geometry;

import static eu.bde.sarchannel.ChannelFixtures.T0;
import static org.junit.Assert.assertEquals;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.Test;

import eu.bde.sarchannel.ChannelFixtures;
import eu.bde.sarchannel.metadata.GeocodingMetadata;
import eu.bde.sarchannel.metadata.SideLooking;
import eu.bde.sarchannel.model.TimeCoordinate;

public class MonostaticInverseGeocoderTest {

	private static final double RANGE_TIME = 2 * 850000.0 / SarGeometry.LIGHT_SPEED;
	private static final double WAVELENGTH = SarGeometry.LIGHT_SPEED / 5.405e9;

	private final Trajectory trajectory = ChannelFixtures.circularOrbit();

	private Vector3D groundPoint() {
		return new SarGeometry(new GeocodingMetadata()).directGeocode(trajectory, T0.plus(123.4), RANGE_TIME,
				SideLooking.RIGHT);
	}

	@Test
	public void invertsDirectGeocoding() throws GeocodingException {
		InverseGeocoder geocoder = new MonostaticInverseGeocoder(new GeocodingMetadata());
		TimeCoordinate solution = geocoder.solve(trajectory, groundPoint(), 0.0, WAVELENGTH, T0.plus(50.0));
		assertEquals(123.4, solution.getAzimuthTime().minus(T0), 1e-6);
		assertEquals(RANGE_TIME, solution.getRangeTime(), 1e-9);
	}

	@Test(expected = GeocodingException.class)
	public void reportsNonConvergence() throws GeocodingException {
		GeocodingMetadata metadata = new GeocodingMetadata();
		metadata.setInverseMaxIterations(1);
		new MonostaticInverseGeocoder(metadata).solve(trajectory, groundPoint(), 0.0, WAVELENGTH, T0.plus(50.0));
	}

	@Test(expected = GeocodingException.class)
	public void guessOutsideTheOrbitFails() throws GeocodingException {
		new MonostaticInverseGeocoder(new GeocodingMetadata()).solve(trajectory, groundPoint(), 0.0, WAVELENGTH,
				T0.plus(5000.0));
	}
}
