package eu.bde.sarchannel.operator;

import static eu.bde.sarchannel.ChannelFixtures.T0;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.apache.commons.math3.util.FastMath;
import org.junit.Test;

import eu.bde.sarchannel.ChannelFixtures;
import eu.bde.sarchannel.geometry.SarGeometry;
import eu.bde.sarchannel.geometry.Trajectory;
import eu.bde.sarchannel.metadata.GeocodingMetadata;
import eu.bde.sarchannel.metadata.SarProjection;
import eu.bde.sarchannel.metadata.SideLooking;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.LocationData;

public class LocationDataCalculatorTest {

	private static final double MID_RANGE_TIME = 2 * 850000.0 / SarGeometry.LIGHT_SPEED;
	private static final double NEAR_RANGE_TIME = 2 * 800000.0 / SarGeometry.LIGHT_SPEED;

	private final Trajectory trajectory = ChannelFixtures.circularOrbit();
	private final SarGeometry geometry = new SarGeometry(new GeocodingMetadata());
	private final AzimuthTime time = T0.plus(100.0);

	@Test
	public void slantRangeSpacing() {
		LocationDataCalculator calculator = new LocationDataCalculator(geometry, trajectory, SideLooking.RIGHT,
				SarProjection.SLANT_RANGE, 0.001, 2.0, MID_RANGE_TIME);
		LocationData data = calculator.compute(time, NEAR_RANGE_TIME);

		assertEquals(geometry.incidenceAngle(trajectory, time, NEAR_RANGE_TIME, SideLooking.RIGHT),
				data.getIncidenceAngle(), 1e-12);
		assertEquals(geometry.lookAngle(trajectory, time, MID_RANGE_TIME, SideLooking.RIGHT), data.getLookAngle(),
				1e-12);
		assertEquals(2.0, data.getRangeStepMeters(), 0.0);
		assertEquals(2.0 / FastMath.sin(data.getIncidenceAngle()), data.getGroundRangeStepMeters(), 1e-9);
		assertEquals(0.001 * data.getGroundVelocity(), data.getAzimuthStepMeters(), 1e-9);
		assertTrue(data.getGroundVelocity() > 6000 && data.getGroundVelocity() < 7600);
	}

	@Test
	public void groundRangeSpacing() {
		LocationDataCalculator calculator = new LocationDataCalculator(geometry, trajectory, SideLooking.RIGHT,
				SarProjection.GROUND_RANGE, 0.001, 5.0, MID_RANGE_TIME);
		LocationData data = calculator.compute(time, MID_RANGE_TIME);
		assertEquals(5.0, data.getGroundRangeStepMeters(), 0.0);
		assertEquals(5.0 * FastMath.sin(data.getIncidenceAngle()), data.getRangeStepMeters(), 1e-9);
		assertEquals(MID_RANGE_TIME, data.getRangeTime(), 0.0);
		assertEquals(time, data.getAzimuthTime());
	}
}
