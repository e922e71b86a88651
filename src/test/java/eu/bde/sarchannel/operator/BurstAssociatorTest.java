package eu.bde.sarchannel.operator;

import static eu.bde.sarchannel.ChannelFixtures.T0;
import static eu.bde.sarchannel.ChannelFixtures.observedAt;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.Test;

import eu.bde.sarchannel.ChannelFixtures;
import eu.bde.sarchannel.geometry.InverseGeocoder;
import eu.bde.sarchannel.geometry.Trajectory;
import eu.bde.sarchannel.metadata.BurstInfo;
import eu.bde.sarchannel.metadata.RasterInfo;
import eu.bde.sarchannel.metadata.SarProjection;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.BurstAssociation;
import eu.bde.sarchannel.model.TimeCoordinate;
import eu.bde.sarchannel.operator.CoordinatesOutOfBoundsException.Axis;
import eu.bde.sarchannel.polynomial.GenericPoly;
import eu.bde.sarchannel.polynomial.PolynomialGroundSlantConversion;
import eu.bde.sarchannel.polynomial.SortedPolyList;

public class BurstAssociatorTest {

	private static BurstAssociator associator(RasterInfo raster, BurstInfo bursts) {
		return new BurstAssociator(new BurstLayout(raster, bursts), null, new ChannelFixtures.ProjectingGeocoder(),
				T0.plus(50.0), 0.05, SarProjection.SLANT_RANGE, null);
	}

	private static BurstAssociator singleBurst() {
		return associator(ChannelFixtures.raster(), ChannelFixtures.singleBurst());
	}

	@Test
	public void timeInsideTheOnlyBurst() {
		assertEquals(0, singleBurst().timeToBurst(T0.plus(1.0)));
	}

	@Test
	public void timeBeforeTheFirstBurst() {
		try {
			singleBurst().timeToBurst(T0.plus(-1.0));
			fail("time before the first burst was accepted");
		} catch (CoordinatesOutOfBoundsException e) {
			assertEquals(Axis.AZIMUTH, e.getAxis());
		}
	}

	@Test(expected = CoordinatesOutOfBoundsException.class)
	public void timeAfterTheNominalEnd() {
		singleBurst().timeToBurst(T0.plus(100.5));
	}

	@Test
	public void burstlessChannelAlwaysAnswersBurstZero() {
		BurstAssociator associator = associator(ChannelFixtures.raster(), BurstInfo.NONE);
		assertEquals(0, associator.timeToBurst(T0.plus(-1000.0)));
	}

	@Test
	public void pixelInsideTheOnlyBurst() {
		assertEquals(0, singleBurst().pixelToBurst(5));
		assertEquals(0, singleBurst().pixelToBurst(1000));
	}

	@Test(expected = CoordinatesOutOfBoundsException.class)
	public void pixelPastTheLastLine() {
		singleBurst().pixelToBurst(5000);
	}

	@Test(expected = CoordinatesOutOfBoundsException.class)
	public void negativePixel() {
		singleBurst().pixelToBurst(-1);
	}

	@Test
	public void burstIndexNeverDecreasesAlongContiguousBursts() {
		BurstAssociator associator = associator(ChannelFixtures.contiguousBurstsRaster(),
				ChannelFixtures.contiguousBursts());
		int previous = 0;
		for (int i = 0; i < 600; i++) {
			double t = i * 0.05;
			int burst = associator.timeToBurst(T0.plus(t));
			assertTrue("burst went back at " + t, burst >= previous);
			previous = burst;
		}
		assertEquals(2, previous);
		assertEquals(1, associator.timeToBurst(T0.plus(10.0)));
	}

	@Test
	public void batchResolvers() {
		BurstAssociator associator = associator(ChannelFixtures.contiguousBurstsRaster(),
				ChannelFixtures.contiguousBursts());
		List<AzimuthTime> times = Arrays.asList(T0.plus(1.0), T0.plus(15.0), T0.plus(29.0));
		assertArrayEquals(new int[] { 0, 1, 2 }, associator.timesToBursts(times));
		assertArrayEquals(new int[] { 0, 1, 1, 2 }, associator.pixelsToBursts(new double[] { 0, 100, 199.5, 250 }));
	}

	@Test
	public void overlapResolvesTimeToTheLatestStartedBurst() {
		BurstAssociator associator = associator(ChannelFixtures.overlappingBurstsRaster(),
				ChannelFixtures.overlappingBursts());
		assertEquals(0, associator.timeToBurst(T0.plus(7.9)));
		assertEquals(1, associator.timeToBurst(T0.plus(9.0)));
	}

	@Test
	public void groundPointInsideOneBurst() {
		BurstAssociator associator = associator(ChannelFixtures.contiguousBurstsRaster(),
				ChannelFixtures.contiguousBursts());
		BurstAssociation association = associator.groundPointToBursts(observedAt(15.0, 2.0));
		assertTrue(association.isAssociated());
		assertEquals(1, association.getBursts().size());
		assertEquals(1, association.getBursts().firstInt());
	}

	@Test
	public void groundPointInOverlapBelongsToBothBursts() {
		BurstAssociator associator = associator(ChannelFixtures.overlappingBurstsRaster(),
				ChannelFixtures.overlappingBursts());
		assertEquals(BurstAssociation.of(0, 1), associator.groundPointToBursts(observedAt(9.0, 2.0)));
	}

	@Test
	public void groundPointOutsideTheSwath() {
		BurstAssociator associator = singleBurst();
		assertFalse(associator.groundPointToBursts(observedAt(150.0, 2.0)).isAssociated());
		// range beyond the last sample
		assertFalse(associator.groundPointToBursts(observedAt(10.0, 6.0)).isAssociated());
	}

	@Test
	public void failedGeocodingDoesNotStopTheBatch() {
		BurstAssociator associator = associator(ChannelFixtures.contiguousBurstsRaster(),
				ChannelFixtures.contiguousBursts());
		List<Vector3D> points = Arrays.asList(observedAt(1.0, 1.0), ChannelFixtures.unreachable(),
				observedAt(25.0, 3.0));
		List<BurstAssociation> associations = associator.associateGroundPoints(points);
		assertEquals(3, associations.size());
		assertEquals(BurstAssociation.of(0), associations.get(0));
		assertEquals(BurstAssociation.none(), associations.get(1));
		assertEquals(BurstAssociation.of(2), associations.get(2));
	}

	/**
	 * Solver failing with an unchecked exception for points with negative x.
	 */
	private static class FailingGeocoder implements InverseGeocoder {

		private static final long serialVersionUID = 1L;

		@Override
		public TimeCoordinate solve(Trajectory trajectory, Vector3D groundPoint, double dopplerCentroid,
				double wavelength, AzimuthTime initialGuess) {
			if (groundPoint.getX() < 0) {
				throw new ArithmeticException("solver diverged");
			}
			return new TimeCoordinate(T0.plus(groundPoint.getX()), groundPoint.getY());
		}
	}

	@Test
	public void uncheckedSolverFailureDoesNotStopTheBatch() {
		InverseGeocoder geocoder = new FailingGeocoder();
		BurstAssociator associator = new BurstAssociator(
				new BurstLayout(ChannelFixtures.raster(), ChannelFixtures.singleBurst()), null, geocoder,
				T0.plus(50.0), 0.05, SarProjection.SLANT_RANGE, null);
		List<BurstAssociation> associations = associator.associateGroundPoints(
				Arrays.asList(observedAt(1.0, 1.0), new Vector3D(-1.0, 1.0, 0.0), observedAt(2.0, 1.0)));
		assertEquals(Arrays.asList(BurstAssociation.of(0), BurstAssociation.none(), BurstAssociation.of(0)),
				associations);
	}

	@Test
	public void groundRangeChannelComparesGroundRange() {
		// ground range of the raster spans [100 m, 610 m)
		RasterInfo raster = new RasterInfo(1000, 51, 0.1, 10.0, T0, 100.0);
		PolynomialGroundSlantConversion conversion = new PolynomialGroundSlantConversion(
				new SortedPolyList(Arrays.asList(GenericPoly.rangePolynomial(T0, 0.0, 5.0e-3, 1.0e-8))),
				new SortedPolyList(Arrays.asList(GenericPoly.rangePolynomial(T0, 5.0e-3, 0.0, 1.0e8))));
		BurstAssociator associator = new BurstAssociator(new BurstLayout(raster, BurstInfo.NONE), null,
				new ChannelFixtures.ProjectingGeocoder(), T0.plus(50.0), 0.05, SarProjection.GROUND_RANGE,
				conversion);

		// 300 m on ground
		assertEquals(BurstAssociation.of(0), associator.groundPointToBursts(observedAt(10.0, 5.0e-3 + 300.0e-8)));
		// 700 m and 50 m on ground
		assertFalse(associator.groundPointToBursts(observedAt(10.0, 5.0e-3 + 700.0e-8)).isAssociated());
		assertFalse(associator.groundPointToBursts(observedAt(10.0, 5.0e-3 + 50.0e-8)).isAssociated());
	}
}
