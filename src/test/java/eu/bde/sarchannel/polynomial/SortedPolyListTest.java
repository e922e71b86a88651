package eu.bde.sarchannel.polynomial;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

import eu.bde.sarchannel.model.AzimuthTime;

public class SortedPolyListTest {

	private static final AzimuthTime REFERENCE = AzimuthTime.parse("09-JUL-2006 21:00:00.0");

	private static final GenericPoly RECENT = new GenericPoly(REFERENCE, 2, new double[] { 2.5, 2.5, 0.0, -1.0 },
			new int[][] { { 0, 2 }, { 1, 0 }, { 1, 0 }, { 0, 2 } });

	private static final GenericPoly AT_EPOCH = new GenericPoly(AzimuthTime.of(0L, 0.0), 8,
			new double[] { 5.5, 6.0, 0.0, 0.0, 1.0, 1.0 },
			new int[][] { { 0, 0 }, { 0, 1 }, { 1, 0 }, { 1, 1 }, { 0, 2 }, { 0, 5 } });

	@Test
	public void usesLatestPolynomialStartedBeforeQuery() {
		SortedPolyList list = new SortedPolyList(Arrays.asList(RECENT, AT_EPOCH));
		assertEquals(13.5, list.evaluate(AzimuthTime.parse("09-JUL-2006 21:00:03.0"), 4), 0.0);
	}

	@Test
	public void earlierQuerySelectsEarlierPolynomial() {
		SortedPolyList list = new SortedPolyList(Arrays.asList(RECENT, AT_EPOCH));
		assertEquals(-1026.5, list.evaluate(AzimuthTime.parse("09-JUL-2006 20:59:07.0"), 4), 0.0);
	}

	@Test
	public void queryBeforeEveryPolynomialUsesTheFirst() {
		SortedPolyList list = new SortedPolyList(Arrays.asList(RECENT));
		// 2.5 * 4 + 2.5 * -10 - 4
		assertEquals(-19.0, list.evaluate(REFERENCE.plus(-10.0), 4), 1e-12);
	}

	@Test
	public void emptyListEvaluatesToZero() {
		assertEquals(0.0, new SortedPolyList().evaluate(REFERENCE, 1.0), 0.0);
		assertEquals(0.0, new DopplerPolynomial(new SortedPolyList()).evaluate(REFERENCE, 1.0), 0.0);
	}

	@Test
	public void dopplerPolynomialDelegatesToTheList() {
		DopplerPolynomial doppler = new DopplerPolynomial(new SortedPolyList(Arrays.asList(RECENT, AT_EPOCH)));
		assertEquals(13.5, doppler.evaluate(AzimuthTime.parse("09-JUL-2006 21:00:03.0"), 4), 0.0);
	}

	@Test
	public void rangePolynomialConversion() {
		SortedPolyList groundToSlant = new SortedPolyList(
				Arrays.asList(GenericPoly.rangePolynomial(REFERENCE, 0.0, 5.0e-3, 4.0e-9)));
		SortedPolyList slantToGround = new SortedPolyList(
				Arrays.asList(GenericPoly.rangePolynomial(REFERENCE, 5.0e-3, 0.0, 2.5e8)));
		GroundSlantConversion conversion = new PolynomialGroundSlantConversion(groundToSlant, slantToGround);
		double slant = conversion.groundToSlant(REFERENCE, 1000.0);
		assertEquals(5.004e-3, slant, 1e-15);
		assertEquals(1000.0, conversion.slantToGround(REFERENCE, slant), 1e-6);
	}

	@Test
	public void steeringRateIsQuadraticInTime() {
		SteeringRatePolynomial rate = new SteeringRatePolynomial(new double[] { 1.0, 2.0, 3.0 });
		assertEquals(17.0, rate.evaluate(2.0), 0.0);
		assertEquals(0.0, SteeringRatePolynomial.ZERO.evaluate(5.0), 0.0);
	}
}
