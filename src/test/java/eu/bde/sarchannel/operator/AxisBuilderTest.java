package eu.bde.sarchannel.operator;

import static eu.bde.sarchannel.ChannelFixtures.T0;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.util.Arrays;

import org.junit.Test;

import eu.bde.sarchannel.ChannelFixtures;
import eu.bde.sarchannel.metadata.BurstInfo;
import eu.bde.sarchannel.metadata.SarProjection;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.BurstRectangle;
import eu.bde.sarchannel.polynomial.GenericPoly;
import eu.bde.sarchannel.polynomial.PolynomialGroundSlantConversion;
import eu.bde.sarchannel.polynomial.SortedPolyList;

public class AxisBuilderTest {

	@Test
	public void azimuthAxisWithoutBurstsIsEvenlySpaced() {
		AzimuthTime[] axis = new AxisBuilder(ChannelFixtures.raster(), BurstInfo.NONE).buildAzimuthAxis();
		assertEquals(1000, axis.length);
		assertEquals(T0, axis[0]);
		assertEquals(99.9, axis[999].minus(T0), 1e-9);
	}

	@Test
	public void azimuthAxisRestartsAtEveryBurst() {
		BurstInfo bursts = new BurstInfo(2, 3, new AzimuthTime[] { T0, T0.plus(0.25) });
		AzimuthTime[] axis = new AxisBuilder(ChannelFixtures.raster(), bursts).buildAzimuthAxis();
		assertEquals(6, axis.length);
		double[] offsets = new double[axis.length];
		for (int i = 0; i < axis.length; i++) {
			offsets[i] = axis[i].minus(T0);
		}
		// burst 1 starts before burst 0 ends: not globally sorted
		assertArrayEquals(new double[] { 0.0, 0.1, 0.2, 0.25, 0.35, 0.45 }, offsets, 1e-12);
	}

	@Test
	public void rangeAxis() {
		double[] axis = new AxisBuilder(ChannelFixtures.raster(), BurstInfo.NONE).buildRangeAxis();
		assertEquals(50, axis.length);
		assertEquals(0.5, axis[0], 0.0);
		assertEquals(1.0, axis[5], 1e-12);
		assertEquals(5.4, axis[49], 1e-12);
	}

	@Test
	public void slantAxisOfGroundRangeRaster() {
		PolynomialGroundSlantConversion conversion = new PolynomialGroundSlantConversion(
				new SortedPolyList(Arrays.asList(GenericPoly.rangePolynomial(T0, 0.0, 1.0, 2.0))),
				new SortedPolyList(Arrays.asList(GenericPoly.rangePolynomial(T0, 1.0, 0.0, 0.5))));
		AxisBuilder builder = new AxisBuilder(ChannelFixtures.raster(), BurstInfo.NONE);
		double[] slant = builder.buildSlantRangeAxis(SarProjection.GROUND_RANGE, conversion, T0);
		assertEquals(2.0, slant[0], 1e-12);
		assertEquals(3.0, slant[5], 1e-12);

		double[] unchanged = builder.buildSlantRangeAxis(SarProjection.SLANT_RANGE, null, T0);
		assertArrayEquals(builder.buildRangeAxis(), unchanged, 0.0);
	}

	@Test
	public void layoutOfBurstlessChannelIsOneRasterWideBurst() {
		BurstLayout layout = new BurstLayout(ChannelFixtures.raster(), BurstInfo.NONE);
		assertEquals(1, layout.getNumberOfBursts());
		assertArrayEquals(new int[] { 1000 }, layout.getLinesPerBurstArray());
		BurstRectangle rectangle = layout.getRectangle(0);
		assertSame(T0, rectangle.getAzimuthStart());
		assertEquals(100.0, rectangle.getAzimuthStop().minus(T0), 1e-9);
		assertEquals(0.5, rectangle.getRangeStart(), 0.0);
		assertEquals(5.5, rectangle.getRangeStop(), 1e-12);
	}

	@Test
	public void burstRectangles() {
		BurstLayout layout = new BurstLayout(ChannelFixtures.contiguousBurstsRaster(), ChannelFixtures.contiguousBursts());
		assertEquals(3, layout.getNumberOfBursts());
		assertArrayEquals(new int[] { 0, 100, 200, 300 }, layout.getLineBoundaries());
		assertEquals(20.0, layout.getRectangle(1).getAzimuthStop().minus(T0), 1e-9);
		assertEquals(30.0, layout.getNominalEnd().minus(T0), 1e-9);
		assertEquals(15.0, layout.getRectangle(1).getCenter().getAzimuthTime().minus(T0), 1e-9);
	}

	@Test
	public void perBurstRangeStarts() {
		BurstInfo bursts = new BurstInfo(2, 100, new AzimuthTime[] { T0, T0.plus(10.0) }, new double[] { 0.5, 0.7 });
		BurstLayout layout = new BurstLayout(ChannelFixtures.overlappingBurstsRaster(), bursts);
		assertEquals(0.7, layout.getRectangle(1).getRangeStart(), 0.0);
		assertEquals(5.7, layout.getRectangle(1).getRangeStop(), 1e-12);
	}

	@Test(expected = IllegalArgumentException.class)
	public void negativeCountsAreRejected() {
		new BurstInfo(-1, 10, new AzimuthTime[0]);
	}
}
