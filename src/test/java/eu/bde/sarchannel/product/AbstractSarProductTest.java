package eu.bde.sarchannel.product;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.vividsolutions.jts.geom.Coordinate;
import com.vividsolutions.jts.geom.Polygon;

import eu.bde.sarchannel.ChannelFixtures;
import eu.bde.sarchannel.geometry.Trajectory;
import eu.bde.sarchannel.metadata.BurstInfo;
import eu.bde.sarchannel.metadata.ChannelMetadata;
import eu.bde.sarchannel.metadata.CropMetadata;
import eu.bde.sarchannel.metadata.GeocodingMetadata;
import eu.bde.sarchannel.metadata.Polarization;
import eu.bde.sarchannel.metadata.RasterInfo;
import eu.bde.sarchannel.rasterreader.InMemoryRasterReader;
import eu.bde.sarchannel.rasterreader.RasterReader;

public class AbstractSarProductTest {

	/**
	 * Product whose channel records are just a polarization per id.
	 */
	private static class MockProduct extends AbstractSarProduct<Polarization> {

		private int recordReads;
		private int rasterOpens;

		MockProduct() {
			super("/data/mock.SAFE", "mock", new ChannelMetadataMapper<Polarization>() {
				@Override
				public ChannelMetadata map(Polarization record) {
					return ChannelFixtures.channel(ChannelFixtures.raster(), BurstInfo.NONE)
							.channelId("iw1_" + record.name().toLowerCase()).polarization(record).build();
				}
			}, new GeocodingMetadata(), new CropMetadata());
		}

		@Override
		protected Map<String, Polarization> readChannelRecords() throws IOException {
			recordReads++;
			Map<String, Polarization> records = new LinkedHashMap<>();
			records.put("iw1_vv", Polarization.VV);
			records.put("iw1_vh", Polarization.VH);
			return records;
		}

		@Override
		protected Trajectory readTrajectory(Polarization record) throws IOException {
			return ChannelFixtures.circularOrbit();
		}

		@Override
		protected RasterReader openRasterReader(Polarization record) throws IOException {
			rasterOpens++;
			RasterInfo raster = ChannelFixtures.raster();
			return new InMemoryRasterReader(raster.getLines(), raster.getSamples(),
					new double[raster.getLines() * raster.getSamples()]);
		}

		@Override
		protected double[] getFootprintExtent() {
			return new double[] { -20.0, 20.0, 0.0, 15.0 };
		}
	}

	private MockProduct product;

	@Before
	public void setUp() {
		product = new MockProduct();
	}

	@Test
	public void footprintIsAClosedLonLatRing() {
		Polygon footprint = product.getFootprint();
		Coordinate[] ring = footprint.getExteriorRing().getCoordinates();
		assertEquals(5, ring.length);
		assertEquals(new Coordinate(0.0, -20.0), ring[0]);
		assertEquals(new Coordinate(15.0, -20.0), ring[1]);
		assertEquals(new Coordinate(15.0, 20.0), ring[2]);
		assertEquals(new Coordinate(0.0, 20.0), ring[3]);
		assertEquals(ring[0], ring[4]);
		assertEquals(15.0 * 40.0, footprint.getArea(), 1e-9);
	}

	@Test
	public void channelsListKeepsProductOrder() throws IOException {
		assertEquals(Arrays.asList("iw1_vv", "iw1_vh"), product.getChannelsList());
		assertEquals("mock", product.getName());
		assertEquals("/data/mock.SAFE", product.getPath());
	}

	@Test
	public void channelDataIsBuiltOnceAndCached() throws IOException {
		SarChannel first = product.getChannelData("iw1_vh");
		SarChannel second = product.getChannelData("iw1_vh");
		assertSame(first, second);
		assertEquals(Polarization.VH, first.getPolarization());
		assertEquals("iw1_vh", first.getChannelId());
		assertEquals(1, product.rasterOpens);
		product.getChannelsList();
		assertEquals(1, product.recordReads);
	}

	@Test
	public void channelsShareTheirOrbitGeometry() throws IOException {
		SarChannel vv = product.getChannelData("iw1_vv");
		SarChannel vh = product.getChannelData("iw1_vh");
		assertArrayEquals(vv.getRangeAxis(), vh.getRangeAxis(), 0.0);
		assertTrue(vv.getTrajectory() != null);
	}

	@Test
	public void unknownChannelIdIsRejected() throws IOException {
		try {
			product.getChannelData("iw3_hh");
			fail();
		} catch (InvalidChannelIdException e) {
			assertEquals("iw3_hh", e.getChannelId());
			assertTrue(e.getMessage().contains("iw1_vv"));
		}
	}
}
