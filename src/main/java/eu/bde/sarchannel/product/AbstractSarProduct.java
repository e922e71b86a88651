package eu.bde.sarchannel.product;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.vividsolutions.jts.geom.Coordinate;
import com.vividsolutions.jts.geom.GeometryFactory;
import com.vividsolutions.jts.geom.Polygon;

import eu.bde.sarchannel.geometry.Trajectory;
import eu.bde.sarchannel.metadata.ChannelMetadata;
import eu.bde.sarchannel.metadata.CropMetadata;
import eu.bde.sarchannel.metadata.GeocodingMetadata;
import eu.bde.sarchannel.rasterreader.RasterReader;

/**
 * Base of the per-format products. A format only has to list its raw channel records, read the
 * orbit and open the raster of a record; the mapper turns each record into {@link ChannelMetadata}
 * and every channel then shares {@link GenericSarChannel}.
 *
 * @param <T> raw channel record of the format
 */
public abstract class AbstractSarProduct<T> implements SarProduct {

	private static final Logger log = Logger.getLogger(AbstractSarProduct.class);

	private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

	private final String path;
	private final String name;
	private final ChannelMetadataMapper<T> mapper;
	private final GeocodingMetadata geocodingMetadata;
	private final CropMetadata cropMetadata;

	private Map<String, T> records;
	private final Map<String, SarChannel> channels = new LinkedHashMap<>();

	protected AbstractSarProduct(String path, String name, ChannelMetadataMapper<T> mapper,
			GeocodingMetadata geocodingMetadata, CropMetadata cropMetadata) {
		this.path = path;
		this.name = name;
		this.mapper = mapper;
		this.geocodingMetadata = geocodingMetadata;
		this.cropMetadata = cropMetadata;
	}

	/**
	 * @return raw channel records keyed by channel id, in product order
	 */
	protected abstract Map<String, T> readChannelRecords() throws IOException;

	protected abstract Trajectory readTrajectory(T record) throws IOException;

	protected abstract RasterReader openRasterReader(T record) throws IOException;

	/**
	 * @return {@code [latMin, latMax, lonMin, lonMax]} in degrees
	 */
	protected abstract double[] getFootprintExtent();

	@Override
	public String getPath() {
		return path;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public Polygon getFootprint() {
		final double[] extent = getFootprintExtent();
		final double latMin = extent[0];
		final double latMax = extent[1];
		final double lonMin = extent[2];
		final double lonMax = extent[3];
		final Coordinate[] ring = new Coordinate[] { new Coordinate(lonMin, latMin), new Coordinate(lonMax, latMin),
				new Coordinate(lonMax, latMax), new Coordinate(lonMin, latMax), new Coordinate(lonMin, latMin) };
		return GEOMETRY_FACTORY.createPolygon(GEOMETRY_FACTORY.createLinearRing(ring), null);
	}

	@Override
	public synchronized List<String> getChannelsList() throws IOException {
		return ImmutableList.copyOf(records().keySet());
	}

	@Override
	public synchronized SarChannel getChannelData(String channelId) throws IOException {
		SarChannel channel = channels.get(channelId);
		if (channel != null) {
			return channel;
		}
		final T record = records().get(channelId);
		if (record == null) {
			throw new InvalidChannelIdException(channelId,
					"no channel " + channelId + " in " + name + ", available: " + records().keySet());
		}
		final ChannelMetadata metadata = mapper.map(record);
		channel = new GenericSarChannel(metadata, readTrajectory(record), openRasterReader(record), geocodingMetadata,
				cropMetadata);
		channels.put(channelId, channel);
		return channel;
	}

	private Map<String, T> records() throws IOException {
		if (records == null) {
			records = readChannelRecords();
			log.info(name + " (" + path + "): " + records.size() + " channels");
		}
		return records;
	}
}
