package eu.bde.sarchannel.product;

import java.io.IOException;
import java.util.List;

import com.vividsolutions.jts.geom.Polygon;

public interface SarProduct {

	String getPath();

	String getName();

	/**
	 * @return lat/lon footprint, x = longitude, y = latitude
	 */
	Polygon getFootprint();

	List<String> getChannelsList() throws IOException;

	/**
	 * @throws InvalidChannelIdException if the product has no such channel
	 */
	SarChannel getChannelData(String channelId) throws IOException;
}
