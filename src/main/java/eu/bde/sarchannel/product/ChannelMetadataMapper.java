package eu.bde.sarchannel.product;

import eu.bde.sarchannel.metadata.ChannelMetadata;

/**
 * Maps a format specific channel record onto the normalized channel description. This is the only
 * place where a product format differs from another.
 *
 * @param <T> raw channel record of the format
 */
public interface ChannelMetadataMapper<T> {

	ChannelMetadata map(T record);
}
