package eu.bde.sarchannel.operator;

/**
 * Which edge of a crop window left the raster: its first line/sample or its last one.
 */
public enum Boundary {
	START,
	END
}
