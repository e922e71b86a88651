package eu.bde.sarchannel.metadata;

public enum SarProjection {
    SLANT_RANGE,
    GROUND_RANGE
}
