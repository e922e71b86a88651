package eu.bde.sarchannel.metadata;

public enum OrbitDirection {
    ASCENDING,
    DESCENDING
}
