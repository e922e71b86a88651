package eu.bde.sarchannel.metadata;

public enum ImageType {
    SLC,
    GRD
}
