package eu.bde.sarchannel.metadata;

public enum Polarization {
    HH,
    HV,
    VH,
    VV
}
