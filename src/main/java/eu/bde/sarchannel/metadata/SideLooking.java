package eu.bde.sarchannel.metadata;

public enum SideLooking {
    LEFT,
    RIGHT
}
