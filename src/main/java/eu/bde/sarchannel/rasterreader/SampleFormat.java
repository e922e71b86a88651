package eu.bde.sarchannel.rasterreader;

/**
 * Sample layout of a flat binary raster. Values are big-endian IEEE floats; complex samples are
 * stored as interleaved (real, imaginary) pairs.
 */
public enum SampleFormat {
    FLOAT32(4, false),
    COMPLEX_FLOAT32(8, true);

    private final int bytesPerSample;
    private final boolean complex;

    SampleFormat(int bytesPerSample, boolean complex) {
        this.bytesPerSample = bytesPerSample;
        this.complex = complex;
    }

    public int getBytesPerSample() {
        return bytesPerSample;
    }

    public boolean isComplex() {
        return complex;
    }
}
