package eu.bde.sarchannel.model;

/**
 * Maps raster coordinates of a {@link SampleWindow} to positions in its row-major sample buffers.
 */
public final class WindowIndex {

    private final int windowStride;
    private final int windowMinSample;
    private final int windowMinLine;

    private int offset = 0;

    public WindowIndex(final SampleWindow window) {
        windowStride = window.getSamples();
        windowMinSample = window.getFirstSample();
        windowMinLine = window.getFirstLine();
    }

    /**
     * calculates offset
     *
     * @param line raster line
     * @return offset
     */
    public int calculateStride(final int line) {
        offset = windowMinSample - ((line - windowMinLine) * windowStride);
        return offset;
    }

    public int getOffset() {
        return offset;
    }

    public int getIndex(final int sample) {
        return sample - offset;
    }
}
