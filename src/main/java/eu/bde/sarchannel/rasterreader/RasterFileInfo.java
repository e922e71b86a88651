package eu.bde.sarchannel.rasterreader;

import java.io.Serializable;

/**
 * Where a channel's samples live and how they are laid out.
 */
public class RasterFileInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String hdfsPath;
    private final int lines;
    private final int samples;
    private final SampleFormat format;
    private final long headerBytes;

    public RasterFileInfo(String hdfsPath, int lines, int samples, SampleFormat format) {
        this(hdfsPath, lines, samples, format, 0L);
    }

    public RasterFileInfo(String hdfsPath, int lines, int samples, SampleFormat format, long headerBytes) {
        this.hdfsPath = hdfsPath;
        this.lines = lines;
        this.samples = samples;
        this.format = format;
        this.headerBytes = headerBytes;
    }

    public String getHdfsPath() {
        return hdfsPath;
    }

    public int getLines() {
        return lines;
    }

    public int getSamples() {
        return samples;
    }

    public SampleFormat getFormat() {
        return format;
    }

    public long getHeaderBytes() {
        return headerBytes;
    }

    /**
     * @return byte offset of the first sample of {@code line} starting at {@code sample}
     */
    public long getOffset(int line, int sample) {
        return headerBytes + ((long) line * samples + sample) * format.getBytesPerSample();
    }

    @Override
    public String toString() {
        return hdfsPath + " [" + lines + "x" + samples + " " + format + "]";
    }
}
