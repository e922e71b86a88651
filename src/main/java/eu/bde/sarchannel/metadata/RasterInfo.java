package eu.bde.sarchannel.metadata;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;

import eu.bde.sarchannel.model.AzimuthTime;

/**
 * Raster shape of a channel. Lines run along azimuth (step in seconds), samples along range
 * (step in seconds for slant-range rasters, meters for ground-range rasters).
 */
public class RasterInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int lines;
    private final int samples;
    private final double linesStep;
    private final double samplesStep;
    private final AzimuthTime linesStart;
    private final double samplesStart;

    public RasterInfo(int lines, int samples, double linesStep, double samplesStep, AzimuthTime linesStart,
            double samplesStart) {
        checkArgument(lines >= 0, "negative line count: %s", lines);
        checkArgument(samples >= 0, "negative sample count: %s", samples);
        checkArgument(linesStep > 0, "lines step must be positive: %s", linesStep);
        checkArgument(samplesStep > 0, "samples step must be positive: %s", samplesStep);
        this.lines = lines;
        this.samples = samples;
        this.linesStep = linesStep;
        this.samplesStep = samplesStep;
        this.linesStart = checkNotNull(linesStart, "linesStart");
        this.samplesStart = samplesStart;
    }

    public int getLines() {
        return lines;
    }

    public int getSamples() {
        return samples;
    }

    public double getLinesStep() {
        return linesStep;
    }

    public double getSamplesStep() {
        return samplesStep;
    }

    public AzimuthTime getLinesStart() {
        return linesStart;
    }

    public double getSamplesStart() {
        return samplesStart;
    }

    @Override
    public String toString() {
        return lines + "x" + samples + " lines from " + linesStart + " by " + linesStep + ", samples from "
                + samplesStart + " by " + samplesStep;
    }
}
