package eu.bde.sarchannel.metadata;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;
import java.util.Arrays;

import eu.bde.sarchannel.model.AzimuthTime;

/**
 * Burst structure of a channel. Every burst spans the same number of lines; burst start times are
 * non-decreasing. Range start times per burst are optional and only given by formats whose sampling
 * window moves from burst to burst.
 */
public class BurstInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final BurstInfo NONE = new BurstInfo(0, 0, new AzimuthTime[0], null);

    private final int numberOfBursts;
    private final int linesPerBurst;
    private final AzimuthTime[] azimuthStartTimes;
    private final double[] rangeStartTimes;

    public BurstInfo(int numberOfBursts, int linesPerBurst, AzimuthTime[] azimuthStartTimes) {
        this(numberOfBursts, linesPerBurst, azimuthStartTimes, null);
    }

    public BurstInfo(int numberOfBursts, int linesPerBurst, AzimuthTime[] azimuthStartTimes,
            double[] rangeStartTimes) {
        checkArgument(numberOfBursts >= 0, "negative burst count: %s", numberOfBursts);
        checkArgument(linesPerBurst >= 0, "negative lines per burst: %s", linesPerBurst);
        checkNotNull(azimuthStartTimes, "azimuthStartTimes");
        checkArgument(azimuthStartTimes.length == numberOfBursts, "%s burst start times given for %s bursts",
                azimuthStartTimes.length, numberOfBursts);
        checkArgument(rangeStartTimes == null || rangeStartTimes.length == numberOfBursts,
                "range start times must be given for every burst");
        for (int i = 1; i < azimuthStartTimes.length; i++) {
            checkArgument(!azimuthStartTimes[i].isBefore(azimuthStartTimes[i - 1]),
                    "burst %s starts before burst %s", i, i - 1);
        }
        this.numberOfBursts = numberOfBursts;
        this.linesPerBurst = linesPerBurst;
        this.azimuthStartTimes = azimuthStartTimes.clone();
        this.rangeStartTimes = rangeStartTimes != null ? rangeStartTimes.clone() : null;
    }

    public boolean hasBursts() {
        return numberOfBursts > 0;
    }

    public int getNumberOfBursts() {
        return numberOfBursts;
    }

    public int getLinesPerBurst() {
        return linesPerBurst;
    }

    public AzimuthTime getAzimuthStartTime(int burst) {
        return azimuthStartTimes[burst];
    }

    public AzimuthTime[] getAzimuthStartTimes() {
        return azimuthStartTimes.clone();
    }

    public boolean hasRangeStartTimes() {
        return rangeStartTimes != null;
    }

    public double getRangeStartTime(int burst) {
        return rangeStartTimes[burst];
    }

    @Override
    public String toString() {
        return numberOfBursts + " bursts of " + linesPerBurst + " lines, starting at "
                + Arrays.toString(azimuthStartTimes);
    }
}
