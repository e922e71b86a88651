package eu.bde.sarchannel.metadata;

import java.io.Serializable;

import eu.bde.sarchannel.model.AzimuthTime;

/**
 * A change of the sampling window start time, effective from {@code time} on.
 */
public class SwstChange implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AzimuthTime time;
    private final double swst;

    public SwstChange(AzimuthTime time, double swst) {
        this.time = time;
        this.swst = swst;
    }

    public AzimuthTime getTime() {
        return time;
    }

    public double getSwst() {
        return swst;
    }

    @Override
    public String toString() {
        return "(" + time + ", " + swst + ")";
    }
}
