package eu.bde.sarchannel.polynomial;

import java.io.Serializable;

import eu.bde.sarchannel.model.AzimuthTime;

/**
 * A scalar surface over (azimuth time, range time).
 */
public interface CoordinateFunction extends Serializable {

    double evaluate(AzimuthTime azimuthTime, double rangeTime);
}
