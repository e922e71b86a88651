package eu.bde.sarchannel.geometry;

import java.io.Serializable;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import eu.bde.sarchannel.model.AzimuthTime;

/**
 * Sensor position along the orbit, in Earth-centred Earth-fixed coordinates (meters).
 */
public interface Trajectory extends Serializable {

    Vector3D evaluate(AzimuthTime time);

    Vector3D evaluateFirstDerivative(AzimuthTime time);

    Vector3D evaluateSecondDerivative(AzimuthTime time);

    AzimuthTime getStartTime();

    AzimuthTime getEndTime();
}
