package eu.bde.sarchannel.geometry;

import java.io.Serializable;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import eu.bde.sarchannel.model.AzimuthTime;

public class StateVector implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AzimuthTime time;
    private final Vector3D position;
    private final Vector3D velocity;

    public StateVector(AzimuthTime time, Vector3D position, Vector3D velocity) {
        this.time = time;
        this.position = position;
        this.velocity = velocity;
    }

    public AzimuthTime getTime() {
        return time;
    }

    public Vector3D getPosition() {
        return position;
    }

    public Vector3D getVelocity() {
        return velocity;
    }
}
