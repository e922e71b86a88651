package eu.bde.sarchannel.metadata;

import java.io.Serializable;

/**
 * Numeric parameters of the geocoding solvers.
 */
public class GeocodingMetadata implements Serializable {

    private static final long serialVersionUID = 1L;

    private int inverseMaxIterations = 20;
    private double inverseTolerance = 1.e-9;

    private int directMaxIterations = 30;
    private double directTolerance = 1.e-5;

    // half-width, in seconds, of the finite difference used for the ground velocity
    private double groundVelocityTimeStep = 0.5;

    public GeocodingMetadata() {
    }

    /**
     * @param iParams inverse max iterations, direct max iterations
     * @param dParams inverse tolerance (s), direct tolerance (m), ground velocity time step (s)
     */
    public GeocodingMetadata(int[] iParams, double[] dParams) {
        this.inverseMaxIterations = iParams[0];
        this.directMaxIterations = iParams[1];
        this.inverseTolerance = dParams[0];
        this.directTolerance = dParams[1];
        this.groundVelocityTimeStep = dParams[2];
    }

    public int getInverseMaxIterations() {
        return inverseMaxIterations;
    }

    public void setInverseMaxIterations(int inverseMaxIterations) {
        this.inverseMaxIterations = inverseMaxIterations;
    }

    public double getInverseTolerance() {
        return inverseTolerance;
    }

    public void setInverseTolerance(double inverseTolerance) {
        this.inverseTolerance = inverseTolerance;
    }

    public int getDirectMaxIterations() {
        return directMaxIterations;
    }

    public void setDirectMaxIterations(int directMaxIterations) {
        this.directMaxIterations = directMaxIterations;
    }

    public double getDirectTolerance() {
        return directTolerance;
    }

    public void setDirectTolerance(double directTolerance) {
        this.directTolerance = directTolerance;
    }

    public double getGroundVelocityTimeStep() {
        return groundVelocityTimeStep;
    }

    public void setGroundVelocityTimeStep(double groundVelocityTimeStep) {
        this.groundVelocityTimeStep = groundVelocityTimeStep;
    }
}
