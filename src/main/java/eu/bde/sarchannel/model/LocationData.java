package eu.bde.sarchannel.model;

/**
 * Geometry derived for one (azimuth time, range time) location. Angles are in radians,
 * velocity in m/s, steps in meters.
 */
public final class LocationData {

    private final AzimuthTime azimuthTime;
    private final double rangeTime;
    private final double incidenceAngle;
    private final double lookAngle;
    private final double groundVelocity;
    private final double azimuthStepMeters;
    private final double rangeStepMeters;
    private final double groundRangeStepMeters;

    public LocationData(AzimuthTime azimuthTime, double rangeTime, double incidenceAngle, double lookAngle,
            double groundVelocity, double azimuthStepMeters, double rangeStepMeters, double groundRangeStepMeters) {
        this.azimuthTime = azimuthTime;
        this.rangeTime = rangeTime;
        this.incidenceAngle = incidenceAngle;
        this.lookAngle = lookAngle;
        this.groundVelocity = groundVelocity;
        this.azimuthStepMeters = azimuthStepMeters;
        this.rangeStepMeters = rangeStepMeters;
        this.groundRangeStepMeters = groundRangeStepMeters;
    }

    public AzimuthTime getAzimuthTime() {
        return azimuthTime;
    }

    public double getRangeTime() {
        return rangeTime;
    }

    public double getIncidenceAngle() {
        return incidenceAngle;
    }

    public double getLookAngle() {
        return lookAngle;
    }

    public double getGroundVelocity() {
        return groundVelocity;
    }

    public double getAzimuthStepMeters() {
        return azimuthStepMeters;
    }

    public double getRangeStepMeters() {
        return rangeStepMeters;
    }

    public double getGroundRangeStepMeters() {
        return groundRangeStepMeters;
    }

    @Override
    public String toString() {
        return "LocationData[" + azimuthTime + ", " + rangeTime + ", incidence=" + incidenceAngle + ", look="
                + lookAngle + ", vg=" + groundVelocity + "]";
    }
}
