package eu.bde.sarchannel.geometry;

/**
 * Raised when the acquisition geometry has no valid solution, e.g. a range shorter than the sensor
 * altitude, a line of sight missing the Earth or a time outside the trajectory.
 */
public class DegenerateGeometryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DegenerateGeometryException(String message) {
        super(message);
    }

    public DegenerateGeometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
