package eu.bde.sarchannel.geometry;

/**
 * Inverse geocoding did not find the acquisition time of a ground point.
 */
public class GeocodingException extends Exception {

    private static final long serialVersionUID = 1L;

    public GeocodingException(String message) {
        super(message);
    }

    public GeocodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
