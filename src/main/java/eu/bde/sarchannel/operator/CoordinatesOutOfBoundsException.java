package eu.bde.sarchannel.operator;

/**
 * A time, pixel or crop request falls outside the swath (or burst) extent.
 */
public class CoordinatesOutOfBoundsException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public enum Axis {
		AZIMUTH,
		RANGE
	}

	private final Axis axis;
	private final double value;

	public CoordinatesOutOfBoundsException(Axis axis, double value, String message) {
		super(message);
		this.axis = axis;
		this.value = value;
	}

	public Axis getAxis() {
		return axis;
	}

	/**
	 * @return the offending index, or for azimuth times the offset in seconds from the first burst start
	 */
	public double getValue() {
		return value;
	}
}
