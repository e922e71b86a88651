package eu.bde.sarchannel.operator;

public class RangeExceedsBoundariesException extends CoordinatesOutOfBoundsException {

	private static final long serialVersionUID = 1L;

	private final Boundary boundary;

	public RangeExceedsBoundariesException(Boundary boundary, int sample, String message) {
		super(Axis.RANGE, sample, message);
		this.boundary = boundary;
	}

	public Boundary getBoundary() {
		return boundary;
	}
}
