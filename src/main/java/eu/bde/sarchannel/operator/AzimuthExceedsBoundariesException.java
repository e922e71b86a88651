package eu.bde.sarchannel.operator;

public class AzimuthExceedsBoundariesException extends CoordinatesOutOfBoundsException {

	private static final long serialVersionUID = 1L;

	private final Boundary boundary;

	public AzimuthExceedsBoundariesException(Boundary boundary, int line, String message) {
		super(Axis.AZIMUTH, line, message);
		this.boundary = boundary;
	}

	public Boundary getBoundary() {
		return boundary;
	}
}
