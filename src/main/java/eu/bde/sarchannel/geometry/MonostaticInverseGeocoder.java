package eu.bde.sarchannel.geometry;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.util.FastMath;

import eu.bde.sarchannel.metadata.GeocodingMetadata;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.TimeCoordinate;

/**
 * Monostatic inverse geocoding: Newton iteration on the azimuth time for the Doppler equation
 * <pre>
 *   V(t) . (X - P(t)) - (lambda * fdc / 2) * |X - P(t)| = 0
 * </pre>
 * then range time = 2 |X - P| / c.
 */
public class MonostaticInverseGeocoder implements InverseGeocoder {

	private static final long serialVersionUID = 1L;

	private final GeocodingMetadata geocodingMetadata;

	public MonostaticInverseGeocoder(GeocodingMetadata geocodingMetadata) {
		this.geocodingMetadata = geocodingMetadata;
	}

	@Override
	public TimeCoordinate solve(Trajectory trajectory, Vector3D groundPoint, double dopplerCentroid,
			double wavelength, AzimuthTime initialGuess) throws GeocodingException {
		final double dopplerTerm = wavelength * dopplerCentroid / 2;
		AzimuthTime t = initialGuess;
		try {
			for (int iteration = 0; iteration < geocodingMetadata.getInverseMaxIterations(); iteration++) {
				final Vector3D p = trajectory.evaluate(t);
				final Vector3D v = trajectory.evaluateFirstDerivative(t);
				final Vector3D a = trajectory.evaluateSecondDerivative(t);
				final Vector3D los = groundPoint.subtract(p);
				final double distance = los.getNorm();
				final double vDotLos = v.dotProduct(los);

				final double g = vDotLos - dopplerTerm * distance;
				final double dg = a.dotProduct(los) - v.getNormSq() + dopplerTerm * vDotLos / distance;
				if (dg == 0.0 || Double.isNaN(dg)) {
					throw new GeocodingException("zero derivative of the Doppler equation at " + t);
				}
				final double dt = -g / dg;
				t = t.plus(dt);
				if (FastMath.abs(dt) < geocodingMetadata.getInverseTolerance()) {
					final double rangeTime = 2 * groundPoint.distance(trajectory.evaluate(t)) / SarGeometry.LIGHT_SPEED;
					return new TimeCoordinate(t, rangeTime);
				}
			}
		} catch (DegenerateGeometryException e) {
			throw new GeocodingException("inverse geocoding left the trajectory for " + groundPoint, e);
		}
		throw new GeocodingException("inverse geocoding did not converge in "
				+ geocodingMetadata.getInverseMaxIterations() + " iterations for " + groundPoint);
	}
}
