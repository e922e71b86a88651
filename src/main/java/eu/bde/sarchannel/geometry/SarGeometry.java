package eu.bde.sarchannel.geometry;

import java.io.Serializable;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.FastMath;

import eu.bde.sarchannel.metadata.GeocodingMetadata;
import eu.bde.sarchannel.metadata.SideLooking;
import eu.bde.sarchannel.model.AzimuthTime;

/**
 * Zero-Doppler SAR geometry over the WGS84 ellipsoid: direct geocoding of a (azimuth time, range time)
 * pair, incidence and look angles, ground velocity.
 */
public class SarGeometry implements Serializable {

	private static final long serialVersionUID = 1L;

	public static final double LIGHT_SPEED = 299792458.0;

	public static final double WGS84_SEMI_MAJOR_AXIS = 6378137.0;
	public static final double WGS84_SEMI_MINOR_AXIS = 6356752.314245179;

	private static final double A2 = WGS84_SEMI_MAJOR_AXIS * WGS84_SEMI_MAJOR_AXIS;
	private static final double B2 = WGS84_SEMI_MINOR_AXIS * WGS84_SEMI_MINOR_AXIS;

	private final GeocodingMetadata geocodingMetadata;

	public SarGeometry(GeocodingMetadata geocodingMetadata) {
		this.geocodingMetadata = geocodingMetadata;
	}

	/**
	 * Ground point on the ellipsoid seen at the given times: the intersection of the range sphere, the
	 * zero-Doppler plane and the ellipsoid, on the looking side.
	 */
	public Vector3D directGeocode(Trajectory trajectory, AzimuthTime azimuthTime, double rangeTime, SideLooking side) {
		final Vector3D p = trajectory.evaluate(azimuthTime);
		final Vector3D v = trajectory.evaluateFirstDerivative(azimuthTime);
		final double range = rangeTime * LIGHT_SPEED / 2;

		// spherical Earth guess, radius of the ellipsoid below the sensor
		final double earthRadius = ellipsoidRadius(p.normalize());
		final double sensorRadius = p.getNorm();
		final double cosLook = (sensorRadius * sensorRadius + range * range - earthRadius * earthRadius)
				/ (2 * sensorRadius * range);
		if (Double.isNaN(cosLook) || cosLook > 1.0 || cosLook < -1.0) {
			throw new DegenerateGeometryException("range " + range + " m does not reach the Earth from altitude "
					+ (sensorRadius - earthRadius) + " m");
		}
		final double look = FastMath.acos(cosLook);
		Vector3D x = p.add(range, lineOfSight(p, v, look, side));

		for (int iteration = 0; iteration < geocodingMetadata.getDirectMaxIterations(); iteration++) {
			final Vector3D d = x.subtract(p);
			final RealVector f = new ArrayRealVector(new double[] {
					d.getNormSq() - range * range,
					v.dotProduct(d),
					(x.getX() * x.getX() + x.getY() * x.getY()) / A2 + x.getZ() * x.getZ() / B2 - 1.0 });
			final Array2DRowRealMatrix jacobian = new Array2DRowRealMatrix(new double[][] {
					{ 2 * d.getX(), 2 * d.getY(), 2 * d.getZ() },
					{ v.getX(), v.getY(), v.getZ() },
					{ 2 * x.getX() / A2, 2 * x.getY() / A2, 2 * x.getZ() / B2 } });
			final RealVector step;
			try {
				step = new LUDecomposition(jacobian).getSolver().solve(f);
			} catch (SingularMatrixException e) {
				throw new DegenerateGeometryException("singular direct geocoding system at " + azimuthTime, e);
			}
			x = x.subtract(new Vector3D(step.getEntry(0), step.getEntry(1), step.getEntry(2)));
			if (step.getNorm() < geocodingMetadata.getDirectTolerance()) {
				return x;
			}
		}
		throw new DegenerateGeometryException("direct geocoding did not converge at (" + azimuthTime + ", "
				+ rangeTime + ")");
	}

	/**
	 * Angle between the line of sight and the ellipsoid normal at the observed ground point, in radians.
	 */
	public double incidenceAngle(Trajectory trajectory, AzimuthTime azimuthTime, double rangeTime, SideLooking side) {
		final Vector3D p = trajectory.evaluate(azimuthTime);
		final Vector3D ground = directGeocode(trajectory, azimuthTime, rangeTime, side);
		final Vector3D normal = new Vector3D(ground.getX() / A2, ground.getY() / A2, ground.getZ() / B2);
		return Vector3D.angle(p.subtract(ground), normal);
	}

	/**
	 * Angle between the line of sight and the geocentric nadir, in radians.
	 */
	public double lookAngle(Trajectory trajectory, AzimuthTime azimuthTime, double rangeTime, SideLooking side) {
		final Vector3D p = trajectory.evaluate(azimuthTime);
		final Vector3D ground = directGeocode(trajectory, azimuthTime, rangeTime, side);
		return Vector3D.angle(ground.subtract(p), p.negate());
	}

	/**
	 * Speed of the footprint of a fixed look angle along the ground, in m/s.
	 */
	public double groundVelocity(Trajectory trajectory, AzimuthTime azimuthTime, double lookAngle, SideLooking side) {
		final double dt = geocodingMetadata.getGroundVelocityTimeStep();
		final Vector3D before = intersectEllipsoid(trajectory, azimuthTime.plus(-dt), lookAngle, side);
		final Vector3D after = intersectEllipsoid(trajectory, azimuthTime.plus(dt), lookAngle, side);
		return after.distance(before) / (2 * dt);
	}

	private Vector3D intersectEllipsoid(Trajectory trajectory, AzimuthTime time, double lookAngle, SideLooking side) {
		final Vector3D p = trajectory.evaluate(time);
		final Vector3D d = lineOfSight(p, trajectory.evaluateFirstDerivative(time), lookAngle, side);
		final double a = (d.getX() * d.getX() + d.getY() * d.getY()) / A2 + d.getZ() * d.getZ() / B2;
		final double b = 2 * ((p.getX() * d.getX() + p.getY() * d.getY()) / A2 + p.getZ() * d.getZ() / B2);
		final double c = (p.getX() * p.getX() + p.getY() * p.getY()) / A2 + p.getZ() * p.getZ() / B2 - 1.0;
		final double discriminant = b * b - 4 * a * c;
		if (discriminant < 0) {
			throw new DegenerateGeometryException("look angle " + FastMath.toDegrees(lookAngle)
					+ " deg misses the Earth at " + time);
		}
		final double distance = (-b - FastMath.sqrt(discriminant)) / (2 * a);
		return p.add(distance, d);
	}

	/**
	 * Unit vector at {@code lookAngle} from nadir, rotated towards the looking side.
	 */
	static Vector3D lineOfSight(Vector3D position, Vector3D velocity, double lookAngle, SideLooking side) {
		final Vector3D nadir = position.normalize().negate();
		Vector3D across = velocity.crossProduct(position).normalize();
		if (side == SideLooking.LEFT) {
			across = across.negate();
		}
		return new Vector3D(FastMath.cos(lookAngle), nadir, FastMath.sin(lookAngle), across);
	}

	private static double ellipsoidRadius(Vector3D direction) {
		final double k = (direction.getX() * direction.getX() + direction.getY() * direction.getY()) / A2
				+ direction.getZ() * direction.getZ() / B2;
		return 1.0 / FastMath.sqrt(k);
	}
}
