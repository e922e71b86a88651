package eu.bde.sarchannel.geometry;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import com.google.common.collect.ImmutableList;

import eu.bde.sarchannel.model.AzimuthTime;

/**
 * Trajectory interpolated from orbit state vectors with piecewise cubic Hermite polynomials, which
 * honour both positions and velocities at the nodes.
 */
public class StateVectorTrajectory implements Trajectory {

	private static final long serialVersionUID = 1L;

	private final ImmutableList<StateVector> stateVectors;
	private final double[] nodeTimes;

	public StateVectorTrajectory(List<StateVector> stateVectors) {
		checkArgument(stateVectors.size() >= 2, "at least two state vectors are needed, got %s", stateVectors.size());
		this.stateVectors = ImmutableList.copyOf(stateVectors);
		this.nodeTimes = new double[stateVectors.size()];
		final AzimuthTime first = stateVectors.get(0).getTime();
		for (int i = 0; i < nodeTimes.length; i++) {
			nodeTimes[i] = stateVectors.get(i).getTime().minus(first);
			checkArgument(i == 0 || nodeTimes[i] > nodeTimes[i - 1], "state vector times must be increasing");
		}
	}

	@Override
	public Vector3D evaluate(AzimuthTime time) {
		final int i = segment(time);
		final double h = nodeTimes[i + 1] - nodeTimes[i];
		final double s = time.minus(stateVectors.get(i).getTime()) / h;
		final double s2 = s * s;
		final double s3 = s2 * s;
		final double h00 = 2 * s3 - 3 * s2 + 1;
		final double h10 = s3 - 2 * s2 + s;
		final double h01 = -2 * s3 + 3 * s2;
		final double h11 = s3 - s2;
		return combine(i, h00, h10 * h, h01, h11 * h);
	}

	@Override
	public Vector3D evaluateFirstDerivative(AzimuthTime time) {
		final int i = segment(time);
		final double h = nodeTimes[i + 1] - nodeTimes[i];
		final double s = time.minus(stateVectors.get(i).getTime()) / h;
		final double s2 = s * s;
		final double d00 = 6 * s2 - 6 * s;
		final double d10 = 3 * s2 - 4 * s + 1;
		final double d01 = -6 * s2 + 6 * s;
		final double d11 = 3 * s2 - 2 * s;
		return combine(i, d00 / h, d10, d01 / h, d11);
	}

	@Override
	public Vector3D evaluateSecondDerivative(AzimuthTime time) {
		final int i = segment(time);
		final double h = nodeTimes[i + 1] - nodeTimes[i];
		final double s = time.minus(stateVectors.get(i).getTime()) / h;
		final double dd00 = 12 * s - 6;
		final double dd10 = 6 * s - 4;
		final double dd01 = -12 * s + 6;
		final double dd11 = 6 * s - 2;
		return combine(i, dd00 / (h * h), dd10 / h, dd01 / (h * h), dd11 / h);
	}

	private Vector3D combine(int i, double wp0, double wv0, double wp1, double wv1) {
		final StateVector sv0 = stateVectors.get(i);
		final StateVector sv1 = stateVectors.get(i + 1);
		return new Vector3D(wp0, sv0.getPosition(), wv0, sv0.getVelocity(), wp1, sv1.getPosition(), wv1,
				sv1.getVelocity());
	}

	private int segment(AzimuthTime time) {
		final double t = time.minus(stateVectors.get(0).getTime());
		if (Double.isNaN(t) || t < 0 || t > nodeTimes[nodeTimes.length - 1]) {
			throw new DegenerateGeometryException("time " + time + " is outside the trajectory [" + getStartTime()
					+ ", " + getEndTime() + "]");
		}
		int low = 0;
		int high = nodeTimes.length - 2;
		while (low < high) {
			final int mid = (low + high + 1) >>> 1;
			if (nodeTimes[mid] <= t) {
				low = mid;
			} else {
				high = mid - 1;
			}
		}
		return low;
	}

	@Override
	public AzimuthTime getStartTime() {
		return stateVectors.get(0).getTime();
	}

	@Override
	public AzimuthTime getEndTime() {
		return stateVectors.get(stateVectors.size() - 1).getTime();
	}

	public List<StateVector> getStateVectors() {
		return stateVectors;
	}
}
