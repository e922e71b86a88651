package eu.bde.sarchannel.operator;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.log4j.Logger;

import eu.bde.sarchannel.geometry.GeocodingException;
import eu.bde.sarchannel.geometry.InverseGeocoder;
import eu.bde.sarchannel.geometry.Trajectory;
import eu.bde.sarchannel.metadata.SarProjection;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.BurstAssociation;
import eu.bde.sarchannel.model.BurstRectangle;
import eu.bde.sarchannel.model.TimeCoordinate;
import eu.bde.sarchannel.operator.CoordinatesOutOfBoundsException.Axis;
import eu.bde.sarchannel.polynomial.GroundSlantConversion;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Resolves the burst owning an azimuth time, an azimuth pixel or a ground point.
 * <p>
 * Time and pixel lookups always return exactly one burst, the closest one that has already started.
 * Ground points may fall in the overlap of two bursts and are associated with every burst containing them.
 */
public class BurstAssociator implements Serializable {

	private static final long serialVersionUID = 1L;

	private static final Logger log = Logger.getLogger(BurstAssociator.class);

	private final BurstLayout layout;
	private final Trajectory trajectory;
	private final InverseGeocoder geocoder;
	private final AzimuthTime midAzimuthTime;
	private final double wavelength;
	private final SarProjection projection;
	private final GroundSlantConversion groundSlantConversion;

	public BurstAssociator(BurstLayout layout, Trajectory trajectory, InverseGeocoder geocoder,
			AzimuthTime midAzimuthTime, double wavelength, SarProjection projection,
			GroundSlantConversion groundSlantConversion) {
		if (projection == SarProjection.GROUND_RANGE && groundSlantConversion == null) {
			throw new IllegalArgumentException("ground range channels need a ground/slant conversion");
		}
		this.layout = layout;
		this.trajectory = trajectory;
		this.geocoder = geocoder;
		this.midAzimuthTime = midAzimuthTime;
		this.wavelength = wavelength;
		this.projection = projection;
		this.groundSlantConversion = groundSlantConversion;
	}

	public int timeToBurst(AzimuthTime azimuthTime) {
		if (!layout.hasBursts()) {
			return 0;
		}
		final AzimuthTime first = layout.getBurstStartTime(0);
		if (azimuthTime.isBefore(first) || azimuthTime.isAfter(layout.getNominalEnd())) {
			throw new CoordinatesOutOfBoundsException(Axis.AZIMUTH, azimuthTime.minus(first),
					"azimuth time " + azimuthTime + " outside [" + first + ", " + layout.getNominalEnd() + "]");
		}
		int burst = -1;
		double minDiff = Double.POSITIVE_INFINITY;
		for (int b = 0; b < layout.getNumberOfBursts(); b++) {
			final double diff = azimuthTime.minus(layout.getBurstStartTime(b));
			if (diff >= 0 && diff < minDiff) {
				minDiff = diff;
				burst = b;
			}
		}
		return burst;
	}

	public int[] timesToBursts(List<AzimuthTime> azimuthTimes) {
		final int[] bursts = new int[azimuthTimes.size()];
		for (int i = 0; i < bursts.length; i++) {
			bursts[i] = timeToBurst(azimuthTimes.get(i));
		}
		return bursts;
	}

	/**
	 * @param azimuthPixel azimuth index, possibly fractional
	 */
	public int pixelToBurst(double azimuthPixel) {
		final int[] boundaries = layout.getLineBoundaries();
		if (azimuthPixel < 0 || azimuthPixel > boundaries[boundaries.length - 1]) {
			throw new CoordinatesOutOfBoundsException(Axis.AZIMUTH, azimuthPixel,
					"azimuth pixel " + azimuthPixel + " outside [0, " + boundaries[boundaries.length - 1] + "]");
		}
		int burst = -1;
		double minDiff = Double.POSITIVE_INFINITY;
		// the last boundary closes the raster and is not a burst start
		for (int b = 0; b < boundaries.length - 1; b++) {
			final double diff = azimuthPixel - boundaries[b];
			if (diff >= 0 && diff < minDiff) {
				minDiff = diff;
				burst = b;
			}
		}
		return burst;
	}

	public int[] pixelsToBursts(double[] azimuthPixels) {
		final int[] bursts = new int[azimuthPixels.length];
		for (int i = 0; i < bursts.length; i++) {
			bursts[i] = pixelToBurst(azimuthPixels[i]);
		}
		return bursts;
	}

	/**
	 * @param groundPoint ECEF coordinates in meters
	 * @return every burst whose rectangle contains the zero-Doppler observation of the point, or
	 *         {@link BurstAssociation#none()} if the point cannot be geocoded or lies in no burst
	 */
	public BurstAssociation groundPointToBursts(Vector3D groundPoint) {
		final TimeCoordinate candidate;
		try {
			candidate = geocoder.solve(trajectory, groundPoint, 0.0, wavelength, midAzimuthTime);
		} catch (GeocodingException | RuntimeException e) {
			// any solver failure only costs this point
			log.debug("no burst association for " + groundPoint + ": " + e);
			return BurstAssociation.none();
		}
		if (candidate == null || candidate.getAzimuthTime() == null || Double.isNaN(candidate.getRangeTime())) {
			log.debug("no burst association for " + groundPoint + ": invalid geocoding result " + candidate);
			return BurstAssociation.none();
		}

		double rangeCoordinate = candidate.getRangeTime();
		if (projection == SarProjection.GROUND_RANGE) {
			rangeCoordinate = groundSlantConversion.slantToGround(midAzimuthTime, rangeCoordinate);
		}

		final IntSortedSet bursts = new IntAVLTreeSet();
		for (BurstRectangle rectangle : layout.getRectangles()) {
			if (rectangle.contains(candidate.getAzimuthTime(), rangeCoordinate)) {
				bursts.add(rectangle.getIndex());
			}
		}
		if (bursts.isEmpty()) {
			log.debug(groundPoint + " observed at " + candidate + " lies in no burst");
			return BurstAssociation.none();
		}
		return BurstAssociation.of(bursts);
	}

	/**
	 * @return one association per ground point, in input order; points that cannot be associated are
	 *         marked {@link BurstAssociation#none()} without failing the batch
	 */
	public List<BurstAssociation> associateGroundPoints(List<Vector3D> groundPoints) {
		final List<BurstAssociation> associations = new ArrayList<>(groundPoints.size());
		int associated = 0;
		for (Vector3D point : groundPoints) {
			final BurstAssociation association = groundPointToBursts(point);
			if (association.isAssociated()) {
				associated++;
			}
			associations.add(association);
		}
		log.debug(associated + " of " + groundPoints.size() + " ground points associated to bursts");
		return associations;
	}

	public BurstLayout getLayout() {
		return layout;
	}
}
