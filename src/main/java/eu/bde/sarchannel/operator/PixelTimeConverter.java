package eu.bde.sarchannel.operator;

import java.io.Serializable;

import eu.bde.sarchannel.metadata.RasterInfo;
import eu.bde.sarchannel.metadata.SarProjection;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.PixelCoordinate;
import eu.bde.sarchannel.model.TimeCoordinate;
import eu.bde.sarchannel.polynomial.GroundSlantConversion;

/**
 * Affine mapping between raster pixels and (azimuth time, slant range time). Ground range rasters go
 * through the ground/slant conversion evaluated at the swath mid azimuth time. No bounds are checked here.
 */
public class PixelTimeConverter implements Serializable {

	private static final long serialVersionUID = 1L;

	private final BurstLayout layout;
	private final BurstAssociator associator;
	private final SarProjection projection;
	private final GroundSlantConversion groundSlantConversion;
	private final AzimuthTime midAzimuthTime;

	public PixelTimeConverter(BurstLayout layout, BurstAssociator associator, SarProjection projection,
			GroundSlantConversion groundSlantConversion, AzimuthTime midAzimuthTime) {
		if (projection == SarProjection.GROUND_RANGE && groundSlantConversion == null) {
			throw new IllegalArgumentException("ground range channels need a ground/slant conversion");
		}
		this.layout = layout;
		this.associator = associator;
		this.projection = projection;
		this.groundSlantConversion = groundSlantConversion;
		this.midAzimuthTime = midAzimuthTime;
	}

	/**
	 * Azimuth time counted from the raster lines start.
	 */
	public TimeCoordinate pixelToTime(double azimuthIndex, double rangeIndex) {
		final RasterInfo raster = layout.getRasterInfo();
		final AzimuthTime azimuthTime = raster.getLinesStart().plus(azimuthIndex * raster.getLinesStep());
		return new TimeCoordinate(azimuthTime, rangeIndexToRangeTime(rangeIndex));
	}

	/**
	 * Azimuth time counted from the start of {@code burst}; falls back to the raster lines start for
	 * channels without burst structure.
	 */
	public TimeCoordinate pixelToTime(double azimuthIndex, double rangeIndex, int burst) {
		if (!layout.hasBursts()) {
			return pixelToTime(azimuthIndex, rangeIndex);
		}
		final double linesIntoBurst = azimuthIndex - layout.getFirstLine(burst);
		final AzimuthTime azimuthTime = layout.getBurstStartTime(burst)
				.plus(linesIntoBurst * layout.getRasterInfo().getLinesStep());
		return new TimeCoordinate(azimuthTime, rangeIndexToRangeTime(rangeIndex));
	}

	/**
	 * Resolves the burst from the azimuth time first.
	 *
	 * @throws CoordinatesOutOfBoundsException if the azimuth time lies outside the bursts
	 */
	public PixelCoordinate timeToPixel(AzimuthTime azimuthTime, double rangeTime) {
		return timeToPixel(azimuthTime, rangeTime, associator.timeToBurst(azimuthTime));
	}

	public PixelCoordinate timeToPixel(AzimuthTime azimuthTime, double rangeTime, int burst) {
		final RasterInfo raster = layout.getRasterInfo();
		final double azimuthIndex;
		if (layout.hasBursts()) {
			azimuthIndex = layout.getFirstLine(burst)
					+ azimuthTime.minus(layout.getBurstStartTime(burst)) / raster.getLinesStep();
		} else {
			azimuthIndex = azimuthTime.minus(raster.getLinesStart()) / raster.getLinesStep();
		}
		return new PixelCoordinate(azimuthIndex, rangeTimeToRangeIndex(rangeTime));
	}

	/**
	 * @return slant range time of the range sample
	 */
	public double rangeIndexToRangeTime(double rangeIndex) {
		final RasterInfo raster = layout.getRasterInfo();
		final double rangeCoordinate = raster.getSamplesStart() + rangeIndex * raster.getSamplesStep();
		if (projection == SarProjection.GROUND_RANGE) {
			return groundSlantConversion.groundToSlant(midAzimuthTime, rangeCoordinate);
		}
		return rangeCoordinate;
	}

	public double rangeTimeToRangeIndex(double rangeTime) {
		final RasterInfo raster = layout.getRasterInfo();
		double rangeCoordinate = rangeTime;
		if (projection == SarProjection.GROUND_RANGE) {
			rangeCoordinate = groundSlantConversion.slantToGround(midAzimuthTime, rangeTime);
		}
		return (rangeCoordinate - raster.getSamplesStart()) / raster.getSamplesStep();
	}
}
