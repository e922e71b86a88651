package eu.bde.sarchannel.operator;

import eu.bde.sarchannel.metadata.BurstInfo;
import eu.bde.sarchannel.metadata.RasterInfo;
import eu.bde.sarchannel.metadata.SarProjection;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.polynomial.GroundSlantConversion;

/**
 * Builds the azimuth and range axes of a channel from its raster and burst metadata.
 */
public class AxisBuilder {

	private final RasterInfo rasterInfo;
	private final BurstInfo burstInfo;

	public AxisBuilder(RasterInfo rasterInfo, BurstInfo burstInfo) {
		this.rasterInfo = rasterInfo;
		this.burstInfo = burstInfo != null ? burstInfo : BurstInfo.NONE;
	}

	/**
	 * One time per line. With bursts, each burst's slice restarts from that burst's start time, so the
	 * axis is only monotonic within a burst.
	 */
	public AzimuthTime[] buildAzimuthAxis() {
		final double step = rasterInfo.getLinesStep();
		if (!burstInfo.hasBursts()) {
			final AzimuthTime start = rasterInfo.getLinesStart();
			final AzimuthTime[] axis = new AzimuthTime[rasterInfo.getLines()];
			for (int line = 0; line < axis.length; line++) {
				axis[line] = start.plus(line * step);
			}
			return axis;
		}
		final int linesPerBurst = burstInfo.getLinesPerBurst();
		final AzimuthTime[] axis = new AzimuthTime[burstInfo.getNumberOfBursts() * linesPerBurst];
		for (int b = 0; b < burstInfo.getNumberOfBursts(); b++) {
			final AzimuthTime start = burstInfo.getAzimuthStartTime(b);
			for (int line = 0; line < linesPerBurst; line++) {
				axis[b * linesPerBurst + line] = start.plus(line * step);
			}
		}
		return axis;
	}

	/**
	 * One value per sample, in the raster's own range unit (seconds or ground meters).
	 */
	public double[] buildRangeAxis() {
		final double[] axis = new double[rasterInfo.getSamples()];
		for (int sample = 0; sample < axis.length; sample++) {
			axis[sample] = sample * rasterInfo.getSamplesStep() + rasterInfo.getSamplesStart();
		}
		return axis;
	}

	/**
	 * Range axis in slant range time. Ground-range axes are converted at the swath mid azimuth time.
	 */
	public double[] buildSlantRangeAxis(SarProjection projection, GroundSlantConversion conversion,
			AzimuthTime midAzimuthTime) {
		final double[] axis = buildRangeAxis();
		if (projection != SarProjection.GROUND_RANGE) {
			return axis;
		}
		for (int sample = 0; sample < axis.length; sample++) {
			axis[sample] = conversion.groundToSlant(midAzimuthTime, axis[sample]);
		}
		return axis;
	}
}
