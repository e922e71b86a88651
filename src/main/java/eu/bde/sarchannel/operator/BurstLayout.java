package eu.bde.sarchannel.operator;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import eu.bde.sarchannel.metadata.BurstInfo;
import eu.bde.sarchannel.metadata.RasterInfo;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.BurstRectangle;

/**
 * Azimuth/range extent of every burst of a channel. A channel without burst structure is laid out
 * as a single burst covering the whole raster.
 */
public class BurstLayout implements Serializable {

	private static final long serialVersionUID = 1L;

	private final RasterInfo rasterInfo;
	private final BurstInfo burstInfo;
	private final ImmutableList<BurstRectangle> rectangles;
	private final int[] lineBoundaries;

	public BurstLayout(RasterInfo rasterInfo, BurstInfo burstInfo) {
		this.rasterInfo = rasterInfo;
		this.burstInfo = burstInfo != null ? burstInfo : BurstInfo.NONE;
		this.rectangles = burstRectangles();

		final int[] linesPerBurst = getLinesPerBurstArray();
		this.lineBoundaries = new int[linesPerBurst.length + 1];
		for (int b = 0; b < linesPerBurst.length; b++) {
			lineBoundaries[b + 1] = lineBoundaries[b] + linesPerBurst[b];
		}
	}

	private ImmutableList<BurstRectangle> burstRectangles() {
		final double rangeExtent = rasterInfo.getSamples() * rasterInfo.getSamplesStep();
		if (!burstInfo.hasBursts()) {
			final AzimuthTime start = rasterInfo.getLinesStart();
			return ImmutableList.of(new BurstRectangle(0, start,
					start.plus(rasterInfo.getLines() * rasterInfo.getLinesStep()), rasterInfo.getSamplesStart(),
					rasterInfo.getSamplesStart() + rangeExtent));
		}
		final ImmutableList.Builder<BurstRectangle> builder = ImmutableList.builder();
		final double burstDuration = burstInfo.getLinesPerBurst() * rasterInfo.getLinesStep();
		for (int b = 0; b < burstInfo.getNumberOfBursts(); b++) {
			final AzimuthTime start = burstInfo.getAzimuthStartTime(b);
			final double rangeStart = burstInfo.hasRangeStartTimes() ? burstInfo.getRangeStartTime(b)
					: rasterInfo.getSamplesStart();
			builder.add(new BurstRectangle(b, start, start.plus(burstDuration), rangeStart, rangeStart + rangeExtent));
		}
		return builder.build();
	}

	public boolean hasBursts() {
		return burstInfo.hasBursts();
	}

	/**
	 * @return number of bursts, 1 for a channel without burst structure
	 */
	public int getNumberOfBursts() {
		return rectangles.size();
	}

	/**
	 * @return lines of each burst; a channel without burst structure has one entry holding all its lines
	 */
	public int[] getLinesPerBurstArray() {
		if (!burstInfo.hasBursts()) {
			return new int[] { rasterInfo.getLines() };
		}
		final int[] lines = new int[burstInfo.getNumberOfBursts()];
		Arrays.fill(lines, burstInfo.getLinesPerBurst());
		return lines;
	}

	public int getLinesPerBurst() {
		return burstInfo.hasBursts() ? burstInfo.getLinesPerBurst() : rasterInfo.getLines();
	}

	/**
	 * @return {@code [0, L1, L1 + L2, ...]}, the first raster line of every burst followed by the line count
	 */
	public int[] getLineBoundaries() {
		return lineBoundaries.clone();
	}

	public int getFirstLine(int burst) {
		return lineBoundaries[burst];
	}

	public AzimuthTime getBurstStartTime(int burst) {
		return rectangles.get(burst).getAzimuthStart();
	}

	/**
	 * @return end of the recorded timeline, assuming bursts follow each other without gaps
	 */
	public AzimuthTime getNominalEnd() {
		final int lines = burstInfo.hasBursts() ? burstInfo.getNumberOfBursts() * burstInfo.getLinesPerBurst()
				: rasterInfo.getLines();
		return getBurstStartTime(0).plus(lines * rasterInfo.getLinesStep());
	}

	public BurstRectangle getRectangle(int burst) {
		return rectangles.get(burst);
	}

	public List<BurstRectangle> getRectangles() {
		return rectangles;
	}

	public RasterInfo getRasterInfo() {
		return rasterInfo;
	}

	public BurstInfo getBurstInfo() {
		return burstInfo;
	}
}
