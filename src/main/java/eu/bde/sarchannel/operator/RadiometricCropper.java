package eu.bde.sarchannel.operator;

import java.awt.Rectangle;
import java.io.IOException;

import org.apache.log4j.Logger;

import eu.bde.sarchannel.calibration.IncidenceAngleProvider;
import eu.bde.sarchannel.calibration.RadiometricConverter;
import eu.bde.sarchannel.metadata.CropMetadata;
import eu.bde.sarchannel.metadata.RadiometricQuantity;
import eu.bde.sarchannel.metadata.RasterInfo;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.SampleWindow;
import eu.bde.sarchannel.rasterreader.RasterReader;

/**
 * Cuts calibrated sample windows centred on a pixel, optionally converting their radiometric quantity.
 */
public class RadiometricCropper {

	private static final Logger log = Logger.getLogger(RadiometricCropper.class);

	private final RasterReader reader;
	private final BurstLayout layout;
	private final BurstAssociator associator;
	private final PixelTimeConverter converter;
	private final double calibrationScale;
	private final RadiometricQuantity nativeQuantity;
	private final IncidenceAngleProvider incidenceAngleProvider;
	private final RadiometricConverter radiometricConverter;
	private final CropMetadata cropMetadata;

	public RadiometricCropper(RasterReader reader, BurstLayout layout, BurstAssociator associator,
			PixelTimeConverter converter, double calibrationScale, RadiometricQuantity nativeQuantity,
			IncidenceAngleProvider incidenceAngleProvider, RadiometricConverter radiometricConverter,
			CropMetadata cropMetadata) {
		this.reader = reader;
		this.layout = layout;
		this.associator = associator;
		this.converter = converter;
		this.calibrationScale = calibrationScale;
		this.nativeQuantity = nativeQuantity;
		this.incidenceAngleProvider = incidenceAngleProvider;
		this.radiometricConverter = radiometricConverter;
		this.cropMetadata = cropMetadata != null ? cropMetadata : new CropMetadata();
	}

	/**
	 * Window of the configured default size and output quantity.
	 */
	public SampleWindow readWindow(int azimuthIndex, int rangeIndex) throws IOException {
		return readWindow(azimuthIndex, rangeIndex, cropMetadata.getCropWidth(), cropMetadata.getCropHeight(),
				cropMetadata.getOutputQuantity());
	}

	/**
	 * @param outputQuantity {@code null} keeps the native quantity
	 */
	public SampleWindow readWindow(int azimuthIndex, int rangeIndex, int width, int height,
			RadiometricQuantity outputQuantity) throws IOException {
		final Rectangle block = centeredBlock(azimuthIndex, rangeIndex, width, height);
		final RasterInfo raster = layout.getRasterInfo();
		checkBounds(block, 0, raster.getLines(), raster.getSamples());
		return read(block, azimuthIndex, rangeIndex, outputQuantity, null);
	}

	/**
	 * Same as {@link #readWindow(int, int, int, int, RadiometricQuantity)}, additionally refusing windows
	 * that leave {@code burst}.
	 */
	public SampleWindow readWindow(int azimuthIndex, int rangeIndex, int width, int height,
			RadiometricQuantity outputQuantity, int burst) throws IOException {
		final Rectangle block = centeredBlock(azimuthIndex, rangeIndex, width, height);
		final RasterInfo raster = layout.getRasterInfo();
		checkBounds(block, 0, raster.getLines(), raster.getSamples());
		final int firstLine = layout.getFirstLine(burst);
		checkBounds(block, firstLine, firstLine + layout.getLinesPerBurstArray()[burst], raster.getSamples());
		return read(block, azimuthIndex, rangeIndex, outputQuantity, burst);
	}

	private static Rectangle centeredBlock(int azimuthIndex, int rangeIndex, int width, int height) {
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException("crop size must be positive: " + width + "x" + height);
		}
		return new Rectangle(rangeIndex - Math.floorDiv(width, 2), azimuthIndex - Math.floorDiv(height, 2), width,
				height);
	}

	/**
	 * Lines are checked against {@code [firstLine, lastLine]}, samples against {@code [0, samples]}.
	 */
	private static void checkBounds(Rectangle block, int firstLine, int lastLine, int samples) {
		final int azimuthStart = block.y;
		final int rangeStart = block.x;
		final int azimuthEnd = block.y + block.height;
		final int rangeEnd = block.x + block.width;
		if (azimuthStart < firstLine || azimuthStart > lastLine) {
			throw new AzimuthExceedsBoundariesException(Boundary.START, azimuthStart,
					"window starts at line " + azimuthStart + ", outside [" + firstLine + ", " + lastLine + "]");
		}
		if (rangeStart < 0 || rangeStart > samples) {
			throw new RangeExceedsBoundariesException(Boundary.START, rangeStart,
					"window starts at sample " + rangeStart + ", outside [0, " + samples + "]");
		}
		if (azimuthEnd > lastLine) {
			throw new AzimuthExceedsBoundariesException(Boundary.END, azimuthEnd,
					"window ends at line " + azimuthEnd + ", past " + lastLine);
		}
		if (rangeEnd > samples) {
			throw new RangeExceedsBoundariesException(Boundary.END, rangeEnd,
					"window ends at sample " + rangeEnd + ", past " + samples);
		}
	}

	private SampleWindow read(Rectangle block, int azimuthIndex, int rangeIndex,
			RadiometricQuantity outputQuantity, Integer burst) throws IOException {
		final SampleWindow window = reader.read(block, calibrationScale);
		if (outputQuantity == null || outputQuantity == nativeQuantity) {
			return window;
		}
		final int owner = burst != null ? burst : associator.pixelToBurst(azimuthIndex);
		final AzimuthTime azimuthTime = converter.pixelToTime(azimuthIndex, rangeIndex, owner).getAzimuthTime();
		final double[] incidenceAngles = incidenceAngleProvider.getIncidenceAngles(azimuthTime, block.x,
				block.width);
		log.debug("converting " + block + " from " + nativeQuantity + " to " + outputQuantity + " at " + azimuthTime);
		return radiometricConverter.convert(window, incidenceAngles, nativeQuantity, outputQuantity);
	}

	public CropMetadata getCropMetadata() {
		return cropMetadata;
	}
}
