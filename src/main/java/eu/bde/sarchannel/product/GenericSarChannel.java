package eu.bde.sarchannel.product;

import java.io.IOException;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.util.FastMath;
import org.apache.log4j.Logger;

import eu.bde.sarchannel.calibration.IncidenceAngleProvider;
import eu.bde.sarchannel.calibration.IncidenceAngleRadiometricConverter;
import eu.bde.sarchannel.calibration.PolynomialIncidenceAngleProvider;
import eu.bde.sarchannel.calibration.TrajectoryIncidenceAngleProvider;
import eu.bde.sarchannel.geometry.InverseGeocoder;
import eu.bde.sarchannel.geometry.MonostaticInverseGeocoder;
import eu.bde.sarchannel.geometry.SarGeometry;
import eu.bde.sarchannel.geometry.Trajectory;
import eu.bde.sarchannel.metadata.ChannelMetadata;
import eu.bde.sarchannel.metadata.CropMetadata;
import eu.bde.sarchannel.metadata.GeocodingMetadata;
import eu.bde.sarchannel.metadata.ImageType;
import eu.bde.sarchannel.metadata.OrbitDirection;
import eu.bde.sarchannel.metadata.Polarization;
import eu.bde.sarchannel.metadata.RadiometricQuantity;
import eu.bde.sarchannel.metadata.RasterInfo;
import eu.bde.sarchannel.metadata.SarProjection;
import eu.bde.sarchannel.metadata.SideLooking;
import eu.bde.sarchannel.metadata.SwstChange;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.BurstAssociation;
import eu.bde.sarchannel.model.LocationData;
import eu.bde.sarchannel.model.PixelCoordinate;
import eu.bde.sarchannel.model.SampleWindow;
import eu.bde.sarchannel.model.TimeCoordinate;
import eu.bde.sarchannel.operator.AxisBuilder;
import eu.bde.sarchannel.operator.BurstAssociator;
import eu.bde.sarchannel.operator.BurstLayout;
import eu.bde.sarchannel.operator.LocationDataCalculator;
import eu.bde.sarchannel.operator.PixelTimeConverter;
import eu.bde.sarchannel.operator.RadiometricCropper;
import eu.bde.sarchannel.polynomial.DopplerPolynomial;
import eu.bde.sarchannel.rasterreader.RasterReader;

/**
 * {@link SarChannel} built from normalized {@link ChannelMetadata}. Axes, burst layout and the
 * derived mid times are computed once here and never change afterwards.
 */
public class GenericSarChannel implements SarChannel {

	private static final Logger log = Logger.getLogger(GenericSarChannel.class);

	private final ChannelMetadata metadata;
	private final Trajectory trajectory;
	private final SarGeometry geometry;

	private final AzimuthTime[] azimuthAxis;
	private final double[] rangeAxis;
	private final double[] slantRangeAxis;
	private final AzimuthTime midAzimuthTime;
	private final double midRangeTime;

	private final BurstLayout layout;
	private final BurstAssociator associator;
	private final PixelTimeConverter converter;
	private final RadiometricCropper cropper;
	private final LocationDataCalculator locationDataCalculator;

	public GenericSarChannel(ChannelMetadata metadata, Trajectory trajectory, RasterReader reader,
			GeocodingMetadata geocodingMetadata, CropMetadata cropMetadata) {
		this(metadata, trajectory, reader, new MonostaticInverseGeocoder(geocodingMetadata),
				new SarGeometry(geocodingMetadata), cropMetadata);
	}

	public GenericSarChannel(ChannelMetadata metadata, Trajectory trajectory, RasterReader reader,
			InverseGeocoder geocoder, SarGeometry geometry, CropMetadata cropMetadata) {
		this.metadata = metadata;
		this.trajectory = trajectory;
		this.geometry = geometry;

		final RasterInfo raster = metadata.getRasterInfo();
		final AxisBuilder axisBuilder = new AxisBuilder(raster, metadata.getBurstInfo());
		this.azimuthAxis = axisBuilder.buildAzimuthAxis();
		this.rangeAxis = axisBuilder.buildRangeAxis();
		this.midAzimuthTime = azimuthAxis.length > 0 ? azimuthAxis[azimuthAxis.length / 2] : raster.getLinesStart();
		this.slantRangeAxis = axisBuilder.buildSlantRangeAxis(metadata.getProjection(),
				metadata.getGroundSlantConversion(), midAzimuthTime);
		this.midRangeTime = computeMidRangeTime();

		this.layout = new BurstLayout(raster, metadata.getBurstInfo());
		this.associator = new BurstAssociator(layout, trajectory, geocoder, midAzimuthTime, getWavelength(),
				metadata.getProjection(), metadata.getGroundSlantConversion());
		this.converter = new PixelTimeConverter(layout, associator, metadata.getProjection(),
				metadata.getGroundSlantConversion(), midAzimuthTime);
		this.cropper = new RadiometricCropper(reader, layout, associator, converter, metadata.getCalibrationScale(),
				metadata.getRadiometricQuantity(), incidenceAngleProvider(), new IncidenceAngleRadiometricConverter(),
				cropMetadata);
		this.locationDataCalculator = trajectory == null ? null
				: new LocationDataCalculator(geometry, trajectory, metadata.getSide(), metadata.getProjection(),
						getAzimuthStepSeconds(), getRangeStepMeters(), midRangeTime);

		log.info("channel " + metadata.getChannelId() + ": " + raster + ", " + metadata.getBurstInfo() + ", "
				+ metadata.getProjection() + ", mid azimuth " + midAzimuthTime + ", mid range " + midRangeTime);
	}

	private double computeMidRangeTime() {
		final RasterInfo raster = metadata.getRasterInfo();
		final double mid = raster.getSamplesStart() + (raster.getSamples() - 1) * raster.getSamplesStep() / 2;
		if (metadata.getProjection() == SarProjection.GROUND_RANGE) {
			return metadata.getGroundSlantConversion().groundToSlant(midAzimuthTime, FastMath.floor(mid));
		}
		return mid;
	}

	private IncidenceAngleProvider incidenceAngleProvider() {
		if (metadata.getIncidenceAnglePolynomial() != null) {
			return new PolynomialIncidenceAngleProvider(metadata.getIncidenceAnglePolynomial());
		}
		if (trajectory != null) {
			return new TrajectoryIncidenceAngleProvider(geometry, trajectory, metadata.getSide(), converter);
		}
		return new IncidenceAngleProvider() {
			private static final long serialVersionUID = 1L;

			@Override
			public double[] getIncidenceAngles(AzimuthTime azimuthTime, int firstSample, int samples) {
				throw new IllegalStateException("channel " + metadata.getChannelId()
						+ " has neither an orbit nor an incidence angle polynomial");
			}
		};
	}

	@Override
	public String getChannelId() {
		return metadata.getChannelId();
	}

	@Override
	public String getSwathName() {
		return metadata.getSwathName();
	}

	@Override
	public SarProjection getProjection() {
		return metadata.getProjection();
	}

	@Override
	public Polarization getPolarization() {
		return metadata.getPolarization();
	}

	@Override
	public OrbitDirection getOrbitDirection() {
		return metadata.getOrbitDirection();
	}

	@Override
	public ImageType getImageType() {
		return metadata.getImageType();
	}

	@Override
	public SideLooking getLookingSide() {
		return metadata.getSide();
	}

	@Override
	public RadiometricQuantity getRadiometricQuantity() {
		return metadata.getRadiometricQuantity();
	}

	@Override
	public double getCarrierFrequency() {
		return metadata.getCarrierFrequency();
	}

	@Override
	public double getWavelength() {
		return SarGeometry.LIGHT_SPEED / metadata.getCarrierFrequency();
	}

	@Override
	public double getPulseRate() {
		return metadata.getPulseBandwidth() / metadata.getPulseLength();
	}

	@Override
	public double getRangeStepMeters() {
		final double step = metadata.getRasterInfo().getSamplesStep();
		if (metadata.getProjection() == SarProjection.GROUND_RANGE) {
			return step;
		}
		return step * SarGeometry.LIGHT_SPEED / 2;
	}

	@Override
	public double getAzimuthStepSeconds() {
		return metadata.getRasterInfo().getLinesStep();
	}

	@Override
	public AzimuthTime getMidAzimuthTime() {
		return midAzimuthTime;
	}

	@Override
	public double getMidRangeTime() {
		return midRangeTime;
	}

	@Override
	public AzimuthTime[] getAzimuthAxis() {
		return azimuthAxis.clone();
	}

	@Override
	public double[] getRangeAxis() {
		return rangeAxis.clone();
	}

	@Override
	public double[] getSlantRangeAxis() {
		return slantRangeAxis.clone();
	}

	@Override
	public int[] getLinesPerBurst() {
		return layout.getLinesPerBurstArray();
	}

	@Override
	public List<SwstChange> getSwstChanges() {
		return metadata.getSwstChanges();
	}

	@Override
	public TimeCoordinate getMidBurstTimes(int burst) {
		if (!layout.hasBursts()) {
			return new TimeCoordinate(midAzimuthTime, midRangeTime);
		}
		return layout.getRectangle(burst).getCenter();
	}

	@Override
	public double getSteeringRate(AzimuthTime azimuthTime) {
		return metadata.getSteeringRate().evaluate(azimuthTime.minus(metadata.getRasterInfo().getLinesStart()));
	}

	@Override
	public double getSteeringRate(AzimuthTime azimuthTime, int burst) {
		if (!layout.hasBursts()) {
			return getSteeringRate(azimuthTime);
		}
		return metadata.getSteeringRate().evaluate(azimuthTime.minus(layout.getBurstStartTime(burst)));
	}

	@Override
	public DopplerPolynomial getDopplerCentroid() {
		return new DopplerPolynomial(metadata.getDopplerCentroid());
	}

	@Override
	public DopplerPolynomial getDopplerRate() {
		return new DopplerPolynomial(metadata.getDopplerRate());
	}

	@Override
	public Trajectory getTrajectory() {
		return trajectory;
	}

	@Override
	public LocationData getLocationData(AzimuthTime azimuthTime, double rangeTime) {
		if (locationDataCalculator == null) {
			throw new IllegalStateException("channel " + getChannelId() + " has no orbit");
		}
		return locationDataCalculator.compute(azimuthTime, rangeTime);
	}

	@Override
	public TimeCoordinate pixelToTime(double azimuthIndex, double rangeIndex) {
		return converter.pixelToTime(azimuthIndex, rangeIndex);
	}

	@Override
	public TimeCoordinate pixelToTime(double azimuthIndex, double rangeIndex, int burst) {
		return converter.pixelToTime(azimuthIndex, rangeIndex, burst);
	}

	@Override
	public PixelCoordinate timeToPixel(AzimuthTime azimuthTime, double rangeTime) {
		return converter.timeToPixel(azimuthTime, rangeTime);
	}

	@Override
	public PixelCoordinate timeToPixel(AzimuthTime azimuthTime, double rangeTime, int burst) {
		return converter.timeToPixel(azimuthTime, rangeTime, burst);
	}

	@Override
	public int timeToBurst(AzimuthTime azimuthTime) {
		return associator.timeToBurst(azimuthTime);
	}

	@Override
	public int pixelToBurst(double azimuthIndex) {
		return associator.pixelToBurst(azimuthIndex);
	}

	@Override
	public BurstAssociation groundPointToBursts(Vector3D groundPoint) {
		return associator.groundPointToBursts(groundPoint);
	}

	@Override
	public List<BurstAssociation> groundPointsToBursts(List<Vector3D> groundPoints) {
		return associator.associateGroundPoints(groundPoints);
	}

	@Override
	public SampleWindow readWindow(int azimuthIndex, int rangeIndex, int width, int height,
			RadiometricQuantity outputQuantity) throws IOException {
		return cropper.readWindow(azimuthIndex, rangeIndex, width, height, outputQuantity);
	}

	@Override
	public SampleWindow readWindow(int azimuthIndex, int rangeIndex, int width, int height,
			RadiometricQuantity outputQuantity, int burst) throws IOException {
		return cropper.readWindow(azimuthIndex, rangeIndex, width, height, outputQuantity, burst);
	}

	/**
	 * Broadcast to the workers by {@link eu.bde.sarchannel.distributed.SparkGroundPointAssociation}.
	 */
	public BurstAssociator getBurstAssociator() {
		return associator;
	}

	public RadiometricCropper getCropper() {
		return cropper;
	}

	public ChannelMetadata getMetadata() {
		return metadata;
	}
}
