package eu.bde.sarchannel.metadata;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;
import java.util.List;

import com.google.common.collect.ImmutableList;

import eu.bde.sarchannel.polynomial.GroundSlantConversion;
import eu.bde.sarchannel.polynomial.SortedPolyList;
import eu.bde.sarchannel.polynomial.SteeringRatePolynomial;

/**
 * Format independent description of one channel (swath + polarization) of a SAR product.
 * Per-format readers fill it through {@link Builder}.
 */
public class ChannelMetadata implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String channelId;
    private final String swathName;
    private final RasterInfo rasterInfo;
    private final BurstInfo burstInfo;
    private final SarProjection projection;
    private final SideLooking side;
    private final Polarization polarization;
    private final OrbitDirection orbitDirection;
    private final ImageType imageType;
    private final RadiometricQuantity radiometricQuantity;
    private final double carrierFrequency;
    private final double pulseBandwidth;
    private final double pulseLength;
    private final SortedPolyList dopplerCentroid;
    private final SortedPolyList dopplerRate;
    private final SteeringRatePolynomial steeringRate;
    private final ImmutableList<SwstChange> swstChanges;
    private final double calibrationScale;
    private final GroundSlantConversion groundSlantConversion;
    private final double[] incidenceAnglePolynomial;

    private ChannelMetadata(Builder builder) {
        this.channelId = checkNotNull(builder.channelId, "channel id");
        this.swathName = builder.swathName;
        this.rasterInfo = checkNotNull(builder.rasterInfo, "raster info");
        this.burstInfo = builder.burstInfo != null ? builder.burstInfo : BurstInfo.NONE;
        this.projection = checkNotNull(builder.projection, "projection");
        this.side = checkNotNull(builder.side, "looking side");
        this.polarization = builder.polarization;
        this.orbitDirection = builder.orbitDirection;
        this.imageType = builder.imageType;
        this.radiometricQuantity = checkNotNull(builder.radiometricQuantity, "radiometric quantity");
        this.carrierFrequency = builder.carrierFrequency;
        this.pulseBandwidth = builder.pulseBandwidth;
        this.pulseLength = builder.pulseLength;
        this.dopplerCentroid = builder.dopplerCentroid != null ? builder.dopplerCentroid : new SortedPolyList();
        this.dopplerRate = builder.dopplerRate != null ? builder.dopplerRate : new SortedPolyList();
        this.steeringRate = builder.steeringRate != null ? builder.steeringRate : SteeringRatePolynomial.ZERO;
        this.swstChanges = ImmutableList.copyOf(builder.swstChanges);
        this.calibrationScale = builder.calibrationScale;
        this.groundSlantConversion = builder.groundSlantConversion;
        this.incidenceAnglePolynomial = builder.incidenceAnglePolynomial;

        checkArgument(carrierFrequency > 0, "carrier frequency must be positive: %s", carrierFrequency);
        checkArgument(projection != SarProjection.GROUND_RANGE || groundSlantConversion != null,
                "ground range channel %s needs a ground/slant conversion", channelId);
        if (burstInfo.hasBursts()) {
            checkArgument(burstInfo.getNumberOfBursts() * burstInfo.getLinesPerBurst() <= rasterInfo.getLines(),
                    "%s bursts of %s lines do not fit %s raster lines", burstInfo.getNumberOfBursts(),
                    burstInfo.getLinesPerBurst(), rasterInfo.getLines());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getChannelId() {
        return channelId;
    }

    public String getSwathName() {
        return swathName;
    }

    public RasterInfo getRasterInfo() {
        return rasterInfo;
    }

    public BurstInfo getBurstInfo() {
        return burstInfo;
    }

    public SarProjection getProjection() {
        return projection;
    }

    public SideLooking getSide() {
        return side;
    }

    public Polarization getPolarization() {
        return polarization;
    }

    public OrbitDirection getOrbitDirection() {
        return orbitDirection;
    }

    public ImageType getImageType() {
        return imageType;
    }

    public RadiometricQuantity getRadiometricQuantity() {
        return radiometricQuantity;
    }

    public double getCarrierFrequency() {
        return carrierFrequency;
    }

    public double getPulseBandwidth() {
        return pulseBandwidth;
    }

    public double getPulseLength() {
        return pulseLength;
    }

    public SortedPolyList getDopplerCentroid() {
        return dopplerCentroid;
    }

    public SortedPolyList getDopplerRate() {
        return dopplerRate;
    }

    public SteeringRatePolynomial getSteeringRate() {
        return steeringRate;
    }

    public List<SwstChange> getSwstChanges() {
        return swstChanges;
    }

    public double getCalibrationScale() {
        return calibrationScale;
    }

    public GroundSlantConversion getGroundSlantConversion() {
        return groundSlantConversion;
    }

    /**
     * @return incidence angle polynomial in degrees of the range pixel index, or {@code null}
     */
    public double[] getIncidenceAnglePolynomial() {
        return incidenceAnglePolynomial == null ? null : incidenceAnglePolynomial.clone();
    }

    public static class Builder {
        private String channelId;
        private String swathName;
        private RasterInfo rasterInfo;
        private BurstInfo burstInfo;
        private SarProjection projection = SarProjection.SLANT_RANGE;
        private SideLooking side = SideLooking.RIGHT;
        private Polarization polarization;
        private OrbitDirection orbitDirection;
        private ImageType imageType = ImageType.SLC;
        private RadiometricQuantity radiometricQuantity = RadiometricQuantity.BETA_NOUGHT;
        private double carrierFrequency;
        private double pulseBandwidth;
        private double pulseLength;
        private SortedPolyList dopplerCentroid;
        private SortedPolyList dopplerRate;
        private SteeringRatePolynomial steeringRate;
        private List<SwstChange> swstChanges = ImmutableList.of();
        private double calibrationScale = 1.0;
        private GroundSlantConversion groundSlantConversion;
        private double[] incidenceAnglePolynomial;

        public Builder channelId(String channelId) {
            this.channelId = channelId;
            return this;
        }

        public Builder swathName(String swathName) {
            this.swathName = swathName;
            return this;
        }

        public Builder rasterInfo(RasterInfo rasterInfo) {
            this.rasterInfo = rasterInfo;
            return this;
        }

        public Builder burstInfo(BurstInfo burstInfo) {
            this.burstInfo = burstInfo;
            return this;
        }

        public Builder projection(SarProjection projection) {
            this.projection = projection;
            return this;
        }

        public Builder side(SideLooking side) {
            this.side = side;
            return this;
        }

        public Builder polarization(Polarization polarization) {
            this.polarization = polarization;
            return this;
        }

        public Builder orbitDirection(OrbitDirection orbitDirection) {
            this.orbitDirection = orbitDirection;
            return this;
        }

        public Builder imageType(ImageType imageType) {
            this.imageType = imageType;
            return this;
        }

        public Builder radiometricQuantity(RadiometricQuantity radiometricQuantity) {
            this.radiometricQuantity = radiometricQuantity;
            return this;
        }

        public Builder carrierFrequency(double carrierFrequency) {
            this.carrierFrequency = carrierFrequency;
            return this;
        }

        public Builder pulse(double bandwidth, double length) {
            this.pulseBandwidth = bandwidth;
            this.pulseLength = length;
            return this;
        }

        public Builder dopplerCentroid(SortedPolyList dopplerCentroid) {
            this.dopplerCentroid = dopplerCentroid;
            return this;
        }

        public Builder dopplerRate(SortedPolyList dopplerRate) {
            this.dopplerRate = dopplerRate;
            return this;
        }

        public Builder steeringRate(SteeringRatePolynomial steeringRate) {
            this.steeringRate = steeringRate;
            return this;
        }

        public Builder swstChanges(List<SwstChange> swstChanges) {
            this.swstChanges = swstChanges;
            return this;
        }

        public Builder calibrationScale(double calibrationScale) {
            this.calibrationScale = calibrationScale;
            return this;
        }

        public Builder groundSlantConversion(GroundSlantConversion groundSlantConversion) {
            this.groundSlantConversion = groundSlantConversion;
            return this;
        }

        public Builder incidenceAnglePolynomial(double[] incidenceAnglePolynomial) {
            this.incidenceAnglePolynomial = incidenceAnglePolynomial == null ? null : incidenceAnglePolynomial.clone();
            return this;
        }

        public ChannelMetadata build() {
            return new ChannelMetadata(this);
        }
    }
}
