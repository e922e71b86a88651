package eu.bde.sarchannel.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.log4j.Logger;

import eu.bde.sarchannel.metadata.CropMetadata;
import eu.bde.sarchannel.metadata.GeocodingMetadata;
import eu.bde.sarchannel.metadata.RadiometricQuantity;

/**
 * Engine settings, read from {@code sarchannel.properties} on the classpath and optionally overridden.
 */
public class EngineConfiguration {

    private static final Logger log = Logger.getLogger(EngineConfiguration.class);

    public static final String RESOURCE = "sarchannel.properties";

    public static final String CROP_WIDTH = "sarchannel.crop.width";
    public static final String CROP_HEIGHT = "sarchannel.crop.height";
    public static final String CROP_OUTPUT_QUANTITY = "sarchannel.crop.outputQuantity";
    public static final String INVERSE_MAX_ITERATIONS = "sarchannel.geocoding.inverse.maxIterations";
    public static final String INVERSE_TOLERANCE = "sarchannel.geocoding.inverse.tolerance";
    public static final String DIRECT_MAX_ITERATIONS = "sarchannel.geocoding.direct.maxIterations";
    public static final String DIRECT_TOLERANCE = "sarchannel.geocoding.direct.tolerance";
    public static final String GROUND_VELOCITY_STEP = "sarchannel.geocoding.groundVelocityTimeStep";
    public static final String SPARK_MASTER = "sarchannel.spark.master";
    public static final String SPARK_APP_NAME = "sarchannel.spark.appName";
    public static final String SPARK_PARTITIONS = "sarchannel.spark.partitions";

    private final Properties properties;

    private EngineConfiguration(Properties properties) {
        this.properties = properties;
    }

    /**
     * @return the defaults shipped with the engine
     */
    public static EngineConfiguration load() throws IOException {
        Properties defaults = new Properties();
        try (InputStream in = EngineConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IOException(RESOURCE + " not found on the classpath");
            }
            defaults.load(in);
        }
        return new EngineConfiguration(defaults);
    }

    public static EngineConfiguration load(String overridesPath) throws IOException {
        Properties overrides = new Properties();
        try (InputStream in = new FileInputStream(overridesPath)) {
            overrides.load(in);
        }
        log.info("configuration overrides from " + overridesPath);
        return load().withOverrides(overrides);
    }

    public EngineConfiguration withOverrides(Properties overrides) {
        Properties merged = new Properties();
        merged.putAll(properties);
        merged.putAll(overrides);
        return new EngineConfiguration(merged);
    }

    public int getCropWidth() {
        return getInt(CROP_WIDTH);
    }

    public int getCropHeight() {
        return getInt(CROP_HEIGHT);
    }

    public RadiometricQuantity getCropOutputQuantity() {
        return RadiometricQuantity.valueOf(getString(CROP_OUTPUT_QUANTITY));
    }

    public int getInverseMaxIterations() {
        return getInt(INVERSE_MAX_ITERATIONS);
    }

    public double getInverseTolerance() {
        return getDouble(INVERSE_TOLERANCE);
    }

    public int getDirectMaxIterations() {
        return getInt(DIRECT_MAX_ITERATIONS);
    }

    public double getDirectTolerance() {
        return getDouble(DIRECT_TOLERANCE);
    }

    public double getGroundVelocityTimeStep() {
        return getDouble(GROUND_VELOCITY_STEP);
    }

    public String getSparkMaster() {
        return getString(SPARK_MASTER);
    }

    public String getSparkAppName() {
        return getString(SPARK_APP_NAME);
    }

    public int getSparkPartitions() {
        return getInt(SPARK_PARTITIONS);
    }

    public GeocodingMetadata createGeocodingMetadata() {
        int[] iParams = { getInverseMaxIterations(), getDirectMaxIterations() };
        double[] dParams = { getInverseTolerance(), getDirectTolerance(), getGroundVelocityTimeStep() };
        return new GeocodingMetadata(iParams, dParams);
    }

    public CropMetadata createCropMetadata() {
        return new CropMetadata(getCropWidth(), getCropHeight(), getCropOutputQuantity());
    }

    private String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("missing configuration key " + key);
        }
        return value.trim();
    }

    private int getInt(String key) {
        try {
            return Integer.parseInt(getString(key));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("configuration key " + key + " is not an integer", e);
        }
    }

    private double getDouble(String key) {
        try {
            return Double.parseDouble(getString(key));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("configuration key " + key + " is not a number", e);
        }
    }
}
