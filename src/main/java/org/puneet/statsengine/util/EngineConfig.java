package org.puneet.statsengine.util;

import org.puneet.statsengine.statistical.CorrectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Immutable configuration of the statistics engine.
 *
 * <p>Holds the fixed numeric constants of the engine and the two settings a
 * deployment may override through the {@value #CONFIG_FILE} classpath resource:
 * the default significance level used when a caller omits {@code alpha}, and the
 * multiple comparison correction applied by the analyzer. Missing resources or
 * keys fall back to the built-in defaults.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    // ===================================================================================
    // ENGINE CONSTANTS
    // ===================================================================================

    /** Default classpath resource holding overrides */
    public static final String CONFIG_FILE = "statistics-engine.properties";

    /** Significance level for hypothesis testing (α = 0.05) */
    public static final double DEFAULT_SIGNIFICANCE_LEVEL = 0.05;

    /** Correction applied to pairwise comparisons unless configured otherwise */
    public static final CorrectionMethod DEFAULT_CORRECTION_METHOD = CorrectionMethod.HOLM_BONFERRONI;

    /** Fixed threshold of the normality verdict (p > 0.05 looks normal) */
    public static final double NORMALITY_ALPHA = 0.05;

    /** Normality test domain */
    public static final int NORMALITY_MIN_SAMPLE_SIZE = 3;
    public static final int NORMALITY_MAX_SAMPLE_SIZE = 5000;

    /** Accuracy the engine guarantees for reported p-values */
    public static final double P_VALUE_TOLERANCE = 1e-6;

    static final String SIGNIFICANCE_LEVEL_KEY = "significance.level";
    static final String CORRECTION_METHOD_KEY = "correction.method";

    private static final EngineConfig DEFAULTS =
            new EngineConfig(DEFAULT_SIGNIFICANCE_LEVEL, DEFAULT_CORRECTION_METHOD);

    private final double significanceLevel;
    private final CorrectionMethod correctionMethod;

    /**
     * Creates a configuration with explicit settings.
     *
     * @param significanceLevel default alpha, strictly between 0 and 1
     * @param correctionMethod pairwise correction method
     * @throws IllegalArgumentException if the significance level is out of range
     *         or the correction method is null
     */
    public EngineConfig(double significanceLevel, CorrectionMethod correctionMethod) {
        if (!(significanceLevel > 0.0 && significanceLevel < 1.0)) {
            throw new IllegalArgumentException(
                "Significance level must be between 0 and 1, got " + significanceLevel);
        }
        if (correctionMethod == null) {
            throw new IllegalArgumentException("Correction method cannot be null");
        }
        this.significanceLevel = significanceLevel;
        this.correctionMethod = correctionMethod;
    }

    /**
     * Returns the built-in defaults (α = 0.05, Holm-Bonferroni).
     *
     * @return shared default configuration
     */
    public static EngineConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Loads the configuration from {@value #CONFIG_FILE}.
     *
     * @return loaded configuration, or the defaults when the resource is absent
     * @throws IllegalArgumentException if the resource holds invalid values
     */
    public static EngineConfig load() {
        return load(CONFIG_FILE);
    }

    /**
     * Loads the configuration from a classpath resource.
     *
     * @param resourceName the properties resource
     * @return loaded configuration, or the defaults when the resource is absent
     * @throws IllegalArgumentException if the resource holds invalid values
     * @throws IllegalStateException if the resource exists but cannot be read
     */
    public static EngineConfig load(String resourceName) {
        Properties props = new Properties();

        try (InputStream inputStream = EngineConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                logger.info("Configuration resource {} not found, using defaults", resourceName);
                return DEFAULTS;
            }
            props.load(inputStream);
            logger.info("Successfully loaded configuration from {}", resourceName);

        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration from " + resourceName, e);
        }

        return fromProperties(props);
    }

    /**
     * Builds a configuration from properties, using defaults for absent keys.
     *
     * @param props the properties
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static EngineConfig fromProperties(Properties props) {
        double alpha = DEFAULT_SIGNIFICANCE_LEVEL;
        String alphaValue = props.getProperty(SIGNIFICANCE_LEVEL_KEY);
        if (alphaValue != null && !alphaValue.trim().isEmpty()) {
            try {
                alpha = Double.parseDouble(alphaValue.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid " + SIGNIFICANCE_LEVEL_KEY + ": " + alphaValue, e);
            }
        }

        CorrectionMethod method = DEFAULT_CORRECTION_METHOD;
        String methodValue = props.getProperty(CORRECTION_METHOD_KEY);
        if (methodValue != null && !methodValue.trim().isEmpty()) {
            try {
                method = CorrectionMethod.valueOf(methodValue.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                    "Invalid " + CORRECTION_METHOD_KEY + ": " + methodValue, e);
            }
        }

        return new EngineConfig(alpha, method);
    }

    public double getSignificanceLevel() {
        return significanceLevel;
    }

    public CorrectionMethod getCorrectionMethod() {
        return correctionMethod;
    }

    @Override
    public String toString() {
        return String.format("EngineConfig[alpha=%s, correction=%s]",
            significanceLevel, correctionMethod.getDisplayName());
    }
}
