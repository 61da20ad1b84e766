package org.puneet.statsengine.statistical;

import org.puneet.statsengine.descriptive.DescriptiveStatisticsCalculator;
import org.puneet.statsengine.distribution.DistributionFunctions;
import org.puneet.statsengine.exceptions.StatisticalValidationException;
import org.puneet.statsengine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Two-sided confidence interval around a point estimate, either a sample mean
 * or a difference of means.
 *
 * <p>Instances are immutable. The static factory builds the t-distribution
 * interval of a sample mean; the hypothesis tests build intervals for their own
 * estimates through the constructor.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public class ConfidenceInterval {

    private static final Logger logger = LoggerFactory.getLogger(ConfidenceInterval.class);

    /** Default confidence level (95%) */
    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;

    /** Minimum sample size required for a t interval */
    private static final int MIN_SAMPLE_SIZE = 2;

    private final double lowerBound;
    private final double upperBound;
    private final double estimate;
    private final double standardError;
    private final double confidenceLevel;
    private final int sampleSize;
    private final String methodUsed;

    /**
     * Creates a confidence interval with specified bounds and parameters.
     *
     * @param lowerBound the lower bound of the interval
     * @param upperBound the upper bound of the interval
     * @param estimate the point estimate the interval surrounds
     * @param standardError the standard error of the estimate
     * @param confidenceLevel the confidence level (e.g., 0.95 for 95%)
     * @param sampleSize the number of observations behind the estimate
     * @param methodUsed the statistical method used for calculation
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public ConfidenceInterval(double lowerBound, double upperBound, double estimate,
                              double standardError, double confidenceLevel,
                              int sampleSize, String methodUsed) {
        validateParameters(lowerBound, upperBound, confidenceLevel, sampleSize);

        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.estimate = estimate;
        this.standardError = standardError;
        this.confidenceLevel = confidenceLevel;
        this.sampleSize = sampleSize;
        this.methodUsed = Objects.requireNonNull(methodUsed, "Method used cannot be null");

        logger.debug("Created confidence interval: [{}, {}] with {}% confidence (n={}) using {}",
            lowerBound, upperBound, confidenceLevel * 100, sampleSize, methodUsed);
    }

    /**
     * Computes the t-distribution confidence interval of a sample mean.
     *
     * @param data the sample data
     * @param confidenceLevel the desired confidence level (e.g., 0.95)
     * @return confidence interval
     * @throws StatisticalValidationException if data is insufficient or the level is invalid
     */
    public static ConfidenceInterval computeTDistribution(double[] data, double confidenceLevel)
            throws StatisticalValidationException {
        ValidationUtils.requireMinimumSize(data, MIN_SAMPLE_SIZE, "t-distribution confidence interval");
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw StatisticalValidationException.invalidParameter("confidenceLevel", confidenceLevel, "in (0, 1)");
        }

        DescriptiveStatisticsCalculator calculator = new DescriptiveStatisticsCalculator();
        double mean = calculator.mean(data);
        double stdDev = calculator.standardDeviation(data);
        int n = data.length;

        if (stdDev == 0.0) {
            logger.warn("All data points are identical - interval width will be zero");
        }

        double tValue = DistributionFunctions.tCritical(n - 1, 1.0 - confidenceLevel);
        double standardError = stdDev / Math.sqrt(n);
        double marginOfError = tValue * standardError;

        return new ConfidenceInterval(
            mean - marginOfError,
            mean + marginOfError,
            mean,
            standardError,
            confidenceLevel,
            n,
            "t-Distribution"
        );
    }

    /**
     * Computes the t-distribution interval using the default 95% confidence level.
     *
     * @param data the sample data
     * @return confidence interval
     * @throws StatisticalValidationException if data is insufficient
     */
    public static ConfidenceInterval computeTDistribution(double[] data) throws StatisticalValidationException {
        return computeTDistribution(data, DEFAULT_CONFIDENCE_LEVEL);
    }

    /**
     * @return the width (upper bound - lower bound)
     */
    public double getWidth() {
        return upperBound - lowerBound;
    }

    public double getMarginOfError() {
        return getWidth() / 2.0;
    }

    public boolean contains(double value) {
        return lowerBound <= value && value <= upperBound;
    }

    /**
     * Checks if the confidence interval contains zero.
     *
     * @return true if zero is within the interval
     */
    public boolean containsZero() {
        return contains(0.0);
    }

    /**
     * Checks if this interval overlaps with another interval.
     *
     * @param other the other confidence interval
     * @return true if intervals overlap
     * @throws NullPointerException if other is null
     */
    public boolean overlaps(ConfidenceInterval other) {
        Objects.requireNonNull(other, "Other interval cannot be null");
        return this.lowerBound <= other.upperBound && this.upperBound >= other.lowerBound;
    }

    @Override
    public String toString() {
        return String.format("[%.4f, %.4f] (estimate=%.4f, n=%d, %.0f%% CI, method=%s)",
            lowerBound, upperBound, estimate, sampleSize, confidenceLevel * 100, methodUsed);
    }

    // Getters
    public double getLowerBound() { return lowerBound; }
    public double getUpperBound() { return upperBound; }
    public double getEstimate() { return estimate; }
    public double getStandardError() { return standardError; }
    public double getConfidenceLevel() { return confidenceLevel; }
    public int getSampleSize() { return sampleSize; }
    public String getMethodUsed() { return methodUsed; }

    private static void validateParameters(double lowerBound, double upperBound,
                                           double confidenceLevel, int sampleSize) {
        if (Double.isNaN(lowerBound) || Double.isNaN(upperBound)) {
            throw new IllegalArgumentException("Bounds cannot be NaN");
        }
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException(
                "Lower bound must be less than or equal to upper bound");
        }
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new IllegalArgumentException(
                "Confidence level must be between 0 and 1");
        }
        if (sampleSize < MIN_SAMPLE_SIZE) {
            throw new IllegalArgumentException(
                "Sample size must be at least " + MIN_SAMPLE_SIZE);
        }
    }
}
