package org.puneet.statsengine.descriptive;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.puneet.statsengine.exceptions.StatisticalValidationException;
import org.puneet.statsengine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes summary statistics of raw samples.
 *
 * <p>Moments come from Apache Commons Math {@link DescriptiveStatistics}, whose
 * variance, skewness and kurtosis are the bias-corrected sample estimators.
 * Quartiles are interpolated here because the Commons percentile estimator uses
 * a different rank definition. The calculator keeps no state between calls and
 * never modifies the caller's array.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public class DescriptiveStatisticsCalculator {

    private static final Logger logger = LoggerFactory.getLogger(DescriptiveStatisticsCalculator.class);

    /** Minimum sample sizes of the individual statistics */
    public static final int MIN_SIZE_VARIANCE = 2;
    public static final int MIN_SIZE_SKEWNESS = 3;
    public static final int MIN_SIZE_KURTOSIS = 4;

    /** Below this variance a sample has no shape; skewness and kurtosis are reported as 0 */
    private static final double ZERO_VARIANCE_THRESHOLD = 1e-19;

    /**
     * Computes every summary statistic of a sample.
     *
     * <p>Since the result carries skewness and kurtosis the sample needs at least
     * four observations; the exception reports the first statistic that cannot be
     * computed.</p>
     *
     * @param sample the observations
     * @return the summary statistics
     * @throws StatisticalValidationException EMPTY_DATASET for an empty sample,
     *         INSUFFICIENT_SAMPLE_SIZE below four observations, INVALID_INPUT for
     *         null or non-finite data
     */
    public DescriptiveStatisticsResult describe(double[] sample) throws StatisticalValidationException {
        ValidationUtils.requireNonEmpty(sample, "descriptive statistics");
        requireSize(sample, MIN_SIZE_VARIANCE, "variance");
        requireSize(sample, MIN_SIZE_SKEWNESS, "skewness");
        requireSize(sample, MIN_SIZE_KURTOSIS, "kurtosis");

        DescriptiveStatistics stats = new DescriptiveStatistics(sample);
        double[] sorted = sortedCopy(sample);
        boolean flat = stats.getVariance() < ZERO_VARIANCE_THRESHOLD;

        DescriptiveStatisticsResult result = new DescriptiveStatisticsResult(
            sample.length,
            stats.getSum(),
            stats.getMean(),
            StatUtils.mode(sample),
            stats.getVariance(),
            sorted[0],
            sorted[sorted.length - 1],
            quartilesOfSorted(sorted),
            flat ? 0.0 : stats.getSkewness(),
            flat ? 0.0 : stats.getKurtosis());

        logger.debug("Described sample: {}", result);
        return result;
    }

    /**
     * Describes every group of a grouped dataset.
     *
     * @param groups group name to observations
     * @return group name to summary statistics, in the iteration order of {@code groups}
     * @throws StatisticalValidationException for the first failing group, carrying
     *         the group key as dataset name and the original error as cause;
     *         INVALID_INPUT if the map itself is null or empty
     */
    public Map<String, DescriptiveStatisticsResult> describeGrouped(Map<String, double[]> groups)
            throws StatisticalValidationException {
        if (groups == null || groups.isEmpty()) {
            throw StatisticalValidationException.invalidInput("Grouped data cannot be null or empty");
        }

        Map<String, DescriptiveStatisticsResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : groups.entrySet()) {
            try {
                results.put(entry.getKey(), describe(entry.getValue()));
            } catch (StatisticalValidationException e) {
                logger.warn("Descriptive statistics failed for group {}: {}", entry.getKey(), e.getMessage());
                throw StatisticalValidationException.forGroup(entry.getKey(), e);
            }
        }
        return Collections.unmodifiableMap(results);
    }

    public double mean(double[] sample) throws StatisticalValidationException {
        ValidationUtils.requireNonEmpty(sample, "mean");
        return StatUtils.mean(sample);
    }

    /**
     * Sample variance with Bessel's correction.
     */
    public double variance(double[] sample) throws StatisticalValidationException {
        ValidationUtils.requireMinimumSize(sample, MIN_SIZE_VARIANCE, "variance");
        return StatUtils.variance(sample);
    }

    public double standardDeviation(double[] sample) throws StatisticalValidationException {
        return Math.sqrt(variance(sample));
    }

    /**
     * Adjusted Fisher-Pearson skewness; 0 for a sample without spread.
     */
    public double skewness(double[] sample) throws StatisticalValidationException {
        ValidationUtils.requireMinimumSize(sample, MIN_SIZE_SKEWNESS, "skewness");
        DescriptiveStatistics stats = new DescriptiveStatistics(sample);
        return stats.getVariance() < ZERO_VARIANCE_THRESHOLD ? 0.0 : stats.getSkewness();
    }

    /**
     * Bias-corrected excess kurtosis; 0 for a sample without spread.
     */
    public double kurtosis(double[] sample) throws StatisticalValidationException {
        ValidationUtils.requireMinimumSize(sample, MIN_SIZE_KURTOSIS, "kurtosis");
        DescriptiveStatistics stats = new DescriptiveStatistics(sample);
        return stats.getVariance() < ZERO_VARIANCE_THRESHOLD ? 0.0 : stats.getKurtosis();
    }

    public double median(double[] sample) throws StatisticalValidationException {
        return quartiles(sample).getQ2();
    }

    public Quartiles quartiles(double[] sample) throws StatisticalValidationException {
        ValidationUtils.requireNonEmpty(sample, "quartiles");
        return quartilesOfSorted(sortedCopy(sample));
    }

    /**
     * @return all values with maximum frequency, ascending
     */
    public double[] mode(double[] sample) throws StatisticalValidationException {
        ValidationUtils.requireNonEmpty(sample, "mode");
        return StatUtils.mode(sample);
    }

    /**
     * Linear interpolation between order statistics at rank {@code p * (n - 1)}.
     *
     * @param sorted ascending, non-empty
     * @param p fraction in [0, 1]
     */
    static double interpolate(double[] sorted, double p) {
        double rank = p * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        double value = sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
        // keep rounding from stepping past the next order statistic
        return Math.min(value, sorted[upper]);
    }

    private static Quartiles quartilesOfSorted(double[] sorted) {
        return new Quartiles(
            interpolate(sorted, 0.25),
            interpolate(sorted, 0.5),
            interpolate(sorted, 0.75));
    }

    private static double[] sortedCopy(double[] sample) {
        double[] sorted = sample.clone();
        Arrays.sort(sorted);
        return sorted;
    }

    private static void requireSize(double[] sample, int minimum, String statistic)
            throws StatisticalValidationException {
        if (sample.length < minimum) {
            throw StatisticalValidationException.insufficientSampleSize(sample.length, minimum, statistic);
        }
    }
}
