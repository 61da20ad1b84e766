package org.puneet.statsengine.descriptive;

import java.util.Arrays;
import java.util.Objects;

/**
 * Summary statistics of one sample. Produced by
 * {@link DescriptiveStatisticsCalculator#describe(double[])} and never modified
 * afterwards.
 *
 * <p>Variance and standard deviation use the n-1 divisor. Skewness and kurtosis
 * are the bias-corrected sample estimators, kurtosis reported as excess over the
 * normal distribution. The coefficient of variation is {@code NaN} when the mean
 * is exactly zero.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public final class DescriptiveStatisticsResult {

    private final int count;
    private final double sum;
    private final double mean;
    private final double median;
    private final double[] mode;
    private final double variance;
    private final double standardDeviation;
    private final double min;
    private final double max;
    private final Quartiles quartiles;
    private final double skewness;
    private final double kurtosis;

    DescriptiveStatisticsResult(int count, double sum, double mean, double[] mode, double variance,
                                double min, double max, Quartiles quartiles,
                                double skewness, double kurtosis) {
        this.count = count;
        this.sum = sum;
        this.mean = mean;
        this.mode = mode.clone();
        this.variance = variance;
        this.standardDeviation = Math.sqrt(variance);
        this.min = min;
        this.max = max;
        this.quartiles = Objects.requireNonNull(quartiles, "Quartiles cannot be null");
        this.median = quartiles.getQ2();
        this.skewness = skewness;
        this.kurtosis = kurtosis;
    }

    public int getCount() { return count; }
    public double getSum() { return sum; }
    public double getMean() { return mean; }
    public double getMedian() { return median; }

    /**
     * @return all values attaining the maximum frequency, ascending; a fresh copy
     */
    public double[] getMode() { return mode.clone(); }

    public double getVariance() { return variance; }
    public double getStandardDeviation() { return standardDeviation; }
    public double getMin() { return min; }
    public double getMax() { return max; }

    public double getRange() {
        return max - min;
    }

    public Quartiles getQuartiles() { return quartiles; }

    public double getInterquartileRange() {
        return quartiles.getInterquartileRange();
    }

    public double getSkewness() { return skewness; }
    public double getKurtosis() { return kurtosis; }

    /**
     * @return standard deviation divided by the mean, {@code NaN} for a zero mean
     */
    public double getCoefficientOfVariation() {
        if (mean == 0.0) {
            return Double.NaN;
        }
        return standardDeviation / mean;
    }

    @Override
    public String toString() {
        return String.format(
            "DescriptiveStatistics[n=%d, mean=%.4f, sd=%.4f, median=%.4f, min=%.4f, max=%.4f, mode=%s, "
                + "skewness=%.4f, kurtosis=%.4f]",
            count, mean, standardDeviation, median, min, max, Arrays.toString(mode), skewness, kurtosis);
    }
}
