package org.puneet.statsengine.statistical;

import org.puneet.statsengine.descriptive.DescriptiveStatisticsCalculator;
import org.puneet.statsengine.distribution.DistributionFunctions;
import org.puneet.statsengine.exceptions.StatisticalValidationException;
import org.puneet.statsengine.util.EngineConfig;
import org.puneet.statsengine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Significance tests on raw samples and contingency tables: one-sample,
 * Welch two-sample and paired t-tests, and the chi-square test of independence.
 *
 * <p>All p-values are two-tailed and a result is significant only when
 * {@code p < alpha}. Overloads without an {@code alpha} argument use the
 * significance level of the engine's {@link EngineConfig}. The engine holds
 * nothing but that immutable configuration, so one instance may be shared
 * between threads.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-06
 */
public class HypothesisTestingEngine {

    private static final Logger logger = LoggerFactory.getLogger(HypothesisTestingEngine.class);

    /** Minimum observations per sample for any t-test */
    private static final int MIN_SAMPLE_SIZE = 2;

    private final EngineConfig config;
    private final DescriptiveStatisticsCalculator calculator;

    /**
     * Constructs an engine with the configuration found on the classpath.
     */
    public HypothesisTestingEngine() {
        this(EngineConfig.load());
    }

    /**
     * Constructs an engine with the given configuration.
     *
     * @param config the engine configuration
     */
    public HypothesisTestingEngine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.calculator = new DescriptiveStatisticsCalculator();

        logger.info("HypothesisTestingEngine initialized with alpha={}", config.getSignificanceLevel());
    }

    public double getDefaultSignificanceLevel() {
        return config.getSignificanceLevel();
    }

    public TTestResult oneSampleTTest(double[] sample, double hypothesizedMean)
            throws StatisticalValidationException {
        return oneSampleTTest(sample, hypothesizedMean, config.getSignificanceLevel());
    }

    /**
     * Tests whether the population mean differs from a hypothesized value.
     *
     * @param sample the observations, at least two
     * @param hypothesizedMean the mean under the null hypothesis
     * @param alpha significance level, strictly between 0 and 1
     * @return the test result; effect size is |mean - μ₀| / sd
     * @throws StatisticalValidationException INSUFFICIENT_SAMPLE_SIZE for n &lt; 2,
     *         DIVISION_BY_ZERO when every observation is identical,
     *         INVALID_PARAMETER for an invalid alpha
     */
    public TTestResult oneSampleTTest(double[] sample, double hypothesizedMean, double alpha)
            throws StatisticalValidationException {
        ValidationUtils.requireSignificanceLevel(alpha);
        ValidationUtils.requireMinimumSize(sample, MIN_SAMPLE_SIZE, "one-sample t-test");
        if (!Double.isFinite(hypothesizedMean)) {
            throw StatisticalValidationException.invalidParameter("hypothesizedMean", hypothesizedMean, "finite");
        }

        TTestResult result = meanTest(TTestResult.TestType.ONE_SAMPLE, sample, hypothesizedMean, alpha);
        logger.debug("One-sample t-test against {}: {}", hypothesizedMean, result);
        return result;
    }

    public TTestResult twoSampleTTest(double[] sampleA, double[] sampleB)
            throws StatisticalValidationException {
        return twoSampleTTest(sampleA, sampleB, config.getSignificanceLevel());
    }

    /**
     * Welch's unequal-variance t-test for a difference between two means.
     *
     * @param sampleA first sample, at least two observations
     * @param sampleB second sample, at least two observations
     * @param alpha significance level, strictly between 0 and 1
     * @return the test result; the statistic, interval and signed Cohen's d refer
     *         to mean A minus mean B
     * @throws StatisticalValidationException INSUFFICIENT_SAMPLE_SIZE, DIVISION_BY_ZERO
     *         when neither sample varies, INVALID_PARAMETER for an invalid alpha
     */
    public TTestResult twoSampleTTest(double[] sampleA, double[] sampleB, double alpha)
            throws StatisticalValidationException {
        ValidationUtils.requireSignificanceLevel(alpha);
        ValidationUtils.requireMinimumSize(sampleA, MIN_SAMPLE_SIZE, "two-sample t-test (sample A)");
        ValidationUtils.requireMinimumSize(sampleB, MIN_SAMPLE_SIZE, "two-sample t-test (sample B)");

        int nA = sampleA.length;
        int nB = sampleB.length;
        double meanA = calculator.mean(sampleA);
        double meanB = calculator.mean(sampleB);
        double varA = calculator.variance(sampleA);
        double varB = calculator.variance(sampleB);

        double seA = varA / nA;
        double seB = varB / nB;
        double standardError = Math.sqrt(seA + seB);
        if (standardError == 0.0) {
            throw StatisticalValidationException.divisionByZero("Welch's t-test",
                "both samples have zero variance");
        }

        double meanDifference = meanA - meanB;
        double t = meanDifference / standardError;

        // Welch-Satterthwaite, on variances scaled to the larger one so the squares cannot underflow
        double scale = Math.max(seA, seB);
        double ratioA = seA / scale;
        double ratioB = seB / scale;
        double df = (ratioA + ratioB) * (ratioA + ratioB)
            / (ratioA * ratioA / (nA - 1) + ratioB * ratioB / (nB - 1));

        double pValue = twoTailedPValue(t, df);

        double pooledSd = Math.sqrt(((nA - 1) * varA + (nB - 1) * varB) / (nA + nB - 2));
        double cohensD = meanDifference / pooledSd;

        double margin = DistributionFunctions.tCritical(df, alpha) * standardError;
        ConfidenceInterval interval = new ConfidenceInterval(
            meanDifference - margin, meanDifference + margin, meanDifference,
            standardError, 1.0 - alpha, nA + nB, "Welch t-Distribution");

        TTestResult result = new TTestResult(TTestResult.TestType.WELCH_TWO_SAMPLE,
            t, pValue, df, alpha, interval, cohensD, meanDifference);
        logger.debug("Welch t-test (nA={}, nB={}): {}", nA, nB, result);
        return result;
    }

    public TTestResult pairedTTest(double[] sampleA, double[] sampleB)
            throws StatisticalValidationException {
        return pairedTTest(sampleA, sampleB, config.getSignificanceLevel());
    }

    /**
     * Paired t-test: a one-sample test of the element-wise differences A - B against zero.
     *
     * @param sampleA first measurement of each pair
     * @param sampleB second measurement of each pair
     * @param alpha significance level, strictly between 0 and 1
     * @return the test result on the differences
     * @throws StatisticalValidationException INVALID_INPUT for samples of different
     *         length, otherwise as {@link #oneSampleTTest(double[], double, double)}
     */
    public TTestResult pairedTTest(double[] sampleA, double[] sampleB, double alpha)
            throws StatisticalValidationException {
        ValidationUtils.requireSignificanceLevel(alpha);
        ValidationUtils.requireNonEmpty(sampleA, "paired t-test (sample A)");
        ValidationUtils.requireNonEmpty(sampleB, "paired t-test (sample B)");
        if (sampleA.length != sampleB.length) {
            throw StatisticalValidationException.invalidInput(String.format(
                "Paired samples must have equal length, got %d and %d", sampleA.length, sampleB.length));
        }
        ValidationUtils.requireMinimumSize(sampleA, MIN_SAMPLE_SIZE, "paired t-test");

        double[] differences = new double[sampleA.length];
        for (int i = 0; i < differences.length; i++) {
            differences[i] = sampleA[i] - sampleB[i];
        }

        TTestResult result = meanTest(TTestResult.TestType.PAIRED, differences, 0.0, alpha);
        logger.debug("Paired t-test (n={}): {}", differences.length, result);
        return result;
    }

    public ChiSquareResult chiSquareTest(long[][] table) throws StatisticalValidationException {
        return chiSquareTest(table, config.getSignificanceLevel());
    }

    /**
     * Chi-square test of independence on a two-way contingency table.
     *
     * @param table observed counts, at least 2x2, rectangular, non-negative
     * @param alpha significance level, strictly between 0 and 1
     * @return the test result with Cramér's V
     * @throws StatisticalValidationException INVALID_INPUT for a malformed table,
     *         DIVISION_BY_ZERO when a row or column sums to zero,
     *         INVALID_PARAMETER for an invalid alpha
     */
    public ChiSquareResult chiSquareTest(long[][] table, double alpha) throws StatisticalValidationException {
        ValidationUtils.requireSignificanceLevel(alpha);
        validateContingencyTable(table);

        int rows = table.length;
        int cols = table[0].length;
        double[] rowTotals = new double[rows];
        double[] colTotals = new double[cols];
        long grandTotal = 0L;
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                rowTotals[i] += table[i][j];
                colTotals[j] += table[i][j];
                grandTotal += table[i][j];
            }
        }
        if (grandTotal == 0L) {
            throw StatisticalValidationException.divisionByZero("Chi-square test", "table contains no observations");
        }

        double[][] expected = new double[rows][cols];
        double statistic = 0.0;
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                expected[i][j] = rowTotals[i] * colTotals[j] / grandTotal;
                if (expected[i][j] == 0.0) {
                    StatisticalValidationException ex = StatisticalValidationException.divisionByZero(
                        "Chi-square test",
                        String.format("expected count of cell (%d, %d) is zero", i, j));
                    ex.addContext("row", i);
                    ex.addContext("column", j);
                    throw ex;
                }
                double deviation = table[i][j] - expected[i][j];
                statistic += deviation * deviation / expected[i][j];
            }
        }

        int df = (rows - 1) * (cols - 1);
        double pValue = DistributionFunctions.chiSquareSurvival(statistic, df);
        double cramersV = Math.sqrt(statistic / (grandTotal * (double) (Math.min(rows, cols) - 1)));

        ChiSquareResult result = new ChiSquareResult(statistic, pValue, df, alpha,
            Math.min(1.0, cramersV), grandTotal, expected);
        logger.debug("Chi-square test on {}x{} table: {}", rows, cols, result);
        return result;
    }

    /** Shared by the one-sample and paired tests. */
    private TTestResult meanTest(TTestResult.TestType type, double[] sample, double hypothesizedMean,
                                 double alpha) throws StatisticalValidationException {
        int n = sample.length;
        double mean = calculator.mean(sample);
        double sd = calculator.standardDeviation(sample);
        if (sd == 0.0) {
            throw StatisticalValidationException.divisionByZero(type.getDisplayName(),
                "sample has zero variance");
        }

        double standardError = sd / Math.sqrt(n);
        double meanDifference = mean - hypothesizedMean;
        double t = meanDifference / standardError;
        double df = n - 1;
        double pValue = twoTailedPValue(t, df);
        double effectSize = Math.abs(meanDifference) / sd;

        double margin = DistributionFunctions.tCritical(df, alpha) * standardError;
        ConfidenceInterval interval = new ConfidenceInterval(
            mean - margin, mean + margin, mean, standardError, 1.0 - alpha, n, "t-Distribution");

        return new TTestResult(type, t, pValue, df, alpha, interval, effectSize, meanDifference);
    }

    private static double twoTailedPValue(double t, double df) throws StatisticalValidationException {
        return Math.min(1.0, 2.0 * DistributionFunctions.studentTCDF(-Math.abs(t), df));
    }

    private static void validateContingencyTable(long[][] table) throws StatisticalValidationException {
        if (table == null) {
            throw StatisticalValidationException.invalidInput("Contingency table cannot be null");
        }
        if (table.length < 2) {
            throw StatisticalValidationException.invalidInput(
                "Contingency table needs at least 2 rows, got " + table.length);
        }
        if (table[0] == null || table[0].length < 2) {
            throw StatisticalValidationException.invalidInput("Contingency table needs at least 2 columns");
        }
        int cols = table[0].length;
        for (int i = 0; i < table.length; i++) {
            if (table[i] == null || table[i].length != cols) {
                throw StatisticalValidationException.invalidInput(String.format(
                    "Contingency table is not rectangular: row %d has %s columns, expected %d",
                    i, table[i] == null ? "no" : String.valueOf(table[i].length), cols));
            }
            for (int j = 0; j < cols; j++) {
                if (table[i][j] < 0) {
                    throw StatisticalValidationException.invalidInput(String.format(
                        "Contingency table count at (%d, %d) is negative: %d", i, j, table[i][j]));
                }
            }
        }
    }
}
