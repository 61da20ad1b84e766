package org.puneet.statsengine.normality;

import org.puneet.statsengine.descriptive.DescriptiveStatisticsCalculator;
import org.puneet.statsengine.distribution.DistributionFunctions;
import org.puneet.statsengine.exceptions.StatisticalValidationException;
import org.puneet.statsengine.util.EngineConfig;
import org.puneet.statsengine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Shapiro-Wilk style normality test.
 *
 * <p>W is the squared correlation between the ordered sample and a set of
 * weights derived from expected normal order statistics. The weights use
 * Royston's (1992) polynomial approximation instead of the exact Shapiro-Wilk
 * coefficient tables, and the p-value uses Royston's normalizing
 * transformation of W: exact for n = 3, a small-sample form up to n = 11 and a
 * large-sample form above. Both are approximations; treat the verdict as
 * indicative, not as a table-accurate Shapiro-Wilk result.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-09
 */
public class NormalityTester {

    private static final Logger logger = LoggerFactory.getLogger(NormalityTester.class);

    public static final String TEST_NAME = "Shapiro-Wilk (Royston approximation)";

    /** Royston's polynomial corrections for the two extreme weights, in powers of 1/sqrt(n) */
    private static final double[] LAST_WEIGHT_POLY = {0.0, 0.221157, -0.147981, -2.071190, 4.434685, -2.706056};
    private static final double[] SECOND_LAST_WEIGHT_POLY = {0.0, 0.042981, -0.293762, -1.752461, 5.682633, -3.582633};

    private static final int SMALL_SAMPLE_LIMIT = 11;

    private final DescriptiveStatisticsCalculator calculator;

    public NormalityTester() {
        this.calculator = new DescriptiveStatisticsCalculator();
    }

    /**
     * Tests whether a sample plausibly comes from a normal distribution.
     *
     * @param sample the observations, 3 &le; n &le; 5000
     * @return W, its approximate p-value and the verdict {@code p > 0.05}
     * @throws StatisticalValidationException INVALID_SAMPLE_SIZE outside the valid
     *         domain, DIVISION_BY_ZERO when every observation is identical,
     *         INVALID_INPUT for null or non-finite data
     */
    public NormalityTestResult testNormality(double[] sample) throws StatisticalValidationException {
        if (sample == null) {
            throw StatisticalValidationException.invalidInput("Normality test: sample cannot be null");
        }
        int n = sample.length;
        if (n < EngineConfig.NORMALITY_MIN_SAMPLE_SIZE || n > EngineConfig.NORMALITY_MAX_SAMPLE_SIZE) {
            throw StatisticalValidationException.invalidSampleSize(n,
                EngineConfig.NORMALITY_MIN_SAMPLE_SIZE, EngineConfig.NORMALITY_MAX_SAMPLE_SIZE, TEST_NAME);
        }
        ValidationUtils.requireFinite(sample, TEST_NAME);

        double sumSquares = calculator.variance(sample) * (n - 1);
        if (sumSquares == 0.0) {
            throw StatisticalValidationException.divisionByZero(TEST_NAME, "all observations are identical");
        }

        double[] sorted = sample.clone();
        Arrays.sort(sorted);
        double[] weights = weights(n);

        double weightedSum = 0.0;
        for (int i = 0; i < n; i++) {
            weightedSum += weights[i] * sorted[i];
        }
        double w = Math.min(1.0, weightedSum * weightedSum / sumSquares);
        double pValue = pValue(w, n);

        NormalityTestResult result = new NormalityTestResult(TEST_NAME, w, pValue, EngineConfig.NORMALITY_ALPHA, n);
        logger.debug("Normality test: {}", result);
        return result;
    }

    /**
     * Antisymmetric weights with unit sum of squares, ascending with the order statistics.
     */
    static double[] weights(int n) throws StatisticalValidationException {
        double[] a = new double[n];
        if (n == 3) {
            a[0] = -Math.sqrt(0.5);
            a[2] = Math.sqrt(0.5);
            return a;
        }

        double[] m = new double[n];
        double summ2 = 0.0;
        for (int i = 0; i < n; i++) {
            m[i] = DistributionFunctions.normalQuantile((i + 1 - 0.375) / (n + 0.25));
            summ2 += m[i] * m[i];
        }
        double ssumm2 = Math.sqrt(summ2);
        double u = 1.0 / Math.sqrt(n);

        double an = m[n - 1] / ssumm2 + polynomial(LAST_WEIGHT_POLY, u);
        double phi;
        int firstMiddle;
        if (n > 5) {
            double an1 = m[n - 2] / ssumm2 + polynomial(SECOND_LAST_WEIGHT_POLY, u);
            phi = (summ2 - 2.0 * m[n - 1] * m[n - 1] - 2.0 * m[n - 2] * m[n - 2])
                / (1.0 - 2.0 * an * an - 2.0 * an1 * an1);
            a[1] = -an1;
            a[n - 2] = an1;
            firstMiddle = 2;
        } else {
            phi = (summ2 - 2.0 * m[n - 1] * m[n - 1]) / (1.0 - 2.0 * an * an);
            firstMiddle = 1;
        }
        a[0] = -an;
        a[n - 1] = an;

        double scale = Math.sqrt(phi);
        for (int i = firstMiddle; i < n - firstMiddle; i++) {
            a[i] = m[i] / scale;
        }
        return a;
    }

    static double pValue(double w, int n) {
        if (w >= 1.0) {
            return 1.0;
        }
        if (n == 3) {
            double p = 6.0 / Math.PI * (Math.asin(Math.sqrt(w)) - Math.asin(Math.sqrt(0.75)));
            return Math.max(0.0, Math.min(1.0, p));
        }

        double y = Math.log(1.0 - w);
        double mean;
        double sd;
        if (n <= SMALL_SAMPLE_LIMIT) {
            double gamma = 0.459 * n - 2.273;
            if (y >= gamma) {
                return 0.0;
            }
            y = -Math.log(gamma - y);
            mean = 0.5440 - 0.39978 * n + 0.025054 * n * n - 0.0006714 * n * n * n;
            sd = Math.exp(1.3822 - 0.77857 * n + 0.062767 * n * n - 0.0020322 * n * n * n);
        } else {
            double ln = Math.log(n);
            mean = -1.5861 - 0.31082 * ln - 0.083751 * ln * ln + 0.0038915 * ln * ln * ln;
            sd = Math.exp(-0.4803 - 0.082676 * ln + 0.0030302 * ln * ln);
        }
        return DistributionFunctions.normalCDF(-(y - mean) / sd);
    }

    private static double polynomial(double[] coefficients, double x) {
        double result = 0.0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            result = result * x + coefficients[i];
        }
        return result;
    }
}
