package org.puneet.statsengine.statistical;

import java.util.Objects;

/**
 * Outcome of a one-sample, Welch two-sample or paired t-test.
 *
 * <p>The p-value is two-tailed. {@link #isSignificant()} is {@code p < alpha}.
 * The confidence interval surrounds the sample mean for the one-sample test and
 * the mean difference otherwise, at level {@code 1 - alpha}.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public final class TTestResult {

    public enum TestType {
        ONE_SAMPLE("One-sample t-test"),
        WELCH_TWO_SAMPLE("Welch's t-test"),
        PAIRED("Paired t-test");

        private final String displayName;

        TestType(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    private final TestType testType;
    private final double tStatistic;
    private final double pValue;
    private final double degreesOfFreedom;
    private final double alpha;
    private final boolean significant;
    private final ConfidenceInterval confidenceInterval;
    private final double effectSize;
    private final double meanDifference;

    /**
     * @param testType which test produced the result
     * @param tStatistic the t statistic
     * @param pValue two-tailed p-value in [0, 1]
     * @param degreesOfFreedom strictly positive, fractional for Welch's test
     * @param alpha significance level used for the verdict
     * @param confidenceInterval interval on the mean or mean difference
     * @param effectSize standardized mean difference
     * @param meanDifference mean minus hypothesized mean, or mean A minus mean B
     * @throws IllegalArgumentException if the p-value or degrees of freedom are out of range
     */
    public TTestResult(TestType testType, double tStatistic, double pValue, double degreesOfFreedom,
                       double alpha, ConfidenceInterval confidenceInterval,
                       double effectSize, double meanDifference) {
        if (!(pValue >= 0.0 && pValue <= 1.0)) {
            throw new IllegalArgumentException("p-value must be in [0, 1], got " + pValue);
        }
        if (!(degreesOfFreedom > 0.0)) {
            throw new IllegalArgumentException("Degrees of freedom must be positive, got " + degreesOfFreedom);
        }
        this.testType = Objects.requireNonNull(testType, "Test type cannot be null");
        this.tStatistic = tStatistic;
        this.pValue = pValue;
        this.degreesOfFreedom = degreesOfFreedom;
        this.alpha = alpha;
        this.significant = pValue < alpha;
        this.confidenceInterval = Objects.requireNonNull(confidenceInterval, "Confidence interval cannot be null");
        this.effectSize = effectSize;
        this.meanDifference = meanDifference;
    }

    /**
     * Cohen's conventional labels on the absolute effect size.
     *
     * @param d a standardized mean difference
     * @return "negligible", "small", "medium" or "large"
     */
    public static String interpretEffectSize(double d) {
        double absD = Math.abs(d);
        if (absD < 0.2) return "negligible";
        if (absD < 0.5) return "small";
        if (absD < 0.8) return "medium";
        return "large";
    }

    public TestType getTestType() { return testType; }
    public double getTStatistic() { return tStatistic; }
    public double getPValue() { return pValue; }
    public double getDegreesOfFreedom() { return degreesOfFreedom; }
    public double getAlpha() { return alpha; }
    public boolean isSignificant() { return significant; }
    public ConfidenceInterval getConfidenceInterval() { return confidenceInterval; }
    public double getEffectSize() { return effectSize; }
    public double getMeanDifference() { return meanDifference; }

    public String getEffectSizeInterpretation() {
        return interpretEffectSize(effectSize);
    }

    @Override
    public String toString() {
        return String.format("%s: t(%.2f)=%.4f, p=%.4f, significant=%s, d=%.4f (%s), CI=%s",
            testType.getDisplayName(), degreesOfFreedom, tStatistic, pValue, significant,
            effectSize, getEffectSizeInterpretation(), confidenceInterval);
    }
}
