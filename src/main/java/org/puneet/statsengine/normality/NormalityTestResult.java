package org.puneet.statsengine.normality;

import java.util.Objects;

/**
 * Outcome of a normality test. The verdict {@link #isNormal()} is
 * {@code p > 0.05}; it is indicative only.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-09
 */
public final class NormalityTestResult {

    private final String testName;
    private final double statistic;
    private final double pValue;
    private final boolean normal;
    private final int sampleSize;

    /**
     * @throws IllegalArgumentException if the p-value is outside [0, 1]
     */
    public NormalityTestResult(String testName, double statistic, double pValue,
                               double alpha, int sampleSize) {
        if (!(pValue >= 0.0 && pValue <= 1.0)) {
            throw new IllegalArgumentException("p-value must be in [0, 1], got " + pValue);
        }
        this.testName = Objects.requireNonNull(testName, "Test name cannot be null");
        this.statistic = statistic;
        this.pValue = pValue;
        this.normal = pValue > alpha;
        this.sampleSize = sampleSize;
    }

    public String getTestName() { return testName; }
    public double getStatistic() { return statistic; }
    public double getPValue() { return pValue; }
    public boolean isNormal() { return normal; }
    public int getSampleSize() { return sampleSize; }

    @Override
    public String toString() {
        return String.format("%s: W=%.4f, p=%.4f, n=%d, normal=%s",
            testName, statistic, pValue, sampleSize, normal);
    }
}
