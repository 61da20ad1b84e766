package org.puneet.statsengine.statistical;

import java.util.Objects;

/**
 * One pairwise Welch t-test of an analysis, with its p-value adjusted for the
 * number of comparisons in the family.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-10
 */
public final class PairwiseComparison {

    private final String groupA;
    private final String groupB;
    private final TTestResult testResult;
    private final double adjustedPValue;
    private final boolean significantAfterCorrection;

    public PairwiseComparison(String groupA, String groupB, TTestResult testResult,
                              double adjustedPValue, boolean significantAfterCorrection) {
        this.groupA = Objects.requireNonNull(groupA, "Group A cannot be null");
        this.groupB = Objects.requireNonNull(groupB, "Group B cannot be null");
        this.testResult = Objects.requireNonNull(testResult, "Test result cannot be null");
        this.adjustedPValue = adjustedPValue;
        this.significantAfterCorrection = significantAfterCorrection;
    }

    public String getGroupA() { return groupA; }
    public String getGroupB() { return groupB; }
    public TTestResult getTestResult() { return testResult; }
    public double getRawPValue() { return testResult.getPValue(); }
    public double getAdjustedPValue() { return adjustedPValue; }

    /** Significance before correction */
    public boolean isSignificant() { return testResult.isSignificant(); }

    public boolean isSignificantAfterCorrection() { return significantAfterCorrection; }

    @Override
    public String toString() {
        return String.format("%s vs %s: raw p=%.4f, adjusted p=%.4f, significant after correction=%s",
            groupA, groupB, getRawPValue(), adjustedPValue, significantAfterCorrection);
    }
}
