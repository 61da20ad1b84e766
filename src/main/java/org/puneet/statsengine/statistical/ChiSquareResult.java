package org.puneet.statsengine.statistical;

/**
 * Outcome of a chi-square test of independence on a contingency table.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public final class ChiSquareResult {

    private final double chiSquareStatistic;
    private final double pValue;
    private final int degreesOfFreedom;
    private final double alpha;
    private final boolean significant;
    private final double cramersV;
    private final long grandTotal;
    private final double[][] expectedCounts;

    /**
     * @throws IllegalArgumentException if the p-value or degrees of freedom are out of range
     */
    public ChiSquareResult(double chiSquareStatistic, double pValue, int degreesOfFreedom, double alpha,
                           double cramersV, long grandTotal, double[][] expectedCounts) {
        if (!(pValue >= 0.0 && pValue <= 1.0)) {
            throw new IllegalArgumentException("p-value must be in [0, 1], got " + pValue);
        }
        if (degreesOfFreedom <= 0) {
            throw new IllegalArgumentException("Degrees of freedom must be positive, got " + degreesOfFreedom);
        }
        this.chiSquareStatistic = chiSquareStatistic;
        this.pValue = pValue;
        this.degreesOfFreedom = degreesOfFreedom;
        this.alpha = alpha;
        this.significant = pValue < alpha;
        this.cramersV = cramersV;
        this.grandTotal = grandTotal;
        this.expectedCounts = copy(expectedCounts);
    }

    public double getChiSquareStatistic() { return chiSquareStatistic; }
    public double getPValue() { return pValue; }
    public int getDegreesOfFreedom() { return degreesOfFreedom; }
    public double getAlpha() { return alpha; }
    public boolean isSignificant() { return significant; }

    /**
     * @return association strength, 0 for none and 1 for perfect association
     */
    public double getCramersV() { return cramersV; }

    public long getGrandTotal() { return grandTotal; }

    /**
     * @return expected counts under independence; a fresh copy
     */
    public double[][] getExpectedCounts() {
        return copy(expectedCounts);
    }

    private static double[][] copy(double[][] table) {
        double[][] result = new double[table.length][];
        for (int i = 0; i < table.length; i++) {
            result[i] = table[i].clone();
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("Chi-square test: X2(%d)=%.4f, p=%.4f, significant=%s, V=%.4f, N=%d",
            degreesOfFreedom, chiSquareStatistic, pValue, significant, cramersV, grandTotal);
    }
}
