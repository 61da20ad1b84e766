package org.puneet.statsengine.descriptive;

/**
 * First, second and third quartile of a sample, interpolated linearly between
 * order statistics at fractional rank {@code p * (n - 1)}.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public final class Quartiles {

    private final double q1;
    private final double q2;
    private final double q3;

    /**
     * @throws IllegalArgumentException if the quartiles are not ordered
     */
    public Quartiles(double q1, double q2, double q3) {
        if (q1 > q2 || q2 > q3) {
            throw new IllegalArgumentException(
                String.format("Quartiles must satisfy q1 <= q2 <= q3, got %s, %s, %s", q1, q2, q3));
        }
        this.q1 = q1;
        this.q2 = q2;
        this.q3 = q3;
    }

    public double getQ1() { return q1; }
    public double getQ2() { return q2; }
    public double getQ3() { return q3; }

    public double getInterquartileRange() {
        return q3 - q1;
    }

    @Override
    public String toString() {
        return String.format("Quartiles[q1=%.4f, q2=%.4f, q3=%.4f]", q1, q2, q3);
    }
}
