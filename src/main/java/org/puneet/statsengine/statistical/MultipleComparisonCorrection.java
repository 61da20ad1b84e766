package org.puneet.statsengine.statistical;

import org.puneet.statsengine.exceptions.StatisticalValidationException;
import org.puneet.statsengine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Adjusts a family of p-values for multiple comparisons.
 *
 * <p>Adjusted p-values are returned in the order of the input and capped at 1.
 * Holm-Bonferroni adjustments are made monotone step-down, Benjamini-Hochberg
 * adjustments monotone step-up, so a hypothesis is rejected exactly when its
 * adjusted p-value is below alpha.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-08
 */
public final class MultipleComparisonCorrection {

    private static final Logger logger = LoggerFactory.getLogger(MultipleComparisonCorrection.class);

    /**
     * Private constructor to prevent instantiation
     */
    private MultipleComparisonCorrection() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Applies the selected p-value correction method.
     *
     * @param pValues raw p-values, each in [0, 1]
     * @param method the correction method
     * @return adjusted p-values in input order
     * @throws StatisticalValidationException INVALID_INPUT for null input or a
     *         p-value outside [0, 1]
     */
    public static double[] adjust(double[] pValues, CorrectionMethod method) throws StatisticalValidationException {
        Objects.requireNonNull(method, "Correction method cannot be null");
        if (pValues == null) {
            throw StatisticalValidationException.invalidInput("p-values cannot be null");
        }
        for (int i = 0; i < pValues.length; i++) {
            if (!(pValues[i] >= 0.0 && pValues[i] <= 1.0)) {
                throw StatisticalValidationException.invalidInput(
                    String.format("p-value at index %d must be in [0, 1], got %s", i, pValues[i]));
            }
        }
        if (pValues.length == 0) {
            return new double[0];
        }

        logger.debug("Applying {} correction to {} p-values", method.getDisplayName(), pValues.length);

        switch (method) {
            case BONFERRONI:
                return bonferroni(pValues);
            case HOLM_BONFERRONI:
                return holmBonferroni(pValues);
            case BENJAMINI_HOCHBERG:
                return benjaminiHochberg(pValues);
            case NONE:
            default:
                return pValues.clone();
        }
    }

    /**
     * Flags the adjusted p-values that fall strictly below alpha.
     *
     * @param adjustedPValues output of {@link #adjust(double[], CorrectionMethod)}
     * @param alpha family-wise significance level
     * @return significance flags in input order
     * @throws StatisticalValidationException INVALID_PARAMETER for an invalid alpha
     */
    public static boolean[] significant(double[] adjustedPValues, double alpha) throws StatisticalValidationException {
        ValidationUtils.requireSignificanceLevel(alpha);
        boolean[] flags = new boolean[adjustedPValues.length];
        for (int i = 0; i < adjustedPValues.length; i++) {
            flags[i] = adjustedPValues[i] < alpha;
        }
        return flags;
    }

    private static double[] bonferroni(double[] pValues) {
        int m = pValues.length;
        double[] adjusted = new double[m];
        for (int i = 0; i < m; i++) {
            adjusted[i] = Math.min(1.0, pValues[i] * m);
        }
        return adjusted;
    }

    private static double[] holmBonferroni(double[] pValues) {
        int m = pValues.length;
        int[] order = ascendingOrder(pValues);
        double[] adjusted = new double[m];

        double runningMax = 0.0;
        for (int rank = 0; rank < m; rank++) {
            int index = order[rank];
            double candidate = Math.min(1.0, pValues[index] * (m - rank));
            runningMax = Math.max(runningMax, candidate);
            adjusted[index] = runningMax;
        }
        return adjusted;
    }

    private static double[] benjaminiHochberg(double[] pValues) {
        int m = pValues.length;
        int[] order = ascendingOrder(pValues);
        double[] adjusted = new double[m];

        double runningMin = 1.0;
        for (int rank = m - 1; rank >= 0; rank--) {
            int index = order[rank];
            double candidate = pValues[index] * m / (rank + 1.0);
            runningMin = Math.min(runningMin, candidate);
            adjusted[index] = runningMin;
        }
        return adjusted;
    }

    private static int[] ascendingOrder(double[] values) {
        return IntStream.range(0, values.length)
            .boxed()
            .sorted(Comparator.comparingDouble(i -> values[i]))
            .mapToInt(Integer::intValue)
            .toArray();
    }
}
