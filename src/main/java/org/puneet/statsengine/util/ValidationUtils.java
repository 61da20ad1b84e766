package org.puneet.statsengine.util;

import org.puneet.statsengine.exceptions.StatisticalValidationException;

/**
 * Precondition checks shared by the calculators and testing engines.
 *
 * <p>Every check throws a {@link StatisticalValidationException} whose error type
 * names the violated precondition; none of them copies or modifies the sample.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class ValidationUtils {

    /**
     * Private constructor to prevent instantiation
     */
    private ValidationUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Checks that a sample is present, non-empty and contains only finite values.
     *
     * @param sample the observations
     * @param computation name of the computation, used in the error message
     * @throws StatisticalValidationException INVALID_INPUT for null or non-finite data,
     *         EMPTY_DATASET for an empty sample
     */
    public static void requireNonEmpty(double[] sample, String computation)
            throws StatisticalValidationException {
        if (sample == null) {
            throw StatisticalValidationException.invalidInput(computation + ": sample cannot be null");
        }
        if (sample.length == 0) {
            throw StatisticalValidationException.emptyDataset(computation);
        }
        requireFinite(sample, computation);
    }

    /**
     * Checks that every observation of a non-null sample is finite.
     *
     * @param sample the observations
     * @param computation name of the computation, used in the error message
     * @throws StatisticalValidationException INVALID_INPUT naming the first NaN or infinite index
     */
    public static void requireFinite(double[] sample, String computation) throws StatisticalValidationException {
        for (int i = 0; i < sample.length; i++) {
            if (!Double.isFinite(sample[i])) {
                StatisticalValidationException ex = StatisticalValidationException.invalidInput(
                        String.format("%s: observation at index %d is not finite (%s)",
                                computation, i, sample[i]));
                ex.addContext("index", i);
                throw ex;
            }
        }
    }

    /**
     * Checks that a sample holds at least {@code minimum} finite observations.
     *
     * @param sample the observations
     * @param minimum smallest accepted size
     * @param computation name of the computation, used in the error message
     * @throws StatisticalValidationException EMPTY_DATASET, INVALID_INPUT or
     *         INSUFFICIENT_SAMPLE_SIZE
     */
    public static void requireMinimumSize(double[] sample, int minimum, String computation)
            throws StatisticalValidationException {
        requireNonEmpty(sample, computation);
        if (sample.length < minimum) {
            throw StatisticalValidationException.insufficientSampleSize(sample.length, minimum, computation);
        }
    }

    /**
     * Checks that a significance level lies strictly between 0 and 1.
     *
     * @param alpha the significance level
     * @throws StatisticalValidationException INVALID_PARAMETER otherwise
     */
    public static void requireSignificanceLevel(double alpha) throws StatisticalValidationException {
        if (!(alpha > 0.0 && alpha < 1.0)) {
            throw StatisticalValidationException.invalidParameter("alpha", alpha, "in (0, 1)");
        }
    }

    /**
     * Checks that a value is a strictly positive number.
     *
     * @param name parameter name for the error message
     * @param value the value to check
     * @throws StatisticalValidationException INVALID_PARAMETER otherwise
     */
    public static void requirePositive(String name, double value) throws StatisticalValidationException {
        if (!(value > 0.0)) {
            throw StatisticalValidationException.invalidParameter(name, value, "> 0");
        }
    }
}
