package org.puneet.statsengine.unit;

import org.junit.jupiter.api.Test;
import org.puneet.statsengine.exceptions.StatisticalValidationException;
import org.puneet.statsengine.exceptions.StatisticalValidationException.StatisticalErrorType;
import org.puneet.statsengine.util.ValidationUtils;

import static org.junit.jupiter.api.Assertions.*;

class ValidationUtilsTest {

    @Test
    void testRequireNonEmpty() {
        assertDoesNotThrow(() -> ValidationUtils.requireNonEmpty(new double[] {1.0}, "mean"));

        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
            () -> ValidationUtils.requireNonEmpty(new double[0], "mean"));
        assertEquals(StatisticalErrorType.EMPTY_DATASET, ex.getErrorType());

        ex = assertThrows(StatisticalValidationException.class,
            () -> ValidationUtils.requireNonEmpty(new double[] {0.0, Double.NEGATIVE_INFINITY}, "mean"));
        assertEquals(StatisticalErrorType.INVALID_INPUT, ex.getErrorType());
        assertEquals(1, ex.getStatisticalContext().get("index"));
    }

    @Test
    void testRequireFinite() {
        assertDoesNotThrow(() -> ValidationUtils.requireFinite(new double[0], "normality"));
        assertDoesNotThrow(() -> ValidationUtils.requireFinite(new double[] {-1.0, 0.0, 1e300}, "normality"));

        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
            () -> ValidationUtils.requireFinite(new double[] {1.0, 2.0, Double.NaN}, "normality"));
        assertEquals(StatisticalErrorType.INVALID_INPUT, ex.getErrorType());
        assertEquals(2, ex.getStatisticalContext().get("index"));
    }

    @Test
    void testRequireMinimumSize() {
        assertDoesNotThrow(() -> ValidationUtils.requireMinimumSize(new double[] {1.0, 2.0}, 2, "variance"));
        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
            () -> ValidationUtils.requireMinimumSize(new double[] {1.0}, 2, "variance"));
        assertEquals(StatisticalErrorType.INSUFFICIENT_SAMPLE_SIZE, ex.getErrorType());
    }

    @Test
    void testRequireSignificanceLevel() {
        assertDoesNotThrow(() -> ValidationUtils.requireSignificanceLevel(0.05));
        for (double alpha : new double[] {0.0, 1.0, -0.1, Double.NaN}) {
            StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
                () -> ValidationUtils.requireSignificanceLevel(alpha));
            assertEquals(StatisticalErrorType.INVALID_PARAMETER, ex.getErrorType());
        }
    }

    @Test
    void testRequirePositive() {
        assertDoesNotThrow(() -> ValidationUtils.requirePositive("df", 3.0));
        assertThrows(StatisticalValidationException.class, () -> ValidationUtils.requirePositive("df", 0.0));
        assertThrows(StatisticalValidationException.class, () -> ValidationUtils.requirePositive("df", Double.NaN));
    }
}
