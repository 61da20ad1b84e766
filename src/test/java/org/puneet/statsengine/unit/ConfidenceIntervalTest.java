package org.puneet.statsengine.unit;

import org.junit.jupiter.api.Test;
import org.puneet.statsengine.exceptions.StatisticalValidationException;
import org.puneet.statsengine.exceptions.StatisticalValidationException.StatisticalErrorType;
import org.puneet.statsengine.statistical.ConfidenceInterval;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceIntervalTest {

    @Test
    void testComputeTDistribution() throws Exception {
        ConfidenceInterval ci = ConfidenceInterval.computeTDistribution(new double[] {1, 2, 3, 4, 5});

        double standardError = Math.sqrt(2.5) / Math.sqrt(5);
        double margin = 2.776445105 * standardError;
        assertEquals(3.0, ci.getEstimate(), 1e-12);
        assertEquals(standardError, ci.getStandardError(), 1e-12);
        assertEquals(3.0 - margin, ci.getLowerBound(), 1e-6);
        assertEquals(3.0 + margin, ci.getUpperBound(), 1e-6);
        assertEquals(margin, ci.getMarginOfError(), 1e-6);
        assertEquals(2 * margin, ci.getWidth(), 1e-6);
        assertEquals(0.95, ci.getConfidenceLevel());
        assertEquals(5, ci.getSampleSize());
        assertEquals("t-Distribution", ci.getMethodUsed());
    }

    @Test
    void testHigherConfidenceGivesWiderInterval() throws Exception {
        double[] data = {10.2, 9.8, 11.1, 10.5, 9.9, 10.7};
        ConfidenceInterval ninety = ConfidenceInterval.computeTDistribution(data, 0.90);
        ConfidenceInterval ninetyNine = ConfidenceInterval.computeTDistribution(data, 0.99);

        assertTrue(ninetyNine.getWidth() > ninety.getWidth());
        assertTrue(ninetyNine.getLowerBound() <= ninety.getLowerBound());
        assertTrue(ninetyNine.getUpperBound() >= ninety.getUpperBound());
    }

    @Test
    void testIdenticalValuesGiveZeroWidth() throws Exception {
        ConfidenceInterval ci = ConfidenceInterval.computeTDistribution(new double[] {4.0, 4.0, 4.0});
        assertEquals(0.0, ci.getWidth(), 1e-15);
        assertTrue(ci.contains(4.0));
    }

    @Test
    void testComputeRejectsInvalidInput() {
        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
            () -> ConfidenceInterval.computeTDistribution(new double[] {1.0}));
        assertEquals(StatisticalErrorType.INSUFFICIENT_SAMPLE_SIZE, ex.getErrorType());

        ex = assertThrows(StatisticalValidationException.class,
            () -> ConfidenceInterval.computeTDistribution(new double[] {1.0, 2.0}, 1.0));
        assertEquals(StatisticalErrorType.INVALID_PARAMETER, ex.getErrorType());
        assertEquals("confidenceLevel", ex.getStatisticalContext().get("parameter"));
        assertEquals(1.0, ex.getStatisticalContext().get("value"));
    }

    @Test
    void testContainsAndOverlaps() {
        ConfidenceInterval a = new ConfidenceInterval(-1.0, 2.0, 0.5, 0.7, 0.95, 10, "t-Distribution");
        ConfidenceInterval b = new ConfidenceInterval(1.5, 4.0, 2.75, 0.6, 0.95, 10, "t-Distribution");
        ConfidenceInterval c = new ConfidenceInterval(2.5, 3.0, 2.75, 0.1, 0.95, 10, "t-Distribution");

        assertTrue(a.containsZero());
        assertFalse(b.containsZero());
        assertTrue(a.contains(2.0));
        assertTrue(a.overlaps(b));
        assertTrue(b.overlaps(a));
        assertFalse(a.overlaps(c));
        assertThrows(NullPointerException.class, () -> a.overlaps(null));
        assertTrue(a.toString().contains("95% CI"));
    }

    @Test
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> new ConfidenceInterval(2.0, 1.0, 1.5, 0.1, 0.95, 10, "t"));
        assertThrows(IllegalArgumentException.class,
            () -> new ConfidenceInterval(Double.NaN, 1.0, 0.5, 0.1, 0.95, 10, "t"));
        assertThrows(IllegalArgumentException.class,
            () -> new ConfidenceInterval(0.0, 1.0, 0.5, 0.1, 1.0, 10, "t"));
        assertThrows(IllegalArgumentException.class,
            () -> new ConfidenceInterval(0.0, 1.0, 0.5, 0.1, 0.95, 1, "t"));
        assertThrows(NullPointerException.class,
            () -> new ConfidenceInterval(0.0, 1.0, 0.5, 0.1, 0.95, 10, null));
    }
}
