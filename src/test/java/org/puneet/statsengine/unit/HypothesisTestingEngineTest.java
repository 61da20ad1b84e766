package org.puneet.statsengine.unit;

import org.apache.commons.math3.stat.inference.ChiSquareTest;
import org.apache.commons.math3.stat.inference.TTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.puneet.statsengine.exceptions.StatisticalValidationException;
import org.puneet.statsengine.exceptions.StatisticalValidationException.StatisticalErrorType;
import org.puneet.statsengine.statistical.ChiSquareResult;
import org.puneet.statsengine.statistical.CorrectionMethod;
import org.puneet.statsengine.statistical.HypothesisTestingEngine;
import org.puneet.statsengine.statistical.TTestResult;
import org.puneet.statsengine.util.EngineConfig;

import static org.junit.jupiter.api.Assertions.*;

class HypothesisTestingEngineTest {

    private static final double[] RESPONSE_TIMES_A = {12.1, 14.3, 11.8, 13.5, 15.2, 12.9, 13.7, 14.8, 12.4, 13.1};
    private static final double[] RESPONSE_TIMES_B = {10.2, 11.5, 9.8, 10.9, 12.3, 11.1, 10.4, 11.8};

    private HypothesisTestingEngine engine;
    private final TTest commonsTTest = new TTest();

    @BeforeEach
    void setUp() {
        engine = new HypothesisTestingEngine();
    }

    @Test
    void testDefaultSignificanceLevelComesFromConfig() {
        assertEquals(0.05, engine.getDefaultSignificanceLevel());
        HypothesisTestingEngine strict = new HypothesisTestingEngine(new EngineConfig(0.01, CorrectionMethod.NONE));
        assertEquals(0.01, strict.getDefaultSignificanceLevel());
    }

    @Test
    void testDefaultConstructorReadsClasspathConfiguration() {
        assertEquals(EngineConfig.load().getSignificanceLevel(), new HypothesisTestingEngine().getDefaultSignificanceLevel());
    }

    @Test
    void testConfiguredSignificanceLevelAppliesToDefaultOverloads() throws Exception {
        HypothesisTestingEngine strict = new HypothesisTestingEngine(EngineConfig.load("strict-engine.properties"));

        TTestResult result = strict.oneSampleTTest(RESPONSE_TIMES_A, 12.0);

        assertEquals(0.01, result.getAlpha());
        assertEquals(0.99, result.getConfidenceInterval().getConfidenceLevel(), 1e-12);
        assertEquals(0.01, strict.chiSquareTest(new long[][] {{10, 10}, {10, 10}}).getAlpha());
    }

    @Test
    void testOneSampleTTestWithMeanEqualToHypothesis() throws Exception {
        TTestResult result = engine.oneSampleTTest(new double[] {5, 7, 5, 3, 5, 3, 3, 9}, 5.0);

        assertEquals(TTestResult.TestType.ONE_SAMPLE, result.getTestType());
        assertEquals(0.0, result.getTStatistic(), 1e-12);
        assertEquals(1.0, result.getPValue(), EngineConfig.P_VALUE_TOLERANCE);
        assertEquals(7.0, result.getDegreesOfFreedom(), 1e-12);
        assertFalse(result.isSignificant());
        assertEquals(0.0, result.getEffectSize(), 1e-12);
        assertTrue(result.getConfidenceInterval().contains(5.0));
    }

    @Test
    void testOneSampleTTestMatchesCommonsMath() throws Exception {
        TTestResult result = engine.oneSampleTTest(RESPONSE_TIMES_A, 12.0);

        assertEquals(commonsTTest.t(12.0, RESPONSE_TIMES_A), result.getTStatistic(), 1e-10);
        assertEquals(commonsTTest.tTest(12.0, RESPONSE_TIMES_A), result.getPValue(), EngineConfig.P_VALUE_TOLERANCE);
        assertTrue(result.isSignificant());
        assertTrue(result.getEffectSize() > 0.0);
        assertFalse(result.getConfidenceInterval().contains(12.0));
        assertEquals(0.95, result.getConfidenceInterval().getConfidenceLevel(), 1e-12);
    }

    @Test
    void testWelchTTestMatchesCommonsMath() throws Exception {
        TTestResult result = engine.twoSampleTTest(RESPONSE_TIMES_A, RESPONSE_TIMES_B);

        assertEquals(TTestResult.TestType.WELCH_TWO_SAMPLE, result.getTestType());
        assertEquals(commonsTTest.t(RESPONSE_TIMES_A, RESPONSE_TIMES_B), result.getTStatistic(), 1e-10);
        assertEquals(commonsTTest.tTest(RESPONSE_TIMES_A, RESPONSE_TIMES_B), result.getPValue(),
            EngineConfig.P_VALUE_TOLERANCE);
        assertTrue(result.isSignificant());
        assertTrue(result.getMeanDifference() > 0.0);
        assertTrue(result.getEffectSize() > 0.0);
        assertEquals("large", result.getEffectSizeInterpretation());
        assertFalse(result.getConfidenceInterval().containsZero());
        assertEquals(18, result.getConfidenceInterval().getSampleSize());
    }

    @Test
    void testWelchTTestIsAntisymmetric() throws Exception {
        TTestResult forward = engine.twoSampleTTest(RESPONSE_TIMES_A, RESPONSE_TIMES_B);
        TTestResult backward = engine.twoSampleTTest(RESPONSE_TIMES_B, RESPONSE_TIMES_A);

        assertEquals(forward.getTStatistic(), -backward.getTStatistic(), 1e-12);
        assertEquals(forward.getPValue(), backward.getPValue(), 1e-12);
        assertEquals(forward.getDegreesOfFreedom(), backward.getDegreesOfFreedom(), 1e-9);
        assertEquals(forward.getEffectSize(), -backward.getEffectSize(), 1e-12);
    }

    @Test
    void testWelchDegreesOfFreedomBounds() throws Exception {
        TTestResult result = engine.twoSampleTTest(RESPONSE_TIMES_A, RESPONSE_TIMES_B);
        double df = result.getDegreesOfFreedom();
        assertTrue(df >= Math.min(RESPONSE_TIMES_A.length, RESPONSE_TIMES_B.length) - 1);
        assertTrue(df <= RESPONSE_TIMES_A.length + RESPONSE_TIMES_B.length - 2);
    }

    @Test
    void testWelchTTestIsScaleInvariant() throws Exception {
        double[] a = {1.0, 2.0, 1.5};
        double[] b = {3.0, 5.0, 4.0};
        TTestResult reference = engine.twoSampleTTest(a, b);
        assertEquals(-3.8729833, reference.getTStatistic(), 1e-6);

        for (double factor : new double[] {1e-100, 1e100}) {
            TTestResult scaled = engine.twoSampleTTest(scale(a, factor), scale(b, factor));
            assertEquals(reference.getTStatistic(), scaled.getTStatistic(), 1e-9, "factor " + factor);
            assertEquals(reference.getDegreesOfFreedom(), scaled.getDegreesOfFreedom(), 1e-9, "factor " + factor);
            assertEquals(reference.getPValue(), scaled.getPValue(), 1e-9, "factor " + factor);
            assertEquals(reference.getEffectSize(), scaled.getEffectSize(), 1e-9, "factor " + factor);
        }
    }

    @Test
    void testOneSampleTTestIsScaleInvariant() throws Exception {
        TTestResult reference = engine.oneSampleTTest(RESPONSE_TIMES_A, 12.0);
        for (double factor : new double[] {1e-100, 1e100}) {
            TTestResult scaled = engine.oneSampleTTest(scale(RESPONSE_TIMES_A, factor), 12.0 * factor);
            assertEquals(reference.getTStatistic(), scaled.getTStatistic(), 1e-9, "factor " + factor);
            assertEquals(reference.getPValue(), scaled.getPValue(), 1e-9, "factor " + factor);
        }
    }

    @Test
    void testWelchTTestWithOneConstantSample() throws Exception {
        TTestResult result = engine.twoSampleTTest(new double[] {3, 3, 3}, new double[] {1, 2, 3, 4});
        assertTrue(Double.isFinite(result.getTStatistic()));
        assertTrue(result.getPValue() >= 0.0 && result.getPValue() <= 1.0);
    }

    @Test
    void testWelchTTestWithoutVarianceRejected() {
        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
            () -> engine.twoSampleTTest(new double[] {2, 2, 2}, new double[] {5, 5}));
        assertEquals(StatisticalErrorType.DIVISION_BY_ZERO, ex.getErrorType());
    }

    @Test
    void testPairedTTestEqualsOneSampleTestOfDifferences() throws Exception {
        double[] before = {72, 75, 68, 80, 77, 74, 69};
        double[] after = {70, 74, 65, 78, 77, 71, 66};
        double[] differences = new double[before.length];
        for (int i = 0; i < before.length; i++) {
            differences[i] = before[i] - after[i];
        }

        TTestResult paired = engine.pairedTTest(before, after);
        TTestResult oneSample = engine.oneSampleTTest(differences, 0.0);

        assertEquals(TTestResult.TestType.PAIRED, paired.getTestType());
        assertEquals(oneSample.getTStatistic(), paired.getTStatistic(), 1e-12);
        assertEquals(oneSample.getPValue(), paired.getPValue(), 1e-12);
        assertEquals(commonsTTest.pairedTTest(before, after), paired.getPValue(), EngineConfig.P_VALUE_TOLERANCE);
    }

    @Test
    void testPairedTTestRejectsUnequalLengths() {
        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
            () -> engine.pairedTTest(new double[] {1, 2, 3}, new double[] {1, 2}));
        assertEquals(StatisticalErrorType.INVALID_INPUT, ex.getErrorType());
    }

    @Test
    void testTTestInputValidation() {
        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
            () -> engine.oneSampleTTest(new double[] {4.2}, 4.0));
        assertEquals(StatisticalErrorType.INSUFFICIENT_SAMPLE_SIZE, ex.getErrorType());

        ex = assertThrows(StatisticalValidationException.class,
            () -> engine.oneSampleTTest(new double[] {1, 1, 1, 1}, 0.0));
        assertEquals(StatisticalErrorType.DIVISION_BY_ZERO, ex.getErrorType());

        ex = assertThrows(StatisticalValidationException.class,
            () -> engine.oneSampleTTest(RESPONSE_TIMES_A, 12.0, 1.0));
        assertEquals(StatisticalErrorType.INVALID_PARAMETER, ex.getErrorType());

        ex = assertThrows(StatisticalValidationException.class,
            () -> engine.twoSampleTTest(RESPONSE_TIMES_A, RESPONSE_TIMES_B, 0.0));
        assertEquals(StatisticalErrorType.INVALID_PARAMETER, ex.getErrorType());

        ex = assertThrows(StatisticalValidationException.class,
            () -> engine.twoSampleTTest(RESPONSE_TIMES_A, new double[0]));
        assertEquals(StatisticalErrorType.EMPTY_DATASET, ex.getErrorType());
    }

    @Test
    void testSignificanceDependsOnAlpha() throws Exception {
        TTestResult lenient = engine.oneSampleTTest(RESPONSE_TIMES_A, 13.0, 0.5);
        TTestResult strict = engine.oneSampleTTest(RESPONSE_TIMES_A, 13.0, 1e-6);

        assertEquals(lenient.getPValue(), strict.getPValue(), 1e-15);
        assertEquals(lenient.getPValue() < 0.5, lenient.isSignificant());
        assertFalse(strict.isSignificant());
        assertTrue(strict.getConfidenceInterval().getWidth() > lenient.getConfidenceInterval().getWidth());
    }

    @Test
    void testEffectSizeInterpretation() {
        assertEquals("negligible", TTestResult.interpretEffectSize(0.1));
        assertEquals("small", TTestResult.interpretEffectSize(-0.3));
        assertEquals("medium", TTestResult.interpretEffectSize(0.5));
        assertEquals("large", TTestResult.interpretEffectSize(1.2));
    }

    @Test
    void testChiSquareIndependentTable() throws Exception {
        ChiSquareResult result = engine.chiSquareTest(new long[][] {{10, 10}, {10, 10}});

        assertEquals(0.0, result.getChiSquareStatistic(), 1e-12);
        assertEquals(1.0, result.getPValue(), EngineConfig.P_VALUE_TOLERANCE);
        assertEquals(1, result.getDegreesOfFreedom());
        assertEquals(0.0, result.getCramersV(), 1e-12);
        assertEquals(40L, result.getGrandTotal());
        assertFalse(result.isSignificant());
        assertEquals(10.0, result.getExpectedCounts()[1][1], 1e-12);
    }

    @Test
    void testChiSquareProportionalRowsNotSignificant() throws Exception {
        ChiSquareResult result = engine.chiSquareTest(new long[][] {{10, 20, 30}, {20, 40, 60}});
        assertEquals(0.0, result.getChiSquareStatistic(), 1e-9);
        assertEquals(2, result.getDegreesOfFreedom());
        assertFalse(result.isSignificant());
    }

    @Test
    void testChiSquareMatchesCommonsMath() throws Exception {
        long[][] table = {{45, 15, 20}, {25, 35, 10}, {10, 20, 40}};
        ChiSquareTest reference = new ChiSquareTest();

        ChiSquareResult result = engine.chiSquareTest(table);

        assertEquals(reference.chiSquare(table), result.getChiSquareStatistic(), 1e-9);
        assertEquals(reference.chiSquareTest(table), result.getPValue(), EngineConfig.P_VALUE_TOLERANCE);
        assertEquals(4, result.getDegreesOfFreedom());
        assertTrue(result.isSignificant());
        assertTrue(result.getCramersV() > 0.0 && result.getCramersV() <= 1.0);
    }

    @Test
    void testChiSquarePerfectAssociation() throws Exception {
        ChiSquareResult result = engine.chiSquareTest(new long[][] {{50, 0}, {0, 50}});
        assertEquals(1.0, result.getCramersV(), 1e-12);
        assertTrue(result.isSignificant());
    }

    @Test
    void testChiSquareExpectedCountsAreCopied() throws Exception {
        ChiSquareResult result = engine.chiSquareTest(new long[][] {{10, 10}, {10, 10}});
        result.getExpectedCounts()[0][0] = -1.0;
        assertEquals(10.0, result.getExpectedCounts()[0][0], 1e-12);
    }

    @Test
    void testChiSquareDegenerateTables() {
        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
            () -> engine.chiSquareTest(new long[][] {{0, 0}, {5, 5}}));
        assertEquals(StatisticalErrorType.DIVISION_BY_ZERO, ex.getErrorType());
        assertEquals(0, ex.getStatisticalContext().get("row"));

        ex = assertThrows(StatisticalValidationException.class,
            () -> engine.chiSquareTest(new long[][] {{0, 0}, {0, 0}}));
        assertEquals(StatisticalErrorType.DIVISION_BY_ZERO, ex.getErrorType());
    }

    @Test
    void testChiSquareMalformedTables() {
        long[][][] malformed = {
            null,
            {{1, 2}},
            {{1}, {2}},
            {{1, 2}, {3}},
            {{1, -2}, {3, 4}}
        };
        for (long[][] table : malformed) {
            StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
                () -> engine.chiSquareTest(table));
            assertEquals(StatisticalErrorType.INVALID_INPUT, ex.getErrorType());
        }

        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
            () -> engine.chiSquareTest(new long[][] {{1, 2}, {3, 4}}, 1.5));
        assertEquals(StatisticalErrorType.INVALID_PARAMETER, ex.getErrorType());
    }

    private static double[] scale(double[] values, double factor) {
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] * factor;
        }
        return scaled;
    }
}
