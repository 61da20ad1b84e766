package org.puneet.statsengine.statistical;

import org.puneet.statsengine.descriptive.DescriptiveStatisticsCalculator;
import org.puneet.statsengine.descriptive.DescriptiveStatisticsResult;
import org.puneet.statsengine.exceptions.StatisticalValidationException;
import org.puneet.statsengine.normality.NormalityTestResult;
import org.puneet.statsengine.normality.NormalityTester;
import org.puneet.statsengine.util.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Multi-group analysis of one metric: descriptive statistics and a normality
 * check per group, then Welch t-tests for every pair of groups with the
 * p-values corrected for multiple comparisons.
 *
 * <p>A failure in any group aborts the analysis with the group key attached;
 * groups are never skipped silently.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-10
 */
public class StatisticalAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(StatisticalAnalyzer.class);

    private final EngineConfig config;
    private final DescriptiveStatisticsCalculator calculator;
    private final NormalityTester normalityTester;
    private final HypothesisTestingEngine testingEngine;

    /**
     * Constructs an analyzer with the configuration found on the classpath.
     */
    public StatisticalAnalyzer() {
        this(EngineConfig.load());
    }

    public StatisticalAnalyzer(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.calculator = new DescriptiveStatisticsCalculator();
        this.normalityTester = new NormalityTester();
        this.testingEngine = new HypothesisTestingEngine(config);

        logger.info("StatisticalAnalyzer initialized with {} correction, alpha={}",
            config.getCorrectionMethod().getDisplayName(), config.getSignificanceLevel());
    }

    /**
     * Analyzes grouped observations of one metric.
     *
     * @param groups group name to observations; at least two groups
     * @param metric name of the metric being analyzed
     * @return the analysis report
     * @throws StatisticalValidationException INVALID_INPUT for fewer than two groups
     *         or a blank metric name; any group failure with its key as dataset name
     */
    public AnalysisReport analyze(Map<String, double[]> groups, String metric)
            throws StatisticalValidationException {
        if (metric == null || metric.trim().isEmpty()) {
            throw StatisticalValidationException.invalidInput("Metric name cannot be null or empty");
        }
        if (groups == null || groups.size() < 2) {
            throw StatisticalValidationException.invalidInput(
                "Analysis needs at least two groups, got " + (groups == null ? 0 : groups.size()));
        }

        logger.info("Starting statistical analysis for metric: {} with {} groups", metric, groups.size());

        Map<String, DescriptiveStatisticsResult> descriptive = calculator.describeGrouped(groups);
        Map<String, NormalityTestResult> normality = checkNormality(groups);
        List<PairwiseComparison> comparisons = compareAllPairs(groups);

        AnalysisReport report = new AnalysisReport(metric, config.getCorrectionMethod(),
            descriptive, normality, comparisons);

        logger.info("Analysis of {}: {} comparisons, {} significant after {} correction",
            metric, comparisons.size(), report.countSignificantAfterCorrection(),
            config.getCorrectionMethod().getDisplayName());
        return report;
    }

    private Map<String, NormalityTestResult> checkNormality(Map<String, double[]> groups)
            throws StatisticalValidationException {
        Map<String, NormalityTestResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : groups.entrySet()) {
            try {
                NormalityTestResult result = normalityTester.testNormality(entry.getValue());
                if (!result.isNormal()) {
                    logger.warn("Group {} does not look normal (p={}), interpret t-tests with caution",
                        entry.getKey(), String.format("%.4f", result.getPValue()));
                }
                results.put(entry.getKey(), result);
            } catch (StatisticalValidationException e) {
                throw StatisticalValidationException.forGroup(entry.getKey(), e);
            }
        }
        return results;
    }

    private List<PairwiseComparison> compareAllPairs(Map<String, double[]> groups)
            throws StatisticalValidationException {
        List<String> names = new ArrayList<>(groups.keySet());
        List<String[]> pairs = new ArrayList<>();
        List<TTestResult> rawResults = new ArrayList<>();

        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                String first = names.get(i);
                String second = names.get(j);
                try {
                    rawResults.add(testingEngine.twoSampleTTest(groups.get(first), groups.get(second)));
                } catch (StatisticalValidationException e) {
                    throw StatisticalValidationException.forGroup(first + " vs " + second, e);
                }
                pairs.add(new String[] {first, second});
            }
        }

        double[] rawPValues = rawResults.stream().mapToDouble(TTestResult::getPValue).toArray();
        double[] adjusted = MultipleComparisonCorrection.adjust(rawPValues, config.getCorrectionMethod());
        boolean[] significant = MultipleComparisonCorrection.significant(adjusted, config.getSignificanceLevel());

        List<PairwiseComparison> comparisons = new ArrayList<>();
        for (int k = 0; k < pairs.size(); k++) {
            comparisons.add(new PairwiseComparison(pairs.get(k)[0], pairs.get(k)[1],
                rawResults.get(k), adjusted[k], significant[k]));
        }
        return comparisons;
    }
}
