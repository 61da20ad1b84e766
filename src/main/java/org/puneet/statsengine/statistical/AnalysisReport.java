package org.puneet.statsengine.statistical;

import org.puneet.statsengine.descriptive.DescriptiveStatisticsResult;
import org.puneet.statsengine.normality.NormalityTestResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable result of {@link StatisticalAnalyzer#analyze(Map, String)}.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-10
 */
public final class AnalysisReport {

    private final String metric;
    private final CorrectionMethod correctionMethod;
    private final Map<String, DescriptiveStatisticsResult> descriptiveStats;
    private final Map<String, NormalityTestResult> normalityResults;
    private final List<PairwiseComparison> pairwiseComparisons;

    public AnalysisReport(String metric, CorrectionMethod correctionMethod,
                          Map<String, DescriptiveStatisticsResult> descriptiveStats,
                          Map<String, NormalityTestResult> normalityResults,
                          List<PairwiseComparison> pairwiseComparisons) {
        this.metric = Objects.requireNonNull(metric, "Metric cannot be null");
        this.correctionMethod = Objects.requireNonNull(correctionMethod, "Correction method cannot be null");
        this.descriptiveStats = Collections.unmodifiableMap(new LinkedHashMap<>(descriptiveStats));
        this.normalityResults = Collections.unmodifiableMap(new LinkedHashMap<>(normalityResults));
        this.pairwiseComparisons = List.copyOf(pairwiseComparisons);
    }

    public String getMetric() { return metric; }
    public CorrectionMethod getCorrectionMethod() { return correctionMethod; }
    public Map<String, DescriptiveStatisticsResult> getDescriptiveStats() { return descriptiveStats; }
    public Map<String, NormalityTestResult> getNormalityResults() { return normalityResults; }
    public List<PairwiseComparison> getPairwiseComparisons() { return pairwiseComparisons; }

    /**
     * Looks up the comparison of two groups in either order.
     */
    public Optional<PairwiseComparison> findComparison(String first, String second) {
        return pairwiseComparisons.stream()
            .filter(c -> (c.getGroupA().equals(first) && c.getGroupB().equals(second))
                || (c.getGroupA().equals(second) && c.getGroupB().equals(first)))
            .findFirst();
    }

    public long countSignificantAfterCorrection() {
        return pairwiseComparisons.stream().filter(PairwiseComparison::isSignificantAfterCorrection).count();
    }
}
