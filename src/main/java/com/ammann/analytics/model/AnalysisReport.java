/* (C)2026 */
package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.NormalityCriterion;
import com.ammann.analytics.enumeration.OutlierMethod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Complete, read-only analysis of one sample.
 *
 * <p>Aggregates the sample, its descriptive statistics, the grouped frequency table and the
 * normality and outlier results. Performs no computation of its own. Rendering layers read
 * it through the accessors or through {@link #asMap()}.
 */
public final class AnalysisReport
{
    private final Sample sample;
    private final DescriptiveStatistics statistics;
    private final FrequencyTable frequencyTable;
    private final Map<NormalityCriterion, NormalityTestResult> normalityResults;
    private final Map<OutlierMethod, OutlierResult> outlierResults;
    private final AnalysisOptions options;

    public AnalysisReport(Sample sample,
                          DescriptiveStatistics statistics,
                          FrequencyTable frequencyTable,
                          Map<NormalityCriterion, NormalityTestResult> normalityResults,
                          Map<OutlierMethod, OutlierResult> outlierResults,
                          AnalysisOptions options)
    {
        this.sample = sample;
        this.statistics = statistics;
        this.frequencyTable = frequencyTable;
        this.normalityResults = Collections.unmodifiableMap(copy(normalityResults, NormalityCriterion.class));
        this.outlierResults = Collections.unmodifiableMap(copy(outlierResults, OutlierMethod.class));
        this.options = options;
    }

    public String label()
    {
        return sample.label();
    }

    public Sample sample()
    {
        return sample;
    }

    public DescriptiveStatistics statistics()
    {
        return statistics;
    }

    public FrequencyTable frequencyTable()
    {
        return frequencyTable;
    }

    /** Results keyed by criterion; Romanovsky is absent for samples larger than 50. */
    public Map<NormalityCriterion, NormalityTestResult> normalityResults()
    {
        return normalityResults;
    }

    public Map<OutlierMethod, OutlierResult> outlierResults()
    {
        return outlierResults;
    }

    public AnalysisOptions options()
    {
        return options;
    }

    public Optional<NormalityTestResult> normality(NormalityCriterion criterion)
    {
        return Optional.ofNullable(normalityResults.get(criterion));
    }

    public Optional<OutlierResult> outliers(OutlierMethod method)
    {
        return Optional.ofNullable(outlierResults.get(method));
    }

    /** Number of available criteria that accept normality. */
    public long normalVerdictCount()
    {
        return normalityResults.values().stream().filter(NormalityTestResult::isNormal).count();
    }

    /** Number of available methods that flagged at least one value. */
    public long methodsFlaggingOutliers()
    {
        return outlierResults.values().stream().filter(OutlierResult::hasOutliers).count();
    }

    /**
     * Returns the full structure as an ordered, unmodifiable map for serialization.
     */
    public Map<String, Object> asMap()
    {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("label", sample.label());
        map.put("values", sample.values());
        map.put("statistics", statistics);
        map.put("frequencyTable", frequencyTable);
        map.put("normality", normalityResults);
        map.put("outliers", outlierResults);
        map.put("options", options);
        return Collections.unmodifiableMap(map);
    }

    private static <K extends Enum<K>, V> Map<K, V> copy(Map<K, V> source, Class<K> type)
    {
        EnumMap<K, V> copy = new EnumMap<>(type);
        copy.putAll(source);
        return copy;
    }

    @Override
    public String toString()
    {
        return "AnalysisReport{label='" + sample.label() + "', n=" + sample.size()
                + ", normal=" + normalVerdictCount() + "/" + normalityResults.size()
                + ", outlierMethodsFlagging=" + methodsFlaggingOutliers() + "}";
    }
}
