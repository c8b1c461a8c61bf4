/* (C)2026 */
package com.ammann.analytics.service;

import com.ammann.analytics.enumeration.NormalityCriterion;
import com.ammann.analytics.enumeration.OutlierMethod;
import com.ammann.analytics.exception.AnalysisException;
import com.ammann.analytics.exception.DegenerateSampleException;
import com.ammann.analytics.exception.InvalidInputException;
import com.ammann.analytics.math.CriticalValues;
import com.ammann.analytics.model.AnalysisOptions;
import com.ammann.analytics.model.AnalysisReport;
import com.ammann.analytics.model.DescriptiveStatistics;
import com.ammann.analytics.model.FrequencyTable;
import com.ammann.analytics.model.NormalityTestResult;
import com.ammann.analytics.model.OutlierResult;
import com.ammann.analytics.model.Sample;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Entry point of the analysis engine: turns one sample into an {@link AnalysisReport}.
 *
 * <p>Computes the descriptive statistics, then the normality and outlier criteria on top of
 * them, and the grouped frequency table. Invalid and degenerate samples abort the analysis
 * with {@link InvalidInputException} or {@link DegenerateSampleException}; failures of single
 * criteria are carried inside the report.
 *
 * <p>Defaults come from {@code analysis.*} configuration properties and can be overridden
 * per call through {@link AnalysisOptions}.
 */
@ApplicationScoped
public class SampleAnalysisService
{
    private static final Logger LOG = Logger.getLogger(SampleAnalysisService.class);

    @ConfigProperty(name = "analysis.significance-level", defaultValue = "0.05")
    double significanceLevel = DescriptiveStatistics.DEFAULT_SIGNIFICANCE_LEVEL;

    @ConfigProperty(name = "analysis.outlier.methods", defaultValue = "ALL")
    String outlierMethods = "ALL";

    @ConfigProperty(name = "analysis.outlier.iqr-multiplier", defaultValue = "1.5")
    double iqrMultiplier = AnalysisOptions.DEFAULT_IQR_MULTIPLIER;

    @ConfigProperty(name = "analysis.outlier.irwin-critical", defaultValue = "1.7")
    double irwinCritical = CriticalValues.DEFAULT_IRWIN_CRITICAL;

    private final NormalityTestService normalityTestService;
    private final OutlierDetectionService outlierDetectionService;
    private final MeterRegistry meterRegistry;

    private Counter analysisCounter;

    @Inject
    public SampleAnalysisService(NormalityTestService normalityTestService,
                                 OutlierDetectionService outlierDetectionService,
                                 MeterRegistry meterRegistry)
    {
        this.normalityTestService = normalityTestService;
        this.outlierDetectionService = outlierDetectionService;
        this.meterRegistry = meterRegistry;
    }

    void initMetrics()
    {
        if (meterRegistry != null && analysisCounter == null) {
            analysisCounter = Counter.builder("sample_analysis_total")
                    .description("Count of completed sample analyses")
                    .register(meterRegistry);
        }
    }

    /**
     * Options built from the configuration properties.
     */
    public AnalysisOptions defaultOptions()
    {
        return new AnalysisOptions(significanceLevel, OutlierMethod.parse(outlierMethods),
                iqrMultiplier, irwinCritical);
    }

    /**
     * Analyses a sample with the configured defaults.
     */
    public AnalysisReport analyze(Sample sample)
    {
        return analyze(sample, defaultOptions());
    }

    /**
     * Analyses a sample.
     *
     * @param sample  validated sample
     * @param options significance level, outlier methods and thresholds
     * @return complete report
     * @throws DegenerateSampleException if all values are identical
     * @throws InvalidInputException     if the options are invalid
     */
    public AnalysisReport analyze(Sample sample, AnalysisOptions options)
    {
        initMetrics();
        long startTime = System.nanoTime();

        try {
            DescriptiveStatistics stats = DescriptiveStatistics.compute(sample, options.significanceLevel());
            Map<NormalityCriterion, NormalityTestResult> normality = normalityTestService.testAll(sample, stats);
            Map<OutlierMethod, OutlierResult> outliers = outlierDetectionService.detect(sample, stats, options);
            FrequencyTable frequencyTable = FrequencyTable.of(sample);

            AnalysisReport report = new AnalysisReport(sample, stats, frequencyTable, normality, outliers, options);

            if (analysisCounter != null) {
                analysisCounter.increment();
            }
            LOG.infof("Analysis of '%s' completed in %.2fms: n=%d, mean=%.4f, s=%.4f, normal %d/%d, outlier methods flagging %d/%d",
                    sample.label(), (System.nanoTime() - startTime) / 1_000_000.0, sample.size(),
                    stats.mean(), stats.sampleStd(), report.normalVerdictCount(), normality.size(),
                    report.methodsFlaggingOutliers(), outliers.size());
            return report;

        } catch (AnalysisException e) {
            recordFailureMetric(e);
            LOG.warnf("Analysis of '%s' rejected: %s", sample.label(), e.getMessage());
            throw e;
        }
    }

    private void recordFailureMetric(AnalysisException e)
    {
        if (meterRegistry != null) {
            String reason = e instanceof DegenerateSampleException ? "degenerate" : "invalid";
            Counter.builder("sample_analysis_failures_total")
                    .description("Count of rejected sample analyses")
                    .tag("reason", reason)
                    .register(meterRegistry)
                    .increment();
        }
    }
}
