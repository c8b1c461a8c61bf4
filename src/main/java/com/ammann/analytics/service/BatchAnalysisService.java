/* (C)2026 */
package com.ammann.analytics.service;

import com.ammann.analytics.exception.AnalysisException;
import com.ammann.analytics.exception.DegenerateSampleException;
import com.ammann.analytics.exception.InvalidInputException;
import com.ammann.analytics.model.AnalysisOptions;
import com.ammann.analytics.model.AnalysisReport;
import com.ammann.analytics.model.Sample;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Service for analysing several independent samples in one call.
 *
 * <p>Every sample is analysed on its own task of the "analysis-executor". Samples share no
 * state, so no synchronization is needed. A fatal error for one sample becomes a failed entry
 * and does not affect the others. Entries keep the order of the input.
 */
@ApplicationScoped
public class BatchAnalysisService
{
    private static final Logger LOG = Logger.getLogger(BatchAnalysisService.class);

    static final int DEFAULT_MAX_SAMPLES = 50;

    @ConfigProperty(name = "analysis.batch.max-samples", defaultValue = "50")
    int maxSamples = DEFAULT_MAX_SAMPLES;

    private final SampleAnalysisService sampleAnalysisService;
    private final Executor executor;

    @Inject
    public BatchAnalysisService(SampleAnalysisService sampleAnalysisService,
                                @Named("analysis-executor") Executor executor)
    {
        this.sampleAnalysisService = sampleAnalysisService;
        this.executor = executor;
    }

    /**
     * Analyses all samples with the same options.
     *
     * @param samples samples to analyse, at least one
     * @param options options applied to every sample
     * @return one entry per sample, in input order
     * @throws InvalidInputException if no samples or more than the configured maximum are given
     */
    public List<BatchEntry> analyzeAll(List<Sample> samples, AnalysisOptions options)
    {
        validateBatchSize(samples);
        return run(samples.stream()
                .map(sample -> new PendingSample(sample.label(), () -> sample))
                .toList(), options);
    }

    /**
     * Validates and analyses raw labelled values. Values that do not form a valid sample
     * produce a failed entry instead of failing the batch.
     *
     * @param inputs  labelled value lists, at least one
     * @param options options applied to every sample
     * @return one entry per input, in input order
     * @throws InvalidInputException if no inputs or more than the configured maximum are given
     */
    public List<BatchEntry> analyzeValues(List<LabelledValues> inputs, AnalysisOptions options)
    {
        validateBatchSize(inputs);
        return run(inputs.stream()
                .map(input -> new PendingSample(Sample.normalizeLabel(input.label()),
                        () -> Sample.of(input.label(), input.values())))
                .toList(), options);
    }

    private void validateBatchSize(List<?> inputs)
    {
        if (inputs == null || inputs.isEmpty()) {
            throw InvalidInputException.insufficientData(1, 0);
        }
        if (inputs.size() > maxSamples) {
            throw InvalidInputException.invalidParameter("samples", inputs.size(),
                    "at most " + maxSamples + " samples per batch");
        }
    }

    private List<BatchEntry> run(List<PendingSample> pending, AnalysisOptions options)
    {
        long startTime = System.nanoTime();
        List<CompletableFuture<BatchEntry>> futures = new ArrayList<>(pending.size());
        for (PendingSample sample : pending) {
            futures.add(CompletableFuture.supplyAsync(() -> analyzeOne(sample, options), executor));
        }

        List<BatchEntry> entries = new ArrayList<>(futures.size());
        for (CompletableFuture<BatchEntry> future : futures) {
            try {
                entries.add(future.join());
            } catch (CompletionException e) {
                throw new AnalysisException("Batch analysis task failed", e.getCause());
            }
        }

        long failed = entries.stream().filter(entry -> !entry.succeeded()).count();
        LOG.infof("Batch analysis of %d samples completed in %.2fms (%d failed)",
                pending.size(), (System.nanoTime() - startTime) / 1_000_000.0, failed);
        return entries;
    }

    private BatchEntry analyzeOne(PendingSample pending, AnalysisOptions options)
    {
        try {
            return BatchEntry.success(sampleAnalysisService.analyze(pending.sample().get(), options));
        } catch (DegenerateSampleException e) {
            return BatchEntry.failure(pending.label(), "DEGENERATE_SAMPLE", e.getMessage());
        } catch (InvalidInputException e) {
            return BatchEntry.failure(pending.label(), "INVALID_INPUT", e.getMessage());
        }
    }

    private record PendingSample(String label, Supplier<Sample> sample)
    {
    }

    /**
     * Unvalidated values of one sample together with its label.
     */
    public record LabelledValues(String label, List<Double> values)
    {
    }

    /**
     * Outcome for one sample of a batch: either a report or an error code with a message.
     */
    public record BatchEntry(
            String label,
            AnalysisReport report,
            String errorCode,
            String errorMessage
    )
    {
        public static BatchEntry success(AnalysisReport report)
        {
            return new BatchEntry(report.label(), report, null, null);
        }

        public static BatchEntry failure(String label, String errorCode, String errorMessage)
        {
            return new BatchEntry(label, null, errorCode, errorMessage);
        }

        public boolean succeeded()
        {
            return report != null;
        }
    }
}
