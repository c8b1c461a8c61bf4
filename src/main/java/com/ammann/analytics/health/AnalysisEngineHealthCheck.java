/* (C)2026 */
package com.ammann.analytics.health;

import com.ammann.analytics.model.AnalysisReport;
import com.ammann.analytics.model.ReferenceSamples;
import com.ammann.analytics.service.SampleAnalysisService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import java.util.Locale;

/**
 * Readiness check that runs the analysis engine on the bundled 25-value reference sample.
 *
 * <p>Reports UP with the sample size, mean and the number of accepting normality criteria.
 * Any exception from the engine, including a failure to load the numerical distributions,
 * reports DOWN with the error message.
 */
@Readiness
@ApplicationScoped
public class AnalysisEngineHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(AnalysisEngineHealthCheck.class);
    private static final String HEALTH_CHECK_NAME = "analysis-engine";

    private final SampleAnalysisService sampleAnalysisService;

    @Inject
    public AnalysisEngineHealthCheck(SampleAnalysisService sampleAnalysisService) {
        this.sampleAnalysisService = sampleAnalysisService;
    }

    @Override
    public HealthCheckResponse call() {
        long startTime = System.currentTimeMillis();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named(HEALTH_CHECK_NAME)
                .withData("reference-sample", ReferenceSamples.MEASUREMENTS_25_LABEL);

        try {
            AnalysisReport report = sampleAnalysisService.analyze(ReferenceSamples.measurements25());
            return builder
                    .withData("n", report.sample().size())
                    .withData("mean", String.format(Locale.ROOT, "%.4f", report.statistics().mean()))
                    .withData("normal-verdicts", report.normalVerdictCount())
                    .withData("last-check-ms", System.currentTimeMillis() - startTime)
                    .up()
                    .build();
        } catch (RuntimeException e) {
            LOG.warnf("Analysis engine health check failed: %s", e.getMessage());
            return builder
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("last-check-ms", System.currentTimeMillis() - startTime)
                    .down()
                    .build();
        }
    }
}
