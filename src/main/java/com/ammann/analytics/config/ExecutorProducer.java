/* (C)2026 */
package com.ammann.analytics.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the named ManagedExecutor that runs batch analyses.
 *
 * <p>Provides the "analysis-executor" bean used by BatchAnalysisService to analyse
 * independent samples in parallel. Each sample is analysed on its own task; the engine keeps
 * no shared mutable state, so no context beyond the defaults is propagated.
 */
@ApplicationScoped
public class ExecutorProducer {

    @ConfigProperty(name = "analysis.executor.max-async", defaultValue = "4")
    int maxAsync;

    @ConfigProperty(name = "analysis.executor.max-queued", defaultValue = "100")
    int maxQueued;

    /**
     * Produces a named ManagedExecutor for batch analyses.
     *
     * <p>Configuration properties:
     * <ul>
     *   <li>analysis.executor.max-async</li>
     *   <li>analysis.executor.max-queued</li>
     * </ul>
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("analysis-executor")
    @ApplicationScoped
    public ManagedExecutor createAnalysisExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }

    void closeAnalysisExecutor(@Disposes @Named("analysis-executor") ManagedExecutor executor) {
        executor.shutdown();
    }
}
