/* (C)2026 */
package com.ammann.analytics.dto;

import com.ammann.analytics.model.AnalysisReport;
import com.ammann.analytics.model.DescriptiveStatistics;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One row of the batch summary table.
 */
@Schema(description = "Key figures of one successfully analysed sample")
public record SampleSummaryDTO(
        @Schema(description = "Display name of the sample")
        String label,

        @Schema(description = "Sample size")
        int n,

        @Schema(description = "Arithmetic mean")
        double mean,

        @Schema(description = "Sample standard deviation")
        double standardDeviation,

        @Schema(description = "Confidence interval for the mean")
        ConfidenceIntervalDTO meanInterval,

        @Schema(description = "Confidence interval for the standard deviation")
        ConfidenceIntervalDTO stdInterval
) {
    static SampleSummaryDTO from(AnalysisReport report) {
        DescriptiveStatistics stats = report.statistics();
        return new SampleSummaryDTO(
                report.label(),
                stats.n(),
                stats.mean(),
                stats.sampleStd(),
                ConfidenceIntervalDTO.from(stats.meanInterval()),
                ConfidenceIntervalDTO.from(stats.stdInterval())
        );
    }
}
