/* (C)2026 */
package com.ammann.analytics.dto;

import com.ammann.analytics.service.BatchAnalysisService;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * Result of a batch analysis.
 *
 * <p>{@code entries} keeps the request order and holds one entry per sample, failed or not.
 * {@code summary} lists only the samples that were analysed, in the same order.
 */
@Schema(description = "Per-sample results of a batch analysis with a summary table")
public record BatchAnalysisResultDTO(
        @Schema(description = "Number of samples in the batch")
        int total,

        @Schema(description = "Number of samples analysed successfully")
        int succeeded,

        @Schema(description = "Number of samples that failed")
        int failed,

        @Schema(description = "One entry per sample, in request order")
        List<BatchEntryDTO> entries,

        @Schema(description = "Label, n, mean, standard deviation and confidence intervals of every analysed sample")
        List<SampleSummaryDTO> summary
) {
    public static BatchAnalysisResultDTO from(List<BatchAnalysisService.BatchEntry> entries) {
        List<BatchEntryDTO> entryDtos = entries.stream().map(BatchEntryDTO::from).toList();
        List<SampleSummaryDTO> summary = entries.stream()
                .filter(BatchAnalysisService.BatchEntry::succeeded)
                .map(entry -> SampleSummaryDTO.from(entry.report()))
                .toList();
        return new BatchAnalysisResultDTO(
                entries.size(),
                summary.size(),
                entries.size() - summary.size(),
                entryDtos,
                summary
        );
    }
}
