/* (C)2026 */
package com.ammann.analytics.dto;

import com.ammann.analytics.service.BatchAnalysisService;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Outcome for one sample of a batch: a report or an error")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchEntryDTO(
        @Schema(description = "Display name of the sample")
        String label,

        @Schema(description = "Whether the sample was analysed")
        boolean success,

        @Schema(description = "Analysis report, present on success")
        AnalysisReportDTO report,

        @Schema(description = "Error code on failure", example = "DEGENERATE_SAMPLE")
        String errorCode,

        @Schema(description = "Error message on failure")
        String errorMessage
) {
    static BatchEntryDTO from(BatchAnalysisService.BatchEntry entry) {
        return new BatchEntryDTO(
                entry.label(),
                entry.succeeded(),
                entry.succeeded() ? AnalysisReportDTO.from(entry.report()) : null,
                entry.errorCode(),
                entry.errorMessage()
        );
    }
}
