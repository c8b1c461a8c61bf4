/* (C)2026 */
package com.ammann.analytics.dto;

import com.ammann.analytics.service.BatchAnalysisService;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

@Schema(description = "One labelled measurement series inside a batch request")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SampleInputDTO(
        @Schema(description = "Display name of the sample", example = "line-3")
        String label,

        @Schema(description = "Measurements in observation order, at least 5 finite numbers", required = true)
        List<Double> values
) {
    /**
     * Converts to the unvalidated input of the batch service; validation happens per entry.
     */
    public BatchAnalysisService.LabelledValues toLabelledValues() {
        return new BatchAnalysisService.LabelledValues(label, values);
    }
}
