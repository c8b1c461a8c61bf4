/* (C)2026 */
package com.ammann.analytics.dto;

import com.ammann.analytics.model.AnalysisOptions;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

@Schema(description = "Several samples analysed with the same options")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchAnalysisRequestDTO(
        @Schema(description = "Samples to analyse, results keep this order", required = true)
        List<SampleInputDTO> samples,

        @Schema(description = "Significance level in (0, 0.5) applied to every sample", example = "0.05")
        Double significanceLevel,

        @Schema(description = "Outlier methods to run for every sample; all when empty")
        List<String> outlierMethods
) {
    public AnalysisOptions toOptions(AnalysisOptions defaults) {
        return AnalysisRequestDTO.applyOverrides(defaults, significanceLevel, outlierMethods);
    }
}
