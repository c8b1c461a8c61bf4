/* (C)2026 */
package com.ammann.analytics.dto;

import com.ammann.analytics.enumeration.NormalityCriterion;
import com.ammann.analytics.enumeration.NormalityVerdict;
import com.ammann.analytics.model.NormalityTestResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Outcome of one normality criterion")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NormalityTestResultDTO(
        @Schema(description = "Criterion identifier")
        NormalityCriterion criterion,

        @Schema(description = "Human readable criterion name", example = "Shapiro-Wilk")
        String name,

        @Schema(description = "Test statistic")
        Double statistic,

        @Schema(description = "p-value, for criteria decided by a p-value")
        Double pValue,

        @Schema(description = "Critical value, for criteria decided by a threshold")
        Double criticalValue,

        @Schema(description = "Degrees of freedom (chi-square only)")
        Integer degreesOfFreedom,

        @Schema(description = "Decision")
        NormalityVerdict verdict,

        @Schema(description = "Whether the criterion accepts normality")
        boolean normal,

        @Schema(description = "Why the criterion is inconclusive or unavailable")
        String reason
) {
    static NormalityTestResultDTO from(NormalityTestResult result) {
        return new NormalityTestResultDTO(
                result.criterion(),
                result.criterion().getDisplayName(),
                result.statistic(),
                result.pValue(),
                result.criticalValue(),
                result.degreesOfFreedom(),
                result.verdict(),
                result.isNormal(),
                result.reason()
        );
    }
}
