/* (C)2026 */
package com.ammann.analytics.dto;

import com.ammann.analytics.enumeration.OutlierMethod;
import com.ammann.analytics.model.OutlierResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

@Schema(description = "Values flagged by one outlier detection method")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutlierResultDTO(
        @Schema(description = "Method identifier")
        OutlierMethod method,

        @Schema(description = "Human readable method name", example = "Grubbs")
        String name,

        @Schema(description = "Whether the method could be computed")
        boolean available,

        @Schema(description = "Number of flagged values")
        int count,

        @Schema(description = "Zero-based observation indices of the flagged values")
        List<Integer> indices,

        @Schema(description = "Flagged values")
        List<Double> values,

        @Schema(description = "Lower acceptance bound")
        Double lowerBound,

        @Schema(description = "Upper acceptance bound")
        Double upperBound,

        @Schema(description = "Test statistic")
        Double statistic,

        @Schema(description = "Threshold the statistic is compared against")
        Double criticalValue,

        @Schema(description = "Number of values left after removing the flagged ones")
        int retainedCount,

        @Schema(description = "Mean of the values left after removing the flagged ones")
        Double retainedMean,

        @Schema(description = "Why the method is unavailable")
        String reason
) {
    static OutlierResultDTO from(OutlierResult result) {
        return new OutlierResultDTO(
                result.method(),
                result.method().getDisplayName(),
                result.available(),
                result.count(),
                result.indices(),
                result.values(),
                result.lowerBound(),
                result.upperBound(),
                result.statistic(),
                result.criticalValue(),
                result.retainedCount(),
                result.retainedMean(),
                result.reason()
        );
    }
}
