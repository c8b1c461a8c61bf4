/* (C)2026 */
package com.ammann.analytics.dto;

import com.ammann.analytics.model.ConfidenceInterval;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Two-sided confidence interval")
public record ConfidenceIntervalDTO(
        @Schema(description = "Lower bound")
        double lower,

        @Schema(description = "Upper bound")
        double upper,

        @Schema(description = "Coverage probability", example = "0.95")
        double confidenceLevel
) {
    static ConfidenceIntervalDTO from(ConfidenceInterval interval) {
        return new ConfidenceIntervalDTO(interval.lower(), interval.upper(), interval.confidenceLevel());
    }
}
