/* (C)2026 */
package com.ammann.analytics.dto;

import com.ammann.analytics.model.FrequencyTable;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "One interval of a grouped frequency table")
public record FrequencyBinDTO(
        @Schema(description = "Inclusive lower bound")
        double lower,

        @Schema(description = "Upper bound, inclusive only for the last interval")
        double upper,

        @Schema(description = "Interval midpoint")
        double midpoint,

        @Schema(description = "Number of values in the interval")
        int count,

        @Schema(description = "count / n")
        double relativeFrequency,

        @Schema(description = "Relative frequency divided by the interval width")
        double density
) {
    static FrequencyBinDTO from(FrequencyTable.Bin bin) {
        return new FrequencyBinDTO(bin.lower(), bin.upper(), bin.midpoint(), bin.count(),
                bin.relativeFrequency(), bin.density());
    }
}
