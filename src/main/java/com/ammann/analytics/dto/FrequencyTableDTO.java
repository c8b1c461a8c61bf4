/* (C)2026 */
package com.ammann.analytics.dto;

import com.ammann.analytics.model.FrequencyTable;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

@Schema(description = "Grouped frequency table with Sturges' number of equal-width intervals")
public record FrequencyTableDTO(
        @Schema(description = "Number of intervals")
        int binCount,

        @Schema(description = "Interval width")
        double width,

        @Schema(description = "Intervals in ascending order")
        List<FrequencyBinDTO> bins
) {
    static FrequencyTableDTO from(FrequencyTable table) {
        return new FrequencyTableDTO(
                table.binCount(),
                table.width(),
                table.bins().stream().map(FrequencyBinDTO::from).toList()
        );
    }
}
