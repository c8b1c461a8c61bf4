/* (C)2026 */
package com.ammann.analytics.dto;

import com.ammann.analytics.enumeration.OutlierMethod;
import com.ammann.analytics.model.AnalysisReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * JSON view of an {@link AnalysisReport}.
 *
 * <p>Normality and outlier results are rendered as lists in criterion and method declaration
 * order, which keeps the output stable across runs.
 */
@Schema(description = "Complete analysis of one sample: statistics, frequency table, normality and outlier results")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisReportDTO(
        @Schema(description = "Display name of the sample")
        String label,

        @Schema(description = "Sample size")
        int n,

        @Schema(description = "Measurements in observation order")
        double[] values,

        @Schema(description = "Significance level used for the analysis", example = "0.05")
        double significanceLevel,

        @Schema(description = "Outlier methods that were requested")
        List<OutlierMethod> outlierMethods,

        @Schema(description = "Descriptive statistics")
        DescriptiveStatisticsDTO statistics,

        @Schema(description = "Grouped frequency table")
        FrequencyTableDTO frequencyTable,

        @Schema(description = "Normality criteria results")
        List<NormalityTestResultDTO> normality,

        @Schema(description = "Outlier method results")
        List<OutlierResultDTO> outliers,

        @Schema(description = "Number of criteria accepting normality")
        long normalVerdicts,

        @Schema(description = "Number of outlier methods that flagged at least one value")
        long outlierMethodsFlagging
) {
    public static AnalysisReportDTO from(AnalysisReport report) {
        return new AnalysisReportDTO(
                report.label(),
                report.sample().size(),
                report.sample().values(),
                report.options().significanceLevel(),
                report.options().outlierMethods().stream().sorted().toList(),
                DescriptiveStatisticsDTO.from(report.statistics()),
                FrequencyTableDTO.from(report.frequencyTable()),
                report.normalityResults().values().stream().map(NormalityTestResultDTO::from).toList(),
                report.outlierResults().values().stream().map(OutlierResultDTO::from).toList(),
                report.normalVerdictCount(),
                report.methodsFlaggingOutliers()
        );
    }
}
