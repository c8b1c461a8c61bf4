/* (C)2026 */
package com.ammann.analytics.dto;

import com.ammann.analytics.enumeration.SpreadAssessment;
import com.ammann.analytics.model.DescriptiveStatistics;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Descriptive statistics of one sample.
 *
 * <p>The harmonic and geometric means, the mean ordering check and the mode are omitted when
 * they are undefined for the sample.
 */
@Schema(description = "Central tendency, dispersion, shape and confidence intervals of a sample")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DescriptiveStatisticsDTO(
        @Schema(description = "Sample size")
        int n,

        @Schema(description = "Sum of all values")
        double sum,

        @Schema(description = "Arithmetic mean")
        double mean,

        @Schema(description = "Median (50th percentile)")
        double median,

        @Schema(description = "Most frequent value, omitted when no value repeats")
        Double mode,

        @Schema(description = "Standard deviation with n - 1 denominator")
        double sampleStd,

        @Schema(description = "Standard deviation with n denominator")
        double populationStd,

        @Schema(description = "Variance with n - 1 denominator")
        double sampleVariance,

        @Schema(description = "Variance with n denominator")
        double populationVariance,

        @Schema(description = "Smallest value")
        double min,

        @Schema(description = "Largest value")
        double max,

        @Schema(description = "max - min")
        double range,

        @Schema(description = "25th percentile, linear interpolation")
        double q1,

        @Schema(description = "75th percentile, linear interpolation")
        double q3,

        @Schema(description = "Q3 - Q1")
        double iqr,

        @Schema(description = "Moment skewness g1")
        double skewness,

        @Schema(description = "Excess kurtosis g2, 0 for the normal distribution")
        double excessKurtosis,

        @Schema(description = "Harmonic mean, omitted unless all values are positive")
        Double harmonicMean,

        @Schema(description = "Geometric mean, omitted unless all values are positive")
        Double geometricMean,

        @Schema(description = "Root mean square")
        double quadraticMean,

        @Schema(description = "Cube root of the mean of cubes")
        double cubicMean,

        @Schema(description = "Whether min <= harmonic <= geometric <= arithmetic <= quadratic <= cubic <= max holds")
        Boolean meansOrdered,

        @Schema(description = "Standard error of the mean")
        double standardError,

        @Schema(description = "Coefficient of variation in percent")
        double coefficientOfVariation,

        @Schema(description = "Range divided by the sample standard deviation")
        double rangeToStdRatio,

        @Schema(description = "Classification of the range to standard deviation ratio")
        SpreadAssessment spreadAssessment,

        @Schema(description = "Confidence interval for the mean (Student t)")
        ConfidenceIntervalDTO meanInterval,

        @Schema(description = "Confidence interval for the standard deviation (chi-square)")
        ConfidenceIntervalDTO stdInterval
) {
    static DescriptiveStatisticsDTO from(DescriptiveStatistics stats) {
        return new DescriptiveStatisticsDTO(
                stats.n(),
                stats.sum(),
                stats.mean(),
                stats.median(),
                stats.mode(),
                stats.sampleStd(),
                stats.populationStd(),
                stats.sampleVariance(),
                stats.populationVariance(),
                stats.min(),
                stats.max(),
                stats.range(),
                stats.q1(),
                stats.q3(),
                stats.iqr(),
                stats.skewness(),
                stats.excessKurtosis(),
                stats.harmonicMean(),
                stats.geometricMean(),
                stats.quadraticMean(),
                stats.cubicMean(),
                stats.meansOrdered(),
                stats.standardError(),
                stats.coefficientOfVariation(),
                stats.rangeToStdRatio(),
                stats.spreadAssessment(),
                ConfidenceIntervalDTO.from(stats.meanInterval()),
                ConfidenceIntervalDTO.from(stats.stdInterval())
        );
    }
}
