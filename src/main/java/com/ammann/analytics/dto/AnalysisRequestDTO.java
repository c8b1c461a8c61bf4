/* (C)2026 */
package com.ammann.analytics.dto;

import com.ammann.analytics.enumeration.OutlierMethod;
import com.ammann.analytics.exception.InvalidInputException;
import com.ammann.analytics.model.AnalysisOptions;
import com.ammann.analytics.model.Sample;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Request body for analysing a single sample.
 *
 * <p>The significance level and the outlier method selection are optional; when absent the
 * configured defaults apply.
 */
@Schema(description = "Sample to analyse with optional per-request analysis options")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisRequestDTO(
        @Schema(description = "Display name of the sample", example = "line-3")
        String label,

        @Schema(description = "Measurements in observation order, at least 5 finite numbers", required = true)
        List<Double> values,

        @Schema(description = "Significance level in (0, 0.5), overrides the configured default", example = "0.05")
        Double significanceLevel,

        @Schema(description = "Outlier methods to run (IQR, THREE_SIGMA, GRUBBS, CHARLIER, IRWIN, CHAUVENET, ROMANOVSKY); all when empty")
        List<String> outlierMethods
) {
    public Sample toSample() {
        return Sample.of(label, values);
    }

    /**
     * Applies the request overrides on top of the given defaults.
     *
     * @throws InvalidInputException if the significance level or a method name is invalid
     */
    public AnalysisOptions toOptions(AnalysisOptions defaults) {
        return applyOverrides(defaults, significanceLevel, outlierMethods);
    }

    static AnalysisOptions applyOverrides(AnalysisOptions defaults, Double significanceLevel,
                                          List<String> outlierMethods) {
        AnalysisOptions options = defaults;
        if (significanceLevel != null) {
            options = options.withSignificanceLevel(significanceLevel);
        }
        if (outlierMethods != null && !outlierMethods.isEmpty()) {
            options = options.withOutlierMethods(parseMethods(outlierMethods));
        }
        return options;
    }

    private static Set<OutlierMethod> parseMethods(List<String> names) {
        Set<OutlierMethod> methods = EnumSet.noneOf(OutlierMethod.class);
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            try {
                methods.add(OutlierMethod.valueOf(name.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw InvalidInputException.invalidParameter("outlierMethods", name,
                        "one of " + EnumSet.allOf(OutlierMethod.class));
            }
        }
        return methods;
    }
}
