/* (C)2026 */
package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.OutlierMethod;
import com.ammann.analytics.exception.InvalidInputException;
import com.ammann.analytics.math.CriticalValues;

import java.util.EnumSet;
import java.util.Set;

/**
 * Tunable parameters of one analysis run.
 *
 * @param significanceLevel alpha for confidence intervals, p-value decisions and Grubbs
 * @param outlierMethods    outlier methods to run, never empty
 * @param iqrMultiplier     fence multiplier of the IQR method
 * @param irwinCritical     critical gap ratio of the Irwin method
 */
public record AnalysisOptions(
        double significanceLevel,
        Set<OutlierMethod> outlierMethods,
        double iqrMultiplier,
        double irwinCritical
)
{
    public static final double DEFAULT_IQR_MULTIPLIER = 1.5;

    public AnalysisOptions
    {
        DescriptiveStatistics.validateSignificanceLevel(significanceLevel);
        if (outlierMethods == null || outlierMethods.isEmpty()) {
            outlierMethods = EnumSet.allOf(OutlierMethod.class);
        }
        outlierMethods = Set.copyOf(outlierMethods);
        if (!(iqrMultiplier > 0.0) || Double.isInfinite(iqrMultiplier)) {
            throw InvalidInputException.invalidParameter("iqrMultiplier", iqrMultiplier, "a positive finite value");
        }
        if (!(irwinCritical > 0.0) || Double.isInfinite(irwinCritical)) {
            throw InvalidInputException.invalidParameter("irwinCritical", irwinCritical, "a positive finite value");
        }
    }

    /** Alpha 0.05, every outlier method, standard IQR fences and Irwin threshold. */
    public static AnalysisOptions defaults()
    {
        return new AnalysisOptions(DescriptiveStatistics.DEFAULT_SIGNIFICANCE_LEVEL,
                EnumSet.allOf(OutlierMethod.class), DEFAULT_IQR_MULTIPLIER,
                CriticalValues.DEFAULT_IRWIN_CRITICAL);
    }

    public AnalysisOptions withSignificanceLevel(double alpha)
    {
        return new AnalysisOptions(alpha, outlierMethods, iqrMultiplier, irwinCritical);
    }

    public AnalysisOptions withOutlierMethods(Set<OutlierMethod> methods)
    {
        return new AnalysisOptions(significanceLevel, methods, iqrMultiplier, irwinCritical);
    }

    public AnalysisOptions withIqrMultiplier(double multiplier)
    {
        return new AnalysisOptions(significanceLevel, outlierMethods, multiplier, irwinCritical);
    }
}
