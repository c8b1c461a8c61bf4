/* (C)2026 */
package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.OutlierMethod;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one outlier detection method.
 *
 * <p>Indices refer to the original observation order of the sample. Bounds, statistic and
 * critical value are {@code null} for methods that do not use them. The retained figures
 * describe the sample after dropping the flagged values.
 *
 * @param method        the method
 * @param indices       observation indices of the flagged values, ascending
 * @param values        flagged values, in the order of {@code indices}
 * @param lowerBound    lower acceptance bound
 * @param upperBound    upper acceptance bound
 * @param statistic     test statistic (largest |z|, largest gap ratio, ...)
 * @param criticalValue threshold the statistic is compared against
 * @param retainedCount number of values not flagged
 * @param retainedMean  mean of the values not flagged, {@code null} if none remain
 * @param available     {@code false} if the method could not be computed
 * @param reason        explanation for unavailable results
 */
public record OutlierResult(
        OutlierMethod method,
        List<Integer> indices,
        List<Double> values,
        Double lowerBound,
        Double upperBound,
        Double statistic,
        Double criticalValue,
        int retainedCount,
        Double retainedMean,
        boolean available,
        String reason
)
{
    public OutlierResult
    {
        Objects.requireNonNull(method, "method");
        indices = List.copyOf(indices);
        values = List.copyOf(values);
    }

    /**
     * Builds a result for the flagged indices of the sample.
     */
    public static OutlierResult of(OutlierMethod method, Sample sample, List<Integer> flagged,
                                   Double lowerBound, Double upperBound,
                                   Double statistic, Double criticalValue)
    {
        List<Integer> indices = flagged.stream().sorted().distinct().toList();
        List<Double> values = indices.stream().map(sample::get).toList();

        double retainedSum = 0.0;
        int retainedCount = 0;
        for (int i = 0; i < sample.size(); i++) {
            if (!indices.contains(i)) {
                retainedSum += sample.get(i);
                retainedCount++;
            }
        }
        Double retainedMean = retainedCount > 0 ? retainedSum / retainedCount : null;

        return new OutlierResult(method, indices, values, lowerBound, upperBound, statistic,
                criticalValue, retainedCount, retainedMean, true, null);
    }

    /**
     * Result of a method that could not be computed for the sample.
     */
    public static OutlierResult unavailable(OutlierMethod method, int sampleSize, String reason)
    {
        return new OutlierResult(method, List.of(), List.of(), null, null, null, null,
                sampleSize, null, false, reason);
    }

    public int count()
    {
        return indices.size();
    }

    public boolean hasOutliers()
    {
        return !indices.isEmpty();
    }
}
