/* (C)2026 */
package com.ammann.analytics.model;

/**
 * Two-sided confidence interval.
 *
 * @param lower           lower bound
 * @param upper           upper bound
 * @param confidenceLevel coverage probability, e.g. 0.95
 */
public record ConfidenceInterval(double lower, double upper, double confidenceLevel)
{
    public ConfidenceInterval
    {
        if (!(lower <= upper)) {
            throw new IllegalArgumentException(
                    String.format("Lower bound %s exceeds upper bound %s", lower, upper));
        }
    }

    public boolean contains(double value)
    {
        return value >= lower && value <= upper;
    }

    public double width()
    {
        return upper - lower;
    }
}
