/* (C)2026 */
package com.ammann.analytics.exception;

/**
 * Exception indicating that the sample has zero standard deviation, so every
 * standard-deviation dependent quantity (z-scores, coefficient of variation, confidence
 * interval of the standard deviation, all normality and outlier criteria) is undefined.
 *
 * <p>Mapped to HTTP 422 (Unprocessable Entity) by {@link GlobalExceptionHandler}.
 */
public class DegenerateSampleException extends AnalysisException
{
    private final double constantValue;

    public DegenerateSampleException(double constantValue)
    {
        super(String.format("Sample is degenerate: all values equal %s, standard deviation is zero",
                constantValue));
        this.constantValue = constantValue;
    }

    public double getConstantValue()
    {
        return constantValue;
    }
}
