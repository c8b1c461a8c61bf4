/* (C)2026 */
package com.ammann.analytics.exception;

/**
 * Exception indicating that a sample or an analysis option cannot be analysed at all:
 * fewer than the minimum number of values, non-finite values, or an out-of-range parameter.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 * Provides factory methods for common validation failure patterns.
 */
public class InvalidInputException extends AnalysisException {

    public InvalidInputException(String message) {
        super(message, null);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates an exception for a sample that is too small.
     */
    public static InvalidInputException insufficientData(int required, int actual) {
        return new InvalidInputException(
                String.format("Insufficient sample size: need at least %d values, but got %d",
                        required, actual));
    }

    /**
     * Creates an exception for a NaN or infinite value at the given position.
     */
    public static InvalidInputException nonFinite(int index, double value) {
        return new InvalidInputException(
                String.format("Sample value at index %d is not finite: %s", index, value));
    }

    /**
     * Creates an exception for a statistic that overflows the double range.
     */
    public static InvalidInputException outOfRange(String quantity, double value) {
        return new InvalidInputException(
                String.format("Sample values are out of numeric range: %s evaluates to %s",
                        quantity, value));
    }

    /**
     * Creates an exception for an invalid parameter.
     */
    public static InvalidInputException invalidParameter(String paramName, Object value, String expected) {
        return new InvalidInputException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
