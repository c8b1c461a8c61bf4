/* (C)2026 */
package com.ammann.analytics.exception;

/**
 * Base unchecked exception for all errors raised by the sample analysis engine.
 *
 * <p>Subclasses represent the fatal error categories (invalid input, degenerate sample) and are
 * mapped to HTTP status codes by {@link GlobalExceptionHandler}. Failures local to a single
 * criterion are never thrown; they are recorded as unavailable results in the report.
 */
public class AnalysisException extends RuntimeException
{
    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    public AnalysisException(String message) {
        super(message);
    }
}
