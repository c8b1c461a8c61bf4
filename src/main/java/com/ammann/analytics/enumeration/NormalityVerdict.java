/* (C)2026 */
package com.ammann.analytics.enumeration;

/**
 * Outcome of a single normality criterion.
 */
public enum NormalityVerdict
{
    /** The criterion does not reject normality at the configured significance level. */
    NORMAL,
    /** The criterion rejects normality. */
    NOT_NORMAL,
    /** The criterion was computed but has no degrees of freedom left to decide; counted as not normal. */
    INCONCLUSIVE,
    /** The criterion could not be computed for this sample. */
    UNAVAILABLE;

    public boolean isNormal() {
        return this == NORMAL;
    }
}
