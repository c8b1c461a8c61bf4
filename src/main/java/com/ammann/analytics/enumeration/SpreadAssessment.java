/* (C)2026 */
package com.ammann.analytics.enumeration;

/**
 * Classification of the range-to-standard-deviation ratio R/S of a sample.
 *
 * <p>For roughly normal samples of moderate size R/S falls between 4 and 6. Smaller ratios
 * indicate a compressed sample, larger ones a stretched sample with heavy tails or outliers.
 */
public enum SpreadAssessment
{
    /** R/S below 4. */
    COMPRESSED,
    /** R/S between 4 and 6 inclusive. */
    NORMAL,
    /** R/S above 6. */
    STRETCHED;

    /**
     * Returns the assessment for the given ratio.
     *
     * @param rangeToStdRatio sample range divided by the sample standard deviation
     * @return the matching assessment
     */
    public static SpreadAssessment fromRatio(double rangeToStdRatio) {
        if (rangeToStdRatio < 4.0) return COMPRESSED;
        if (rangeToStdRatio <= 6.0) return NORMAL;
        return STRETCHED;
    }
}
