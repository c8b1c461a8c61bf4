/* (C)2026 */
package com.ammann.analytics.math;

import org.apache.commons.math3.distribution.TDistribution;

/**
 * Critical values and thresholds of the normality and outlier criteria.
 *
 * <p>The Smirnov table and the Irwin threshold are approximations tabulated for
 * {@code alpha = 0.05}. The Irwin value is accurate near {@code n = 50} only and is therefore
 * configurable.
 */
public final class CriticalValues
{
    /** Threshold of the skewness-based Romanovsky normality statistic. */
    public static final double ROMANOVSKY_NORMALITY_CRITICAL = 3.0;

    /** Largest sample size for which the Romanovsky normality criterion is evaluated. */
    public static final int ROMANOVSKY_MAX_SAMPLE_SIZE = 50;

    /** Default critical gap ratio of the Irwin criterion. */
    public static final double DEFAULT_IRWIN_CRITICAL = 1.7;

    /** |z| above which a point counts for the Charlier and three-sigma criteria. */
    public static final double SIGMA_LIMIT = 3.0;

    /** Chauvenet rejects a point when fewer than this many equally extreme points are expected. */
    public static final double CHAUVENET_EXPECTED_COUNT = 0.5;

    /** Minimum expected frequency per bin in the chi-square test. */
    public static final double CHI_SQUARE_MIN_EXPECTED = 5.0;

    private static final double TABLE_ALPHA = 0.05;

    private CriticalValues() {}

    /**
     * Critical maximum deviation of the Smirnov criterion.
     *
     * <p>At {@code alpha = 0.05}: 0.294 up to n = 20, 0.242 up to 30, 0.210 up to 40 and
     * {@code 1.36 / sqrt(n)} above. Other levels use the asymptotic
     * {@code sqrt(-ln(alpha / 2) / 2) / sqrt(n)}.
     */
    public static double smirnov(int n, double alpha)
    {
        if (Math.abs(alpha - TABLE_ALPHA) < 1e-12) {
            if (n <= 20) return 0.294;
            if (n <= 30) return 0.242;
            if (n <= 40) return 0.210;
            return 1.36 / Math.sqrt(n);
        }
        return Math.sqrt(-0.5 * Math.log(alpha / 2.0)) / Math.sqrt(n);
    }

    /**
     * Two-sided Grubbs critical value
     * {@code (n - 1) t / sqrt(n (n - 2 + t^2))} with {@code t = t(1 - alpha / (2n), n - 2)}.
     */
    public static double grubbs(int n, double alpha)
    {
        if (n < 3) {
            throw new IllegalArgumentException("Grubbs test needs at least 3 values, got " + n);
        }
        double t = new TDistribution(n - 2).inverseCumulativeProbability(1.0 - alpha / (2.0 * n));
        return ((n - 1) * t) / Math.sqrt(n * (n - 2 + t * t));
    }

    /**
     * Threshold for the distance of a sample extreme from the mean, in standard deviations:
     * 2 below 10 values, 2.5 below 20, 3 otherwise.
     */
    public static double romanovskyExtreme(int n)
    {
        if (n < 10) return 2.0;
        if (n < 20) return 2.5;
        return 3.0;
    }
}
