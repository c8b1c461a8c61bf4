/* (C)2026 */
package com.ammann.analytics.math;

/**
 * Equal-width histogram binning shared by the frequency table and the chi-square test.
 */
public final class HistogramBinning
{
    /** Smallest bin count used by the chi-square test. */
    public static final int MIN_TEST_BINS = 5;

    /** Largest bin count used by the chi-square test. */
    public static final int MAX_TEST_BINS = 20;

    private HistogramBinning() {}

    /**
     * Sturges' rule {@code ceil(1 + 3.322 log10 n)}.
     */
    public static int sturgesBinCount(int n)
    {
        if (n < 1) {
            throw new IllegalArgumentException("Sample size must be positive, got " + n);
        }
        return (int) Math.ceil(1.0 + 3.322 * Math.log10(n));
    }

    /**
     * Sturges' rule clamped to [{@value #MIN_TEST_BINS}, {@value #MAX_TEST_BINS}].
     */
    public static int clampedSturgesBinCount(int n)
    {
        return Math.max(MIN_TEST_BINS, Math.min(sturgesBinCount(n), MAX_TEST_BINS));
    }

    /**
     * Returns {@code k + 1} equally spaced edges from {@code min} to {@code max}. The last edge
     * is exactly {@code max}.
     */
    public static double[] edges(double min, double max, int k)
    {
        if (k < 1) {
            throw new IllegalArgumentException("Bin count must be positive, got " + k);
        }
        if (!(max > min)) {
            throw new IllegalArgumentException(
                    String.format("Cannot bin a zero or negative range [%s, %s]", min, max));
        }
        double step = (max - min) / k;
        double[] edges = new double[k + 1];
        for (int i = 0; i < k; i++) {
            edges[i] = min + i * step;
        }
        edges[k] = max;
        return edges;
    }

    /**
     * Counts values per bin. Bins are {@code [edge_i, edge_i+1)} except the last, which is closed.
     * Values outside {@code [edges[0], edges[k]]} are ignored.
     */
    public static int[] counts(double[] values, double[] edges)
    {
        int k = edges.length - 1;
        double min = edges[0];
        double max = edges[k];
        double step = (max - min) / k;
        int[] counts = new int[k];

        for (double x : values) {
            if (x < min || x > max) {
                continue;
            }
            int index = (int) ((x - min) / step);
            if (index >= k) {
                index = k - 1;
            }
            // Correct rounding at interior edges
            if (x < edges[index]) {
                index--;
            } else if (index < k - 1 && x >= edges[index + 1]) {
                index++;
            }
            counts[index]++;
        }
        return counts;
    }
}
