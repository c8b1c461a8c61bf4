/* (C)2026 */
package com.ammann.analytics.model;

import com.ammann.analytics.math.HistogramBinning;

import java.util.ArrayList;
import java.util.List;

/**
 * Grouped frequency table of a sample using Sturges' rule.
 *
 * <p>The sample range is split into {@code k = ceil(1 + 3.322 log10 n)} intervals of equal
 * width. Intervals are half-open except the last one, which also holds the maximum.
 *
 * @param binCount number of intervals
 * @param width    interval width h
 * @param bins     intervals in ascending order
 */
public record FrequencyTable(int binCount, double width, List<Bin> bins)
{
    public FrequencyTable
    {
        bins = List.copyOf(bins);
    }

    /**
     * One interval of the table.
     *
     * @param lower             inclusive lower bound
     * @param upper             upper bound, exclusive except for the last interval
     * @param midpoint          (lower + upper) / 2
     * @param count             number of values in the interval
     * @param relativeFrequency count / n
     * @param density           relativeFrequency / width
     */
    public record Bin(double lower, double upper, double midpoint, int count,
                      double relativeFrequency, double density)
    {
    }

    /**
     * Builds the table for a sample with a non-zero range.
     */
    public static FrequencyTable of(Sample sample)
    {
        int n = sample.size();
        int k = HistogramBinning.sturgesBinCount(n);
        double[] edges = HistogramBinning.edges(sample.min(), sample.max(), k);
        int[] counts = HistogramBinning.counts(sample.sorted(), edges);
        double width = (sample.max() - sample.min()) / k;

        List<Bin> bins = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            double relativeFrequency = (double) counts[i] / n;
            bins.add(new Bin(edges[i], edges[i + 1], (edges[i] + edges[i + 1]) / 2.0,
                    counts[i], relativeFrequency, relativeFrequency / width));
        }
        return new FrequencyTable(k, width, bins);
    }

    /** Sum of all interval counts; equals the sample size. */
    public int totalCount()
    {
        return bins.stream().mapToInt(Bin::count).sum();
    }
}
