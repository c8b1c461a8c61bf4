/* (C)2026 */
package com.ammann.analytics.service;

import com.ammann.analytics.enumeration.NormalityCriterion;
import com.ammann.analytics.enumeration.NormalityVerdict;
import com.ammann.analytics.math.CriticalValues;
import com.ammann.analytics.math.HistogramBinning;
import com.ammann.analytics.math.ShapiroWilk;
import com.ammann.analytics.model.DescriptiveStatistics;
import com.ammann.analytics.model.NormalityTestResult;
import com.ammann.analytics.model.Sample;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Service for testing a sample against the normal distribution fitted by its mean and
 * sample standard deviation.
 *
 * <p>Implements five criteria:
 * <ul>
 *   <li>Shapiro-Wilk W (Royston approximation)</li>
 *   <li>Romanovsky skewness heuristic, only for samples of at most 50 values</li>
 *   <li>Pearson chi-square goodness of fit over Sturges bins with small-bin merging</li>
 *   <li>One-sample Kolmogorov-Smirnov</li>
 *   <li>Smirnov maximum deviation against a size-dependent critical table</li>
 * </ul>
 *
 * <p>Every criterion runs independently. A numerical failure in one criterion is recorded as
 * an unavailable result and the remaining criteria still run.
 */
@ApplicationScoped
public class NormalityTestService
{
    private static final Logger LOG = Logger.getLogger(NormalityTestService.class);

    /**
     * Runs all applicable criteria.
     *
     * @param sample validated sample
     * @param stats  statistics of the same sample; its significance level drives the decisions
     * @return results keyed by criterion, in declaration order
     */
    public Map<NormalityCriterion, NormalityTestResult> testAll(Sample sample, DescriptiveStatistics stats)
    {
        Map<NormalityCriterion, NormalityTestResult> results = new EnumMap<>(NormalityCriterion.class);

        results.put(NormalityCriterion.SHAPIRO_WILK,
                guarded(NormalityCriterion.SHAPIRO_WILK, () -> shapiroWilk(sample, stats)));
        if (sample.size() <= CriticalValues.ROMANOVSKY_MAX_SAMPLE_SIZE) {
            results.put(NormalityCriterion.ROMANOVSKY,
                    guarded(NormalityCriterion.ROMANOVSKY, () -> romanovsky(sample, stats)));
        }
        results.put(NormalityCriterion.PEARSON_CHI_SQUARE,
                guarded(NormalityCriterion.PEARSON_CHI_SQUARE, () -> chiSquare(sample, stats)));
        results.put(NormalityCriterion.KOLMOGOROV_SMIRNOV,
                guarded(NormalityCriterion.KOLMOGOROV_SMIRNOV, () -> kolmogorovSmirnov(sample, stats)));
        results.put(NormalityCriterion.SMIRNOV,
                guarded(NormalityCriterion.SMIRNOV, () -> smirnov(sample, stats)));

        LOG.debugf("Normality tests for '%s' (n=%d): %s", sample.label(), sample.size(), results.values());
        return results;
    }

    /**
     * Shapiro-Wilk W; normal iff p exceeds the significance level.
     */
    public NormalityTestResult shapiroWilk(Sample sample, DescriptiveStatistics stats)
    {
        if (sample.size() > ShapiroWilk.MAX_SIZE) {
            return NormalityTestResult.unavailable(NormalityCriterion.SHAPIRO_WILK,
                    String.format("Shapiro-Wilk supports at most %d values", ShapiroWilk.MAX_SIZE));
        }
        ShapiroWilk.Result result = ShapiroWilk.test(sample.sorted());
        return NormalityTestResult.fromPValue(NormalityCriterion.SHAPIRO_WILK,
                result.w(), result.pValue(), stats.significanceLevel());
    }

    /**
     * Romanovsky heuristic {@code |g1| / sqrt(6 / n)}; normal iff below 3.
     */
    public NormalityTestResult romanovsky(Sample sample, DescriptiveStatistics stats)
    {
        int n = sample.size();
        double statistic = Math.abs(stats.skewness()) / Math.sqrt(6.0 / n);
        return NormalityTestResult.fromCriticalValue(NormalityCriterion.ROMANOVSKY, statistic,
                CriticalValues.ROMANOVSKY_NORMALITY_CRITICAL,
                statistic < CriticalValues.ROMANOVSKY_NORMALITY_CRITICAL);
    }

    /**
     * Pearson chi-square goodness of fit.
     *
     * <p>Observed counts come from equal-width bins over the sample range, expected counts from
     * the fitted normal CDF at the bin edges. Bins with an expected count below 5 are merged into
     * a neighbour until all reach 5 or only two bins remain. Degrees of freedom are the bin count
     * minus 3; with none left the result is inconclusive.
     */
    public NormalityTestResult chiSquare(Sample sample, DescriptiveStatistics stats)
    {
        int n = sample.size();
        int k = HistogramBinning.clampedSturgesBinCount(n);
        double[] edges = HistogramBinning.edges(stats.min(), stats.max(), k);
        int[] counts = HistogramBinning.counts(sample.sorted(), edges);

        NormalDistribution fitted = new NormalDistribution(stats.mean(), stats.sampleStd());
        List<Double> expected = new ArrayList<>(k);
        List<Double> observed = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            double p = fitted.cumulativeProbability(edges[i + 1]) - fitted.cumulativeProbability(edges[i]);
            expected.add(n * p);
            observed.add((double) counts[i]);
        }

        mergeSmallBins(expected, observed);

        if (expected.size() < 3) {
            return NormalityTestResult.unavailable(NormalityCriterion.PEARSON_CHI_SQUARE,
                    String.format("Bin merging left %d bins, at least 3 are required", expected.size()));
        }

        double statistic = 0.0;
        for (int i = 0; i < expected.size(); i++) {
            double e = expected.get(i);
            if (!(e > 0.0)) {
                return NormalityTestResult.unavailable(NormalityCriterion.PEARSON_CHI_SQUARE,
                        "Expected frequency of a merged bin is zero");
            }
            double d = observed.get(i) - e;
            statistic += d * d / e;
        }

        int df = expected.size() - 3;
        if (df <= 0) {
            return new NormalityTestResult(NormalityCriterion.PEARSON_CHI_SQUARE, statistic, 0.0,
                    null, df, NormalityVerdict.INCONCLUSIVE,
                    String.format("No degrees of freedom left after merging into %d bins", expected.size()));
        }

        double pValue = 1.0 - new ChiSquaredDistribution(df).cumulativeProbability(statistic);
        NormalityVerdict verdict = pValue > stats.significanceLevel()
                ? NormalityVerdict.NORMAL
                : NormalityVerdict.NOT_NORMAL;
        return new NormalityTestResult(NormalityCriterion.PEARSON_CHI_SQUARE, statistic, pValue,
                null, df, verdict, null);
    }

    /**
     * One-sample Kolmogorov-Smirnov test against the fitted normal distribution.
     */
    public NormalityTestResult kolmogorovSmirnov(Sample sample, DescriptiveStatistics stats)
    {
        NormalDistribution fitted = new NormalDistribution(stats.mean(), stats.sampleStd());
        KolmogorovSmirnovTest test = new KolmogorovSmirnovTest();
        double[] values = sample.values();

        double statistic = test.kolmogorovSmirnovStatistic(fitted, values);
        double pValue = test.kolmogorovSmirnovTest(fitted, values);
        return NormalityTestResult.fromPValue(NormalityCriterion.KOLMOGOROV_SMIRNOV,
                statistic, pValue, stats.significanceLevel());
    }

    /**
     * Smirnov maximum deviation between the empirical CDF of the standardised sample and the
     * standard normal CDF, taken on both sides of every step.
     */
    public NormalityTestResult smirnov(Sample sample, DescriptiveStatistics stats)
    {
        double[] sorted = sample.sorted();
        int n = sorted.length;
        NormalDistribution standardNormal = new NormalDistribution(0.0, 1.0);

        double d = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            double z = (sorted[i] - stats.mean()) / stats.sampleStd();
            double theoretical = standardNormal.cumulativeProbability(z);
            double dPlus = (double) (i + 1) / n - theoretical;
            double dMinus = theoretical - (double) i / n;
            d = Math.max(d, Math.max(dPlus, dMinus));
        }

        double critical = CriticalValues.smirnov(n, stats.significanceLevel());
        return NormalityTestResult.fromCriticalValue(NormalityCriterion.SMIRNOV, d, critical, d <= critical);
    }

    /**
     * Folds the bin with the smallest expected count into a neighbour while any expected count
     * is below the minimum and more than two bins remain. Edge bins fold inwards, interior bins
     * into their left neighbour.
     */
    static void mergeSmallBins(List<Double> expected, List<Double> observed)
    {
        while (expected.size() > 2 && minimum(expected) < CriticalValues.CHI_SQUARE_MIN_EXPECTED) {
            int idx = indexOfMinimum(expected);
            int target = idx == 0 ? 1 : idx - 1;
            expected.set(target, expected.get(target) + expected.get(idx));
            observed.set(target, observed.get(target) + observed.get(idx));
            expected.remove(idx);
            observed.remove(idx);
        }
    }

    private static double minimum(List<Double> values)
    {
        return values.get(indexOfMinimum(values));
    }

    private static int indexOfMinimum(List<Double> values)
    {
        int idx = 0;
        for (int i = 1; i < values.size(); i++) {
            if (values.get(i) < values.get(idx)) {
                idx = i;
            }
        }
        return idx;
    }

    private static boolean isFiniteOrAbsent(Double value)
    {
        return value == null || Double.isFinite(value);
    }

    private NormalityTestResult guarded(NormalityCriterion criterion, Supplier<NormalityTestResult> test)
    {
        try {
            NormalityTestResult result = test.get();
            if (!isFiniteOrAbsent(result.statistic()) || !isFiniteOrAbsent(result.pValue())) {
                LOG.warnf("Normality criterion %s unavailable: non-finite statistic %s",
                        criterion.getDisplayName(), result.statistic());
                return NormalityTestResult.unavailable(criterion, "Test statistic is not a finite number");
            }
            return result;
        } catch (RuntimeException e) {
            LOG.warnf("Normality criterion %s unavailable: %s", criterion.getDisplayName(), e.getMessage());
            return NormalityTestResult.unavailable(criterion, e.getMessage());
        }
    }
}
