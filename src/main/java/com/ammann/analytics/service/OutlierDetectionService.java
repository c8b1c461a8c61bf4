/* (C)2026 */
package com.ammann.analytics.service;

import com.ammann.analytics.enumeration.OutlierMethod;
import com.ammann.analytics.math.CriticalValues;
import com.ammann.analytics.model.AnalysisOptions;
import com.ammann.analytics.model.DescriptiveStatistics;
import com.ammann.analytics.model.OutlierResult;
import com.ammann.analytics.model.Sample;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Service for flagging anomalous values of a sample.
 *
 * <p>All z-score based methods share the z-score vector computed once by
 * {@link DescriptiveStatistics}. Each method runs independently; a failure in one method is
 * recorded as an unavailable result for that method only.
 */
@ApplicationScoped
public class OutlierDetectionService
{
    private static final Logger LOG = Logger.getLogger(OutlierDetectionService.class);

    /**
     * Runs every method with default options.
     */
    public Map<OutlierMethod, OutlierResult> detectAll(Sample sample, DescriptiveStatistics stats)
    {
        return detect(sample, stats, AnalysisOptions.defaults().withSignificanceLevel(stats.significanceLevel()));
    }

    /**
     * Runs the methods selected in the options.
     *
     * @param sample  validated sample
     * @param stats   statistics of the same sample
     * @param options method selection and thresholds; Grubbs uses its significance level
     * @return results keyed by method, in declaration order
     */
    public Map<OutlierMethod, OutlierResult> detect(Sample sample, DescriptiveStatistics stats,
                                                    AnalysisOptions options)
    {
        double[] z = stats.zScoreArray();
        Set<OutlierMethod> methods = options.outlierMethods();
        Map<OutlierMethod, OutlierResult> results = new EnumMap<>(OutlierMethod.class);

        for (OutlierMethod method : OutlierMethod.values()) {
            if (!methods.contains(method)) {
                continue;
            }
            try {
                results.put(method, run(method, sample, stats, z, options));
            } catch (RuntimeException e) {
                LOG.warnf("Outlier method %s unavailable: %s", method.getDisplayName(), e.getMessage());
                results.put(method, OutlierResult.unavailable(method, sample.size(), e.getMessage()));
            }
        }

        LOG.debugf("Outlier detection for '%s' (n=%d): %d of %d methods flagged values",
                sample.label(), sample.size(),
                results.values().stream().filter(OutlierResult::hasOutliers).count(), results.size());
        return results;
    }

    private OutlierResult run(OutlierMethod method, Sample sample, DescriptiveStatistics stats,
                              double[] z, AnalysisOptions options)
    {
        return switch (method) {
            case IQR -> iqr(sample, stats, options.iqrMultiplier());
            case THREE_SIGMA -> threeSigma(sample, stats);
            case GRUBBS -> grubbs(sample, z, options.significanceLevel());
            case CHARLIER -> charlier(sample, z);
            case IRWIN -> irwin(sample, stats, options.irwinCritical());
            case CHAUVENET -> chauvenet(sample, z);
            case ROMANOVSKY -> romanovsky(sample, stats);
        };
    }

    /**
     * Tukey fences {@code Q1 - m IQR} and {@code Q3 + m IQR}, using the quartiles of the
     * descriptive statistics.
     */
    public OutlierResult iqr(Sample sample, DescriptiveStatistics stats, double multiplier)
    {
        double iqr = stats.iqr();
        double lower = stats.q1() - multiplier * iqr;
        double upper = stats.q3() + multiplier * iqr;
        return OutlierResult.of(OutlierMethod.IQR, sample, outside(sample, lower, upper),
                lower, upper, null, null);
    }

    /**
     * Wright's criterion: values outside {@code mean +/- 3 s}.
     */
    public OutlierResult threeSigma(Sample sample, DescriptiveStatistics stats)
    {
        double lower = stats.mean() - CriticalValues.SIGMA_LIMIT * stats.sampleStd();
        double upper = stats.mean() + CriticalValues.SIGMA_LIMIT * stats.sampleStd();
        return OutlierResult.of(OutlierMethod.THREE_SIGMA, sample, outside(sample, lower, upper),
                lower, upper, null, null);
    }

    /**
     * Grubbs test for a single outlier. Flags at most the one point with the largest |z|, and
     * only when that exceeds the critical value.
     */
    public OutlierResult grubbs(Sample sample, double[] z, double alpha)
    {
        int n = sample.size();
        int extreme = 0;
        for (int i = 1; i < n; i++) {
            if (Math.abs(z[i]) > Math.abs(z[extreme])) {
                extreme = i;
            }
        }
        double statistic = Math.abs(z[extreme]);
        double critical = CriticalValues.grubbs(n, alpha);

        List<Integer> flagged = statistic > critical ? List.of(extreme) : List.of();
        return OutlierResult.of(OutlierMethod.GRUBBS, sample, flagged, null, null, statistic, critical);
    }

    /**
     * Charlier criterion: every point with {@code |z| > 3}.
     */
    public OutlierResult charlier(Sample sample, double[] z)
    {
        List<Integer> flagged = new ArrayList<>();
        double maxAbsZ = 0.0;
        for (int i = 0; i < z.length; i++) {
            maxAbsZ = Math.max(maxAbsZ, Math.abs(z[i]));
            if (Math.abs(z[i]) > CriticalValues.SIGMA_LIMIT) {
                flagged.add(i);
            }
        }
        return OutlierResult.of(OutlierMethod.CHARLIER, sample, flagged, null, null,
                maxAbsZ, CriticalValues.SIGMA_LIMIT);
    }

    /**
     * Irwin criterion on the widest gap between neighbouring order statistics, scaled by the
     * standard deviation. When the gap exceeds the critical ratio, the point of the pair lying
     * farther from the mean is flagged.
     */
    public OutlierResult irwin(Sample sample, DescriptiveStatistics stats, double critical)
    {
        double[] sorted = sample.sorted();
        int widest = 0;
        double maxLambda = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < sorted.length - 1; i++) {
            double lambda = (sorted[i + 1] - sorted[i]) / stats.sampleStd();
            if (lambda > maxLambda) {
                maxLambda = lambda;
                widest = i;
            }
        }

        List<Integer> flagged = List.of();
        if (maxLambda > critical) {
            double low = sorted[widest];
            double high = sorted[widest + 1];
            double suspect = Math.abs(high - stats.mean()) >= Math.abs(low - stats.mean()) ? high : low;
            flagged = indexOf(sample, suspect);
        }
        return OutlierResult.of(OutlierMethod.IRWIN, sample, flagged, null, null, maxLambda, critical);
    }

    /**
     * Chauvenet criterion: flags points whose two-tailed normal probability times n is below 0.5.
     */
    public OutlierResult chauvenet(Sample sample, double[] z)
    {
        NormalDistribution standardNormal = new NormalDistribution(0.0, 1.0);
        int n = sample.size();
        List<Integer> flagged = new ArrayList<>();
        double minExpected = Double.POSITIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            double tailProbability = 2.0 * (1.0 - standardNormal.cumulativeProbability(Math.abs(z[i])));
            double expectedCount = n * tailProbability;
            minExpected = Math.min(minExpected, expectedCount);
            if (expectedCount < CriticalValues.CHAUVENET_EXPECTED_COUNT) {
                flagged.add(i);
            }
        }
        return OutlierResult.of(OutlierMethod.CHAUVENET, sample, flagged, null, null,
                minExpected, CriticalValues.CHAUVENET_EXPECTED_COUNT);
    }

    /**
     * Romanovsky extreme-value check: {@code |mean - min| / s} and {@code |max - mean| / s}
     * against 2, 2.5 or 3 depending on the sample size. The larger ratio is reported.
     */
    public OutlierResult romanovsky(Sample sample, DescriptiveStatistics stats)
    {
        double betaMin = Math.abs(stats.mean() - stats.min()) / stats.sampleStd();
        double betaMax = Math.abs(stats.max() - stats.mean()) / stats.sampleStd();
        double threshold = CriticalValues.romanovskyExtreme(sample.size());

        List<Integer> flagged = new ArrayList<>();
        if (betaMin > threshold) {
            flagged.addAll(indexOf(sample, stats.min()));
        }
        if (betaMax > threshold) {
            flagged.addAll(indexOf(sample, stats.max()));
        }
        double lower = stats.mean() - threshold * stats.sampleStd();
        double upper = stats.mean() + threshold * stats.sampleStd();
        return OutlierResult.of(OutlierMethod.ROMANOVSKY, sample, flagged, lower, upper,
                Math.max(betaMin, betaMax), threshold);
    }

    private static List<Integer> outside(Sample sample, double lower, double upper)
    {
        List<Integer> flagged = new ArrayList<>();
        for (int i = 0; i < sample.size(); i++) {
            double x = sample.get(i);
            if (x < lower || x > upper) {
                flagged.add(i);
            }
        }
        return flagged;
    }

    /** Every observation index holding exactly this value. */
    private static List<Integer> indexOf(Sample sample, double value)
    {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < sample.size(); i++) {
            if (sample.get(i) == value) {
                indices.add(i);
            }
        }
        return indices;
    }
}
