/* (C)2026 */
package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.SpreadAssessment;
import com.ammann.analytics.exception.DegenerateSampleException;
import com.ammann.analytics.exception.InvalidInputException;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the descriptive statistics of one {@link Sample}.
 *
 * <p>All fields are derived once by {@link #compute(Sample, double)}; calling it twice on the
 * same sample yields equal snapshots. Fields that are undefined for a sample are {@code null}:
 * the harmonic and geometric means (and the mean ordering check) when any value is not
 * strictly positive, and the mode when every value is unique.
 *
 * <p>Shape statistics use the moment estimators {@code g1 = m3 / m2^1.5} and
 * {@code g2 = m4 / m2^2 - 3} with central moments {@code mk = sum((x - mean)^k) / n}.
 * Quartiles and the median use linear interpolation between order statistics at
 * position {@code 1 + p (n - 1)}.
 *
 * @param n                      sample size
 * @param sum                    sum of the values
 * @param mean                   arithmetic mean
 * @param sampleStd              standard deviation with n - 1 denominator
 * @param populationStd          standard deviation with n denominator
 * @param sampleVariance         variance with n - 1 denominator
 * @param populationVariance     variance with n denominator
 * @param min                    smallest value
 * @param max                    largest value
 * @param range                  max - min
 * @param median                 50th percentile
 * @param q1                     25th percentile
 * @param q3                     75th percentile
 * @param skewness               moment skewness g1
 * @param excessKurtosis         moment kurtosis g2 (normal distribution: 0)
 * @param harmonicMean           harmonic mean, {@code null} unless all values are positive
 * @param geometricMean          geometric mean, {@code null} unless all values are positive
 * @param quadraticMean          root mean square
 * @param cubicMean              cube root of the mean of cubes
 * @param mode                   most frequent value, {@code null} if no value repeats
 * @param meansOrdered           whether min &lt;= H &lt;= G &lt;= A &lt;= Q &lt;= C &lt;= max holds,
 *                               {@code null} when H and G are undefined
 * @param standardError          sampleStd / sqrt(n)
 * @param coefficientOfVariation sampleStd / mean in percent, 0 when the mean is 0
 * @param rangeToStdRatio        range / sampleStd
 * @param spreadAssessment       classification of the R/S ratio
 * @param significanceLevel      alpha used for both confidence intervals
 * @param meanInterval           Student-t confidence interval for the mean
 * @param stdInterval            chi-square confidence interval for the standard deviation
 * @param zScores                (x - mean) / sampleStd in observation order
 */
public record DescriptiveStatistics(
        int n,
        double sum,
        double mean,
        double sampleStd,
        double populationStd,
        double sampleVariance,
        double populationVariance,
        double min,
        double max,
        double range,
        double median,
        double q1,
        double q3,
        double skewness,
        double excessKurtosis,
        Double harmonicMean,
        Double geometricMean,
        double quadraticMean,
        double cubicMean,
        Double mode,
        Boolean meansOrdered,
        double standardError,
        double coefficientOfVariation,
        double rangeToStdRatio,
        SpreadAssessment spreadAssessment,
        double significanceLevel,
        ConfidenceInterval meanInterval,
        ConfidenceInterval stdInterval,
        List<Double> zScores
)
{
    /** Significance level used when none is configured. */
    public static final double DEFAULT_SIGNIFICANCE_LEVEL = 0.05;

    private static final double ORDERING_TOLERANCE = 1e-12;

    public DescriptiveStatistics
    {
        zScores = List.copyOf(zScores);
    }

    /**
     * Computes the statistics with 95 percent confidence intervals.
     *
     * @throws DegenerateSampleException if all values are identical
     */
    public static DescriptiveStatistics compute(Sample sample)
    {
        return compute(sample, DEFAULT_SIGNIFICANCE_LEVEL);
    }

    /**
     * Computes the statistics with {@code 1 - alpha} confidence intervals.
     *
     * @param sample validated sample
     * @param alpha  significance level in (0, 0.5)
     * @return immutable snapshot
     * @throws InvalidInputException     if alpha is outside (0, 0.5) or the values are so large
     *                                   that a statistic is not representable as a double
     * @throws DegenerateSampleException if the standard deviation is zero
     */
    public static DescriptiveStatistics compute(Sample sample, double alpha)
    {
        validateSignificanceLevel(alpha);

        double[] values = sample.values();
        double[] sorted = sample.sorted();
        int n = values.length;

        double min = sorted[0];
        double max = sorted[n - 1];
        if (min == max) {
            throw new DegenerateSampleException(min);
        }

        // Power sums and moments run on values scaled by a power of two near max |x|.
        // The scaling is exact, so results only differ where the raw sums would overflow
        // or underflow.
        int exponent = Math.getExponent(Math.max(Math.abs(min), Math.abs(max)));
        double[] scaled = new double[n];
        for (int i = 0; i < n; i++) {
            scaled[i] = Math.scalb(values[i], -exponent);
        }

        double scaledMean = StatUtils.mean(scaled);
        double scaledVariance = StatUtils.variance(scaled, scaledMean);
        if (scaledVariance == 0.0) {
            throw new DegenerateSampleException(min);
        }
        double scaledStd = Math.sqrt(scaledVariance);
        double scaledPopulationVariance = scaledVariance * (n - 1) / n;

        double mean = Math.scalb(scaledMean, exponent);
        double sampleVariance = Math.scalb(scaledVariance, 2 * exponent);
        double populationVariance = Math.scalb(scaledPopulationVariance, 2 * exponent);
        double sampleStd = Math.scalb(scaledStd, exponent);
        double populationStd = Math.scalb(Math.sqrt(scaledPopulationVariance), exponent);
        double range = max - min;

        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(sorted);
        double q1 = percentile.evaluate(25.0);
        double median = percentile.evaluate(50.0);
        double q3 = percentile.evaluate(75.0);

        // Central moments m2..m4 with n denominator
        double m2 = 0.0;
        double m3 = 0.0;
        double m4 = 0.0;
        double sumSquares = 0.0;
        double sumCubes = 0.0;
        for (double y : scaled) {
            double d = y - scaledMean;
            double d2 = d * d;
            m2 += d2;
            m3 += d2 * d;
            m4 += d2 * d2;
            sumSquares += y * y;
            sumCubes += y * y * y;
        }
        m2 /= n;
        m3 /= n;
        m4 /= n;
        double skewness = m3 / Math.pow(m2, 1.5);
        double excessKurtosis = m4 / (m2 * m2) - 3.0;

        double quadraticMean = Math.scalb(Math.sqrt(sumSquares / n), exponent);
        double cubicMean = Math.scalb(Math.cbrt(sumCubes / n), exponent);

        Double harmonicMean = null;
        Double geometricMean = null;
        if (min > 0.0) {
            // min / x lies in (0, 1] and the term for the minimum is exactly 1
            double reciprocalSum = 0.0;
            for (double x : values) {
                reciprocalSum += min / x;
            }
            harmonicMean = min * (n / reciprocalSum);
            geometricMean = StatUtils.geometricMean(values);
        }

        Boolean meansOrdered = harmonicMean == null ? null : isNonDecreasing(
                min, harmonicMean, geometricMean, mean, quadraticMean, cubicMean, max);

        double standardError = sampleStd / Math.sqrt(n);
        double coefficientOfVariation = scaledMean == 0.0 ? 0.0 : scaledStd / scaledMean * 100.0;
        double rangeToStdRatio = (Math.scalb(max, -exponent) - Math.scalb(min, -exponent)) / scaledStd;

        double tCritical = new TDistribution(n - 1).inverseCumulativeProbability(1.0 - alpha / 2.0);
        double meanLower = mean - tCritical * standardError;
        double meanUpper = mean + tCritical * standardError;

        ChiSquaredDistribution chiSquared = new ChiSquaredDistribution(n - 1);
        double chiUpperQuantile = chiSquared.inverseCumulativeProbability(1.0 - alpha / 2.0);
        double chiLowerQuantile = chiSquared.inverseCumulativeProbability(alpha / 2.0);
        double stdLower = sampleStd * Math.sqrt((n - 1) / chiUpperQuantile);
        double stdUpper = sampleStd * Math.sqrt((n - 1) / chiLowerQuantile);

        double sum = StatUtils.sum(values);

        requireFinite("sum", sum);
        requireFinite("mean", mean);
        requireFinite("sampleVariance", sampleVariance);
        requireFinite("populationVariance", populationVariance);
        requireFinite("sampleStd", sampleStd);
        requireFinite("range", range);
        requireFinite("median", median);
        requireFinite("q1", q1);
        requireFinite("q3", q3);
        requireFinite("skewness", skewness);
        requireFinite("excessKurtosis", excessKurtosis);
        requireFinite("coefficientOfVariation", coefficientOfVariation);
        requireFinite("rangeToStdRatio", rangeToStdRatio);
        requireFinite("meanInterval", meanLower);
        requireFinite("meanInterval", meanUpper);
        requireFinite("stdInterval", stdLower);
        requireFinite("stdInterval", stdUpper);

        ConfidenceInterval meanInterval = new ConfidenceInterval(meanLower, meanUpper, 1.0 - alpha);
        ConfidenceInterval stdInterval = new ConfidenceInterval(stdLower, stdUpper, 1.0 - alpha);

        List<Double> zScores = new ArrayList<>(n);
        for (double y : scaled) {
            zScores.add((y - scaledMean) / scaledStd);
        }

        return new DescriptiveStatistics(
                n,
                sum,
                mean,
                sampleStd,
                populationStd,
                sampleVariance,
                populationVariance,
                min,
                max,
                range,
                median,
                q1,
                q3,
                skewness,
                excessKurtosis,
                harmonicMean,
                geometricMean,
                quadraticMean,
                cubicMean,
                mode(values),
                meansOrdered,
                standardError,
                coefficientOfVariation,
                rangeToStdRatio,
                SpreadAssessment.fromRatio(rangeToStdRatio),
                alpha,
                meanInterval,
                stdInterval,
                zScores
        );
    }

    /** Interquartile range Q3 - Q1. */
    public double iqr()
    {
        return q3 - q1;
    }

    /** Returns the z-scores as a fresh primitive array. */
    public double[] zScoreArray()
    {
        return zScores.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * Rejects significance levels outside the open interval (0, 0.5).
     *
     * @throws InvalidInputException if alpha is not usable
     */
    public static void validateSignificanceLevel(double alpha)
    {
        if (!(alpha > 0.0 && alpha < 0.5)) {
            throw InvalidInputException.invalidParameter("significanceLevel", alpha, "a value in (0, 0.5)");
        }
    }

    /**
     * Rejects a derived quantity that left the double range.
     *
     * @throws InvalidInputException if the value is NaN or infinite
     */
    private static void requireFinite(String quantity, double value)
    {
        if (!Double.isFinite(value)) {
            throw InvalidInputException.outOfRange(quantity, value);
        }
    }

    /** First value in observation order among those with the highest frequency. */
    private static Double mode(double[] values)
    {
        Map<Double, Integer> frequencies = new LinkedHashMap<>();
        for (double x : values) {
            frequencies.merge(x, 1, Integer::sum);
        }

        Double mode = null;
        int best = 1;
        for (Map.Entry<Double, Integer> entry : frequencies.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                mode = entry.getKey();
            }
        }
        return mode;
    }

    private static boolean isNonDecreasing(double... chain)
    {
        for (int i = 1; i < chain.length; i++) {
            double tolerance = ORDERING_TOLERANCE * Math.max(1.0, Math.abs(chain[i]));
            if (chain[i - 1] > chain[i] + tolerance) {
                return false;
            }
        }
        return true;
    }
}
