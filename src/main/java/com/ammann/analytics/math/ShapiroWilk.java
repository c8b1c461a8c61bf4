/* (C)2026 */
package com.ammann.analytics.math;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Shapiro-Wilk W test using Royston's approximations (Applied Statistics algorithm AS R94,
 * 1995) for the coefficients and for the null distribution of W.
 *
 * <p>Valid for {@value #MIN_SIZE} to {@value #MAX_SIZE} observations.
 */
public final class ShapiroWilk
{
    public static final int MIN_SIZE = 3;
    public static final int MAX_SIZE = 5000;

    // Polynomial coefficients, lowest order first
    private static final double[] G = {-2.273, 0.459};
    private static final double[] C1 = {0.0, 0.221157, -0.147981, -2.07119, 4.434685, -2.706056};
    private static final double[] C2 = {0.0, 0.042981, -0.293762, -1.752461, 5.682633, -3.582633};
    private static final double[] C3 = {0.544, -0.39978, 0.025054, -6.714e-4};
    private static final double[] C4 = {1.3822, -0.77857, 0.062767, -0.0020322};
    private static final double[] C5 = {-1.5861, -0.31082, -0.083751, 0.0038915};
    private static final double[] C6 = {-0.4803, -0.082676, 0.0030302};

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private ShapiroWilk() {}

    /**
     * W statistic and its p-value.
     *
     * @param w      statistic in (0, 1]
     * @param pValue probability of a W at least this small under normality
     */
    public record Result(double w, double pValue)
    {
    }

    /**
     * Runs the test.
     *
     * @param sorted observations in ascending order
     * @return statistic and p-value
     * @throws IllegalArgumentException if the size is out of range, the data are not sorted
     *                                  or all values are equal
     */
    public static Result test(double[] sorted)
    {
        int n = sorted.length;
        if (n < MIN_SIZE || n > MAX_SIZE) {
            throw new IllegalArgumentException(String.format(
                    "Shapiro-Wilk requires between %d and %d values, got %d", MIN_SIZE, MAX_SIZE, n));
        }
        double range = sorted[n - 1] - sorted[0];
        if (!(range > 0.0)) {
            throw new IllegalArgumentException("Shapiro-Wilk is undefined for a sample with zero range");
        }
        for (int i = 1; i < n; i++) {
            if (sorted[i] < sorted[i - 1]) {
                throw new IllegalArgumentException("Shapiro-Wilk input must be sorted ascending");
            }
        }

        double[] a = coefficients(n);
        int half = n / 2;

        // Scale by the range to keep the sums well conditioned
        double mean = 0.0;
        for (double x : sorted) {
            mean += x / range;
        }
        mean /= n;
        double ssq = 0.0;
        for (double x : sorted) {
            double d = x / range - mean;
            ssq += d * d;
        }
        double numerator = 0.0;
        for (int i = 0; i < half; i++) {
            numerator += a[i] * (sorted[n - 1 - i] - sorted[i]) / range;
        }
        double w = Math.min(1.0, numerator * numerator / ssq);

        return new Result(w, pValue(w, n));
    }

    /**
     * First {@code n / 2} coefficients for the upper half of the order statistics; the lower half
     * is their negation.
     */
    static double[] coefficients(int n)
    {
        int half = n / 2;
        double[] a = new double[half];

        if (n == 3) {
            a[0] = Math.sqrt(0.5);
            return a;
        }

        double an25 = n + 0.25;
        double[] m = new double[half];
        double summ2 = 0.0;
        for (int i = 0; i < half; i++) {
            m[i] = STANDARD_NORMAL.inverseCumulativeProbability((i + 1 - 0.375) / an25);
            summ2 += m[i] * m[i];
        }
        summ2 *= 2.0;
        double ssumm2 = Math.sqrt(summ2);
        double rsn = 1.0 / Math.sqrt(n);
        double a1 = poly(C1, rsn) - m[0] / ssumm2;

        int first;
        double fac;
        if (n > 5) {
            first = 2;
            double a2 = -m[1] / ssumm2 + poly(C2, rsn);
            fac = Math.sqrt((summ2 - 2.0 * m[0] * m[0] - 2.0 * m[1] * m[1])
                    / (1.0 - 2.0 * a1 * a1 - 2.0 * a2 * a2));
            a[1] = a2;
        } else {
            first = 1;
            fac = Math.sqrt((summ2 - 2.0 * m[0] * m[0]) / (1.0 - 2.0 * a1 * a1));
        }
        a[0] = a1;
        for (int i = first; i < half; i++) {
            a[i] = -m[i] / fac;
        }
        return a;
    }

    static double pValue(double w, int n)
    {
        if (n == 3) {
            double pi6 = 6.0 / Math.PI;
            double stqr = Math.PI / 3.0;
            return Math.max(0.0, Math.min(1.0, pi6 * (Math.asin(Math.sqrt(w)) - stqr)));
        }

        double w1 = 1.0 - w;
        if (w1 <= 0.0) {
            return 1.0;
        }
        double y = Math.log(w1);
        double m;
        double s;
        if (n <= 11) {
            double gamma = poly(G, n);
            if (y >= gamma) {
                return 1e-99;
            }
            y = -Math.log(gamma - y);
            m = poly(C3, n);
            s = Math.exp(poly(C4, n));
        } else {
            double logN = Math.log(n);
            m = poly(C5, logN);
            s = Math.exp(poly(C6, logN));
        }
        return 1.0 - new NormalDistribution(m, s).cumulativeProbability(y);
    }

    /** Evaluates {@code c[0] + c[1] x + c[2] x^2 + ...}. */
    static double poly(double[] c, double x)
    {
        double result = 0.0;
        for (int i = c.length - 1; i >= 0; i--) {
            result = result * x + c[i];
        }
        return result;
    }
}
