/* (C)2026 */
package com.ammann.analytics.support;

import com.ammann.analytics.model.Sample;

import java.util.Random;

/**
 * Samples shared by the engine tests.
 */
public final class TestSamples
{
    private TestSamples() {}

    /** Eleven repeated measurements of a nominal 100 with one high reading at index 7. */
    public static final double[] MEASUREMENTS_11 = {
            100.71, 100.56, 98.97, 100.63, 100.58, 100.87, 100.78, 102.51, 99.97, 101.11, 100.02
    };

    public static final double MEASUREMENTS_11_MEAN = 100.61;
    public static final double MEASUREMENTS_11_STD = 0.8612548983895552;

    /** Twenty values between 99.7 and 100.3 followed by a gross error of 500 at index 20. */
    public static final double[] WITH_GROSS_ERROR = {
            99.8, 100.1, 100.0, 99.9, 100.2, 100.3, 99.7, 100.0, 100.1, 99.9,
            100.2, 99.8, 100.0, 100.1, 99.9, 100.0, 100.2, 99.8, 100.1, 100.0,
            500.0
    };

    public static final int GROSS_ERROR_INDEX = 20;

    /** Data set of the classic Shapiro-Wilk example with W = 0.7888 and p = 0.0067. */
    public static final double[] SHAPIRO_EXAMPLE = {
            148, 154, 158, 160, 161, 162, 166, 170, 182, 195, 236
    };

    public static Sample measurements11()
    {
        return Sample.of("measurements-11", MEASUREMENTS_11);
    }

    public static Sample withGrossError()
    {
        return Sample.of("gross-error", WITH_GROSS_ERROR);
    }

    /** exp(1), exp(2), ..., exp(n): strongly right-skewed. */
    public static Sample exponentialGrowth(int n)
    {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = Math.exp(i + 1);
        }
        return Sample.of("exp-growth", values);
    }

    /** 1, 2, ..., n. */
    public static Sample arithmeticSequence(int n)
    {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = i + 1;
        }
        return Sample.of("sequence", values);
    }

    /** Pseudo-random normal sample with a fixed seed. */
    public static Sample gaussian(int n, double mean, double std, long seed)
    {
        Random random = new Random(seed);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = mean + std * random.nextGaussian();
        }
        return Sample.of("gaussian-" + seed, values);
    }
}
