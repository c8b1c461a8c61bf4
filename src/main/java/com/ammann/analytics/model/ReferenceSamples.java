/* (C)2026 */
package com.ammann.analytics.model;

import java.util.List;

/**
 * Bundled measurement series used for the reference endpoint and the readiness check.
 *
 * <p>Both series are repeated measurements of a nominal value of 100 with a few suspect
 * readings (98.97, 102.37, 102.51).
 */
public final class ReferenceSamples
{
    private ReferenceSamples() {}

    public static final String MEASUREMENTS_48_LABEL = "reference-48";
    public static final String MEASUREMENTS_25_LABEL = "reference-25";

    private static final double[] MEASUREMENTS_48 = {
            101.09, 100.65, 100.93, 101.06, 100.57, 100.98, 99.37, 100.71, 100.51, 100.58,
            101.01, 100.49, 100.72, 100.67, 100.24, 100.34, 100.23, 100.63, 99.66, 100.31,
            100.43, 100.18, 99.79, 100.26, 100.77, 100.93, 100.36, 100.03, 100.87, 100.51,
            100.34, 100.53, 100.20, 102.37, 101.42, 101.08, 100.46, 101.17, 100.56, 98.97,
            100.63, 100.85, 100.87, 100.78, 102.51, 99.97, 101.11, 100.02
    };

    private static final double[] MEASUREMENTS_25 = {
            100.71, 100.56, 98.97, 100.63, 100.58, 100.87, 100.78, 102.51, 99.97, 101.11,
            100.02, 100.55, 100.46, 100.29, 100.84, 100.98, 100.35, 100.89, 100.67, 101.10,
            99.94, 100.21, 100.58, 100.47, 101.70
    };

    /** 48 measurements, within the size limit of the Romanovsky normality check. */
    public static Sample measurements48()
    {
        return Sample.of(MEASUREMENTS_48_LABEL, MEASUREMENTS_48);
    }

    public static Sample measurements25()
    {
        return Sample.of(MEASUREMENTS_25_LABEL, MEASUREMENTS_25);
    }

    /** Both series, larger one first. */
    public static List<Sample> all()
    {
        return List.of(measurements48(), measurements25());
    }
}
