/* (C)2026 */
package com.ammann.analytics.enumeration;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Outlier detection methods supported by the analysis engine.
 */
public enum OutlierMethod
{
    /** Tukey fences at Q1 - 1.5 IQR and Q3 + 1.5 IQR. */
    IQR("Interquartile range"),
    /** Wright's criterion: values outside mean +/- 3 standard deviations. */
    THREE_SIGMA("Three sigma (Wright)"),
    /** Single most extreme point against the Student-t derived critical value. */
    GRUBBS("Grubbs"),
    /** Count of points whose absolute z-score exceeds 3. */
    CHARLIER("Charlier"),
    /** Largest gap between neighbouring order statistics, scaled by the standard deviation. */
    IRWIN("Irwin"),
    /** Expected count of equally extreme points below one half. */
    CHAUVENET("Chauvenet"),
    /** Distance of the sample extremes from the mean against a size-dependent threshold. */
    ROMANOVSKY("Romanovsky");

    private final String displayName;

    OutlierMethod(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }

    /**
     * Parses a comma separated list of method names. {@code ALL}, blank or {@code null}
     * selects every method.
     *
     * @param names comma separated method names, case-insensitive
     * @return the selected methods, never empty
     * @throws IllegalArgumentException if a name is unknown
     */
    public static Set<OutlierMethod> parse(String names) {
        if (names == null || names.isBlank() || "ALL".equalsIgnoreCase(names.trim())) {
            return EnumSet.allOf(OutlierMethod.class);
        }
        EnumSet<OutlierMethod> methods = EnumSet.noneOf(OutlierMethod.class);
        Arrays.stream(names.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> OutlierMethod.valueOf(s.toUpperCase(Locale.ROOT)))
                .forEach(methods::add);
        return methods.isEmpty() ? EnumSet.allOf(OutlierMethod.class) : methods;
    }
}
