/* (C)2026 */
package com.ammann.analytics.enumeration;

/**
 * Normality criteria evaluated for every sample.
 */
public enum NormalityCriterion
{
    SHAPIRO_WILK("Shapiro-Wilk"),
    /** Skewness-based heuristic; only evaluated for samples of at most 50 values. */
    ROMANOVSKY("Romanovsky"),
    PEARSON_CHI_SQUARE("Pearson chi-square"),
    KOLMOGOROV_SMIRNOV("Kolmogorov-Smirnov"),
    SMIRNOV("Smirnov");

    private final String displayName;

    NormalityCriterion(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }
}
