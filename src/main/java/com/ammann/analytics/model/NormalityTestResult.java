/* (C)2026 */
package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.NormalityCriterion;
import com.ammann.analytics.enumeration.NormalityVerdict;

import java.util.Objects;

/**
 * Outcome of one normality criterion.
 *
 * <p>Criteria decided by a p-value carry {@code pValue}; criteria decided by a threshold carry
 * {@code criticalValue}. A criterion that could not be computed is represented by
 * {@link #unavailable(NormalityCriterion, String)}: its numeric fields are {@code null} and
 * {@code reason} explains why.
 *
 * @param criterion        the criterion
 * @param statistic        test statistic, {@code null} when unavailable
 * @param pValue           p-value, {@code null} for threshold-based criteria
 * @param criticalValue    threshold, {@code null} for p-value based criteria
 * @param degreesOfFreedom degrees of freedom where the criterion has them
 * @param verdict          decision
 * @param reason           explanation for inconclusive or unavailable results
 */
public record NormalityTestResult(
        NormalityCriterion criterion,
        Double statistic,
        Double pValue,
        Double criticalValue,
        Integer degreesOfFreedom,
        NormalityVerdict verdict,
        String reason
)
{
    public NormalityTestResult
    {
        Objects.requireNonNull(criterion, "criterion");
        Objects.requireNonNull(verdict, "verdict");
    }

    /**
     * Result of a criterion decided by its p-value: normal iff {@code pValue > alpha}.
     */
    public static NormalityTestResult fromPValue(NormalityCriterion criterion, double statistic,
                                                 double pValue, double alpha)
    {
        return new NormalityTestResult(criterion, statistic, pValue, null, null,
                pValue > alpha ? NormalityVerdict.NORMAL : NormalityVerdict.NOT_NORMAL, null);
    }

    /**
     * Result of a criterion decided by a threshold.
     */
    public static NormalityTestResult fromCriticalValue(NormalityCriterion criterion, double statistic,
                                                        double criticalValue, boolean normal)
    {
        return new NormalityTestResult(criterion, statistic, null, criticalValue, null,
                normal ? NormalityVerdict.NORMAL : NormalityVerdict.NOT_NORMAL, null);
    }

    /**
     * Result of a criterion that could not be computed for the sample.
     */
    public static NormalityTestResult unavailable(NormalityCriterion criterion, String reason)
    {
        return new NormalityTestResult(criterion, null, null, null, null,
                NormalityVerdict.UNAVAILABLE, reason);
    }

    public boolean isNormal()
    {
        return verdict.isNormal();
    }

    public boolean isAvailable()
    {
        return verdict != NormalityVerdict.UNAVAILABLE;
    }
}
