/* (C)2026 */
package com.ammann.analytics.service;

import com.ammann.analytics.enumeration.NormalityCriterion;
import com.ammann.analytics.enumeration.NormalityVerdict;
import com.ammann.analytics.model.DescriptiveStatistics;
import com.ammann.analytics.model.NormalityTestResult;
import com.ammann.analytics.model.ReferenceSamples;
import com.ammann.analytics.model.Sample;
import com.ammann.analytics.support.TestSamples;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

/**
 * Unit tests for {@link NormalityTestService}.
 */
class NormalityTestServiceTest
{

    private final NormalityTestService service = new NormalityTestService();

    @Nested
    @DisplayName("eleven measurements around 100")
    class Measurements11
    {
        private final Sample sample = TestSamples.measurements11();
        private final DescriptiveStatistics stats = DescriptiveStatistics.compute(sample);

        @Test
        void runsAllFiveCriteriaInDeclarationOrder()
        {
            Map<NormalityCriterion, NormalityTestResult> results = service.testAll(sample, stats);

            assertThat(results.keySet()).containsExactly(NormalityCriterion.values());
        }

        @Test
        void shapiroWilkAcceptsNormality()
        {
            NormalityTestResult result = service.shapiroWilk(sample, stats);

            assertThat(result.statistic()).isCloseTo(0.90652, within(1e-4));
            assertThat(result.pValue()).isCloseTo(0.22166, within(1e-3));
            assertThat(result.verdict()).isEqualTo(NormalityVerdict.NORMAL);
            assertThat(result.criticalValue()).isNull();
        }

        @Test
        void romanovskyUsesSkewnessOverItsStandardError()
        {
            NormalityTestResult result = service.romanovsky(sample, stats);

            assertThat(result.statistic()).isCloseTo(0.47323, within(1e-4));
            assertThat(result.criticalValue()).isEqualTo(3.0);
            assertThat(result.isNormal()).isTrue();
        }

        @Test
        void chiSquareIsUnavailableWhenMergingLeavesTwoBins()
        {
            NormalityTestResult result = service.chiSquare(sample, stats);

            assertThat(result.verdict()).isEqualTo(NormalityVerdict.UNAVAILABLE);
            assertThat(result.isAvailable()).isFalse();
            assertThat(result.reason()).contains("2 bins");
        }

        @Test
        void kolmogorovSmirnovMatchesCommonsMath()
        {
            NormalDistribution fitted = new NormalDistribution(stats.mean(), stats.sampleStd());
            KolmogorovSmirnovTest reference = new KolmogorovSmirnovTest();

            NormalityTestResult result = service.kolmogorovSmirnov(sample, stats);

            assertThat(result.statistic())
                    .isCloseTo(reference.kolmogorovSmirnovStatistic(fitted, sample.values()), within(1e-12));
            assertThat(result.pValue())
                    .isCloseTo(reference.kolmogorovSmirnovTest(fitted, sample.values()), within(1e-12));
            assertThat(result.isNormal()).isTrue();
        }

        @Test
        void smirnovComparesMaximumDeviationWithTable()
        {
            NormalityTestResult result = service.smirnov(sample, stats);

            assertThat(result.statistic()).isCloseTo(0.20413, within(1e-4));
            assertThat(result.criticalValue()).isEqualTo(0.294);
            assertThat(result.isNormal()).isTrue();
        }
    }

    @Test
    void romanovskyIsSkippedAboveFiftyValues()
    {
        Sample sample = TestSamples.gaussian(60, 10.0, 2.0, 7L);

        Map<NormalityCriterion, NormalityTestResult> results =
                service.testAll(sample, DescriptiveStatistics.compute(sample));

        assertThat(results).doesNotContainKey(NormalityCriterion.ROMANOVSKY).hasSize(4);
    }

    @Test
    void chiSquareMergesSparseTailBinsOfReferenceSample()
    {
        Sample sample = ReferenceSamples.measurements48();

        NormalityTestResult result = service.chiSquare(sample, DescriptiveStatistics.compute(sample));

        assertThat(result.degreesOfFreedom()).isEqualTo(1);
        assertThat(result.statistic()).isCloseTo(3.95405, within(1e-3));
        assertThat(result.pValue()).isBetween(0.0, 1.0);
        assertThat(result.isNormal()).isEqualTo(result.pValue() > 0.05);
    }

    @Test
    void chiSquareIsInconclusiveWhenMergingLeavesThreeBins()
    {
        Sample sample = TestSamples.arithmeticSequence(22);

        NormalityTestResult result = service.chiSquare(sample, DescriptiveStatistics.compute(sample));

        assertThat(result.verdict()).isEqualTo(NormalityVerdict.INCONCLUSIVE);
        assertThat(result.degreesOfFreedom()).isZero();
        assertThat(result.pValue()).isEqualTo(0.0);
        assertThat(result.statistic()).isPositive();
        assertThat(result.isNormal()).isFalse();
        assertThat(result.reason()).contains("3 bins");
    }

    @Test
    void chiSquareRejectsUniformSequence()
    {
        Sample sample = TestSamples.arithmeticSequence(100);

        NormalityTestResult result = service.chiSquare(sample, DescriptiveStatistics.compute(sample));

        assertThat(result.degreesOfFreedom()).isEqualTo(5);
        assertThat(result.statistic()).isCloseTo(22.9646, within(1e-2));
        assertThat(result.verdict()).isEqualTo(NormalityVerdict.NOT_NORMAL);
    }

    @Test
    void skewedSampleFailsShapiroWilk()
    {
        Sample sample = TestSamples.exponentialGrowth(20);

        Map<NormalityCriterion, NormalityTestResult> results =
                service.testAll(sample, DescriptiveStatistics.compute(sample));

        assertThat(results.get(NormalityCriterion.SHAPIRO_WILK).verdict()).isEqualTo(NormalityVerdict.NOT_NORMAL);
        assertThat(results.get(NormalityCriterion.ROMANOVSKY).verdict()).isEqualTo(NormalityVerdict.NOT_NORMAL);
    }

    @Test
    void pValueVerdictsFollowTheSignificanceLevel()
    {
        Sample sample = ReferenceSamples.measurements48();
        DescriptiveStatistics stats = DescriptiveStatistics.compute(sample, 0.001);

        NormalityTestResult result = service.shapiroWilk(sample, stats);

        assertThat(result.pValue()).isCloseTo(0.00624, within(1e-3));
        assertThat(result.verdict()).isEqualTo(NormalityVerdict.NORMAL);
        assertThat(service.shapiroWilk(sample, DescriptiveStatistics.compute(sample)).verdict())
                .isEqualTo(NormalityVerdict.NOT_NORMAL);
    }

    @Test
    void failureOfOneCriterionDoesNotStopTheOthers()
    {
        NormalityTestService failing = spy(new NormalityTestService());
        doThrow(new IllegalStateException("no convergence")).when(failing).kolmogorovSmirnov(any(), any());
        Sample sample = TestSamples.measurements11();

        Map<NormalityCriterion, NormalityTestResult> results =
                failing.testAll(sample, DescriptiveStatistics.compute(sample));

        NormalityTestResult ks = results.get(NormalityCriterion.KOLMOGOROV_SMIRNOV);
        assertThat(ks.verdict()).isEqualTo(NormalityVerdict.UNAVAILABLE);
        assertThat(ks.reason()).isEqualTo("no convergence");
        assertThat(results.get(NormalityCriterion.SHAPIRO_WILK).isAvailable()).isTrue();
        assertThat(results.get(NormalityCriterion.SMIRNOV).isAvailable()).isTrue();
    }

    @Test
    void tinySpreadGivesFiniteRomanovskyStatistic()
    {
        Sample sample = Sample.of(0, 0, 0, 0, 1e-150);

        Map<NormalityCriterion, NormalityTestResult> results =
                service.testAll(sample, DescriptiveStatistics.compute(sample));

        NormalityTestResult romanovsky = results.get(NormalityCriterion.ROMANOVSKY);
        assertThat(romanovsky.statistic()).isCloseTo(1.5 / Math.sqrt(1.2), within(1e-9));
        assertThat(romanovsky.verdict()).isEqualTo(NormalityVerdict.NORMAL);
        assertThat(results.get(NormalityCriterion.SHAPIRO_WILK).isAvailable()).isTrue();
        assertThat(results.values())
                .filteredOn(NormalityTestResult::isAvailable)
                .allSatisfy(r -> assertThat(r.statistic()).isFinite());
    }

    @Test
    void nonFiniteStatisticIsReportedAsUnavailable()
    {
        NormalityTestService failing = spy(new NormalityTestService());
        doReturn(NormalityTestResult.fromCriticalValue(NormalityCriterion.SMIRNOV, Double.NaN, 0.294, false))
                .when(failing).smirnov(any(), any());
        Sample sample = TestSamples.measurements11();

        NormalityTestResult smirnov = failing.testAll(sample, DescriptiveStatistics.compute(sample))
                .get(NormalityCriterion.SMIRNOV);

        assertThat(smirnov.verdict()).isEqualTo(NormalityVerdict.UNAVAILABLE);
        assertThat(smirnov.statistic()).isNull();
        assertThat(smirnov.reason()).contains("not a finite number");
    }

    @Nested
    @DisplayName("small-bin merging")
    class MergeSmallBins
    {
        @Test
        void foldsEdgeBinsInwards()
        {
            List<Double> expected = new ArrayList<>(List.of(1.0, 4.0, 10.0, 10.0, 4.0, 1.0));
            List<Double> observed = new ArrayList<>(List.of(0.0, 5.0, 9.0, 11.0, 3.0, 2.0));

            NormalityTestService.mergeSmallBins(expected, observed);

            assertThat(expected).containsExactly(5.0, 10.0, 10.0, 5.0);
            assertThat(observed).containsExactly(5.0, 9.0, 11.0, 5.0);
        }

        @Test
        void foldsInteriorBinsToTheLeft()
        {
            List<Double> expected = new ArrayList<>(List.of(6.0, 2.0, 7.0));
            List<Double> observed = new ArrayList<>(List.of(5.0, 1.0, 9.0));

            NormalityTestService.mergeSmallBins(expected, observed);

            assertThat(expected).containsExactly(8.0, 7.0);
            assertThat(observed).containsExactly(6.0, 9.0);
        }

        @Test
        void stopsAtTwoBins()
        {
            List<Double> expected = new ArrayList<>(List.of(1.0, 1.0, 1.0));
            List<Double> observed = new ArrayList<>(List.of(1.0, 1.0, 1.0));

            NormalityTestService.mergeSmallBins(expected, observed);

            assertThat(expected).hasSize(2);
            assertThat(expected.stream().mapToDouble(Double::doubleValue).sum()).isEqualTo(3.0);
            assertThat(observed.stream().mapToDouble(Double::doubleValue).sum()).isEqualTo(3.0);
        }

        @Test
        void leavesBinsAloneWhenAllExpectedCountsAreLargeEnough()
        {
            List<Double> expected = new ArrayList<>(List.of(5.0, 6.0, 7.0));
            List<Double> observed = new ArrayList<>(List.of(4.0, 7.0, 7.0));

            NormalityTestService.mergeSmallBins(expected, observed);

            assertThat(expected).containsExactly(5.0, 6.0, 7.0);
        }
    }
}
