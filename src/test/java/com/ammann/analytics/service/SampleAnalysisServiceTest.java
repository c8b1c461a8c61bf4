/* (C)2026 */
package com.ammann.analytics.service;

import com.ammann.analytics.enumeration.NormalityCriterion;
import com.ammann.analytics.enumeration.OutlierMethod;
import com.ammann.analytics.exception.DegenerateSampleException;
import com.ammann.analytics.exception.InvalidInputException;
import com.ammann.analytics.model.AnalysisOptions;
import com.ammann.analytics.model.AnalysisReport;
import com.ammann.analytics.model.Sample;
import com.ammann.analytics.support.TestSamples;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SampleAnalysisServiceTest
{

    private SimpleMeterRegistry meterRegistry;
    private SampleAnalysisService service;

    @BeforeEach
    void setUp()
    {
        meterRegistry = new SimpleMeterRegistry();
        service = new SampleAnalysisService(new NormalityTestService(), new OutlierDetectionService(), meterRegistry);
    }

    @Test
    void buildsCompleteReport()
    {
        AnalysisReport report = service.analyze(TestSamples.measurements11());

        assertThat(report.label()).isEqualTo("measurements-11");
        assertThat(report.statistics().mean()).isCloseTo(TestSamples.MEASUREMENTS_11_MEAN, within(1e-9));
        assertThat(report.normalityResults()).hasSize(NormalityCriterion.values().length);
        assertThat(report.outlierResults()).hasSize(OutlierMethod.values().length);
        assertThat(report.frequencyTable().totalCount()).isEqualTo(11);
        assertThat(report.options()).isEqualTo(AnalysisOptions.defaults());
    }

    @Test
    void defaultOptionsComeFromConfiguration()
    {
        service.significanceLevel = 0.01;
        service.outlierMethods = "grubbs, iqr";
        service.iqrMultiplier = 3.0;

        AnalysisOptions options = service.defaultOptions();

        assertThat(options.significanceLevel()).isEqualTo(0.01);
        assertThat(options.outlierMethods()).containsExactlyInAnyOrder(OutlierMethod.GRUBBS, OutlierMethod.IQR);
        assertThat(options.iqrMultiplier()).isEqualTo(3.0);
    }

    @Test
    void perCallOptionsOverrideDefaults()
    {
        AnalysisOptions options = AnalysisOptions.defaults()
                .withSignificanceLevel(0.01)
                .withOutlierMethods(EnumSet.of(OutlierMethod.CHAUVENET));

        AnalysisReport report = service.analyze(TestSamples.measurements11(), options);

        assertThat(report.outlierResults()).containsOnlyKeys(OutlierMethod.CHAUVENET);
        assertThat(report.statistics().meanInterval().confidenceLevel()).isCloseTo(0.99, within(1e-12));
    }

    @Test
    void countsCompletedAnalyses()
    {
        service.analyze(TestSamples.measurements11());
        service.analyze(TestSamples.withGrossError());

        assertThat(meterRegistry.get("sample_analysis_total").counter().count()).isEqualTo(2.0);
    }

    @Test
    void degenerateSampleIsRejectedAndCounted()
    {
        Sample constant = Sample.of(7, 7, 7, 7, 7, 7);

        assertThatThrownBy(() -> service.analyze(constant)).isInstanceOf(DegenerateSampleException.class);
        assertThat(meterRegistry.get("sample_analysis_failures_total").tag("reason", "degenerate").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void invalidConfiguredSignificanceLevelIsRejected()
    {
        service.significanceLevel = 0.7;

        assertThatThrownBy(() -> service.analyze(TestSamples.measurements11()))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void worksWithoutMeterRegistry()
    {
        SampleAnalysisService withoutMetrics =
                new SampleAnalysisService(new NormalityTestService(), new OutlierDetectionService(), null);

        assertThat(withoutMetrics.analyze(TestSamples.measurements11()).statistics().n()).isEqualTo(11);
        assertThatThrownBy(() -> withoutMetrics.analyze(Sample.of(1, 1, 1, 1, 1)))
                .isInstanceOf(DegenerateSampleException.class);
    }

    @Test
    void repeatedAnalysisYieldsEqualStatistics()
    {
        AnalysisReport first = service.analyze(TestSamples.measurements11());
        AnalysisReport second = service.analyze(TestSamples.measurements11());

        assertThat(second.statistics()).isEqualTo(first.statistics());
        assertThat(second.normalityResults()).isEqualTo(first.normalityResults());
        assertThat(second.outlierResults()).isEqualTo(first.outlierResults());
    }
}
