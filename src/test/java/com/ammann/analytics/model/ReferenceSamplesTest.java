/* (C)2026 */
package com.ammann.analytics.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ReferenceSamplesTest
{

    @Test
    void bundledSeriesHaveExpectedSizesAndMeans()
    {
        Sample large = ReferenceSamples.measurements48();
        Sample small = ReferenceSamples.measurements25();

        assertThat(large.size()).isEqualTo(48);
        assertThat(large.label()).isEqualTo(ReferenceSamples.MEASUREMENTS_48_LABEL);
        assertThat(DescriptiveStatistics.compute(large).mean()).isCloseTo(100.59833, within(1e-4));
        assertThat(small.size()).isEqualTo(25);
        assertThat(DescriptiveStatistics.compute(small).mean()).isCloseTo(100.6296, within(1e-4));
    }

    @Test
    void allListsTheLargerSeriesFirst()
    {
        assertThat(ReferenceSamples.all()).extracting(Sample::label)
                .containsExactly(ReferenceSamples.MEASUREMENTS_48_LABEL, ReferenceSamples.MEASUREMENTS_25_LABEL);
    }
}
