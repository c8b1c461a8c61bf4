/* (C)2026 */
package com.ammann.analytics.model;

import com.ammann.analytics.support.TestSamples;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FrequencyTableTest
{

    @Test
    void groupsElevenMeasurementsIntoFiveIntervals()
    {
        FrequencyTable table = FrequencyTable.of(TestSamples.measurements11());

        assertThat(table.binCount()).isEqualTo(5);
        assertThat(table.width()).isCloseTo(0.708, within(1e-9));
        assertThat(table.bins()).extracting(FrequencyTable.Bin::count).containsExactly(1, 2, 6, 1, 1);
        assertThat(table.bins().get(0).lower()).isEqualTo(98.97);
        assertThat(table.bins().get(4).upper()).isEqualTo(102.51);
        assertThat(table.totalCount()).isEqualTo(11);
    }

    @Test
    void relativeFrequenciesSumToOneAndDensityIntegratesToOne()
    {
        FrequencyTable table = FrequencyTable.of(ReferenceSamples.measurements48());

        double relative = table.bins().stream().mapToDouble(FrequencyTable.Bin::relativeFrequency).sum();
        double area = table.bins().stream().mapToDouble(bin -> bin.density() * table.width()).sum();

        assertThat(table.binCount()).isEqualTo(7);
        assertThat(table.totalCount()).isEqualTo(48);
        assertThat(relative).isCloseTo(1.0, within(1e-12));
        assertThat(area).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void midpointsLieInsideTheirIntervals()
    {
        FrequencyTable table = FrequencyTable.of(TestSamples.withGrossError());

        assertThat(table.bins()).allSatisfy(bin -> {
            assertThat(bin.midpoint()).isCloseTo((bin.lower() + bin.upper()) / 2.0, within(1e-9));
            assertThat(bin.lower()).isLessThan(bin.upper());
        });
        assertThat(table.totalCount()).isEqualTo(21);
        assertThat(table.bins().get(0).count()).isEqualTo(20);
        assertThat(table.bins().get(table.binCount() - 1).count()).isEqualTo(1);
    }
}
