/* (C)2026 */
package com.ammann.analytics.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ConfidenceIntervalTest
{

    @Test
    void containsIsInclusiveAtBothBounds()
    {
        ConfidenceInterval ci = new ConfidenceInterval(1.0, 3.0, 0.95);

        assertThat(ci.contains(1.0)).isTrue();
        assertThat(ci.contains(3.0)).isTrue();
        assertThat(ci.contains(3.0001)).isFalse();
        assertThat(ci.width()).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void rejectsInvertedBounds()
    {
        assertThatThrownBy(() -> new ConfidenceInterval(2.0, 1.0, 0.95))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfidenceInterval(Double.NaN, 1.0, 0.95))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
