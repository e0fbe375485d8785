package com.tutor.common.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoreUtilsTest {

    @Test
    void should_ClampIntoRange_When_ValueOutside() {
        assertThat(ScoreUtils.clamp01(1.7)).isEqualTo(1.0);
        assertThat(ScoreUtils.clamp01(-0.2)).isEqualTo(0.0);
        assertThat(ScoreUtils.clamp(0.1, 0.3, 1.0)).isEqualTo(0.3);
        assertThat(ScoreUtils.clamp01(0.42)).isEqualTo(0.42);
    }

    @Test
    void should_ReturnMin_When_ValueIsNaN() {
        assertThat(ScoreUtils.clamp(Double.NaN, 0.3, 1.0)).isEqualTo(0.3);
    }

    @Test
    void should_ReturnZero_When_DenominatorIsZero() {
        assertThat(ScoreUtils.ratio(5, 0)).isZero();
        assertThat(ScoreUtils.ratio(1, 4)).isEqualTo(0.25);
    }

    @Test
    void should_RoundToScale() {
        assertThat(ScoreUtils.round(0.98765, 3)).isCloseTo(0.988, within(1e-9));
    }
}
