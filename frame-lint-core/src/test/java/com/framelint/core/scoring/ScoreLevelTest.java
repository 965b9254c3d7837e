package com.framelint.core.scoring;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ScoreLevel}.
 */
class ScoreLevelTest {

    @Test
    void of_boundaries() {
        assertThat(ScoreLevel.of(100)).isEqualTo(ScoreLevel.PERFECT);
        assertThat(ScoreLevel.of(90)).isEqualTo(ScoreLevel.EXCELLENT);
        assertThat(ScoreLevel.of(75)).isEqualTo(ScoreLevel.GOOD);
        assertThat(ScoreLevel.of(60)).isEqualTo(ScoreLevel.FAIR);
        assertThat(ScoreLevel.of(59)).isEqualTo(ScoreLevel.POOR);
    }

    @Test
    void of_outOfRange_throwsException() {
        assertThatThrownBy(() -> ScoreLevel.of(101)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScoreLevel.of(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
