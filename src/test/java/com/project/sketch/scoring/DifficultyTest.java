package com.project.sketch.scoring;

import com.project.sketch.scoring.engine.Difficulty;
import com.project.sketch.scoring.engine.ScoringWeights;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DifficultyTest {

    @Test
    void weights_sumToOne() {
        for (Difficulty d : Difficulty.values()) {
            assertThat(d.weights().sum()).as(d.id()).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void harderTiers_shiftWeightToDetail() {
        assertThat(Difficulty.EASY.weights().contour()).isGreaterThan(Difficulty.MEDIUM.weights().contour());
        assertThat(Difficulty.MEDIUM.weights().contour()).isGreaterThan(Difficulty.HARD.weights().contour());
        assertThat(Difficulty.HARD.weights().local()).isEqualTo(0.10);
    }

    @Test
    void fromId_defaultsToMedium() {
        assertThat(Difficulty.fromId(null)).isEqualTo(Difficulty.MEDIUM);
        assertThat(Difficulty.fromId("  ")).isEqualTo(Difficulty.MEDIUM);
    }

    @Test
    void fromId_ignoresCase() {
        assertThat(Difficulty.fromId("HARD")).isEqualTo(Difficulty.HARD);
        assertThat(Difficulty.fromId(" easy ")).isEqualTo(Difficulty.EASY);
    }

    @Test
    void fromId_rejectsUnknown() {
        assertThatThrownBy(() -> Difficulty.fromId("extreme"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid difficulty: extreme");
    }

    @Test
    void weights_mustSumToOne() {
        assertThatThrownBy(() -> new ScoringWeights(0.5, 0.3, 0.3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScoringWeights(1.2, -0.1, -0.1)).isInstanceOf(IllegalArgumentException.class);
    }
}
