package com.edgesentinel.core.detection;

import com.edgesentinel.core.sketch.SketchKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DimensionTracker}.
 */
class DimensionTrackerTest {

    private static final SketchKey A = SketchKey.node("a");
    private static final SketchKey B = SketchKey.node("b");

    @Test
    @DisplayName("Should clear current counts on tick advance when decay is 0")
    void shouldClearWithZeroDecay() {
        DimensionTracker tracker = new DimensionTracker("src", 256, 4, 0);
        tracker.observe(A, 5, false);

        tracker.observe(B, 1, true);

        assertThat(tracker.estimate(A).current()).isZero();
        assertThat(tracker.estimate(A).total()).isEqualTo(5.0);
        assertThat(tracker.estimate(B).current()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should scale current counts by the decay factor before adding")
    void shouldDecayBeforeAdding() {
        DimensionTracker tracker = new DimensionTracker("edge", 256, 4, 0.25);
        tracker.observe(A, 8, false);

        tracker.observe(A, 1, true);

        assertThat(tracker.estimate(A).current()).isEqualTo(8 * 0.25 + 1);
        assertThat(tracker.estimate(A).total()).isEqualTo(9.0);
    }

    @Test
    @DisplayName("Should not decay without a tick advance")
    void shouldNotDecayWithinTick() {
        DimensionTracker tracker = new DimensionTracker("dst", 256, 4, 0.5);
        tracker.observe(A, 2, false);
        tracker.observe(A, 2, false);

        assertThat(tracker.estimate(A).current()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Should leave current counts untouched when decay is 1")
    void shouldKeepCountsWithUnitDecay() {
        DimensionTracker tracker = new DimensionTracker("dst", 256, 4, 1);
        tracker.observe(A, 3, false);

        tracker.observe(B, 1, true);

        assertThat(tracker.estimate(A).current()).isEqualTo(3.0);
    }
}
