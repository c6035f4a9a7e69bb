package com.edgesentinel.core.sketch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CountMinSketch}.
 */
class CountMinSketchTest {

    @Test
    @DisplayName("Should size width and depth from error rate and confidence")
    void shouldSizeFromErrorRateAndConfidence() {
        CountMinSketch sketch = CountMinSketch.withErrorRate(0.1, 1 - 0.02 / 2);

        assertThat(sketch.getWidth()).isEqualTo(28);   // ceil(e / 0.1)
        assertThat(sketch.getDepth()).isEqualTo(5);    // ceil(ln(100))
    }

    @Test
    @DisplayName("Should never undercount, even with heavy collisions")
    void shouldNeverUndercount() {
        CountMinSketch sketch = new CountMinSketch(8, 3);
        Map<String, Integer> truth = new HashMap<>();
        Random random = new Random(42);

        for (int i = 0; i < 5_000; i++) {
            String node = "node-" + random.nextInt(200);
            int count = 1 + random.nextInt(3);
            sketch.add(SketchKey.node(node), count);
            truth.merge(node, count, Integer::sum);
        }

        truth.forEach((node, count) ->
                assertThat(sketch.check(SketchKey.node(node))).isGreaterThanOrEqualTo(count));
    }

    @Test
    @DisplayName("Should be exact for a single key")
    void shouldBeExactWithoutCollisions() {
        CountMinSketch sketch = new CountMinSketch(64, 4);
        SketchKey key = SketchKey.edge("a", "b");

        sketch.add(key, 3);
        sketch.add(key, 4);

        assertThat(sketch.check(key)).isEqualTo(7.0);
        assertThat(sketch.check(SketchKey.edge("b", "a"))).isLessThanOrEqualTo(7.0);
        assertThat(sketch.getTotalCount()).isEqualTo(7.0);
    }

    @Test
    @DisplayName("Should scale every estimate by exactly the decay factor")
    void shouldDecayExactly() {
        CountMinSketch sketch = new CountMinSketch(32, 4);
        SketchKey a = SketchKey.node("a");
        SketchKey b = SketchKey.node("b");
        sketch.add(a, 10);
        sketch.add(b, 3);
        double beforeA = sketch.check(a);
        double beforeB = sketch.check(b);

        sketch.decay(0.3);

        assertThat(sketch.check(a)).isEqualTo(beforeA * 0.3);
        assertThat(sketch.check(b)).isEqualTo(beforeB * 0.3);
    }

    @Test
    @DisplayName("Should zero all bins on clear")
    void shouldClear() {
        CountMinSketch sketch = new CountMinSketch(16, 3);
        sketch.add(SketchKey.node("a"), 5);

        sketch.clear();

        assertThat(sketch.check(SketchKey.node("a"))).isZero();
        assertThat(sketch.getTotalCount()).isZero();
    }

    @Test
    @DisplayName("Should reject negative counts and out-of-range decay")
    void shouldRejectInvalidArguments() {
        CountMinSketch sketch = new CountMinSketch(16, 3);

        assertThatThrownBy(() -> sketch.add(SketchKey.node("a"), -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sketch.decay(1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CountMinSketch(0, 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CountMinSketch.widthFor(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
