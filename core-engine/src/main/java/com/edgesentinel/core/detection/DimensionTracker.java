package com.edgesentinel.core.detection;

import com.edgesentinel.core.sketch.CountMinSketch;
import com.edgesentinel.core.sketch.SketchKey;

import java.io.Serializable;
import java.util.Objects;

/**
 * Current-tick and all-time counts for one dimension (edges, sources or
 * destinations).
 *
 * <p>
 * {@code total} only ever grows. {@code current} is scaled by the decay factor
 * on every tick transition, or cleared when the factor is 0, before the
 * observation that opened the new tick is added.
 * </p>
 *
 * @since 1.0.0
 */
public class DimensionTracker implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String dimension;
    private final double decayFactor;
    private final CountMinSketch current;
    private final CountMinSketch total;

    /**
     * @param dimension   label used in logs, e.g. {@code "edge"}
     * @param width       sketch width
     * @param depth       sketch depth
     * @param decayFactor factor in [0, 1] applied to {@code current} per tick
     */
    public DimensionTracker(String dimension, int width, int depth, double decayFactor) {
        this.dimension = Objects.requireNonNull(dimension, "dimension must not be null");
        if (!(decayFactor >= 0 && decayFactor <= 1)) {
            throw new IllegalArgumentException(
                    "Decay factor must be in [0, 1], got: " + decayFactor);
        }
        this.decayFactor = decayFactor;
        this.current = new CountMinSketch(width, depth);
        this.total = new CountMinSketch(width, depth);
    }

    /**
     * Record {@code count} occurrences of {@code key}.
     *
     * @param key          the item
     * @param count        non-negative amount
     * @param tickAdvanced whether this observation opened a new tick
     */
    public void observe(SketchKey key, double count, boolean tickAdvanced) {
        if (tickAdvanced) {
            onTickAdvance();
        }
        current.add(key, count);
        total.add(key, count);
    }

    /**
     * Apply the per-tick decay to the current counts.
     */
    public void onTickAdvance() {
        if (decayFactor == 0) {
            current.clear();
        } else if (decayFactor < 1) {
            current.decay(decayFactor);
        }
    }

    /**
     * @param key the item
     * @return current and total estimates for {@code key}
     */
    public Estimate estimate(SketchKey key) {
        return new Estimate(current.check(key), total.check(key));
    }

    public String getDimension() {
        return dimension;
    }

    CountMinSketch current() {
        return current;
    }

    CountMinSketch total() {
        return total;
    }

    /**
     * Pair of sketch estimates feeding the score function.
     */
    public static final class Estimate {

        private final double current;
        private final double total;

        public Estimate(double current, double total) {
            this.current = current;
            this.total = total;
        }

        public double current() {
            return current;
        }

        public double total() {
            return total;
        }

        @Override
        public String toString() {
            return "Estimate{current=" + current + ", total=" + total + '}';
        }
    }
}
