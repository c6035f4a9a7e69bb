package com.edgesentinel.core.detection;

import java.io.Serializable;

/**
 * Maps event timestamps onto a non-decreasing sequence of whole ticks.
 *
 * <p>
 * A timestamp {@code t} snaps to {@code floor(t / tickSize)}. The first
 * timestamp seen anchors the clock one tick before its own tick, so the first
 * event sits at elapsed tick 1 and elapsed tick 0 is never observed. Every
 * later timestamp maps to {@code elapsed(t) = floor(t / tickSize) - anchor}.
 * </p>
 *
 * <p>
 * Ticks are clamped to {@code [-2^61, 2^61]} so that elapsed-tick arithmetic
 * cannot overflow for any finite timestamp.
 * </p>
 *
 * <p>
 * The clock never moves backward. A timestamp older than the current tick is
 * accepted but leaves the tick, and therefore already decayed counters,
 * untouched.
 * </p>
 *
 * @since 1.0.0
 */
public class EpochClock implements Serializable {

    private static final long serialVersionUID = 1L;

    static final long MAX_TICK = 1L << 61;

    private final double tickSize;

    private boolean anchored;
    private long anchor;
    private long currentTick;

    /**
     * @param tickSize length of one tick in timestamp units; must be positive
     * @throws IllegalArgumentException if {@code tickSize} is not positive and finite
     */
    public EpochClock(double tickSize) {
        if (!(tickSize > 0) || Double.isInfinite(tickSize)) {
            throw new IllegalArgumentException("tickSize must be > 0, got: " + tickSize);
        }
        this.tickSize = tickSize;
    }

    /**
     * Observe a timestamp and report whether it opened a new tick.
     *
     * @param timestamp event time; must be finite
     * @return the elapsed tick of {@code timestamp} and whether the clock advanced
     * @throws IllegalArgumentException if {@code timestamp} is NaN or infinite
     */
    public TickAdvance advance(double timestamp) {
        long tick = snap(timestamp);
        if (!anchored) {
            anchor = tick - 1;
            anchored = true;
            currentTick = 1;
            return new TickAdvance(currentTick, false);
        }
        long elapsed = tick - anchor;
        if (elapsed > currentTick) {
            currentTick = elapsed;
            return new TickAdvance(elapsed, true);
        }
        return new TickAdvance(elapsed, false);
    }

    /**
     * @return the latest elapsed tick, 0 before the first timestamp
     */
    public long currentTick() {
        return currentTick;
    }

    public boolean isAnchored() {
        return anchored;
    }

    public double getTickSize() {
        return tickSize;
    }

    private long snap(double timestamp) {
        if (!Double.isFinite(timestamp)) {
            throw new IllegalArgumentException("timestamp must be finite, got: " + timestamp);
        }
        double tick = Math.floor(timestamp / tickSize);
        return (long) Math.max(-MAX_TICK, Math.min(MAX_TICK, tick));
    }

    @Override
    public String toString() {
        return "EpochClock{tickSize=" + tickSize + ", anchor=" + (anchored ? anchor : "unset")
                + ", currentTick=" + currentTick + '}';
    }

    /**
     * Outcome of {@link #advance(double)}.
     */
    public static final class TickAdvance {

        private final long elapsed;
        private final boolean advanced;

        TickAdvance(long elapsed, boolean advanced) {
            this.elapsed = elapsed;
            this.advanced = advanced;
        }

        /**
         * @return elapsed tick of the observed timestamp
         */
        public long elapsed() {
            return elapsed;
        }

        /**
         * @return {@code true} if the timestamp crossed into a later tick
         */
        public boolean advanced() {
            return advanced;
        }

        @Override
        public String toString() {
            return "TickAdvance{elapsed=" + elapsed + ", advanced=" + advanced + '}';
        }
    }
}
