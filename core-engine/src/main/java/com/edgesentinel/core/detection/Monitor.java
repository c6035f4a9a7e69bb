package com.edgesentinel.core.detection;

import com.edgesentinel.core.model.FlowRecord;

import java.io.Serializable;

/**
 * Contract for streaming burst detectors over directed flows.
 * <p>
 * Implementations are <strong>stateful</strong>: each call to
 * {@link #update(FlowRecord)} folds one observation into the stream state, and
 * the detection methods score a flow against that state. Code that feeds flows
 * only depends on this interface, so detector variants are interchangeable.
 * </p>
 * <p>
 * Monitors must be {@link Serializable} because Flink snapshots them in
 * checkpointed keyed state.
 * </p>
 * <p>
 * Scores are only comparable within one {@link ScoreMode}; use
 * {@link #detect(FlowRecord)} or {@link ScoreMode#isAnomalous(double, double)}
 * instead of comparing scores with the threshold by hand.
 * </p>
 */
public interface Monitor extends Serializable {

    /**
     * Prepare the monitor for use. Monitors that are ready on construction
     * treat this as a no-op; others fail every other operation with
     * {@link NotInitializedException} until it has been called.
     */
    default void initialize() {
    }

    /**
     * @return {@code true} once the monitor accepts flows
     */
    default boolean isInitialized() {
        return true;
    }

    /**
     * Fold one flow into the stream state.
     *
     * @param flow the observed flow
     */
    void update(FlowRecord flow);

    /**
     * Score a flow against the current state without changing it.
     *
     * @param flow the flow to score; only its endpoints are used
     * @return transformed score in this monitor's {@link ScoreMode}
     */
    double detectScore(FlowRecord flow);

    /**
     * Decide whether a flow is a burst under the current state.
     *
     * @param flow the flow to score
     * @return {@code true} if the score crosses the threshold
     */
    default boolean detect(FlowRecord flow) {
        return getMode().isAnomalous(detectScore(flow), getThreshold());
    }

    /**
     * {@link #update(FlowRecord)} then {@link #detectScore(FlowRecord)} as one
     * step against the same tick.
     *
     * @param flow the observed flow
     * @return transformed score after the update
     */
    double updateDetectScore(FlowRecord flow);

    /**
     * {@link #updateDetectScore(FlowRecord)} compared with the threshold.
     *
     * @param flow the observed flow
     * @return {@code true} if the flow is a burst after the update
     */
    default boolean updateDetect(FlowRecord flow) {
        return getMode().isAnomalous(updateDetectScore(flow), getThreshold());
    }

    /**
     * @return the decision threshold, fixed at construction
     */
    double getThreshold();

    /**
     * @return the output transform of every score this monitor returns
     */
    ScoreMode getMode();

    /**
     * @return the monitor name used in alerts and logs
     */
    String getName();
}
