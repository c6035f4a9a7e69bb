/**
 * Streaming burst detection over directed flow edges.
 *
 * <p>
 * All detectors implement the
 * {@link com.edgesentinel.core.detection.Monitor}
 * interface and are instantiated via
 * {@link com.edgesentinel.core.detection.DetectorFactory}.
 * Built-in detector types:
 * </p>
 * <ul>
 * <li>{@code midas-r}: {@link com.edgesentinel.core.detection.MidasR}, edge,
 * source and destination sketches scored with a chi-squared statistic</li>
 * <li>{@code sharded-midas-r}:
 * {@link com.edgesentinel.core.detection.ShardedMonitor}, independent
 * MIDAS-R shards partitioned by source</li>
 * </ul>
 *
 * <p>
 * Building blocks: {@link com.edgesentinel.core.detection.EpochClock} (tick
 * snapping), {@link com.edgesentinel.core.detection.DimensionTracker}
 * (current and all-time sketches),
 * {@link com.edgesentinel.core.detection.ChiSquaredScorer} and
 * {@link com.edgesentinel.core.detection.ScoreMode} (scoring and output
 * transforms).
 * </p>
 *
 * @since 1.0.0
 */
package com.edgesentinel.core.detection;
