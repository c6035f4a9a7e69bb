/**
 * Apache Flink streaming host for the edge detector.
 *
 * <p>
 * Consumes JSON flow records from Kafka, keys them by source shard, runs one
 * MIDAS-R detector per shard in keyed state and publishes alerts back to
 * Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.edgesentinel.flink.EdgeSentinelJob}: main entry point</li>
 * <li>{@link com.edgesentinel.flink.MidasProcessFunction}: keyed process
 * function</li>
 * <li>{@link com.edgesentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.edgesentinel.flink.HealthServer}: HTTP health and readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.edgesentinel.flink;
