package com.edgesentinel.flink;

import com.edgesentinel.core.config.DetectorConfig;
import com.edgesentinel.core.detection.DetectorFactory;
import com.edgesentinel.core.detection.MidasR;
import com.edgesentinel.core.detection.Monitor;
import com.edgesentinel.core.detection.ShardedMonitor;
import com.edgesentinel.core.model.Alert;
import com.edgesentinel.core.model.FlowRecord;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} that runs the configured {@link Monitor}
 * over a keyed flow stream.
 *
 * <p>
 * The stream is keyed by {@link ShardedMonitor#shardFor(String, int)} over
 * {@link #partitionCount(DetectorConfig)} partitions, and each key owns one
 * monitor in Flink managed {@code ValueState}, snapshotted with every
 * checkpoint. Monitors are built by {@link DetectorFactory} from the config's
 * {@code type}:
 * </p>
 * <ul>
 * <li>{@value ShardedMonitor#TYPE}: the Flink keys are the shards. Key
 * {@code i} holds a {@value MidasR#TYPE} monitor named {@code name#i}, the
 * same partitioning and naming {@link ShardedMonitor} uses in process.</li>
 * <li>any other registered type: a single key holds one monitor of that type
 * for the whole stream.</li>
 * </ul>
 *
 * <h3>Per Record</h3>
 * <ol>
 * <li>Lazily create the key's monitor.</li>
 * <li>Update and score the flow in one step.</li>
 * <li>Emit an {@link Alert} when the score crosses the threshold.</li>
 * </ol>
 *
 * <p>
 * A detector call that throws is logged and the record skipped; the
 * pipeline keeps running.
 * </p>
 *
 * @since 1.0.0
 */
public class MidasProcessFunction extends KeyedProcessFunction<Integer, FlowRecord, Alert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MidasProcessFunction.class);

    /** Validated detector settings, shared by every key. */
    private final DetectorConfig detectorConfig;

    private transient ValueState<Monitor> monitorState;

    private transient SentinelMetrics metrics;

    /**
     * @param detectorConfig detector settings; validated here
     * @throws NullPointerException if {@code detectorConfig} is {@code null}
     * @throws com.edgesentinel.core.config.DetectorConfigurationException
     *                              if the settings are invalid or the type is
     *                              not registered
     */
    public MidasProcessFunction(DetectorConfig detectorConfig) {
        Objects.requireNonNull(detectorConfig, "Detector config must not be null");
        detectorConfig.validate();
        this.detectorConfig = detectorConfig.copy();
        // resolves type, mode and aggregation before the job is submitted
        DetectorFactory.createUninitialized(keyedConfig(this.detectorConfig, 0));
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        ValueStateDescriptor<Monitor> descriptor =
                new ValueStateDescriptor<>("edge-monitor", TypeInformation.of(Monitor.class));
        monitorState = getRuntimeContext().getState(descriptor);

        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("MidasProcessFunction opened for {} detector '{}' over {} partition(s)",
                detectorConfig.getType(), detectorConfig.getName(), partitionCount(detectorConfig));
    }

    @Override
    public void close() {
        LOG.info("MidasProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(FlowRecord flow,
            KeyedProcessFunction<Integer, FlowRecord, Alert>.Context ctx,
            Collector<Alert> out) throws Exception {
        long startNanos = System.nanoTime();

        Monitor monitor = monitorState.value();
        if (monitor == null) {
            monitor = createMonitor(detectorConfig, ctx.getCurrentKey());
        }

        try {
            double score = monitor.updateDetectScore(flow);
            if (monitor.getMode().isAnomalous(score, monitor.getThreshold())) {
                Alert alert = toAlert(monitor, flow, score);
                out.collect(alert);
                metrics.incrementAnomaliesDetected();
                LOG.debug("Alert fired: monitor={} edge={}->{} score={}",
                        alert.getMonitorName(), flow.getSrc(), flow.getDst(), score);
            }
        } catch (RuntimeException e) {
            metrics.incrementDetectorErrors();
            LOG.error("Monitor '{}' failed on {}, skipping record", monitor.getName(), flow, e);
        }

        // the monitor mutated in place; write it back so the state backend sees it
        monitorState.update(monitor);

        metrics.incrementFlowsProcessed();
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * @param config detector settings
     * @return number of Flink keys the stream is partitioned into
     */
    static int partitionCount(DetectorConfig config) {
        return isSharded(config) ? config.getShards() : 1;
    }

    /**
     * Settings of the monitor owned by one key.
     *
     * @param config detector settings
     * @param key    Flink key in {@code [0, partitionCount)}
     * @return a copy; for a sharded config, a {@value MidasR#TYPE} shard
     */
    static DetectorConfig keyedConfig(DetectorConfig config, int key) {
        DetectorConfig keyed = config.copy();
        if (isSharded(config)) {
            keyed.setType(MidasR.TYPE);
            keyed.setName(config.getName() + "#" + key);
        }
        return keyed;
    }

    static Monitor createMonitor(DetectorConfig config, int key) {
        Monitor monitor = DetectorFactory.create(keyedConfig(config, key));
        LOG.info("Created monitor '{}' for key {}", monitor.getName(), key);
        return monitor;
    }

    private static boolean isSharded(DetectorConfig config) {
        return ShardedMonitor.TYPE.equals(config.getType());
    }

    /**
     * Build the alert for a flow that crossed the threshold.
     *
     * @param monitor detector that scored the flow
     * @param flow    the scored flow
     * @param score   transformed score
     * @return alert timestamped at the flow's event time, or now when the flow
     *         carries none
     */
    static Alert toAlert(Monitor monitor, FlowRecord flow, double score) {
        Instant timestamp = flow.hasTimestamp()
                ? Instant.ofEpochMilli(Math.round(flow.getTimestamp() * 1000.0))
                : Instant.now();
        StringBuilder details = new StringBuilder()
                .append("count=").append(flow.getCount());
        flow.label().ifPresent(label -> details.append(", label=").append(label));
        return Alert.builder()
                .monitorName(monitor.getName())
                .src(flow.getSrc())
                .dst(flow.getDst())
                .score(score)
                .threshold(monitor.getThreshold())
                .mode(monitor.getMode().getModeName())
                .timestamp(timestamp)
                .details(details.toString())
                .build();
    }
}
