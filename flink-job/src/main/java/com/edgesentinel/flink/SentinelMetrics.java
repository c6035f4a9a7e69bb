package com.edgesentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metrics of the edge detector, registered under the
 * {@code edge_sentinel} group.
 *
 * <ul>
 *   <li>{@code flows_processed_total}: flow records scored</li>
 *   <li>{@code anomalies_detected_total}: alerts emitted</li>
 *   <li>{@code detector_errors_total}: records skipped because scoring failed</li>
 *   <li>{@code processing_latency_ms}: per-record latency histogram</li>
 * </ul>
 *
 * Reporters are configured at cluster level in {@code flink-conf.yaml}.
 */
public class SentinelMetrics {

    static final String GROUP = "edge_sentinel";

    private final Counter flowsProcessed;
    private final Counter anomaliesDetected;
    private final Counter detectorErrors;
    private final Histogram processingLatency;

    public SentinelMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup(GROUP);

        this.flowsProcessed = group.counter("flows_processed_total");
        this.anomaliesDetected = group.counter("anomalies_detected_total");
        this.detectorErrors = group.counter("detector_errors_total");
        // sliding window of the last 350 samples
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementFlowsProcessed() {
        flowsProcessed.inc();
    }

    public void incrementAnomaliesDetected() {
        anomaliesDetected.inc();
    }

    public void incrementDetectorErrors() {
        detectorErrors.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
