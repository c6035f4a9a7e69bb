package com.edgesentinel.flink;

import com.edgesentinel.core.config.DetectorConfig;
import com.edgesentinel.core.config.DetectorConfigLoader;
import com.edgesentinel.core.detection.ShardedMonitor;
import com.edgesentinel.core.model.Alert;
import com.edgesentinel.core.model.FlowRecord;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the Edge Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (flows topic)
 *     → Deserialize JSON → FlowRecord
 *     → Key by source partition
 *     → MidasProcessFunction (update + score per key)
 *     → Serialize Alert → JSON
 *     → Kafka (alerts topic)
 * </pre>
 *
 * <p>
 * The detector reads its own clock from the flow timestamps, so the source
 * assigns no watermarks. Checkpointing is exactly-once so the per-shard
 * detector state survives failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class EdgeSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(EdgeSentinelJob.class);

    private EdgeSentinelJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws Exception {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Edge Sentinel with config: {}", config);

        DetectorConfig detectorConfig = loadDetectorConfig(config);
        LOG.info("Using {} detector '{}' over {} partition(s)", detectorConfig.getType(),
                detectorConfig.getName(), MidasProcessFunction.partitionCount(detectorConfig));

        HealthServer healthServer = new HealthServer();
        healthServer.start(config.getHealthPort());
        Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(config.getParallelism());
        configureCheckpointing(env, config);

        buildPipeline(env, config, detectorConfig);

        env.execute("Edge Sentinel – MIDAS-R Edge Burst Detection");
    }

    // ---------------------------------------------------------------
    // Pipeline assembly
    // ---------------------------------------------------------------

    /**
     * Build the Kafka → Flink → Kafka pipeline.
     */
    static void buildPipeline(StreamExecutionEnvironment env,
            JobConfig config,
            DetectorConfig detectorConfig) {
        KafkaSource<FlowRecord> kafkaSource = KafkaSource.<FlowRecord>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getKafkaInputTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setValueOnlyDeserializer(new FlowRecordDeserializationSchema())
                .build();

        DataStream<FlowRecord> flows = env.fromSource(
                kafkaSource, WatermarkStrategy.noWatermarks(), "kafka-flows-source");

        int partitions = MidasProcessFunction.partitionCount(detectorConfig);
        DataStream<Alert> alerts = flows
                .filter(Objects::nonNull) // deserialization failures
                .keyBy(flow -> ShardedMonitor.shardFor(flow.getSrc(), partitions), Types.INT)
                .process(new MidasProcessFunction(detectorConfig))
                .name("midas-r-detection");

        KafkaSink<Alert> kafkaSink = KafkaSink.<Alert>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setRecordSerializer(
                        KafkaRecordSerializationSchema.builder()
                                .setTopic(config.getKafkaAlertTopic())
                                .setValueSerializationSchema(new AlertSerializationSchema())
                                .build())
                .build();

        alerts.sinkTo(kafkaSink).name("kafka-alerts-sink");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Resolve the detector config and apply the job's shard override.
     */
    static DetectorConfig loadDetectorConfig(JobConfig config) {
        String path = config.getDetectorConfigPath();
        DetectorConfig detectorConfig = path != null && !path.isBlank()
                ? DetectorConfigLoader.fromFile(path)
                : DetectorConfigLoader.load();
        if (config.getShards() != null) {
            detectorConfig.setShards(config.getShards());
            detectorConfig.validate();
        }
        return detectorConfig;
    }

    private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
        long interval = config.getCheckpointIntervalMs();
        env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

        CheckpointConfig cpConfig = env.getCheckpointConfig();
        cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
        cpConfig.setCheckpointTimeout(interval * 2);
        cpConfig.setMaxConcurrentCheckpoints(1);
        cpConfig.setExternalizedCheckpointCleanup(
                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
    }
}
