package com.edgesentinel.flink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the Edge Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job is
 * configured the same way in a Kubernetes Deployment, a Docker {@code -e}
 * flag or a shell.
 * </p>
 *
 * <h3>Environment Variables</h3>
 * <ul>
 * <li>{@code KAFKA_BOOTSTRAP_SERVERS} (default {@code localhost:9092})</li>
 * <li>{@code KAFKA_INPUT_TOPIC} (default {@code flows})</li>
 * <li>{@code KAFKA_ALERT_TOPIC} (default {@code edge-alerts})</li>
 * <li>{@code KAFKA_GROUP_ID} (default {@code edge-sentinel})</li>
 * <li>{@code FLINK_PARALLELISM}, {@code FLINK_CHECKPOINT_INTERVAL_MS}</li>
 * <li>{@code DETECTOR_CONFIG_PATH}: YAML detector config file; blank means
 * classpath {@code detector.yml}</li>
 * <li>{@code DETECTOR_SHARDS}: overrides the detector's shard count when
 * set</li>
 * <li>{@code HEALTH_PORT} (default {@code 8080})</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Detector
    // ---------------------------------------------------------------
    private final String detectorConfigPath;
    private final Integer shards;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.detectorConfigPath = b.detectorConfigPath;
        this.shards = b.shards;
        this.healthPort = b.healthPort;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            String shardsEnv = env("DETECTOR_SHARDS", "");
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "flows"))
                    .kafkaAlertTopic(env("KAFKA_ALERT_TOPIC", "edge-alerts"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "edge-sentinel"))
                    .parallelism(Integer.parseInt(env("FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(env("FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .detectorConfigPath(env("DETECTOR_CONFIG_PATH", ""))
                    .shards(shardsEnv.isEmpty() ? null : Integer.valueOf(shardsEnv))
                    .healthPort(Integer.parseInt(env("HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public String getDetectorConfigPath() {
        return detectorConfigPath;
    }

    /**
     * @return shard count override, or {@code null} to keep the detector
     *         config's value
     */
    public Integer getShards() {
        return shards;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} checks parallelism &gt; 0, checkpoint interval &gt; 0,
     * shards &gt; 0 when set, port in [1, 65535] and non-blank topic names.
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "flows";
        private String kafkaAlertTopic = "edge-alerts";
        private String kafkaGroupId = "edge-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String detectorConfigPath = "";
        private Integer shards;
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder detectorConfigPath(String v) {
            this.detectorConfigPath = v;
            return this;
        }

        public Builder shards(Integer v) {
            this.shards = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (shards != null && shards < 1) {
                throw new IllegalArgumentException("shards must be >= 1, got: " + shards);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", detectorConfigPath='" + detectorConfigPath + '\'' +
                ", shards=" + shards +
                ", healthPort=" + healthPort +
                '}';
    }
}
