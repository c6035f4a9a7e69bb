package com.edgesentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults should be valid")
    void shouldBuildDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaInputTopic()).isEqualTo("flows");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("edge-alerts");
        assertThat(config.getKafkaGroupId()).isEqualTo("edge-sentinel");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getCheckpointIntervalMs()).isEqualTo(60_000L);
        assertThat(config.getDetectorConfigPath()).isEmpty();
        assertThat(config.getShards()).isNull();
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Builder should carry explicit values")
    void shouldCarryExplicitValues() {
        JobConfig config = new JobConfig.Builder()
                .kafkaInputTopic("netflow")
                .parallelism(4)
                .shards(16)
                .detectorConfigPath("/etc/edge/detector.yml")
                .build();

        assertThat(config.getKafkaInputTopic()).isEqualTo("netflow");
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getShards()).isEqualTo(16);
        assertThat(config.getDetectorConfigPath()).isEqualTo("/etc/edge/detector.yml");
        assertThat(config.toString()).contains("shards=16");
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .hasMessageContaining("checkpointIntervalMs");
        assertThatThrownBy(() -> new JobConfig.Builder().shards(0).build())
                .hasMessageContaining("shards");
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaAlertTopic(" ").build())
                .hasMessageContaining("kafkaAlertTopic");
    }
}
