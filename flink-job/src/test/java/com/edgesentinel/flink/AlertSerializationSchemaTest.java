package com.edgesentinel.flink;

import com.edgesentinel.core.model.Alert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertSerializationSchema}.
 */
class AlertSerializationSchemaTest {

    @Test
    @DisplayName("Should write alert fields with an ISO-8601 timestamp")
    void shouldSerializeAlert() {
        Alert alert = Alert.builder()
                .monitorName("edge_burst#3")
                .src("A")
                .dst("B")
                .score(998.0)
                .threshold(3.84)
                .mode("raw")
                .timestamp(Instant.parse("2024-01-01T00:00:02Z"))
                .details("count=1000")
                .build();

        String json = new String(new AlertSerializationSchema().serialize(alert), StandardCharsets.UTF_8);

        assertThat(json)
                .contains("\"monitorName\":\"edge_burst#3\"")
                .contains("\"src\":\"A\"")
                .contains("\"dst\":\"B\"")
                .contains("\"score\":998.0")
                .contains("\"mode\":\"raw\"")
                .contains("\"timestamp\":\"2024-01-01T00:00:02Z\"");
    }
}
