package com.edgesentinel.flink;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    private final HealthServer server = new HealthServer();
    private final HttpClient client = HttpClient.newHttpClient();

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> send(String method, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(
                        URI.create("http://localhost:" + server.getPort() + path))
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Should answer health and readiness probes")
    void shouldServeProbes() throws Exception {
        server.start(0);

        assertThat(server.isRunning()).isTrue();
        assertThat(send("GET", "/health").body()).isEqualTo("{\"status\":\"UP\"}");
        assertThat(send("GET", "/readiness").statusCode()).isEqualTo(200);
        assertThat(send("POST", "/health").statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Should stop idempotently")
    void shouldStop() {
        server.start(0);
        server.stop();
        server.stop();

        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should reject an out-of-range port")
    void shouldRejectBadPort() {
        assertThatThrownBy(() -> server.start(70_000))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
