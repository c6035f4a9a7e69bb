package com.edgesentinel.flink;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Health and readiness endpoints for container probes, served by the JDK
 * {@link HttpServer}.
 *
 * <ul>
 * <li>{@code GET /health}: {@code 200} with {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness}: {@code 200} once the server runs</li>
 * </ul>
 *
 * Any other method on these paths gets {@code 405}.
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] UP = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * Start the server. A port of {@code 0} binds an ephemeral port, see
     * {@link #getPort()}.
     *
     * @param port TCP port in [0, 65535]
     * @throws IllegalArgumentException if the port is out of range
     * @throws IllegalStateException    if the server is already running
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        if (running.get()) {
            throw new IllegalStateException("Health server already running on port " + getPort());
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind health server on port " + port, e);
        }
        server.createContext("/health", HealthServer::handle);
        server.createContext("/readiness", HealthServer::handle);
        server.setExecutor(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "health-server");
            t.setDaemon(true);
            return t;
        }));
        server.start();
        running.set(true);
        LOG.info("Health server started on port {}", getPort());
    }

    /**
     * Stop the server. Safe to call more than once.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} when not started
     */
    public int getPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    private static void handle(HttpExchange exchange) throws IOException {
        try (exchange) {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(405, -1);
                return;
            }
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, UP.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(UP);
            }
        }
    }
}
