package com.infrasentinel.flink;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Lightweight HTTP server that exposes health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200 OK} with body {@code {"status":"UP"}}
 * while the process runs</li>
 * <li>{@code GET /readiness}: {@code 200 OK} once the readiness check passes
 * (baseline fitted), {@code 503} with {@code {"status":"NOT_READY"}}
 * before</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] UP_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NOT_READY_RESPONSE =
            "{\"status\":\"NOT_READY\"}".getBytes(StandardCharsets.UTF_8);

    private final BooleanSupplier readiness;
    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param readiness evaluated on every {@code /readiness} request
     */
    public HealthServer(BooleanSupplier readiness) {
        this.readiness = Objects.requireNonNull(readiness, "Readiness check must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start health server on port " + port, e);
        }
        server.createContext("/health", exchange -> respond(exchange, 200, UP_RESPONSE));
        server.createContext("/readiness", this::handleReadiness);

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
     * Stop the health server gracefully.
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

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (readiness.getAsBoolean()) {
            respond(exchange, 200, UP_RESPONSE);
        } else {
            respond(exchange, 503, NOT_READY_RESPONSE);
        }
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
