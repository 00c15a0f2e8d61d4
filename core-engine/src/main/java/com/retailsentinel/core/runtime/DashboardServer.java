package com.retailsentinel.core.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailsentinel.core.emit.DashboardSnapshot;
import com.retailsentinel.core.emit.EventJson;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server for health checks and the dashboard feed.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200 OK} with body {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness}: same; readiness check target</li>
 * <li>{@code GET /api/data}: the current {@link DashboardSnapshot} as JSON,
 * with a permissive CORS header for browser dashboards. Only registered when
 * a snapshot source is given; a health-only server answers {@code 404}.</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class DashboardServer {

    private static final Logger LOG = LoggerFactory.getLogger(DashboardServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final Supplier<DashboardSnapshot> snapshots;
    private final ObjectMapper mapper = EventJson.newMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private HttpServer server;

    /**
     * @param snapshots source of the latest snapshot; called on the server thread
     */
    public DashboardServer(Supplier<DashboardSnapshot> snapshots) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots must not be null");
    }

    private DashboardServer() {
        this.snapshots = null;
    }

    /**
     * @return a server exposing only {@code /health} and {@code /readiness}
     */
    public static DashboardServer healthOnly() {
        return new DashboardServer();
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to, or {@code 0} for an ephemeral port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("Dashboard port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", DashboardServer::handleHealthCheck);
            server.createContext("/readiness", DashboardServer::handleHealthCheck);
            if (snapshots != null) {
                server.createContext("/api/data", this::handleData);
            }

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "dashboard-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Dashboard server started on port {}", getPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start dashboard server on port " + port, e);
        }
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Dashboard server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} if not started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, HEALTH_RESPONSE.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(HEALTH_RESPONSE);
        }
    }

    private void handleData(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return;
        }
        byte[] body = mapper.writeValueAsBytes(snapshots.get());
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
