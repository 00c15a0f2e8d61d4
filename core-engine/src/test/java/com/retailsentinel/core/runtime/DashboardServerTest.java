package com.retailsentinel.core.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailsentinel.core.emit.DashboardAggregator;
import com.retailsentinel.core.model.Station;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static com.retailsentinel.core.RecordFixtures.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DashboardServer} over a real ephemeral port.
 */
class DashboardServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private DashboardAggregator aggregator;
    private DashboardServer server;

    @BeforeEach
    void setUp() {
        aggregator = new DashboardAggregator(10);
        server = new DashboardServer(aggregator::snapshot);
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should answer health and readiness checks")
    void answersHealthChecks() throws Exception {
        assertThat(get("/health").statusCode()).isEqualTo(200);
        HttpResponse<String> readiness = get("/readiness");
        assertThat(readiness.statusCode()).isEqualTo(200);
        assertThat(readiness.body()).contains("UP");
    }

    @Test
    @DisplayName("Should serve the latest snapshot as JSON with CORS")
    void servesSnapshot() throws Exception {
        Station station = new Station("SCC1");
        station.observe("Active", at(5));
        station.updateCustomerCount(3);
        aggregator.refresh(at(10), List.of(station), 2, 0, 0);

        HttpResponse<String> response = get("/api/data");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).contains("*");
        JsonNode body = new ObjectMapper().readTree(response.body());
        assertThat(body.path("summary").path("total_stations").asInt()).isEqualTo(1);
        assertThat(body.path("summary").path("dropped_late").asInt()).isEqualTo(2);
        assertThat(body.path("stations").path("SCC1").path("customer_count").asInt()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should answer CORS preflight with no content")
    void answersPreflight() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri("/api/data"))
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                .build();

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(204);
    }

    @Test
    @DisplayName("Should expose only health endpoints when built without a snapshot source")
    void healthOnlyServer() throws Exception {
        DashboardServer server = DashboardServer.healthOnly();
        server.start(0);
        try {
            URI base = URI.create("http://localhost:" + server.getPort());
            HttpResponse<String> health = client.send(HttpRequest.newBuilder(base.resolve("/health")).build(),
                    HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> data = client.send(HttpRequest.newBuilder(base.resolve("/api/data")).build(),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(health.statusCode()).isEqualTo(200);
            assertThat(data.statusCode()).isEqualTo(404);
        } finally {
            server.stop();
        }
    }

    @Test
    @DisplayName("Should report state and reject invalid ports")
    void reportsState() {
        assertThat(server.isRunning()).isTrue();
        assertThat(server.getPort()).isPositive();
        assertThatThrownBy(() -> new DashboardServer(aggregator::snapshot).start(70_000))
                .isInstanceOf(IllegalArgumentException.class);

        server.stop();
        assertThat(server.isRunning()).isFalse();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }
}
