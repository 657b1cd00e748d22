package in.alphamine.infrastructure.brain.metrics;

import in.alphamine.domain.simulation.JobStatus;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 *
 * Tests:
 * - Endpoint accessibility and text format
 * - Metrics registration
 * - Metrics recording and export
 * - Non-GET requests are refused
 */
class MetricsEndpointTest {

    private Undertow server;
    private PrometheusSimulationMetrics metrics;
    private HttpClient httpClient;
    private URI metricsUri;

    @BeforeEach
    void setUp() {
        CollectorRegistry registry = new CollectorRegistry();
        metrics = new PrometheusSimulationMetrics(registry);

        server = Undertow.builder()
            .addHttpListener(0, "localhost")
            .setHandler(Handlers.path().addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        int port = ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
        metricsUri = URI.create("http://localhost:" + port + "/metrics");
        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        HttpRequest request = HttpRequest.newBuilder().uri(metricsUri).GET().build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"), "Content-Type should be text/plain for Prometheus format");
        assertFalse(response.body().isEmpty(), "Response body should not be empty");
    }

    @Test
    void testMetricsContainExpectedMetrics() throws Exception {
        String body = scrape().body();

        assertTrue(body.contains("brain_requests_total"));
        assertTrue(body.contains("brain_request_latency_seconds"));
        assertTrue(body.contains("brain_rate_limit_waits_total"));
        assertTrue(body.contains("simulations_in_flight"));
        assertTrue(body.contains("# HELP"), "Metrics should contain HELP declarations");
        assertTrue(body.contains("# TYPE"), "Metrics should contain TYPE declarations");
    }

    @Test
    void testMetricsRecordingAndExport() throws Exception {
        metrics.recordRequest("POST", 201, Duration.ofMillis(150));
        metrics.recordRequest("GET", 429, Duration.ofMillis(40));
        metrics.recordRetry("TIMEOUT");
        metrics.recordRateLimitWait(Duration.ofMillis(2500));
        metrics.recordAuthentication(true, Duration.ofMillis(300));
        metrics.recordJobCompleted("simulation", JobStatus.COMPLETE, 7);
        metrics.recordSimulation(false, Duration.ofSeconds(40));
        metrics.updateInFlight(3);

        String body = scrape().body();

        assertTrue(body.contains("brain_requests_total{method=\"POST\",status=\"201\",} 1.0"), body);
        assertTrue(body.contains("brain_requests_total{method=\"GET\",status=\"429\",} 1.0"));
        assertTrue(body.contains("brain_retries_total{reason=\"TIMEOUT\",} 1.0"));
        assertTrue(body.contains("brain_rate_limit_waits_total 1.0"));
        assertTrue(body.contains("brain_authentications_total{status=\"success\",} 1.0"));
        assertTrue(body.contains("brain_jobs_total{profile=\"simulation\",status=\"COMPLETE\",} 1.0"));
        assertTrue(body.contains("simulations_total{status=\"failure\",} 1.0"));
        assertTrue(body.contains("simulations_in_flight 3.0"));
    }

    @Test
    void testMetricsFormat() throws Exception {
        metrics.recordRequest("GET", 200, Duration.ofMillis(80));

        String body = scrape().body();

        assertTrue(body.contains("# HELP brain_requests_total"));
        assertTrue(body.contains("# TYPE brain_requests_total counter"));
        assertTrue(body.contains("brain_request_latency_seconds_count{method=\"GET\",} 1.0"));
    }

    @Test
    void testPostRefused() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(metricsUri)
            .POST(HttpRequest.BodyPublishers.noBody())
            .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(405, response.statusCode());
        assertEquals("GET", response.headers().firstValue("Allow").orElse(""));
    }
}
