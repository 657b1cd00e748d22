package in.alphamine.infrastructure.brain.metrics;

import in.alphamine.domain.simulation.JobStatus;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of SimulationMetrics.
 *
 * Key Metrics:
 * - brain_requests_total{method, status} - HTTP exchanges with the platform
 * - brain_request_latency_seconds{method} - round-trip latency
 * - brain_retries_total{reason} - transport retries
 * - brain_rate_limit_waits_total / brain_rate_limit_wait_seconds - 429 handling
 * - brain_authentications_total{status} - logins
 * - brain_jobs_total{profile, status} - terminal job states
 * - simulations_total{status} - orchestrated simulations
 * - simulations_in_flight - simulations currently in worker threads
 */
public class PrometheusSimulationMetrics implements SimulationMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusSimulationMetrics.class);

    private final CollectorRegistry registry;

    private final Counter requestCounter;
    private final Histogram requestLatency;
    private final Counter retryCounter;
    private final Counter rateLimitCounter;
    private final Histogram rateLimitWait;
    private final Counter authCounter;
    private final Histogram authLatency;
    private final Counter jobCounter;
    private final Histogram jobPolls;
    private final Counter simulationCounter;
    private final Histogram simulationDuration;
    private final Gauge inFlight;

    public PrometheusSimulationMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusSimulationMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.requestCounter = Counter.build()
            .name("brain_requests_total")
            .help("Total number of HTTP requests sent to the platform")
            .labelNames("method", "status")
            .register(registry);

        this.requestLatency = Histogram.build()
            .name("brain_request_latency_seconds")
            .help("Platform request latency in seconds")
            .labelNames("method")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0, 30.0)
            .register(registry);

        this.retryCounter = Counter.build()
            .name("brain_retries_total")
            .help("Total number of request retries after transport failures")
            .labelNames("reason")
            .register(registry);

        this.rateLimitCounter = Counter.build()
            .name("brain_rate_limit_waits_total")
            .help("Total number of waits directed by a 429 response")
            .register(registry);

        this.rateLimitWait = Histogram.build()
            .name("brain_rate_limit_wait_seconds")
            .help("Duration of rate limit waits in seconds")
            .buckets(0.5, 1.0, 2.0, 5.0, 10.0, 30.0, 60.0)
            .register(registry);

        this.authCounter = Counter.build()
            .name("brain_authentications_total")
            .help("Total number of login attempts")
            .labelNames("status")
            .register(registry);

        this.authLatency = Histogram.build()
            .name("brain_authentication_latency_seconds")
            .help("Login latency in seconds")
            .buckets(0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0)
            .register(registry);

        this.jobCounter = Counter.build()
            .name("brain_jobs_total")
            .help("Total number of polled jobs by terminal status")
            .labelNames("profile", "status")
            .register(registry);

        this.jobPolls = Histogram.build()
            .name("brain_job_polls")
            .help("Counted poll attempts per job")
            .labelNames("profile")
            .buckets(1, 2, 5, 10, 20, 30, 60)
            .register(registry);

        this.simulationCounter = Counter.build()
            .name("simulations_total")
            .help("Total number of orchestrated simulations")
            .labelNames("status")
            .register(registry);

        this.simulationDuration = Histogram.build()
            .name("simulation_duration_seconds")
            .help("End-to-end simulation duration in seconds")
            .buckets(5, 15, 30, 60, 120, 300, 600)
            .register(registry);

        this.inFlight = Gauge.build()
            .name("simulations_in_flight")
            .help("Simulations currently running in worker threads")
            .register(registry);

        log.info("[PrometheusSimulationMetrics] Metrics registered");
    }

    @Override
    public void recordRequest(String method, int status, Duration latency) {
        requestCounter.labels(method, String.valueOf(status)).inc();
        requestLatency.labels(method).observe(seconds(latency));
    }

    @Override
    public void recordRetry(String reason) {
        retryCounter.labels(reason).inc();
    }

    @Override
    public void recordRateLimitWait(Duration wait) {
        rateLimitCounter.inc();
        rateLimitWait.observe(seconds(wait));
    }

    @Override
    public void recordAuthentication(boolean success, Duration latency) {
        authCounter.labels(success ? "success" : "failure").inc();
        authLatency.observe(seconds(latency));
    }

    @Override
    public void recordJobCompleted(String profile, JobStatus status, int polls) {
        jobCounter.labels(profile, status.name()).inc();
        jobPolls.labels(profile).observe(polls);
    }

    @Override
    public void recordSimulation(boolean success, Duration elapsed) {
        simulationCounter.labels(success ? "success" : "failure").inc();
        simulationDuration.observe(seconds(elapsed));
    }

    @Override
    public void updateInFlight(int count) {
        inFlight.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
