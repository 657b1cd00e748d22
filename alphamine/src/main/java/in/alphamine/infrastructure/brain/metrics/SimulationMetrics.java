package in.alphamine.infrastructure.brain.metrics;

import in.alphamine.domain.simulation.JobStatus;

import java.time.Duration;

/**
 * Metrics for the platform client, the job poller and the batch runner.
 *
 * Implementations can publish to Prometheus or any other backend.
 */
public interface SimulationMetrics {

    /**
     * Record one HTTP exchange with the platform.
     *
     * @param method  HTTP method
     * @param status  response status code
     * @param latency round-trip time
     */
    void recordRequest(String method, int status, Duration latency);

    /**
     * Record a retry after a transport failure or timeout.
     *
     * @param reason short reason label (TIMEOUT, TRANSPORT, ...)
     */
    void recordRetry(String reason);

    /**
     * Record a server-directed wait after a 429.
     */
    void recordRateLimitWait(Duration wait);

    /**
     * Record a login attempt.
     */
    void recordAuthentication(boolean success, Duration latency);

    /**
     * Record how a polled job ended.
     *
     * @param profile  polling profile name
     * @param status   terminal status
     * @param polls    counted poll attempts
     */
    void recordJobCompleted(String profile, JobStatus status, int polls);

    /**
     * Record the result of one orchestrated simulation.
     */
    void recordSimulation(boolean success, Duration elapsed);

    /**
     * Current number of simulations running in worker threads.
     */
    void updateInFlight(int inFlight);
}
