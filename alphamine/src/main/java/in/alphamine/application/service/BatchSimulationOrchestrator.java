package in.alphamine.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import in.alphamine.domain.common.BatchEntry;
import in.alphamine.domain.common.BatchResult;
import in.alphamine.domain.simulation.MetricSet;
import in.alphamine.domain.simulation.SimulationRequest;
import in.alphamine.domain.simulation.SimulationResult;
import in.alphamine.infrastructure.brain.BrainClient;
import in.alphamine.infrastructure.brain.BrainException;
import in.alphamine.infrastructure.brain.job.JobPoller;
import in.alphamine.infrastructure.brain.job.PollingProfile;
import in.alphamine.infrastructure.brain.job.SimulationJob;
import in.alphamine.infrastructure.brain.metrics.SimulationMetrics;
import in.alphamine.service.validation.ExpressionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs simulations concurrently through a bounded worker budget.
 *
 * Per request: validate -> submit -> poll to terminal -> fetch alpha details. A failure
 * to fetch details is logged and tolerated; any other failure becomes a failure Outcome
 * for that request only.
 */
public final class BatchSimulationOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BatchSimulationOrchestrator.class);

    private final BrainClient client;
    private final JobPoller poller;
    private final ExpressionValidator validator;
    private final BoundedWorkerPool pool;
    private final PollingProfile profile;
    private final SimulationMetrics metrics;

    private final AtomicInteger inFlight = new AtomicInteger();

    /**
     * @param metrics may be null
     */
    public BatchSimulationOrchestrator(BrainClient client, JobPoller poller, ExpressionValidator validator,
                                       BoundedWorkerPool pool, PollingProfile profile, SimulationMetrics metrics) {
        this.client = client;
        this.poller = poller;
        this.validator = validator;
        this.pool = pool;
        this.profile = profile;
        this.metrics = metrics;
    }

    public BatchResult<SimulationRequest, SimulationResult> simulateBatch(List<SimulationRequest> requests,
                                                                          int maxConcurrency) {
        return simulateBatch(requests, maxConcurrency, null);
    }

    /**
     * @param listener receives each entry as it completes, may be null
     */
    public BatchResult<SimulationRequest, SimulationResult> simulateBatch(
            List<SimulationRequest> requests,
            int maxConcurrency,
            Consumer<BatchEntry<SimulationRequest, SimulationResult>> listener) {

        log.info("═══════════════════════════════════════════════════════");
        log.info("[BATCH] Simulating {} expressions, max {} concurrent", requests.size(), maxConcurrency);

        BatchResult<SimulationRequest, SimulationResult> result =
            pool.run(requests, maxConcurrency, this::simulate, listener);

        log.info("[BATCH] Done: {}/{} succeeded", result.successCount(), result.size());
        for (BatchEntry<SimulationRequest, SimulationResult> failure : result.failures()) {
            log.warn("[BATCH]   failed #{} {}: {} {}", failure.index(), abbreviate(failure.input().expression()),
                failure.outcome().errorKind(), failure.outcome().errorMessage());
        }
        log.info("═══════════════════════════════════════════════════════");
        return result;
    }

    /**
     * Run the same requests in each region, one region after another. Regions do not
     * affect each other: a region whose batch fails entirely still yields its entries.
     */
    public Map<String, BatchResult<SimulationRequest, SimulationResult>> simulateMultipleRegions(
            List<SimulationRequest> requests, List<String> regions, int maxConcurrency) {

        Map<String, BatchResult<SimulationRequest, SimulationResult>> byRegion = new LinkedHashMap<>();
        for (String region : regions) {
            log.info("[BATCH] Region {}", region);
            List<SimulationRequest> regional = requests.stream()
                .map(request -> request.inRegion(region))
                .toList();
            byRegion.put(region, simulateBatch(regional, maxConcurrency));
        }
        return byRegion;
    }

    /**
     * Simulate one request on the calling thread.
     */
    public SimulationResult simulate(SimulationRequest request) {
        Instant start = Instant.now();
        updateInFlight(inFlight.incrementAndGet());
        boolean success = false;
        try {
            validator.requireValid(request.expression());

            SimulationJob job = client.submitSimulation(request.expression(), request.settings());
            JsonNode simulation = poller.await(job, profile);

            String alphaId = simulation.hasNonNull("alpha") ? simulation.get("alpha").asText() : null;
            JsonNode details = null;
            MetricSet metricSet = null;
            if (alphaId == null || alphaId.isEmpty()) {
                log.warn("[BATCH] Simulation of {} completed without an alpha id", abbreviate(request.expression()));
            } else {
                details = fetchDetails(alphaId);
                if (details != null && details.path("is").isObject()) {
                    metricSet = MetricSet.fromApiFormat(details.get("is"));
                }
            }

            success = true;
            return new SimulationResult(request, job.handle(), simulation, alphaId, details, metricSet);
        } finally {
            updateInFlight(inFlight.decrementAndGet());
            if (metrics != null) {
                metrics.recordSimulation(success, Duration.between(start, Instant.now()));
            }
        }
    }

    private JsonNode fetchDetails(String alphaId) {
        try {
            return client.getAlphaDetails(alphaId);
        } catch (BrainException e) {
            log.warn("[BATCH] Could not fetch details for alpha {}: {}", alphaId, e.getMessage());
            return null;
        }
    }

    private void updateInFlight(int count) {
        if (metrics != null) {
            metrics.updateInFlight(count);
        }
    }

    private static String abbreviate(String expression) {
        return expression.length() <= 60 ? expression : expression.substring(0, 60) + "...";
    }
}
