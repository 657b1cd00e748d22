package in.alphamine.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.alphamine.domain.common.BatchResult;
import in.alphamine.domain.common.ErrorKind;
import in.alphamine.domain.simulation.JobStatus;
import in.alphamine.domain.simulation.SimulationRequest;
import in.alphamine.domain.simulation.SimulationResult;
import in.alphamine.domain.simulation.SimulationSettings;
import in.alphamine.infrastructure.brain.BrainClient;
import in.alphamine.infrastructure.brain.BrainRequestException;
import in.alphamine.infrastructure.brain.TransientNetworkException;
import in.alphamine.infrastructure.brain.job.JobFailedException;
import in.alphamine.infrastructure.brain.job.JobPoller;
import in.alphamine.infrastructure.brain.job.PollingProfile;
import in.alphamine.infrastructure.brain.job.SimulationJob;
import in.alphamine.infrastructure.brain.metrics.SimulationMetrics;
import in.alphamine.service.validation.ExpressionValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BatchSimulationOrchestrator.
 *
 * Tests:
 * - One entry per request, in request order
 * - Failure isolation and classification
 * - Concurrency bound
 * - Independent regions
 * - Tolerated alpha-details failures
 */
@ExtendWith(MockitoExtension.class)
class BatchSimulationOrchestratorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private BrainClient client;

    @Mock
    private JobPoller poller;

    @Mock
    private SimulationMetrics metrics;

    private BoundedWorkerPool pool;
    private BatchSimulationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        pool = new BoundedWorkerPool("sim-test");
        orchestrator = new BatchSimulationOrchestrator(client, poller, new ExpressionValidator(), pool,
            PollingProfile.forSimulation(), metrics);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private void submitsWithHandleFromExpression() {
        when(client.submitSimulation(anyString(), any(SimulationSettings.class)))
            .thenAnswer(inv -> SimulationJob.submitted("/simulations/" + inv.getArgument(0).hashCode()));
    }

    private static JsonNode completed(String alphaId) {
        return MAPPER.createObjectNode().put("status", "COMPLETE").put("alpha", alphaId);
    }

    private static JsonNode details(double sharpe) {
        ObjectNode node = MAPPER.createObjectNode();
        node.putObject("is").put("sharpe", sharpe).put("fitness", 1.1).put("turnover", 0.2);
        return node;
    }

    @Test
    void testEveryRequestYieldsOneEntryInOrder() {
        submitsWithHandleFromExpression();
        when(poller.await(any(SimulationJob.class), any(PollingProfile.class))).thenReturn(completed("A1"));
        when(client.getAlphaDetails("A1")).thenReturn(details(1.4));

        List<SimulationRequest> requests = IntStream.range(1, 8)
            .mapToObj(i -> SimulationRequest.of("ts_mean(close, " + i + ")"))
            .toList();

        BatchResult<SimulationRequest, SimulationResult> result = orchestrator.simulateBatch(requests, 3);

        assertEquals(7, result.size());
        assertEquals(7, result.successCount());
        for (int i = 0; i < requests.size(); i++) {
            assertSame(requests.get(i), result.entries().get(i).input());
            SimulationResult simulation = result.entries().get(i).outcome().value();
            assertEquals("A1", simulation.alphaId());
            assertEquals(1.4, simulation.metrics().sharpe(), 1e-9);
        }
        verify(metrics, times(7)).recordSimulation(eq(true), any());
    }

    @Test
    void testFailuresAreIsolatedAndClassified() {
        submitsWithHandleFromExpression();
        when(poller.await(any(SimulationJob.class), any(PollingProfile.class))).thenAnswer(inv -> {
            SimulationJob job = inv.getArgument(0);
            if (job.handle().equals("/simulations/" + "rank(volume)".hashCode())) {
                throw new JobFailedException(job.handle(), JobStatus.FAILED, "bad data", null);
            }
            return completed("A2");
        });
        when(client.getAlphaDetails("A2")).thenReturn(details(0.9));

        List<SimulationRequest> requests = List.of(
            SimulationRequest.of("rank(close)"),
            SimulationRequest.of("rank(close"),
            SimulationRequest.of("rank(volume)"));

        BatchResult<SimulationRequest, SimulationResult> result = orchestrator.simulateBatch(requests, 2);

        assertEquals(3, result.size());
        assertTrue(result.entries().get(0).isSuccess());
        assertEquals(ErrorKind.VALIDATION, result.entries().get(1).outcome().errorKind());
        assertEquals(ErrorKind.JOB_FAILED, result.entries().get(2).outcome().errorKind());
        verify(client, never()).submitSimulation(eq("rank(close"), any());
        verify(metrics, times(2)).recordSimulation(eq(false), any());
    }

    @Test
    void testConcurrencyBound() {
        submitsWithHandleFromExpression();
        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(poller.await(any(SimulationJob.class), any(PollingProfile.class))).thenAnswer(inv -> {
            peak.accumulateAndGet(current.incrementAndGet(), Math::max);
            Thread.sleep(15);
            current.decrementAndGet();
            return MAPPER.createObjectNode().put("status", "COMPLETE");
        });

        List<SimulationRequest> requests = IntStream.range(0, 12)
            .mapToObj(i -> SimulationRequest.of("ts_delta(close, " + (i + 1) + ")"))
            .toList();

        BatchResult<SimulationRequest, SimulationResult> result = orchestrator.simulateBatch(requests, 4);

        assertEquals(12, result.successCount());
        assertTrue(peak.get() <= 4, "Peak in flight was " + peak.get());
        verify(client, never()).getAlphaDetails(anyString());
    }

    @Test
    void testRegionsAreIndependent() {
        when(client.submitSimulation(anyString(), any(SimulationSettings.class))).thenAnswer(inv -> {
            SimulationSettings settings = inv.getArgument(1);
            if (settings.region().equals("EUR")) {
                throw new BrainRequestException("region not enabled", 403, "{}");
            }
            return SimulationJob.submitted("/simulations/" + settings.region());
        });
        when(poller.await(any(SimulationJob.class), any(PollingProfile.class))).thenReturn(completed("U1"));
        when(client.getAlphaDetails("U1")).thenReturn(details(1.3));

        List<SimulationRequest> requests = List.of(
            SimulationRequest.of("rank(close)"),
            SimulationRequest.of("rank(volume)"));

        Map<String, BatchResult<SimulationRequest, SimulationResult>> byRegion =
            orchestrator.simulateMultipleRegions(requests, List.of("USA", "EUR"), 2);

        assertEquals(List.of("USA", "EUR"), List.copyOf(byRegion.keySet()));
        assertEquals(2, byRegion.get("USA").successCount());
        assertEquals(0, byRegion.get("EUR").successCount());
        assertEquals(2, byRegion.get("EUR").size());
        assertEquals(ErrorKind.REMOTE_REJECTED, byRegion.get("EUR").entries().get(0).outcome().errorKind());
        assertEquals("EUR", byRegion.get("EUR").entries().get(1).input().settings().region());
    }

    @Test
    void testDetailsFailureIsTolerated() {
        submitsWithHandleFromExpression();
        when(poller.await(any(SimulationJob.class), any(PollingProfile.class))).thenReturn(completed("A9"));
        when(client.getAlphaDetails("A9"))
            .thenThrow(new TransientNetworkException("details unavailable", 503, "", null));

        SimulationResult result = orchestrator.simulate(SimulationRequest.of("rank(close)"));

        assertEquals("A9", result.alphaId());
        assertNull(result.alphaDetails());
        assertFalse(result.hasMetrics());
    }

    @Test
    void testMissingAlphaIdSkipsDetails() {
        submitsWithHandleFromExpression();
        when(poller.await(any(SimulationJob.class), any(PollingProfile.class)))
            .thenReturn(MAPPER.createObjectNode().put("status", "COMPLETE"));

        SimulationResult result = orchestrator.simulate(SimulationRequest.of("rank(close)"));

        assertNull(result.alphaId());
        assertEquals("/simulations/" + "rank(close)".hashCode(), result.jobHandle());
        verify(client, never()).getAlphaDetails(anyString());
        verify(metrics).updateInFlight(1);
        verify(metrics).updateInFlight(0);
    }
}
