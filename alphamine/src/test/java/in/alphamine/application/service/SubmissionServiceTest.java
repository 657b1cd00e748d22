package in.alphamine.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.alphamine.domain.common.BatchResult;
import in.alphamine.domain.common.ErrorKind;
import in.alphamine.domain.simulation.Alpha;
import in.alphamine.domain.simulation.AlphaCheck;
import in.alphamine.domain.simulation.CheckResult;
import in.alphamine.domain.simulation.MetricSet;
import in.alphamine.domain.simulation.SubmissionCriteria;
import in.alphamine.infrastructure.brain.AlphaProperties;
import in.alphamine.infrastructure.brain.AlphaQuery;
import in.alphamine.infrastructure.brain.BrainClient;
import in.alphamine.infrastructure.brain.BrainRequestException;
import in.alphamine.infrastructure.brain.job.JobPoller;
import in.alphamine.infrastructure.brain.job.PollingProfile;
import in.alphamine.infrastructure.brain.job.SimulationJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SubmissionService.
 *
 * Tests:
 * - Candidate paging, age cutoff and thresholds
 * - Submission of eligible alphas only
 * - Every input reported once, in input order
 */
@ExtendWith(MockitoExtension.class)
class SubmissionServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2024-03-10T00:00:00Z");

    @Mock
    private BrainClient client;

    @Mock
    private JobPoller poller;

    private BoundedWorkerPool pool;
    private SubmissionService service;
    private final SubmissionCriteria criteria = SubmissionCriteria.defaults();

    @BeforeEach
    void setUp() {
        pool = new BoundedWorkerPool("submit-test");
        service = new SubmissionService(client, poller, pool, PollingProfile.forSubmission(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private static ObjectNode listed(String id, double sharpe, String dateCreated) {
        ObjectNode alpha = MAPPER.createObjectNode();
        alpha.put("id", id);
        alpha.put("status", "UNSUBMITTED");
        alpha.put("dateCreated", dateCreated);
        alpha.putObject("regular").put("code", "rank(close)");
        ObjectNode is = alpha.putObject("is");
        is.put("sharpe", sharpe).put("fitness", 1.2).put("turnover", 0.3);
        is.putArray("checks").addObject().put("name", "LOW_SHARPE").put("result", "PASS");
        return alpha;
    }

    private static JsonNode page(List<ObjectNode> alphas) {
        ObjectNode page = MAPPER.createObjectNode();
        page.put("count", alphas.size());
        ArrayNode results = page.putArray("results");
        alphas.forEach(results::add);
        return page;
    }

    private static Alpha alpha(String id, double sharpe) {
        MetricSet metrics = new MetricSet(sharpe, 1.2, 0.3, 0.1, 0.05, 0.001, 900, 900,
            List.of(new AlphaCheck("LOW_SHARPE", CheckResult.PASS, 1.25, sharpe)));
        return new Alpha(id, "rank(close)", null, null, metrics, "UNSUBMITTED", "GOOD",
            List.of(), null, null, NOW);
    }

    @Test
    void testFindCandidatesPagesUntilShortPage() {
        List<ObjectNode> first = new ArrayList<>();
        for (int i = 0; i < SubmissionService.PAGE_SIZE; i++) {
            first.add(listed("p1-" + i, i % 10 == 0 ? 1.5 : 0.5, "2024-03-01T00:00:00Z"));
        }
        List<ObjectNode> second = List.of(
            listed("old", 2.0, "2024-01-01T00:00:00Z"),
            listed("fresh", 1.8, "2024-03-09T12:00:00Z"),
            listed("weak", 0.3, "2024-03-09T12:00:00Z"));
        when(client.listAlphas(any(AlphaQuery.class))).thenReturn(page(first), page(second));

        List<Alpha> candidates = service.findCandidates(criteria, 100, 30);

        assertEquals(6, candidates.size());
        assertEquals("p1-0", candidates.get(0).id());
        assertEquals("fresh", candidates.get(5).id());

        ArgumentCaptor<AlphaQuery> queries = ArgumentCaptor.forClass(AlphaQuery.class);
        verify(client, times(2)).listAlphas(queries.capture());
        assertEquals(0, queries.getAllValues().get(0).offset());
        assertEquals(SubmissionService.PAGE_SIZE, queries.getAllValues().get(1).offset());
        assertEquals("UNSUBMITTED", queries.getAllValues().get(0).status());
    }

    @Test
    void testFindCandidatesStopsAtMaxResults() {
        List<ObjectNode> first = new ArrayList<>();
        for (int i = 0; i < SubmissionService.PAGE_SIZE; i++) {
            first.add(listed("a" + i, 1.5, "2024-03-01T00:00:00Z"));
        }
        when(client.listAlphas(any(AlphaQuery.class))).thenReturn(page(first));

        List<Alpha> candidates = service.findCandidates(criteria, 3, 30);

        assertEquals(3, candidates.size());
        verify(client, times(1)).listAlphas(any(AlphaQuery.class));
    }

    @Test
    void testFindCandidatesEmptyListing() {
        when(client.listAlphas(any(AlphaQuery.class))).thenReturn(page(List.of()));

        assertTrue(service.findCandidates(criteria, 10, 30).isEmpty());
    }

    @Test
    void testSubmitAllReportsEveryAlphaInOrder() {
        when(client.startSubmission("good")).thenReturn(SimulationJob.submitted("/alphas/good/submit"));
        when(client.startSubmission("denied"))
            .thenThrow(new BrainRequestException("already submitted", 403, "{}"));
        when(poller.await(any(SimulationJob.class), any(PollingProfile.class)))
            .thenReturn(MAPPER.createObjectNode().put("id", "good"));

        List<Alpha> alphas = List.of(
            alpha("good", 1.6),
            alpha("weak", 0.4),
            alpha(null, 1.6),
            alpha("denied", 1.7));

        BatchResult<Alpha, JsonNode> result = service.submitAll(alphas, criteria, 2);

        assertEquals(4, result.size());
        assertEquals(1, result.successCount());
        assertEquals("good", result.entries().get(0).outcome().value().get("id").asText());
        assertEquals(ErrorKind.VALIDATION, result.entries().get(1).outcome().errorKind());
        assertTrue(result.entries().get(1).outcome().errorMessage().startsWith("Sharpe ratio too low"));
        assertEquals(ErrorKind.VALIDATION, result.entries().get(2).outcome().errorKind());
        assertEquals(ErrorKind.REMOTE_REJECTED, result.entries().get(3).outcome().errorKind());
        for (int i = 0; i < alphas.size(); i++) {
            assertEquals(i, result.entries().get(i).index());
            assertSame(alphas.get(i), result.entries().get(i).input());
        }
        verify(client, never()).startSubmission("weak");
    }

    @Test
    void testSubmitAllWithoutCriteriaSendsEveryAlpha() {
        when(client.startSubmission(anyString()))
            .thenAnswer(inv -> SimulationJob.submitted("/alphas/" + inv.getArgument(0) + "/submit"));
        when(poller.await(any(SimulationJob.class), any(PollingProfile.class)))
            .thenReturn(MAPPER.createObjectNode());

        BatchResult<Alpha, JsonNode> result = service.submitAll(
            List.of(alpha("a", 0.1), alpha("b", 0.2)), null, 4);

        assertEquals(2, result.successCount());
        verify(client, times(2)).startSubmission(anyString());
    }

    @Test
    void testValidateForSubmissionUsesCriteria() {
        assertTrue(service.validateForSubmission(alpha("a", 1.6), criteria).isEmpty());
        assertTrue(service.validateForSubmission(alpha("a", 1.0), criteria).isPresent());
    }

    @Test
    void testTagPatchesProperties() {
        AlphaProperties properties = AlphaProperties.tags(List.of("mined"));

        service.tag("a1", properties);

        verify(client).patchProperties("a1", properties);
    }
}
