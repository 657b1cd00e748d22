package in.alphamine.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import in.alphamine.domain.common.BatchEntry;
import in.alphamine.domain.common.BatchResult;
import in.alphamine.domain.common.ErrorKind;
import in.alphamine.domain.common.Outcome;
import in.alphamine.domain.simulation.Alpha;
import in.alphamine.domain.simulation.SubmissionCriteria;
import in.alphamine.infrastructure.brain.AlphaProperties;
import in.alphamine.infrastructure.brain.AlphaQuery;
import in.alphamine.infrastructure.brain.BrainClient;
import in.alphamine.infrastructure.brain.job.JobPoller;
import in.alphamine.infrastructure.brain.job.PollingProfile;
import in.alphamine.infrastructure.brain.job.SimulationJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds qualifying alphas and runs the submission-acceptance flow for them.
 */
public class SubmissionService {
    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    static final int PAGE_SIZE = 50;

    private final BrainClient client;
    private final JobPoller poller;
    private final BoundedWorkerPool pool;
    private final PollingProfile profile;
    private final Clock clock;

    public SubmissionService(BrainClient client, JobPoller poller, BoundedWorkerPool pool) {
        this(client, poller, pool, PollingProfile.forSubmission(), Clock.systemUTC());
    }

    public SubmissionService(BrainClient client, JobPoller poller, BoundedWorkerPool pool,
                             PollingProfile profile, Clock clock) {
        this.client = client;
        this.poller = poller;
        this.pool = pool;
        this.profile = profile;
        this.clock = clock;
    }

    /**
     * Page through unsubmitted alphas, newest first, keeping those that meet the
     * criteria thresholds and are not older than {@code maxAgeDays}.
     */
    public List<Alpha> findCandidates(SubmissionCriteria criteria, int maxResults, int maxAgeDays) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(maxAgeDays));
        log.info("[SUBMIT] Finding candidates (sharpe >= {}, fitness >= {}, newer than {})",
            criteria.minSharpe(), criteria.minFitness(), cutoff);

        List<Alpha> candidates = new ArrayList<>();
        AlphaQuery query = AlphaQuery.page("UNSUBMITTED", PAGE_SIZE, 0);

        while (candidates.size() < maxResults) {
            JsonNode page = client.listAlphas(query);
            JsonNode results = page.path("results");
            if (results.size() == 0) {
                break;
            }

            for (JsonNode data : results) {
                Alpha alpha;
                try {
                    alpha = Alpha.fromApiFormat(data);
                } catch (RuntimeException e) {
                    log.error("[SUBMIT] Failed to parse alpha {}: {}", data.path("id").asText("?"), e.getMessage());
                    continue;
                }
                if (alpha.dateCreated() != null && alpha.dateCreated().isBefore(cutoff)) {
                    continue;
                }
                if (criteria.meetsThresholds(alpha.metrics())) {
                    candidates.add(alpha);
                    if (candidates.size() >= maxResults) {
                        break;
                    }
                }
            }

            if (results.size() < query.limit()) {
                break;
            }
            query = query.next();
        }

        log.info("[SUBMIT] Found {} candidates", candidates.size());
        return candidates;
    }

    /**
     * @return the reason the alpha cannot be submitted, empty if it qualifies
     */
    public Optional<String> validateForSubmission(Alpha alpha, SubmissionCriteria criteria) {
        return criteria.rejectionReason(alpha.metrics());
    }

    /**
     * Submit alphas concurrently. With criteria, alphas that do not qualify are not sent
     * and appear as VALIDATION failures; every input appears exactly once in the result.
     *
     * @param criteria may be null to skip validation
     */
    public BatchResult<Alpha, JsonNode> submitAll(List<Alpha> alphas, SubmissionCriteria criteria, int maxConcurrency) {
        List<BatchEntry<Alpha, JsonNode>> rejected = new ArrayList<>();
        List<Alpha> eligible = new ArrayList<>();
        List<Integer> eligibleIndex = new ArrayList<>();

        for (int i = 0; i < alphas.size(); i++) {
            Alpha alpha = alphas.get(i);
            Optional<String> reason = alpha.id() == null
                ? Optional.of("Alpha has no id")
                : criteria == null ? Optional.empty() : validateForSubmission(alpha, criteria);
            if (reason.isPresent()) {
                log.warn("[SUBMIT] Skipping alpha {}: {}", alpha.id(), reason.get());
                rejected.add(new BatchEntry<>(i, alpha, Outcome.failure(ErrorKind.VALIDATION, reason.get())));
            } else {
                eligible.add(alpha);
                eligibleIndex.add(i);
            }
        }

        log.info("[SUBMIT] Submitting {} of {} alphas", eligible.size(), alphas.size());
        BatchResult<Alpha, JsonNode> submitted = pool.run(eligible, maxConcurrency, this::submitOne);

        @SuppressWarnings("unchecked")
        BatchEntry<Alpha, JsonNode>[] merged = new BatchEntry[alphas.size()];
        for (BatchEntry<Alpha, JsonNode> entry : rejected) {
            merged[entry.index()] = entry;
        }
        for (BatchEntry<Alpha, JsonNode> entry : submitted.entries()) {
            int index = eligibleIndex.get(entry.index());
            merged[index] = new BatchEntry<>(index, entry.input(), entry.outcome());
        }

        BatchResult<Alpha, JsonNode> result = new BatchResult<>(List.of(merged));
        log.info("[SUBMIT] Completed {}/{} submissions", result.successCount(), alphas.size());
        return result;
    }

    public void tag(String alphaId, AlphaProperties properties) {
        client.patchProperties(alphaId, properties);
    }

    private JsonNode submitOne(Alpha alpha) {
        SimulationJob job = client.startSubmission(alpha.id());
        JsonNode result = poller.await(job, profile);
        log.info("[SUBMIT] Alpha {} submission check returned", alpha.id());
        return result;
    }
}
