package in.alphamine.infrastructure.brain.job;

import com.fasterxml.jackson.databind.JsonNode;
import in.alphamine.domain.common.ErrorKind;
import in.alphamine.domain.simulation.JobStatus;
import in.alphamine.infrastructure.brain.BrainClient;
import in.alphamine.infrastructure.brain.BrainException;
import in.alphamine.infrastructure.brain.BrainResponse;
import in.alphamine.infrastructure.brain.RateLimitExceededException;
import in.alphamine.infrastructure.brain.TransientNetworkException;
import in.alphamine.infrastructure.brain.common.Sleeper;
import in.alphamine.infrastructure.brain.metrics.SimulationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Polls a job handle until it reaches a terminal state.
 *
 * Each iteration issues one {@link BrainClient#pollJobOnce} and interprets the response:
 * <pre>
 * transport failure           -> stay, wait pollInterval, counted
 * 429                         -> wait Retry-After (pollInterval if absent), not counted
 * 202 / 204 / 200 empty body  -> still processing, counted
 * other non-200               -> transient, counted
 * 200 status=COMPLETE         -> COMPLETE, payload returned
 * 200 status=FAILED|ERROR     -> JobFailedException
 * 200 other status            -> non-terminal, counted
 * 200 unparsable body         -> transient, counted
 * </pre>
 * In {@link PollingProfile.Mode#SUBMISSION_CHECK} any parseable 200 body is the terminal
 * result. After {@code maxAttempts} counted iterations the job is marked TIMEOUT.
 * There is no wait after the last counted attempt.
 */
public class JobPoller {
    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

    /** Upper bound on uncounted 429 waits for one job. */
    static final int MAX_RATE_LIMIT_WAITS = 100;

    private final BrainClient client;
    private final SimulationMetrics metrics;
    private final Sleeper sleeper;

    public JobPoller(BrainClient client) {
        this(client, null, Sleeper.SYSTEM);
    }

    /**
     * @param metrics may be null
     */
    public JobPoller(BrainClient client, SimulationMetrics metrics, Sleeper sleeper) {
        this.client = client;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    /**
     * Block until the job is terminal.
     *
     * @return the terminal payload
     * @throws JobFailedException  if the platform reports FAILED or ERROR
     * @throws JobTimeoutException if maxAttempts counted polls pass without a terminal state
     */
    public JsonNode await(SimulationJob job, PollingProfile profile) {
        if (job.isTerminal()) {
            throw new IllegalStateException("Job " + job.handle() + " is already " + job.status());
        }

        int counted = 0;
        int rateLimitWaits = 0;
        Integer lastStatus = null;
        String lastBody = null;

        while (counted < profile.maxAttempts()) {
            BrainResponse response;
            try {
                response = client.pollJobOnce(job.handle());
            } catch (TransientNetworkException e) {
                counted++;
                log.warn("[POLL] {} poll failed ({}/{}): {}", job.handle(), counted, profile.maxAttempts(), e.getMessage());
                waitBetweenAttempts(counted, profile);
                continue;
            }
            lastStatus = response.statusCode();
            lastBody = response.body();

            Step step = interpret(response, profile);
            switch (step.kind()) {
                case COMPLETE -> {
                    job.transitionTo(JobStatus.COMPLETE, step.payload(), null);
                    record(profile, JobStatus.COMPLETE, counted + 1);
                    log.info("[POLL] {} complete after {} polls", job.handle(), counted + 1);
                    return step.payload();
                }
                case FAILED -> {
                    job.transitionTo(step.status(), step.payload(), step.message());
                    record(profile, step.status(), counted + 1);
                    log.error("[POLL] {} ended {}: {}", job.handle(), step.status(), step.message());
                    throw new JobFailedException(job.handle(), step.status(), step.message(), step.payload());
                }
                case RATE_LIMITED -> {
                    if (rateLimitWaits >= MAX_RATE_LIMIT_WAITS) {
                        throw new RateLimitExceededException(
                            "Polling " + job.handle() + " still rate limited after " + rateLimitWaits + " waits",
                            lastBody);
                    }
                    rateLimitWaits++;
                    log.warn("[POLL] {} rate limited, waiting {} ms", job.handle(), step.delay().toMillis());
                    if (metrics != null) {
                        metrics.recordRateLimitWait(step.delay());
                    }
                    pause(step.delay());
                }
                case CONTINUE -> {
                    if (step.status() != null && step.status() != job.status()) {
                        job.transitionTo(step.status(), null, null);
                    }
                    counted++;
                    log.debug("[POLL] {} {} ({}/{})", job.handle(), step.message(), counted, profile.maxAttempts());
                    waitBetweenAttempts(counted, profile);
                }
            }
        }

        job.transitionTo(JobStatus.TIMEOUT, null, "Timed out after " + counted + " attempts");
        record(profile, JobStatus.TIMEOUT, counted);
        log.error("[POLL] {} timed out after {} attempts", job.handle(), counted);
        throw new JobTimeoutException(job.handle(), counted, lastStatus, lastBody);
    }

    /**
     * Classify one poll response. Pure: no I/O and no state change.
     */
    static Step interpret(BrainResponse response, PollingProfile profile) {
        int status = response.statusCode();

        if (status == 429) {
            return Step.rateLimited(retryAfter(response).orElse(profile.pollInterval()));
        }
        if (status == 202 || status == 204) {
            return Step.proceed(null, "still processing (HTTP " + status + ")");
        }
        if (status != 200) {
            return Step.proceed(null, "unexpected HTTP " + status);
        }
        if (!response.hasBody()) {
            return Step.proceed(null, "empty body");
        }

        JsonNode body;
        try {
            body = response.json();
        } catch (IOException e) {
            return Step.proceed(null, "unparsable body");
        }

        if (profile.mode() == PollingProfile.Mode.SUBMISSION_CHECK) {
            return Step.complete(body);
        }

        String reported = body.path("status").asText("");
        switch (reported) {
            case "COMPLETE":
                return Step.complete(body);
            case "FAILED":
            case "ERROR": {
                String detail = body.hasNonNull("message") ? body.get("message").asText() : null;
                return Step.failed(JobStatus.valueOf(reported), body, detail);
            }
            case "RUNNING":
                return Step.proceed(JobStatus.RUNNING, "status RUNNING");
            default:
                return Step.proceed(null, "status " + (reported.isEmpty() ? "<none>" : reported));
        }
    }

    private static Optional<Duration> retryAfter(BrainResponse response) {
        Optional<String> header = response.header("Retry-After");
        if (header.isEmpty()) {
            return Optional.empty();
        }
        try {
            double seconds = Double.parseDouble(header.get().trim());
            if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds < 0) {
                return Optional.empty();
            }
            return Optional.of(Duration.ofMillis(Math.round(seconds * 1000)));
        } catch (NumberFormatException e) {
            log.warn("[POLL] Could not parse Retry-After '{}'", header.get());
            return Optional.empty();
        }
    }

    private void waitBetweenAttempts(int counted, PollingProfile profile) {
        if (counted < profile.maxAttempts()) {
            pause(profile.pollInterval());
        }
    }

    private void pause(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrainException(ErrorKind.UNEXPECTED, "Interrupted while polling", e);
        }
    }

    private void record(PollingProfile profile, JobStatus status, int polls) {
        if (metrics != null) {
            metrics.recordJobCompleted(profile.name(), status, polls);
        }
    }

    enum StepKind {
        COMPLETE,
        FAILED,
        RATE_LIMITED,
        CONTINUE
    }

    /**
     * Outcome of interpreting one poll response.
     *
     * @param status for CONTINUE, the status to move to, or null to stay
     */
    record Step(StepKind kind, JobStatus status, JsonNode payload, String message, Duration delay) {

        static Step complete(JsonNode payload) {
            return new Step(StepKind.COMPLETE, JobStatus.COMPLETE, payload, null, Duration.ZERO);
        }

        static Step failed(JobStatus status, JsonNode payload, String message) {
            return new Step(StepKind.FAILED, status, payload, message, Duration.ZERO);
        }

        static Step rateLimited(Duration delay) {
            return new Step(StepKind.RATE_LIMITED, null, null, "rate limited", delay);
        }

        static Step proceed(JobStatus status, String message) {
            return new Step(StepKind.CONTINUE, status, null, message, Duration.ZERO);
        }
    }
}
