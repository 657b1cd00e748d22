package in.alphamine.infrastructure.brain.job;

import java.time.Duration;
import java.util.Objects;

/**
 * How a job handle is polled.
 *
 * @param name         label for logs and metrics
 * @param maxAttempts  counted iterations before TIMEOUT
 * @param pollInterval wait between counted iterations
 * @param mode         how a 200 response is interpreted
 */
public record PollingProfile(String name, int maxAttempts, Duration pollInterval, Mode mode) {

    public enum Mode {
        /** 200 bodies carry a status field; COMPLETE is terminal. */
        SIMULATION_STATUS,
        /** 204 while processing; any 200 JSON body is the terminal result. */
        SUBMISSION_CHECK
    }

    public PollingProfile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(mode, "mode");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must not be negative");
        }
    }

    /**
     * 60 attempts, 5 seconds apart.
     */
    public static PollingProfile forSimulation() {
        return new PollingProfile("simulation", 60, Duration.ofSeconds(5), Mode.SIMULATION_STATUS);
    }

    /**
     * 30 attempts, 10 seconds apart.
     */
    public static PollingProfile forSubmission() {
        return new PollingProfile("submission", 30, Duration.ofSeconds(10), Mode.SUBMISSION_CHECK);
    }

    public PollingProfile withMaxAttempts(int attempts) {
        return new PollingProfile(name, attempts, pollInterval, mode);
    }

    public PollingProfile withPollInterval(Duration interval) {
        return new PollingProfile(name, maxAttempts, interval, mode);
    }
}
