package in.alphamine.domain.simulation;

/**
 * Lifecycle of a remote job.
 * PENDING -> RUNNING -> {COMPLETE, FAILED, ERROR} | TIMEOUT
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETE,
    FAILED,
    ERROR,
    TIMEOUT;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == ERROR || this == TIMEOUT;
    }
}
