package in.alphamine.infrastructure.brain.job;

import com.fasterxml.jackson.databind.JsonNode;
import in.alphamine.domain.simulation.JobStatus;

import java.util.Objects;

/**
 * A remote job identified by its poll handle.
 *
 * Created PENDING on submission and advanced only by {@link JobPoller}. Once terminal
 * the job never changes state again.
 */
public final class SimulationJob {

    private final String handle;
    private volatile JobStatus status;
    private volatile JsonNode resultPayload;
    private volatile String message;

    private SimulationJob(String handle) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.status = JobStatus.PENDING;
    }

    public static SimulationJob submitted(String handle) {
        if (handle == null || handle.isBlank()) {
            throw new IllegalArgumentException("Job handle must not be blank");
        }
        return new SimulationJob(handle);
    }

    synchronized void transitionTo(JobStatus next, JsonNode payload, String detail) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + handle + " is already " + status + ", cannot move to " + next);
        }
        this.status = next;
        if (payload != null) {
            this.resultPayload = payload;
        }
        if (detail != null) {
            this.message = detail;
        }
    }

    public String handle() {
        return handle;
    }

    public JobStatus status() {
        return status;
    }

    public JsonNode resultPayload() {
        return resultPayload;
    }

    public String message() {
        return message;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    @Override
    public String toString() {
        return "SimulationJob[" + handle + ", " + status + "]";
    }
}
