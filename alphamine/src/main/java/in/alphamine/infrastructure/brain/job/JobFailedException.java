package in.alphamine.infrastructure.brain.job;

import com.fasterxml.jackson.databind.JsonNode;
import in.alphamine.domain.common.ErrorKind;
import in.alphamine.domain.simulation.JobStatus;
import in.alphamine.infrastructure.brain.BrainException;

/**
 * The platform reported the job as FAILED or ERROR.
 */
public class JobFailedException extends BrainException {

    private final String handle;
    private final JobStatus status;
    private final transient JsonNode payload;

    public JobFailedException(String handle, JobStatus status, String detail, JsonNode payload) {
        super(ErrorKind.JOB_FAILED, "Job " + handle + " ended " + status + (detail == null ? "" : ": " + detail),
            200, payload == null ? null : payload.toString(), null);
        this.handle = handle;
        this.status = status;
        this.payload = payload;
    }

    public String getHandle() {
        return handle;
    }

    public JobStatus getStatus() {
        return status;
    }

    public JsonNode getPayload() {
        return payload;
    }
}
