package in.alphamine.infrastructure.brain.job;

import in.alphamine.domain.common.ErrorKind;
import in.alphamine.infrastructure.brain.BrainException;

/**
 * The job did not reach a terminal state within the profile's attempt budget.
 */
public class JobTimeoutException extends BrainException {

    private final String handle;
    private final int attempts;

    public JobTimeoutException(String handle, int attempts, Integer lastStatus, String lastBody) {
        super(ErrorKind.TIMEOUT, "Job " + handle + " not terminal after " + attempts + " attempts",
            lastStatus, lastBody, null);
        this.handle = handle;
        this.attempts = attempts;
    }

    public String getHandle() {
        return handle;
    }

    public int getAttempts() {
        return attempts;
    }
}
