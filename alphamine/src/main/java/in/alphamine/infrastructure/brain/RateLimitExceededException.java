package in.alphamine.infrastructure.brain;

import in.alphamine.domain.common.ErrorKind;

/**
 * Thrown when the server keeps answering 429 past the configured number of waits.
 */
public class RateLimitExceededException extends BrainException {

    public RateLimitExceededException(String message, String lastBody) {
        super(ErrorKind.RATE_LIMITED, message, 429, lastBody, null);
    }
}
