package in.alphamine.infrastructure.brain;

import in.alphamine.domain.common.ErrorKind;

/**
 * The platform answered a non-polling call with a rejection (4xx or an unexpected status).
 */
public class BrainRequestException extends BrainException {

    public BrainRequestException(String message, Integer lastStatus, String lastBody) {
        super(ErrorKind.REMOTE_REJECTED, message, lastStatus, lastBody, null);
    }
}
