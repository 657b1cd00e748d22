package in.alphamine.infrastructure.brain;

import in.alphamine.domain.common.ErrorKind;

/**
 * Timeouts, transport failures and 5xx responses that outlived the retry budget.
 */
public class TransientNetworkException extends BrainException {

    public TransientNetworkException(String message, Integer lastStatus, String lastBody, Throwable cause) {
        super(ErrorKind.TRANSIENT_NETWORK, message, lastStatus, lastBody, cause);
    }
}
