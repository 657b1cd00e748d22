package in.alphamine.infrastructure.brain;

import in.alphamine.domain.common.ErrorKind;

/**
 * Exception thrown when login fails or a re-authenticated session is rejected again.
 */
public class BrainAuthenticationException extends BrainException {

    public BrainAuthenticationException(String message) {
        super(ErrorKind.AUTH, message);
    }

    public BrainAuthenticationException(String message, Integer lastStatus, String lastBody) {
        super(ErrorKind.AUTH, message, lastStatus, lastBody, null);
    }

    public BrainAuthenticationException(String message, Throwable cause) {
        super(ErrorKind.AUTH, message, cause);
    }
}
