package in.alphamine.infrastructure.brain;

import in.alphamine.domain.common.ErrorKind;

/**
 * Base exception for failures talking to the BRAIN platform.
 * Carries the error kind and, when one was observed, the last HTTP status and body.
 */
public class BrainException extends RuntimeException {

    private final ErrorKind kind;
    private final Integer lastStatus;
    private final String lastBody;

    public BrainException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    public BrainException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, null, cause);
    }

    public BrainException(ErrorKind kind, String message, Integer lastStatus, String lastBody, Throwable cause) {
        super(String.format("[%s] %s", kind, message), cause);
        this.kind = kind;
        this.lastStatus = lastStatus;
        this.lastBody = lastBody;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Integer getLastStatus() {
        return lastStatus;
    }

    public String getLastBody() {
        return lastBody;
    }
}
