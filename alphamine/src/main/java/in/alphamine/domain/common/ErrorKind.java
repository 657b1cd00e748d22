package in.alphamine.domain.common;

/**
 * Failure taxonomy shared by the client, the poller and the orchestrator.
 */
public enum ErrorKind {
    /** Credentials rejected or re-authentication exhausted. Fatal to the client instance. */
    AUTH,
    /** Timeout, connection failure or 5xx after local retries were exhausted. */
    TRANSIENT_NETWORK,
    /** HTTP 429. Always waited out, never counted as a failure. */
    RATE_LIMITED,
    /** Remote job reached FAILED or ERROR. */
    JOB_FAILED,
    /** Polling ran out of attempts. */
    TIMEOUT,
    /** Expression rejected by local syntactic checks before any network call. */
    VALIDATION,
    /** Non-retryable 4xx answer to a submission, listing or update call. */
    REMOTE_REJECTED,
    UNEXPECTED
}
