package in.alphamine.infrastructure.brain;

import com.fasterxml.jackson.databind.JsonNode;
import in.alphamine.domain.simulation.SimulationSettings;
import in.alphamine.infrastructure.brain.job.SimulationJob;

import java.util.List;
import java.util.Map;

/**
 * Client for the BRAIN simulation platform.
 *
 * Responsibilities:
 * - Own one authenticated session shared by every caller thread
 * - Retry transport failures with exponential backoff
 * - Re-authenticate once on session expiry
 * - Honor server-directed backoff (429 Retry-After)
 *
 * Error Handling:
 * - All failures are unchecked {@link BrainException}s carrying an ErrorKind
 * - Job polling is left to {@link in.alphamine.infrastructure.brain.job.JobPoller}
 *
 * Implementations must be safe for concurrent use.
 */
public interface BrainClient {

    // ═══════════════════════════════════════════════════════════════════════
    // SESSION
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Log in with the configured credentials.
     *
     * @throws BrainAuthenticationException if every attempt is rejected or fails
     */
    void authenticate();

    boolean isAuthenticated();

    // ═══════════════════════════════════════════════════════════════════════
    // RAW REQUESTS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Send one request through the retry loop.
     *
     * @param method          HTTP method
     * @param path            path relative to the base URL, or an absolute URL
     * @param body            JSON body, may be null
     * @param params          query parameters, may be empty
     * @param honorRetryAfter when false a 429 response is returned instead of waited out
     * @return the first response that is not retried internally
     * @throws TransientNetworkException when transport failures exhaust the retry budget
     * @throws BrainAuthenticationException when the session is rejected after re-login
     */
    BrainResponse request(String method, String path, JsonNode body, Map<String, String> params,
                          boolean honorRetryAfter);

    default BrainResponse request(String method, String path) {
        return request(method, path, null, Map.of(), true);
    }

    default BrainResponse request(String method, String path, JsonNode body) {
        return request(method, path, body, Map.of(), true);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SIMULATIONS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Submit an expression for simulation.
     *
     * @return a PENDING job whose handle is the Location header
     * @throws BrainRequestException if the platform rejects the submission
     */
    SimulationJob submitSimulation(String expression, SimulationSettings settings);

    /**
     * One status query for a job handle. 429 responses are returned, not waited out.
     */
    BrainResponse pollJobOnce(String handle);

    // ═══════════════════════════════════════════════════════════════════════
    // ALPHAS
    // ═══════════════════════════════════════════════════════════════════════

    JsonNode getAlphaDetails(String alphaId);

    /**
     * One page of the account's alphas: {@code {count, results[]}}.
     */
    JsonNode listAlphas(AlphaQuery query);

    /**
     * Update name, color, tags or description. Null fields are not sent.
     */
    void patchProperties(String alphaId, AlphaProperties properties);

    /**
     * Start the submission-acceptance flow for an alpha.
     *
     * @return a PENDING job polled with the submission profile
     */
    SimulationJob startSubmission(String alphaId);

    // ═══════════════════════════════════════════════════════════════════════
    // CATALOG
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * All data fields matching the query, following pagination.
     */
    List<JsonNode> getDataFields(DataFieldQuery query);

    List<JsonNode> getOperators();
}
