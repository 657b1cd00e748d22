package in.alphamine.infrastructure.brain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.alphamine.config.BrainClientConfig;
import in.alphamine.domain.common.ErrorKind;
import in.alphamine.domain.simulation.SimulationSettings;
import in.alphamine.infrastructure.brain.common.RetryPolicy;
import in.alphamine.infrastructure.brain.common.SessionManager;
import in.alphamine.infrastructure.brain.common.Sleeper;
import in.alphamine.infrastructure.brain.job.SimulationJob;
import in.alphamine.infrastructure.brain.metrics.SimulationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.CookieManager;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * BRAIN platform client with session management, retry and rate-limit handling.
 *
 * Retry rules for {@link #request}:
 * - timeout / transport error: backoff {@code baseDelay * 2^attempt}, at most
 *   {@code maxAttempts} sends, then {@link TransientNetworkException}
 * - 401: single-flight re-login, retried without consuming the budget; a second 401
 *   fails with {@link BrainAuthenticationException}
 * - 429 (when honored): wait Retry-After seconds, retried without consuming the budget
 * - anything else: returned to the caller
 *
 * The session cookie lives in the HttpClient's CookieManager. Basic credentials are only
 * sent to the authentication endpoint.
 */
public class ResilientBrainClient implements BrainClient {
    private static final Logger log = LoggerFactory.getLogger(ResilientBrainClient.class);

    static final String AUTH_PATH = "/authentication";
    static final String SIMULATIONS_PATH = "/simulations";
    static final String ALPHAS_PATH = "/alphas";
    static final String USER_ALPHAS_PATH = "/users/self/alphas";
    static final String DATA_FIELDS_PATH = "/data-fields";
    static final String OPERATORS_PATH = "/operators";

    private static final int MAX_LOGGED_BODY = 200;

    private final BrainClientConfig config;
    private final RetryPolicy retryPolicy;
    private final SimulationMetrics metrics;
    private final Sleeper sleeper;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final SessionManager session;

    public ResilientBrainClient(BrainClientConfig config) {
        this(config, RetryPolicy.fromConfig(config), null, Sleeper.SYSTEM);
    }

    public ResilientBrainClient(BrainClientConfig config, SimulationMetrics metrics) {
        this(config, RetryPolicy.fromConfig(config), metrics, Sleeper.SYSTEM);
    }

    /**
     * @param metrics may be null
     */
    public ResilientBrainClient(BrainClientConfig config, RetryPolicy retryPolicy,
                                SimulationMetrics metrics, Sleeper sleeper) {
        this.config = config;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.sleeper = sleeper;
        this.httpClient = HttpClient.newBuilder()
            .cookieHandler(new CookieManager())
            .connectTimeout(config.timeout())
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
        this.session = new SessionManager("BRAIN", this::login);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SESSION
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void authenticate() {
        session.establish();
    }

    @Override
    public boolean isAuthenticated() {
        return session.isAuthenticated();
    }

    /**
     * One login round: up to maxAttempts POSTs, 201 is success.
     */
    private void login() {
        log.info("[BRAIN] Authenticating as {}", config.username());
        String credentials = config.username() + ":" + config.password();
        String basic = "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));

        Integer lastStatus = null;
        String lastBody = null;
        Exception lastError = null;

        for (int attempt = 0; attempt < retryPolicy.maxAttempts(); attempt++) {
            Instant start = Instant.now();
            try {
                HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.baseUrl() + AUTH_PATH))
                    .timeout(config.timeout())
                    .header("Authorization", basic)
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.noBody())
                    .build();
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                boolean success = response.statusCode() == 201;
                if (metrics != null) {
                    metrics.recordAuthentication(success, Duration.between(start, Instant.now()));
                }
                if (success) {
                    log.info("[BRAIN] Authentication successful");
                    return;
                }
                lastStatus = response.statusCode();
                lastBody = response.body();
                log.warn("[BRAIN] Authentication failed: HTTP {} {}", lastStatus, abbreviate(lastBody));
            } catch (IOException e) {
                lastError = e;
                if (metrics != null) {
                    metrics.recordAuthentication(false, Duration.between(start, Instant.now()));
                }
                log.warn("[BRAIN] Authentication request failed: {}", e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrainAuthenticationException("Interrupted during authentication", e);
            }

            if (attempt < retryPolicy.maxAttempts() - 1) {
                pause(retryPolicy.delayForAttempt(attempt), "authentication backoff");
            }
        }

        String message = "Authentication failed after " + retryPolicy.maxAttempts() + " attempts";
        if (lastStatus == null && lastError != null) {
            throw new BrainAuthenticationException(message + ": " + lastError.getMessage(), lastError);
        }
        throw new BrainAuthenticationException(message + " (status " + lastStatus + ")", lastStatus, lastBody);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // RAW REQUESTS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public BrainResponse request(String method, String path, JsonNode body, Map<String, String> params,
                                 boolean honorRetryAfter) {
        session.ensureEstablished();
        URI uri = resolve(path, params);

        int failedAttempts = 0;
        int rateLimitWaits = 0;
        boolean reauthenticated = false;
        Integer lastStatus = null;
        String lastBody = null;

        while (true) {
            long generation = session.generation();
            Instant start = Instant.now();
            HttpResponse<String> raw;
            try {
                raw = httpClient.send(buildRequest(method, uri, body), HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                String reason = e instanceof HttpTimeoutException ? "TIMEOUT" : "TRANSPORT";
                failedAttempts++;
                if (failedAttempts >= retryPolicy.maxAttempts()) {
                    log.error("[BRAIN] {} {} failed after {} attempts: {}", method, path, failedAttempts, e.toString());
                    throw new TransientNetworkException(
                        method + " " + path + " failed after " + failedAttempts + " attempts: " + e.getMessage(),
                        lastStatus, lastBody, e);
                }
                Duration wait = retryPolicy.delayForAttempt(failedAttempts - 1);
                log.warn("[BRAIN] {} {} {} ({}), retrying in {} ms", method, path, reason, e.toString(), wait.toMillis());
                if (metrics != null) {
                    metrics.recordRetry(reason);
                }
                pause(wait, "retry backoff");
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrainException(ErrorKind.UNEXPECTED, "Interrupted during " + method + " " + path, e);
            }

            BrainResponse response = new BrainResponse(raw.statusCode(), raw.headers().map(), raw.body());
            lastStatus = response.statusCode();
            lastBody = response.body();
            if (metrics != null) {
                metrics.recordRequest(method, response.statusCode(), Duration.between(start, Instant.now()));
            }

            if (response.statusCode() == 401) {
                if (reauthenticated) {
                    log.error("[BRAIN] {} {} rejected again after re-authentication", method, path);
                    throw new BrainAuthenticationException(
                        "Session rejected after re-authentication: " + method + " " + path, 401, lastBody);
                }
                session.refreshIfStale(generation);
                reauthenticated = true;
                continue;
            }

            if (response.statusCode() == 429 && honorRetryAfter) {
                if (rateLimitWaits >= retryPolicy.maxRateLimitWaits()) {
                    throw new RateLimitExceededException(
                        method + " " + path + " still rate limited after " + rateLimitWaits + " waits", lastBody);
                }
                rateLimitWaits++;
                Duration wait = retryAfter(response, retryPolicy.baseDelay());
                log.warn("[BRAIN] Rate limited on {} {}, waiting {} ms", method, path, wait.toMillis());
                if (metrics != null) {
                    metrics.recordRateLimitWait(wait);
                }
                pause(wait, "rate limit");
                continue;
            }

            return response;
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SIMULATIONS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public SimulationJob submitSimulation(String expression, SimulationSettings settings) {
        SimulationSettings effective = settings == null ? SimulationSettings.DEFAULT : settings;
        ObjectNode payload = mapper.createObjectNode();
        payload.put("type", "REGULAR");
        payload.set("settings", effective.toApiFormat());
        payload.put("regular", expression);

        log.info("[BRAIN] Submitting simulation: {} ({}/{})",
            abbreviate(expression, 100), effective.region(), effective.universe());

        BrainResponse response = request("POST", SIMULATIONS_PATH, payload);
        if (response.statusCode() != 201) {
            String message = "Simulation submission failed (status " + response.statusCode() + ")"
                + describeBody(response);
            if (response.statusCode() >= 500) {
                throw new TransientNetworkException(message, response.statusCode(), response.body(), null);
            }
            throw new BrainRequestException(message, response.statusCode(), response.body());
        }

        Optional<String> location = response.header("Location").filter(l -> !l.isBlank());
        if (location.isEmpty()) {
            throw new BrainRequestException("Simulation accepted without a Location header",
                response.statusCode(), response.body());
        }

        log.info("[BRAIN] Simulation submitted, handle={}", location.get());
        return SimulationJob.submitted(location.get());
    }

    @Override
    public BrainResponse pollJobOnce(String handle) {
        return request("GET", handle, null, Map.of(), false);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ALPHAS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public JsonNode getAlphaDetails(String alphaId) {
        log.debug("[BRAIN] Fetching details for alpha {}", alphaId);
        BrainResponse response = request("GET", ALPHAS_PATH + "/" + alphaId);
        return expectJson(response, 200, "alpha details for " + alphaId);
    }

    @Override
    public JsonNode listAlphas(AlphaQuery query) {
        log.debug("[BRAIN] Listing alphas {}", query);
        BrainResponse response = request("GET", USER_ALPHAS_PATH, null, query.toParams(), true);
        return expectJson(response, 200, "alpha listing");
    }

    @Override
    public void patchProperties(String alphaId, AlphaProperties properties) {
        if (properties == null || properties.isEmpty()) {
            log.warn("[BRAIN] No properties to update for alpha {}, skipping PATCH", alphaId);
            return;
        }

        ObjectNode payload = mapper.createObjectNode();
        if (properties.name() != null) {
            payload.put("name", properties.name());
        }
        if (properties.color() != null) {
            payload.put("color", properties.color());
        }
        if (properties.tags() != null) {
            ArrayNode tags = payload.putArray("tags");
            properties.tags().forEach(tags::add);
        }
        if (properties.description() != null) {
            payload.putObject("regular").put("description", properties.description());
        }

        log.info("[BRAIN] Updating alpha {}: {}", alphaId, payload);
        BrainResponse response = request("PATCH", ALPHAS_PATH + "/" + alphaId, payload);
        if (response.statusCode() != 200) {
            throw rejection(response, "Property update for alpha " + alphaId);
        }
    }

    @Override
    public SimulationJob startSubmission(String alphaId) {
        String submitPath = ALPHAS_PATH + "/" + alphaId + "/submit";
        log.info("[BRAIN] Submitting alpha {}", alphaId);
        BrainResponse response = request("POST", submitPath);
        if (response.statusCode() != 201) {
            throw rejection(response, "Submission of alpha " + alphaId);
        }
        return SimulationJob.submitted(submitPath);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CATALOG
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public List<JsonNode> getDataFields(DataFieldQuery query) {
        Map<String, String> params = query.toParams();
        log.info("[BRAIN] Fetching data fields {}", params);

        JsonNode first = expectJson(request("GET", DATA_FIELDS_PATH, null, params, true), 200, "data fields");
        int total = first.path("count").asInt(0);
        List<JsonNode> results = new ArrayList<>();
        first.path("results").forEach(results::add);

        while (results.size() < total) {
            int offset = results.size();
            params.put("offset", String.valueOf(offset));
            BrainResponse page = request("GET", DATA_FIELDS_PATH, null, params, true);
            if (page.statusCode() != 200) {
                log.warn("[BRAIN] Data field page at offset {} failed (status {}), stopping pagination",
                    offset, page.statusCode());
                break;
            }
            JsonNode pageResults;
            try {
                pageResults = page.json().path("results");
            } catch (IOException e) {
                log.warn("[BRAIN] Data field page at offset {} is not JSON, stopping pagination", offset);
                break;
            }
            if (pageResults.size() == 0) {
                log.warn("[BRAIN] Empty data field page at offset {}, stopping pagination", offset);
                break;
            }
            pageResults.forEach(results::add);
        }

        log.info("[BRAIN] Fetched {} data fields", results.size());
        return results;
    }

    @Override
    public List<JsonNode> getOperators() {
        JsonNode data = expectJson(request("GET", OPERATORS_PATH), 200, "operators");
        JsonNode array = data.isArray() ? data : data.path("results");
        List<JsonNode> operators = new ArrayList<>();
        array.forEach(operators::add);
        log.info("[BRAIN] Fetched {} operators", operators.size());
        return operators;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════════════

    URI resolve(String path, Map<String, String> params) {
        String base = path.startsWith("http://") || path.startsWith("https://")
            ? path
            : config.baseUrl() + (path.startsWith("/") ? path : "/" + path);
        if (params == null || params.isEmpty()) {
            return URI.create(base);
        }
        StringJoiner query = new StringJoiner("&");
        params.forEach((key, value) -> query.add(
            URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
        return URI.create(base + (base.contains("?") ? "&" : "?") + query);
    }

    private HttpRequest buildRequest(String method, URI uri, JsonNode body) {
        HttpRequest.BodyPublisher publisher = body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(body.toString());
        return HttpRequest.newBuilder()
            .uri(uri)
            .timeout(config.timeout())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .method(method.toUpperCase(), publisher)
            .build();
    }

    /**
     * Retry-After as (possibly fractional) seconds; fallback when absent or unparsable.
     */
    static Duration retryAfter(BrainResponse response, Duration fallback) {
        Optional<String> header = response.header("Retry-After");
        if (header.isEmpty()) {
            return fallback;
        }
        try {
            double seconds = Double.parseDouble(header.get().trim());
            if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds < 0) {
                return fallback;
            }
            return Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException e) {
            log.warn("[BRAIN] Could not parse Retry-After '{}', using {} ms", header.get(), fallback.toMillis());
            return fallback;
        }
    }

    private JsonNode expectJson(BrainResponse response, int expectedStatus, String what) {
        if (response.statusCode() != expectedStatus) {
            throw rejection(response, "Fetching " + what);
        }
        try {
            return response.json();
        } catch (IOException e) {
            throw new BrainException(ErrorKind.UNEXPECTED, "Malformed JSON in " + what,
                response.statusCode(), response.body(), e);
        }
    }

    private BrainException rejection(BrainResponse response, String action) {
        String message = action + " failed (status " + response.statusCode() + ")" + describeBody(response);
        if (response.statusCode() >= 500) {
            return new TransientNetworkException(message, response.statusCode(), response.body(), null);
        }
        return new BrainRequestException(message, response.statusCode(), response.body());
    }

    private String describeBody(BrainResponse response) {
        if (!response.hasBody()) {
            return "";
        }
        try {
            return ", details: " + response.json();
        } catch (IOException e) {
            return ", response: " + abbreviate(response.body());
        }
    }

    private void pause(Duration duration, String reason) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrainException(ErrorKind.UNEXPECTED, "Interrupted during " + reason, e);
        }
    }

    private static String abbreviate(String text) {
        return abbreviate(text, MAX_LOGGED_BODY);
    }

    private static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
