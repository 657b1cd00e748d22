package in.alphamine.config;

import in.alphamine.util.Env;

import java.time.Duration;

/**
 * Connection settings for the BRAIN simulation platform.
 *
 * Environment variables:
 * - WQ_BASE_URL (default https://api.worldquantbrain.com)
 * - WQ_USERNAME / WQ_PASSWORD (required)
 * - WQ_MAX_RETRIES (default 3)
 * - WQ_RETRY_DELAY seconds (default 5), base of the exponential backoff and the
 *   fallback wait for a 429 without a usable Retry-After header
 * - WQ_TIMEOUT seconds (default 30), per-request timeout
 */
public record BrainClientConfig(
    String baseUrl,
    String username,
    String password,
    int maxRetries,
    Duration retryDelay,
    Duration timeout
) {
    public static final String DEFAULT_BASE_URL = "https://api.worldquantbrain.com";

    public BrainClientConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive");
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static BrainClientConfig fromEnv() {
        return new BrainClientConfig(
            Env.get("WQ_BASE_URL", DEFAULT_BASE_URL),
            Env.get("WQ_USERNAME", null),
            Env.get("WQ_PASSWORD", null),
            Env.getInt("WQ_MAX_RETRIES", 3),
            Env.getSeconds("WQ_RETRY_DELAY", Duration.ofSeconds(5)),
            Env.getSeconds("WQ_TIMEOUT", Duration.ofSeconds(30))
        );
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank() && password != null && !password.isBlank();
    }

    @Override
    public String toString() {
        return "BrainClientConfig[baseUrl=" + baseUrl + ", username=" + username
            + ", password=********, maxRetries=" + maxRetries
            + ", retryDelay=" + retryDelay + ", timeout=" + timeout + "]";
    }
}
