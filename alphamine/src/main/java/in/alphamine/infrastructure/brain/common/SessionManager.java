package in.alphamine.infrastructure.brain.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Owns the authenticated session shared by all workers.
 *
 * Each successful login bumps a generation counter. A worker that sees its session
 * rejected calls {@link #refreshIfStale(long)} with the generation it observed before
 * sending; only the first caller for that generation logs in again, the rest reuse the
 * fresh session. N concurrent 401s therefore cause exactly one re-login.
 *
 * Usage:
 * <pre>
 * long generation = session.generation();
 * HttpResponse&lt;String&gt; response = send(request);
 * if (response.statusCode() == 401) {
 *     session.refreshIfStale(generation);
 *     // retry
 * }
 * </pre>
 */
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final String name;
    private final Runnable loginAction;

    private volatile long generation = 0;

    /**
     * @param name        label used in log lines
     * @param loginAction performs one login; throws on failure
     */
    public SessionManager(String name, Runnable loginAction) {
        this.name = Objects.requireNonNull(name, "name");
        this.loginAction = Objects.requireNonNull(loginAction, "loginAction");
    }

    /**
     * Log in unconditionally.
     */
    public synchronized void establish() {
        log.info("[{}] Establishing session", name);
        try {
            loginAction.run();
        } catch (RuntimeException e) {
            log.error("[{}] Login failed: {}", name, e.getMessage());
            throw e;
        }
        generation++;
        log.debug("[{}] Session established, generation={}", name, generation);
    }

    /**
     * Log in if no session has been established yet.
     */
    public void ensureEstablished() {
        if (generation > 0) {
            return;
        }
        synchronized (this) {
            if (generation == 0) {
                establish();
            }
        }
    }

    /**
     * Re-login unless another caller already did so after {@code observedGeneration}.
     *
     * @param observedGeneration generation read before the rejected request was sent
     * @return true if this call performed the login
     */
    public synchronized boolean refreshIfStale(long observedGeneration) {
        if (generation != observedGeneration) {
            log.debug("[{}] Session already refreshed (observed={}, current={})",
                name, observedGeneration, generation);
            return false;
        }
        log.warn("[{}] Session expired, re-authenticating", name);
        establish();
        return true;
    }

    public long generation() {
        return generation;
    }

    public boolean isAuthenticated() {
        return generation > 0;
    }
}
