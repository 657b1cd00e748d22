package in.alphamine.bootstrap;

import in.alphamine.config.AppConfig;
import in.alphamine.config.BrainClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Runs before anything talks to the platform. Throws IllegalStateException and the
 * process refuses to start if the configuration cannot work.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    static final Set<String> RUN_MODES = Set.of("MINE", "SIMULATE", "SUBMIT");

    public static void validate(BrainClientConfig brain, AppConfig app) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");

        if (!brain.hasCredentials()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: platform credentials missing\n" +
                "Set WQ_USERNAME and WQ_PASSWORD."
            );
        }
        log.info("✓ Credentials present for {}", brain.username());

        if (!RUN_MODES.contains(app.runMode())) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: RUN_MODE=" + app.runMode() + " (expected one of " + RUN_MODES + ")");
        }
        log.info("✓ Run mode {}", app.runMode());

        if (app.maxConcurrentSimulations() <= 0 || app.maxConcurrentSubmissions() <= 0) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: MAX_CONCURRENT_SIMULATIONS and MAX_CONCURRENT_SUBMISSIONS must be positive");
        }

        if ("MINE".equals(app.runMode()) && (app.baseExpression() == null || app.baseExpression().isBlank())) {
            throw new IllegalStateException("❌ INVALID CONFIG: RUN_MODE=MINE requires BASE_EXPRESSION");
        }
        if ("SIMULATE".equals(app.runMode()) && app.expressions().isEmpty()) {
            throw new IllegalStateException("❌ INVALID CONFIG: RUN_MODE=SIMULATE requires EXPRESSIONS");
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private StartupConfigValidator() {}
}
