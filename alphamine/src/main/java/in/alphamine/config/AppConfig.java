package in.alphamine.config;

import in.alphamine.util.Env;

import java.util.List;

/**
 * Application-level settings.
 *
 * RUN_MODE selects what the bootstrap does (MINE, SIMULATE or SUBMIT).
 * EXPRESSIONS holds the SIMULATE inputs, separated by ';'.
 */
public record AppConfig(
    String runMode,
    String outputDir,
    int maxConcurrentSimulations,
    int maxConcurrentSubmissions,
    int metricsPort,
    String baseExpression,
    String region,
    String universe,
    double variationRange,
    int maxVariations,
    List<String> expressions,
    List<String> regions
) {
    public AppConfig {
        expressions = expressions == null ? List.of() : List.copyOf(expressions);
        regions = regions == null || regions.isEmpty() ? List.of(region) : List.copyOf(regions);
    }

    public static AppConfig fromEnv() {
        return new AppConfig(
            Env.get("RUN_MODE", "MINE").toUpperCase(),
            Env.get("OUTPUT_DIR", "./output"),
            Env.getInt("MAX_CONCURRENT_SIMULATIONS", 5),
            Env.getInt("MAX_CONCURRENT_SUBMISSIONS", 3),
            Env.getInt("METRICS_PORT", 0),
            Env.get("BASE_EXPRESSION", null),
            Env.get("REGION", "USA"),
            Env.get("UNIVERSE", "TOP3000"),
            Env.getDouble("VARIATION_RANGE", 0.5),
            Env.getInt("MAX_VARIATIONS", 20),
            Env.getList("EXPRESSIONS"),
            Env.getList("REGIONS")
        );
    }

    public boolean metricsEnabled() {
        return metricsPort > 0;
    }
}
