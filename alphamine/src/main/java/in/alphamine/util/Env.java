package in.alphamine.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Reads settings from the environment, then from system properties (-D flags).
 * A blank value counts as unset. A value that does not parse falls back to the default.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = lookup(key);
        return value != null ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, Integer::parseInt, defaultValue);
    }

    public static double getDouble(String key, double defaultValue) {
        return parse(key, Double::parseDouble, defaultValue);
    }

    /** Whole seconds. */
    public static Duration getSeconds(String key, Duration defaultValue) {
        return parse(key, s -> Duration.ofSeconds(Long.parseLong(s)), defaultValue);
    }

    /**
     * @return the non-blank entries of a ';' separated value, empty when unset
     */
    public static List<String> getList(String key) {
        String value = lookup(key);
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(";"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static <T> T parse(String key, Function<String, T> parser, T defaultValue) {
        String value = lookup(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return parser.apply(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}='{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static String lookup(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private Env() {}
}
