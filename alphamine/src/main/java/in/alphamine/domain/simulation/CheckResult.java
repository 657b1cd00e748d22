package in.alphamine.domain.simulation;

import java.util.Locale;

/**
 * Verdict of one platform check. Results the platform may add later read as UNKNOWN.
 */
public enum CheckResult {
    PASS,
    FAIL,
    WARNING,
    PENDING,
    UNKNOWN;

    public static CheckResult fromWire(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
