package in.alphamine.service.validation;

import in.alphamine.domain.common.ValidationErrorCode;
import in.alphamine.domain.common.ValidationResult;
import in.alphamine.domain.simulation.SimulationSettings;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Local syntactic checks run before an expression is sent for simulation.
 *
 * Checks, in order:
 * - not blank
 * - as many '(' as ')'
 * - not a bare number or identifier
 * - contains at least one call {@code name(}
 * - no empty call {@code ()}
 * - no adjacent calls without an operator {@code )(}
 *
 * Semantic validity (known operators, data field names) is left to the platform.
 */
public class ExpressionValidator {

    private static final Pattern TOO_SIMPLE = Pattern.compile("\\d+\\.?|[a-zA-Z_]+");
    private static final Pattern FUNCTION_CALL = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*\\s*\\(");
    private static final Pattern EMPTY_CALL = Pattern.compile("\\(\\s*\\)");
    private static final Pattern MISSING_OPERATOR = Pattern.compile("\\)\\s*\\(");

    private static final Set<String> INSTRUMENT_TYPES = Set.of("EQUITY", "FUTURES", "CRYPTO", "FOREX");
    private static final Set<String> REGIONS =
        Set.of("USA", "CHN", "JPN", "EUR", "ASIA", "KOR", "TWN", "GBR", "HKG", "GLOBAL");
    private static final Set<String> UNIVERSES = Set.of("TOP3000", "TOP1000", "TOP500", "TOP100", "ALL");
    private static final Set<String> NEUTRALIZATIONS = Set.of("INDUSTRY", "SECTOR", "MARKET", "NONE");

    public ValidationResult validate(String expression) {
        if (expression == null || expression.isBlank()) {
            return ValidationResult.fail(ValidationErrorCode.EMPTY);
        }
        if (count(expression, '(') != count(expression, ')')) {
            return ValidationResult.fail(ValidationErrorCode.UNBALANCED_PARENTHESES);
        }
        if (TOO_SIMPLE.matcher(expression).matches()) {
            return ValidationResult.fail(ValidationErrorCode.TOO_SIMPLE);
        }
        if (!FUNCTION_CALL.matcher(expression).find()) {
            return ValidationResult.fail(ValidationErrorCode.NO_FUNCTION_CALL);
        }
        if (EMPTY_CALL.matcher(expression).find()) {
            return ValidationResult.fail(ValidationErrorCode.EMPTY_CALL);
        }
        if (MISSING_OPERATOR.matcher(expression).find()) {
            return ValidationResult.fail(ValidationErrorCode.MISSING_OPERATOR);
        }
        return ValidationResult.pass();
    }

    public boolean isValid(String expression) {
        return validate(expression).passed();
    }

    /**
     * @throws ExpressionValidationException if the expression fails any check
     */
    public void requireValid(String expression) {
        ValidationResult result = validate(expression);
        if (!result.passed()) {
            throw new ExpressionValidationException(result.code(), result.message(), expression);
        }
    }

    public ValidationResult validateSettings(SimulationSettings settings) {
        if (settings == null) {
            return ValidationResult.fail(ValidationErrorCode.INVALID_SETTINGS, "Settings are missing");
        }
        if (!INSTRUMENT_TYPES.contains(settings.instrumentType())) {
            return invalidSetting("instrumentType", settings.instrumentType());
        }
        if (!REGIONS.contains(settings.region())) {
            return invalidSetting("region", settings.region());
        }
        if (!UNIVERSES.contains(settings.universe())) {
            return invalidSetting("universe", settings.universe());
        }
        if (!NEUTRALIZATIONS.contains(settings.neutralization())) {
            return invalidSetting("neutralization", settings.neutralization());
        }
        return ValidationResult.pass();
    }

    private static ValidationResult invalidSetting(String field, String value) {
        return ValidationResult.fail(ValidationErrorCode.INVALID_SETTINGS, "Invalid " + field + ": " + value);
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }
}
