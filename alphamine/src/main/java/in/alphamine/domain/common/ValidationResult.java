package in.alphamine.domain.common;

/**
 * Result of a local validation check.
 */
public record ValidationResult(boolean passed, ValidationErrorCode code, String message) {

    private static final ValidationResult PASS = new ValidationResult(true, null, null);

    public static ValidationResult pass() {
        return PASS;
    }

    public static ValidationResult fail(ValidationErrorCode code) {
        return new ValidationResult(false, code, code.description());
    }

    public static ValidationResult fail(ValidationErrorCode code, String message) {
        return new ValidationResult(false, code, message);
    }
}
