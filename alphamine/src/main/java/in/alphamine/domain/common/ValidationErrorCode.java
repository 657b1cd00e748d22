package in.alphamine.domain.common;

/**
 * Reasons an expression can fail local validation.
 */
public enum ValidationErrorCode {
    EMPTY("Expression is empty"),
    UNBALANCED_PARENTHESES("Unbalanced parentheses"),
    TOO_SIMPLE("Expression too simple (just a number or variable name)"),
    NO_FUNCTION_CALL("No function calls found in expression"),
    EMPTY_CALL("Empty function calls"),
    MISSING_OPERATOR("Missing operator between terms"),
    INVALID_SETTINGS("Invalid simulation settings");

    private final String description;

    ValidationErrorCode(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
