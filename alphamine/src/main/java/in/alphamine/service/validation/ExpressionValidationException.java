package in.alphamine.service.validation;

import in.alphamine.domain.common.ValidationErrorCode;

/**
 * Thrown when an expression or settings object fails local validation.
 */
public class ExpressionValidationException extends RuntimeException {

    private final ValidationErrorCode code;
    private final String expression;

    public ExpressionValidationException(ValidationErrorCode code, String message, String expression) {
        super(String.format("[%s] %s", code, message));
        this.code = code;
        this.expression = expression;
    }

    public ValidationErrorCode getCode() {
        return code;
    }

    public String getExpression() {
        return expression;
    }
}
