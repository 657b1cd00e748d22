package in.alphamine.application.service;

import in.alphamine.domain.common.ErrorKind;
import in.alphamine.infrastructure.brain.BrainException;
import in.alphamine.service.validation.ExpressionValidationException;

/**
 * Maps exceptions escaping a unit of work to the ErrorKind reported in its Outcome.
 */
public final class FailureClassifier {

    public static ErrorKind kindOf(Throwable error) {
        if (error instanceof BrainException) {
            return ((BrainException) error).getKind();
        }
        if (error instanceof ExpressionValidationException) {
            return ErrorKind.VALIDATION;
        }
        return ErrorKind.UNEXPECTED;
    }

    public static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }

    private FailureClassifier() {}
}
