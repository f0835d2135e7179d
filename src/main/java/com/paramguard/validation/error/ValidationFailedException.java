package com.paramguard.validation.error;

/**
 * A correctly typed value was rejected by one of its binding's constraints.
 */
public class ValidationFailedException extends ParameterValidationException {
    private final String declaredType;
    private final String reason;

    public ValidationFailedException(final String parameterName, final String declaredType, final String reason) {
        super("Parameter '" + parameterName + "' " + reason, parameterName);
        this.declaredType = declaredType;
        this.reason = reason;
    }

    public String declaredType() {
        return declaredType;
    }

    /** The constraint's own message, without the parameter prefix. */
    public String reason() {
        return reason;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION_FAILED;
    }
}
