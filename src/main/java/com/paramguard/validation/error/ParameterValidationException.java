package com.paramguard.validation.error;

/**
 * Base type for every failure raised while resolving a single handler parameter.
 * Custom error handlers receive instances of this type and can switch on {@link #kind()}.
 */
public abstract class ParameterValidationException extends RuntimeException {
    private final String parameterName;

    protected ParameterValidationException(final String message, final String parameterName) {
        super(message);
        this.parameterName = parameterName;
    }

    public abstract ErrorKind kind();

    public String parameterName() {
        return parameterName;
    }

    public int httpStatus() {
        return kind().httpStatus();
    }
}
