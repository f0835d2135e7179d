package com.paramguard.validation.error;

/**
 * Raised by a source binding when a value breaks one of its constraints.
 * The engine rethrows it as a {@link ValidationFailedException} carrying the parameter.
 */
public class ConstraintViolationException extends Exception {

    public ConstraintViolationException(final String reason) {
        super(reason);
    }
}
