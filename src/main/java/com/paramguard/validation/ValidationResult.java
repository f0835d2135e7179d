package com.paramguard.validation;

import java.util.List;

import com.paramguard.validation.error.ParameterValidationException;

/**
 * Outcome of a validation session.
 */
public record ValidationResult(ValidatedParameters parameters, List<ParameterValidationException> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public ParameterValidationException firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }

    /** Validated parameters, or the first error thrown. */
    public ValidatedParameters orElseThrow() {
        if (!errors.isEmpty()) throw errors.get(0);
        return parameters;
    }
}
