package com.paramguard.validation.error;

import com.paramguard.validation.source.SourceKind;

/**
 * A required parameter was not supplied and has neither a default nor an optional type.
 */
public class MissingInputException extends ParameterValidationException {
    private final SourceKind sourceKind;

    public MissingInputException(final String parameterName, final SourceKind sourceKind) {
        super("Required " + sourceKind.displayName() + " parameter '" + parameterName + "' not given", parameterName);
        this.sourceKind = sourceKind;
    }

    public SourceKind sourceKind() {
        return sourceKind;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MISSING_INPUT;
    }
}
