package com.paramguard.validation.error;

import com.paramguard.validation.source.SourceKind;

/**
 * A parameter is bound to a source the request bundle does not provide.
 * Indicates a broken handler declaration, not a bad request.
 */
public class InvalidParameterSourceException extends ParameterValidationException {
    private final SourceKind sourceKind;

    public InvalidParameterSourceException(final String parameterName, final SourceKind sourceKind) {
        super("Invalid parameter source '" + sourceKind + "' for parameter '" + parameterName + "'", parameterName);
        this.sourceKind = sourceKind;
    }

    /** The unrecognised source, or null when the parameter declared none. */
    public SourceKind sourceKind() {
        return sourceKind;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MISCONFIGURED_SOURCE;
    }
}
