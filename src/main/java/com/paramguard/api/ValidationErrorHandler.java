package com.paramguard.api;

import java.util.List;

import com.paramguard.validation.error.ParameterValidationException;

/**
 * Formats validation failures into a response. A custom handler receives the raw exception
 * and its response is sent verbatim.
 */
@FunctionalInterface
public interface ValidationErrorHandler {

    EndpointResponse handle(ParameterValidationException error);

    /**
     * Called with every failure of a session. Fail-fast sessions pass a single error;
     * the default formats only the first one.
     */
    default EndpointResponse handleAll(final List<ParameterValidationException> errors) {
        return handle(errors.get(0));
    }
}
