package com.paramguard.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.paramguard.validation.error.ParameterValidationException;

/**
 * Responds with {"error": message} and the error's status: 400 for request defects,
 * 500 for a misconfigured parameter source. When several errors were collected the
 * body also lists every message under "errors".
 */
public class DefaultValidationErrorHandler implements ValidationErrorHandler {

    @Override
    public EndpointResponse handle(final ParameterValidationException error) {
        return EndpointResponse.error(error.httpStatus(), error.getMessage());
    }

    @Override
    public EndpointResponse handleAll(final List<ParameterValidationException> errors) {
        if (errors.size() == 1) {
            return handle(errors.get(0));
        }
        final ParameterValidationException first = errors.get(0);
        final int status = errors.stream().mapToInt(ParameterValidationException::httpStatus).max().orElse(400);
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", first.getMessage());
        body.put("errors", errors.stream().map(ParameterValidationException::getMessage).toList());
        return EndpointResponse.of(status, body);
    }
}
