package com.paramguard.api;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paramguard.validation.ValidatedParameters;
import com.sun.net.httpserver.HttpExchange;

/**
 * Calls an endpoint method with validated values and sends whatever it returns.
 */
public class EndpointInvoker implements ValidatedHandler {
    private static final Logger log = LoggerFactory.getLogger(EndpointInvoker.class);

    private final EndpointDef endpoint;

    public EndpointInvoker(final EndpointDef endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public void handle(final HttpExchange exchange, final ValidatedParameters parameters) throws IOException {
        final Object result;
        try {
            result = endpoint.invoke(exchange, parameters);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            log.error("Endpoint {} failed", endpoint, e);
            EndpointResponse.error(500, "Internal server error").send(exchange);
            return;
        }
        toResponse(result).send(exchange);
    }

    static EndpointResponse toResponse(final Object result) {
        if (result instanceof EndpointResponse response) {
            return response;
        }
        if (result == null) {
            return new EndpointResponse(204, null);
        }
        return EndpointResponse.ok(result);
    }
}
