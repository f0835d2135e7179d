package com.paramguard.api;

import java.io.IOException;
import java.util.Map;

import com.paramguard.utils.HttpUtils;
import com.sun.net.httpserver.HttpExchange;

/**
 * Status and body an endpoint or error handler wants sent. Strings are sent as plain text,
 * other bodies as JSON, and a null body as an empty response.
 */
public record EndpointResponse(int status, Object body) {

    public static EndpointResponse ok(final Object body) {
        return new EndpointResponse(200, body);
    }

    public static EndpointResponse of(final int status, final Object body) {
        return new EndpointResponse(status, body);
    }

    /** Convenience factory for the {"error": message} shape. */
    public static EndpointResponse error(final int status, final String message) {
        return new EndpointResponse(status, Map.of("error", message));
    }

    public void send(final HttpExchange exchange) throws IOException {
        if (body == null) {
            HttpUtils.sendEmpty(exchange, status);
        } else if (body instanceof String s) {
            HttpUtils.sendText(exchange, status, s);
        } else {
            HttpUtils.sendJson(exchange, status, body);
        }
    }
}
