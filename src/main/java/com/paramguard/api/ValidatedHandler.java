package com.paramguard.api;

import java.io.IOException;

import com.paramguard.validation.ValidatedParameters;
import com.sun.net.httpserver.HttpExchange;

/**
 * Next stage after validation: receives the exchange together with the validated values.
 */
@FunctionalInterface
public interface ValidatedHandler {
    void handle(HttpExchange exchange, ValidatedParameters parameters) throws IOException;
}
