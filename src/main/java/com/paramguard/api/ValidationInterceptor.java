package com.paramguard.api;

import java.io.IOException;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paramguard.validation.ValidationResult;
import com.paramguard.validation.ValidationSession;
import com.paramguard.validation.error.ErrorKind;
import com.paramguard.validation.source.RequestInputs;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

/**
 * HTTP handler that validates a request against an endpoint's parameter contracts before
 * the endpoint runs. Invalid requests are answered by the error handler and never reach
 * the next stage.
 */
public class ValidationInterceptor implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(ValidationInterceptor.class);

    private final RoutePattern route;
    private final ValidationSession session;
    private final ValidationErrorHandler errorHandler;
    private final ValidatedHandler next;

    public ValidationInterceptor(final RoutePattern route, final ValidationSession session,
                                 final ValidationErrorHandler errorHandler, final ValidatedHandler next) {
        this.route = route;
        this.session = session;
        this.errorHandler = errorHandler;
        this.next = next;
    }

    @Override
    public void handle(final HttpExchange exchange) throws IOException {
        final String path = exchange.getRequestURI().getRawPath();
        final Map<String, String> routeParams = route.match(path).orElse(Map.of());

        final RequestInputs inputs;
        try {
            inputs = RequestInputsReader.read(exchange, routeParams);
        } catch (MalformedRequestException e) {
            log.info("Rejected {} {}: {}", exchange.getRequestMethod(), path, e.getMessage());
            EndpointResponse.error(400, e.getMessage()).send(exchange);
            return;
        }

        final ValidationResult result = session.run(inputs);
        if (!result.isValid()) {
            log.info("Rejected {} {}: {}", exchange.getRequestMethod(), path, result.firstError().getMessage());
            exchange.setAttribute(ErrorKind.EXCHANGE_ATTRIBUTE, result.firstError().kind());
            errorHandler.handleAll(result.errors()).send(exchange);
            return;
        }
        next.handle(exchange, result.parameters());
    }
}
