package com.paramguard.api;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

/**
 * Picks the endpoint for a request by path template and method. Templates without
 * variables win over templates with variables; otherwise registration order decides.
 * Unknown paths get 404, known paths with the wrong method 405.
 */
class RouteDispatcher implements HttpHandler {

    record RouteEntry(String method, RoutePattern pattern, HttpHandler handler) {}

    private final List<RouteEntry> routes = new CopyOnWriteArrayList<>();

    void add(final String method, final RoutePattern pattern, final HttpHandler handler) {
        for (final RouteEntry existing : routes) {
            if (existing.method().equals(method) && existing.pattern().template().equals(pattern.template())) {
                throw new IllegalStateException("Duplicate endpoint " + method + " " + pattern.template());
            }
        }
        final RouteEntry entry = new RouteEntry(method, pattern, handler);
        if (pattern.variables().isEmpty()) {
            // literal templates go ahead of every templated one
            int index = 0;
            while (index < routes.size() && routes.get(index).pattern().variables().isEmpty()) {
                index++;
            }
            routes.add(index, entry);
        } else {
            routes.add(entry);
        }
    }

    List<RouteEntry> routes() {
        return new ArrayList<>(routes);
    }

    @Override
    public void handle(final HttpExchange exchange) throws IOException {
        final String path = exchange.getRequestURI().getRawPath();
        final String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);

        final Set<String> allowed = new TreeSet<>();
        for (final RouteEntry route : routes) {
            if (route.pattern().match(path).isEmpty()) continue;
            if (route.method().equals(method)) {
                route.handler().handle(exchange);
                return;
            }
            allowed.add(route.method());
        }

        if (allowed.isEmpty()) {
            EndpointResponse.error(404, "Not found: " + path).send(exchange);
        } else {
            exchange.getResponseHeaders().set("Allow", String.join(", ", allowed));
            EndpointResponse.error(405, "Method " + method + " not allowed for " + path).send(exchange);
        }
    }
}
