package com.paramguard.api;

import java.io.IOException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paramguard.telemetry.TelemetryInterceptor;
import com.paramguard.telemetry.TelemetryLogger;
import com.paramguard.validation.ValidationEngine;
import com.paramguard.validation.ValidationPolicy;
import com.paramguard.validation.ValidationSession;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

/**
 * Registers @Endpoint methods of handler objects with an {@link HttpServer}. Each endpoint
 * runs behind a {@link ValidationInterceptor}; one server context is created per static
 * path prefix and all of them share a {@link RouteDispatcher}.
 */
public class EndpointRegistry {
    private static final Logger log = LoggerFactory.getLogger(EndpointRegistry.class);

    public static final String CATALOG_PATH = "/endpoints";

    private final HttpServer server;
    private final ValidationEngine engine = new ValidationEngine();
    private final ValidationPolicy policy;
    private final ValidationErrorHandler errorHandler;
    private final TelemetryLogger telemetryLogger;
    private final RouteDispatcher dispatcher = new RouteDispatcher();
    private final Set<String> contexts = new HashSet<>();
    private final List<EndpointDef> endpoints = new ArrayList<>();

    /**
     * @param telemetryLogger telemetry sink, or null to run without telemetry
     */
    public EndpointRegistry(final HttpServer server, final ValidationPolicy policy,
                            final ValidationErrorHandler errorHandler, final TelemetryLogger telemetryLogger) {
        this.server = server;
        this.policy = policy;
        this.errorHandler = errorHandler;
        this.telemetryLogger = telemetryLogger;
        dispatcher.add("GET", RoutePattern.compile(CATALOG_PATH), this::sendCatalog);
        ensureContext(CATALOG_PATH);
    }

    public EndpointRegistry(final HttpServer server) {
        this(server, ValidationPolicy.FAIL_FAST, new DefaultValidationErrorHandler(), null);
    }

    /**
     * Register every @Endpoint method of the given handler objects.
     *
     * @throws IllegalStateException when an endpoint declaration is invalid or duplicated
     */
    public synchronized void register(final Object... handlers) {
        for (final Object handler : handlers) {
            final Method[] methods = handler.getClass().getMethods();
            Arrays.sort(methods, Comparator.comparing(Method::getName));
            for (final Method method : methods) {
                if (method.isAnnotationPresent(Endpoint.class)) {
                    registerEndpoint(EndpointDef.fromMethod(handler, method));
                }
            }
        }
    }

    /**
     * Register a single endpoint definition.
     */
    public synchronized void registerEndpoint(final EndpointDef endpoint) {
        final ValidationSession session = new ValidationSession(endpoint.toParameterSpecs(), engine, policy);
        final HttpHandler handler = new ValidationInterceptor(endpoint.getRoute(), session, errorHandler,
            new EndpointInvoker(endpoint));

        dispatcher.add(endpoint.getHttpMethod(), endpoint.getRoute(), wrapWithTelemetry(handler, endpoint));
        ensureContext(endpoint.getRoute().staticPrefix());
        endpoints.add(endpoint);
        log.info("Registered endpoint {}", endpoint);
    }

    public synchronized List<EndpointDef> getEndpoints() {
        return List.copyOf(endpoints);
    }

    /**
     * Catalog of registered endpoints, as served by GET /endpoints.
     */
    public synchronized Map<String, Object> catalog() {
        final List<Map<String, Object>> entries = new ArrayList<>();
        for (final EndpointDef endpoint : endpoints) {
            entries.add(endpoint.toCatalogEntry());
        }
        final Map<String, Object> catalog = new LinkedHashMap<>();
        catalog.put("endpoints", entries);
        return catalog;
    }

    /**
     * Shut down the telemetry logger and write its final summary.
     */
    public void shutdown() {
        if (telemetryLogger != null) {
            telemetryLogger.shutdown();
            log.info("Telemetry logger shut down");
        }
    }

    private void sendCatalog(final HttpExchange exchange) throws IOException {
        EndpointResponse.ok(catalog()).send(exchange);
    }

    private HttpHandler wrapWithTelemetry(final HttpHandler handler, final EndpointDef endpoint) {
        if (telemetryLogger == null) return handler;
        return new TelemetryInterceptor(handler, telemetryLogger, endpoint.getName(), endpoint.getRoute().template());
    }

    private void ensureContext(final String prefix) {
        if (contexts.add(prefix)) {
            server.createContext(prefix, dispatcher);
        }
    }
}
