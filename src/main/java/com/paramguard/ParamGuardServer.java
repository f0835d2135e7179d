package com.paramguard;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paramguard.api.DefaultValidationErrorHandler;
import com.paramguard.api.EndpointRegistry;
import com.paramguard.api.ValidationErrorHandler;
import com.paramguard.server.ServerConfig;
import com.paramguard.server.ServerConfigLoader;
import com.paramguard.server.ServerManager;
import com.paramguard.telemetry.TelemetryLogger;

/**
 * Runs handler objects behind parameter validation on an embedded HTTP server.
 *
 * <pre>
 *   ParamGuardServer server = new ParamGuardServer(ServerConfigLoader.load());
 *   server.start(new UserEndpoints());
 * </pre>
 */
public class ParamGuardServer {
    private static final Logger log = LoggerFactory.getLogger(ParamGuardServer.class);

    private final ServerManager serverManager;
    private final ValidationErrorHandler errorHandler;
    private EndpointRegistry registry;

    public ParamGuardServer() {
        this(ServerConfigLoader.load());
    }

    public ParamGuardServer(final ServerConfig config) {
        this(new ServerManager(config), new DefaultValidationErrorHandler());
    }

    public ParamGuardServer(final ServerConfig config, final ValidationErrorHandler errorHandler) {
        this(new ServerManager(config), errorHandler);
    }

    public ParamGuardServer(final ServerManager serverManager, final ValidationErrorHandler errorHandler) {
        this.serverManager = serverManager;
        this.errorHandler = errorHandler;
    }

    /**
     * Start the server and register the endpoints of the given handlers. Restarting replaces
     * the previous server and its endpoints.
     *
     * @throws IOException if the server cannot bind its address
     * @throws IllegalStateException if an endpoint declaration is invalid
     */
    public synchronized void start(final Object... handlers) throws IOException {
        if (registry != null) {
            stop();
        }
        final ServerConfig config = serverManager.getConfig();
        final TelemetryLogger telemetry = config.telemetryEnabled() ? new TelemetryLogger(config.telemetryDir()) : null;
        if (telemetry != null) {
            telemetry.init();
        }

        registry = new EndpointRegistry(serverManager.startServer(), config.policy(), errorHandler, telemetry);
        try {
            registry.register(handlers);
        } catch (RuntimeException e) {
            log.error("Endpoint registration failed, stopping server", e);
            stop();
            throw e;
        }
        log.info("ParamGuard serving {} endpoint(s) on port {}", registry.getEndpoints().size(), serverManager.boundPort());
    }

    public synchronized void stop() {
        if (registry != null) {
            registry.shutdown();
            registry = null;
        }
        serverManager.stopServer();
    }

    public synchronized boolean isRunning() {
        return serverManager.isServerRunning();
    }

    public int port() {
        return serverManager.boundPort();
    }

    /**
     * @return the registry of the running server, or null when stopped
     */
    public synchronized EndpointRegistry getRegistry() {
        return registry;
    }
}
