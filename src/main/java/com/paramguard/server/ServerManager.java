package com.paramguard.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpServer;

/**
 * Manages the lifecycle of the embedded HTTP server.
 */
public class ServerManager {
    private static final Logger log = LoggerFactory.getLogger(ServerManager.class);

    private final ServerConfig config;
    private final ServerFactory serverFactory;
    private HttpServer server;
    private ExecutorService executor;

    /**
     * Creates the server socket. Replaced in tests.
     */
    @FunctionalInterface
    public interface ServerFactory {
        HttpServer create(InetSocketAddress address) throws IOException;
    }

    public ServerManager(final ServerConfig config) {
        this(config, address -> HttpServer.create(address, 0));
    }

    public ServerManager(final ServerConfig config, final ServerFactory serverFactory) {
        this.config = config;
        this.serverFactory = serverFactory;
    }

    /**
     * Start the HTTP server, stopping a running one first.
     *
     * @throws IOException if the address cannot be bound
     */
    public synchronized HttpServer startServer() throws IOException {
        if (server != null) {
            log.info("Stopping existing HTTP server before starting a new one");
            stopServer();
        }

        final HttpServer created = serverFactory.create(new InetSocketAddress(config.bindAddress(), config.port()));
        if (config.threads() > 0) {
            executor = Executors.newFixedThreadPool(config.threads());
            created.setExecutor(executor);
        } else {
            created.setExecutor(null);
        }
        created.start();
        server = created;
        log.info("HTTP server started on {}:{}", config.bindAddress(), boundPort());
        return server;
    }

    /**
     * Stop the HTTP server if it is running.
     */
    public synchronized void stopServer() {
        if (server != null) {
            log.info("Stopping HTTP server...");
            server.stop(config.stopDelaySeconds());
            server = null;
            if (executor != null) {
                executor.shutdown();
                executor = null;
            }
            log.info("HTTP server stopped");
        }
    }

    /**
     * @return the HTTP server, or null if not running
     */
    public synchronized HttpServer getServer() {
        return server;
    }

    public synchronized boolean isServerRunning() {
        return server != null;
    }

    /** Port actually bound; differs from the configured one when that is 0. */
    public synchronized int boundPort() {
        if (server == null || server.getAddress() == null) return config.port();
        return server.getAddress().getPort();
    }

    public ServerConfig getConfig() {
        return config;
    }
}
