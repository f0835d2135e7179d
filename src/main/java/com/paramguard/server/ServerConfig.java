package com.paramguard.server;

import java.nio.file.Path;

import com.paramguard.validation.ValidationPolicy;

/**
 * Settings of the embedded HTTP server.
 *
 * @param port             listening port; 0 picks a free one
 * @param bindAddress      interface to bind
 * @param stopDelaySeconds grace period for open exchanges on stop
 * @param threads          worker threads; 0 runs handlers on the server's dispatcher thread
 * @param policy           how many parameter failures a request reports
 * @param telemetryEnabled whether endpoint telemetry is written
 * @param telemetryDir     where telemetry files go
 */
public record ServerConfig(int port, String bindAddress, int stopDelaySeconds, int threads,
                           ValidationPolicy policy, boolean telemetryEnabled, Path telemetryDir) {

    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_BIND_ADDRESS = "0.0.0.0";

    public ServerConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (stopDelaySeconds < 0) {
            throw new IllegalArgumentException("stopDelaySeconds must not be negative: " + stopDelaySeconds);
        }
        if (threads < 0) {
            throw new IllegalArgumentException("threads must not be negative: " + threads);
        }
        if (bindAddress == null || bindAddress.isBlank()) {
            bindAddress = DEFAULT_BIND_ADDRESS;
        }
        if (policy == null) {
            policy = ValidationPolicy.FAIL_FAST;
        }
        if (telemetryDir == null) {
            telemetryDir = defaultTelemetryDir();
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_PORT, DEFAULT_BIND_ADDRESS, 1, 0, ValidationPolicy.FAIL_FAST,
            false, defaultTelemetryDir());
    }

    public ServerConfig withPort(final int newPort) {
        return new ServerConfig(newPort, bindAddress, stopDelaySeconds, threads, policy, telemetryEnabled, telemetryDir);
    }

    static Path defaultTelemetryDir() {
        return Path.of(System.getProperty("user.home"), ".paramguard", "telemetry");
    }
}
