package com.paramguard.server;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paramguard.validation.ValidationPolicy;

/**
 * Loads {@link ServerConfig} from {@code paramguard.properties} on the classpath, then
 * applies system properties with the same keys on top.
 */
public final class ServerConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ServerConfigLoader.class);

    public static final String RESOURCE = "paramguard.properties";

    static final String PORT = "paramguard.port";
    static final String BIND_ADDRESS = "paramguard.bindAddress";
    static final String STOP_DELAY = "paramguard.stopDelaySeconds";
    static final String THREADS = "paramguard.threads";
    static final String POLICY = "paramguard.validation.policy";
    static final String TELEMETRY_ENABLED = "paramguard.telemetry.enabled";
    static final String TELEMETRY_DIR = "paramguard.telemetry.dir";

    private ServerConfigLoader() {}

    /**
     * @throws IllegalArgumentException if a value cannot be parsed; the message names the key
     */
    public static ServerConfig load() {
        final Properties props = new Properties();
        try (InputStream in = ServerConfigLoader.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
                log.debug("Loaded {} from classpath", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (final String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("paramguard.")) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(props);
    }

    /**
     * Build a config from explicit properties; missing keys keep their defaults.
     */
    public static ServerConfig fromProperties(final Properties props) {
        final ServerConfig defaults = ServerConfig.defaults();
        return new ServerConfig(
            intValue(props, PORT, defaults.port()),
            props.getProperty(BIND_ADDRESS, defaults.bindAddress()).trim(),
            intValue(props, STOP_DELAY, defaults.stopDelaySeconds()),
            intValue(props, THREADS, defaults.threads()),
            policyValue(props, defaults.policy()),
            booleanValue(props, TELEMETRY_ENABLED, defaults.telemetryEnabled()),
            props.containsKey(TELEMETRY_DIR) ? Path.of(props.getProperty(TELEMETRY_DIR).trim()) : defaults.telemetryDir());
    }

    private static int intValue(final Properties props, final String key, final int fallback) {
        final String value = props.getProperty(key);
        if (value == null) return fallback;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    private static boolean booleanValue(final Properties props, final String key, final boolean fallback) {
        final String value = props.getProperty(key);
        if (value == null) return fallback;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException("Invalid boolean for " + key + ": '" + value + "'");
        };
    }

    private static ValidationPolicy policyValue(final Properties props, final ValidationPolicy fallback) {
        final String value = props.getProperty(POLICY);
        if (value == null) return fallback;
        try {
            return ValidationPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid validation policy for " + POLICY + ": '" + value + "'", e);
        }
    }
}
