package com.paramguard.utils;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpExchange;

/**
 * Utility methods for reading requests and writing responses on the JDK HTTP server.
 */
public final class HttpUtils {
    private static final Logger log = LoggerFactory.getLogger(HttpUtils.class);

    public static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";
    public static final String TEXT_CONTENT_TYPE = "text/plain; charset=utf-8";

    private HttpUtils() {}

    /**
     * Parse query parameters from the URL, e.g. ?offset=10&tag=a&tag=b.
     * Repeated keys become a {@code List<String>}, single keys a {@code String}.
     */
    public static Map<String, Object> parseQueryParams(final HttpExchange exchange) {
        return parseUrlEncoded(exchange.getRequestURI().getRawQuery());
    }

    /**
     * Parse an application/x-www-form-urlencoded string, e.g. oldName=foo&newName=bar.
     * Pairs without '=' are ignored.
     */
    public static Map<String, Object> parseUrlEncoded(final String encoded) {
        final Map<String, Object> result = new LinkedHashMap<>();
        if (encoded == null || encoded.isEmpty()) return result;

        for (final String pair : encoded.split("&")) {
            final int equalsIndex = pair.indexOf('=');
            if (equalsIndex <= 0) continue;
            final String key = decodeUrlParameter(pair.substring(0, equalsIndex));
            final String value = decodeUrlParameter(pair.substring(equalsIndex + 1));
            addValue(result, key, value);
        }
        return result;
    }

    /**
     * Add a value under {@code key}, turning the entry into a list when the key repeats.
     */
    public static void addValue(final Map<String, Object> target, final String key, final Object value) {
        final Object existing = target.get(key);
        if (existing == null) {
            target.put(key, value);
            return;
        }
        final List<Object> values = new ArrayList<>();
        if (existing instanceof List<?> previous) {
            values.addAll(previous);
        } else {
            values.add(existing);
        }
        values.add(value);
        target.put(key, values);
    }

    /**
     * Helper method to decode URL parameters safely
     */
    public static String decodeUrlParameter(final String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.warn("Error decoding URL parameter: {} - {}", value, e.getMessage());
            return value; // Return the original value if decoding fails
        }
    }

    /**
     * Media type of the request without parameters, lower-cased; empty when absent.
     */
    public static String mediaType(final HttpExchange exchange) {
        final String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        if (contentType == null) return "";
        final int semicolon = contentType.indexOf(';');
        final String type = semicolon < 0 ? contentType : contentType.substring(0, semicolon);
        return type.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Value of a Content-Type parameter such as {@code boundary}, or null.
     */
    public static String contentTypeParameter(final String contentType, final String name) {
        if (contentType == null) return null;
        for (final String part : contentType.split(";")) {
            final String trimmed = part.trim();
            final int eq = trimmed.indexOf('=');
            if (eq > 0 && trimmed.substring(0, eq).trim().equalsIgnoreCase(name)) {
                final String value = trimmed.substring(eq + 1).trim();
                return value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")
                    ? value.substring(1, value.length() - 1) : value;
            }
        }
        return null;
    }

    public static byte[] readBody(final HttpExchange exchange) throws IOException {
        try (var in = exchange.getRequestBody()) {
            return in.readAllBytes();
        }
    }

    /**
     * Send a plain text HTTP response
     */
    public static void sendText(final HttpExchange exchange, final int status, final String response) throws IOException {
        send(exchange, status, TEXT_CONTENT_TYPE, response.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Serialize {@code body} with Jackson and send it as JSON.
     */
    public static void sendJson(final HttpExchange exchange, final int status, final Object body) throws IOException {
        send(exchange, status, JSON_CONTENT_TYPE, Json.serialize(body).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Send a response without a body, e.g. 204 or 405.
     */
    public static void sendEmpty(final HttpExchange exchange, final int status) throws IOException {
        exchange.sendResponseHeaders(status, -1);
        exchange.close();
    }

    private static void send(final HttpExchange exchange, final int status, final String contentType,
                             final byte[] bytes) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (var os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
