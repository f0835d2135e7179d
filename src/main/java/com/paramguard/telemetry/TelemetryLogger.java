package com.paramguard.telemetry;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.paramguard.validation.error.ErrorKind;

/**
 * Telemetry logger for endpoint usage, success rates and validation failures.
 * Writes one JSON event per line to a daily file and a JSON summary on shutdown.
 */
public class TelemetryLogger {
    private static final Logger log = LoggerFactory.getLogger(TelemetryLogger.class);

    private static final String LOG_FILE_PREFIX = "paramguard_telemetry_";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Gson gson = new GsonBuilder().create(); // one event per line, no pretty printing
    private final Path telemetryDir;
    private final Map<String, EndpointMetrics> endpointMetrics = new ConcurrentHashMap<>();
    private final AtomicLong sessionRequestCount = new AtomicLong();
    private final String sessionId;
    private final long sessionStartTime;

    /**
     * Metrics tracked for each endpoint.
     */
    private static class EndpointMetrics {
        final AtomicLong invocationCount = new AtomicLong();
        final AtomicLong successCount = new AtomicLong();
        final AtomicLong failureCount = new AtomicLong();
        final AtomicLong totalDurationMs = new AtomicLong();
        final AtomicLong minDurationMs = new AtomicLong(Long.MAX_VALUE);
        final AtomicLong maxDurationMs = new AtomicLong();
        final Map<String, AtomicLong> errorCounts = new ConcurrentHashMap<>();
        final Map<ErrorKind, AtomicLong> validationFailures = new ConcurrentHashMap<>();
    }

    /**
     * One line of the event log.
     */
    public static class TelemetryEvent {
        public final String timestamp;
        public final String sessionId;
        public final String eventType;
        public final String endpoint;
        public final String path;
        public final boolean success;
        public final Integer status;
        public final String errorType;
        public final String errorMessage;
        public final long durationMs;
        public final long responseSize;
        public final Map<String, Object> metadata;

        TelemetryEvent(final String sessionId, final String eventType, final String endpoint, final String path,
                       final boolean success, final Integer status, final String errorType, final String errorMessage,
                       final long durationMs, final long responseSize, final Map<String, Object> metadata) {
            this.timestamp = Instant.now().toString();
            this.sessionId = sessionId;
            this.eventType = eventType;
            this.endpoint = endpoint;
            this.path = path;
            this.success = success;
            this.status = status;
            this.errorType = errorType;
            this.errorMessage = errorMessage;
            this.durationMs = durationMs;
            this.responseSize = responseSize;
            this.metadata = metadata;
        }
    }

    public TelemetryLogger(final Path telemetryDir) {
        this.telemetryDir = telemetryDir;
        this.sessionStartTime = System.currentTimeMillis();
        this.sessionId = "session_" + sessionStartTime + "_" + UUID.randomUUID().toString().substring(0, 8);

        try {
            Files.createDirectories(telemetryDir);
            log.info("Telemetry directory at {}", telemetryDir);
        } catch (IOException e) {
            log.error("Failed to create telemetry directory {}", telemetryDir, e);
        }
    }

    /**
     * Log the session start. Call once after construction.
     */
    public void init() {
        logSessionEvent("SESSION_START", null);
    }

    /**
     * Log the start of an endpoint invocation.
     *
     * @return start time in milliseconds, to pass to the success or failure call
     */
    public long logEndpointStart(final String endpoint, final String path) {
        final long startTime = System.currentTimeMillis();
        sessionRequestCount.incrementAndGet();
        metrics(endpoint).invocationCount.incrementAndGet();
        return startTime;
    }

    public void logEndpointSuccess(final String endpoint, final String path, final long startTime,
                                   final int status, final long responseSize) {
        final long duration = System.currentTimeMillis() - startTime;
        final EndpointMetrics metrics = metrics(endpoint);
        metrics.successCount.incrementAndGet();
        recordDuration(metrics, duration);

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("successRate", successRate(metrics));
        metadata.put("avgDurationMs", avgDuration(metrics));

        writeEvent(new TelemetryEvent(sessionId, "ENDPOINT_SUCCESS", endpoint, path, true, status,
            null, null, duration, responseSize, metadata));
    }

    /**
     * Log a failed invocation.
     *
     * @param validationKind kind of the validation failure that rejected the request, or null
     */
    public void logEndpointFailure(final String endpoint, final String path, final long startTime, final Integer status,
                                   final String errorType, final String errorMessage, final ErrorKind validationKind) {
        final long duration = System.currentTimeMillis() - startTime;
        final EndpointMetrics metrics = metrics(endpoint);
        metrics.failureCount.incrementAndGet();
        recordDuration(metrics, duration);
        final String errorKey = errorType != null ? errorType : "UNKNOWN_ERROR";
        metrics.errorCounts.computeIfAbsent(errorKey, k -> new AtomicLong()).incrementAndGet();
        if (validationKind != null) {
            metrics.validationFailures.computeIfAbsent(validationKind, k -> new AtomicLong()).incrementAndGet();
        }

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("successRate", successRate(metrics));
        metadata.put("errorTypeCount", metrics.errorCounts.get(errorKey).get());
        if (validationKind != null) {
            metadata.put("validationKind", validationKind.name());
        }

        writeEvent(new TelemetryEvent(sessionId, "ENDPOINT_FAILURE", endpoint, path, false, status,
            errorType, errorMessage, duration, 0, metadata));
    }

    public void logSessionEvent(final String eventType, final Map<String, Object> metadata) {
        final Map<String, Object> sessionMetadata = new LinkedHashMap<>();
        sessionMetadata.put("sessionDurationMs", System.currentTimeMillis() - sessionStartTime);
        sessionMetadata.put("totalRequests", sessionRequestCount.get());
        sessionMetadata.put("uniqueEndpointsUsed", endpointMetrics.size());
        if (metadata != null) {
            sessionMetadata.putAll(metadata);
        }
        writeEvent(new TelemetryEvent(sessionId, eventType, null, null, true, null,
            null, null, 0, 0, sessionMetadata));
    }

    /**
     * Snapshot of the per-endpoint counters, keyed by endpoint name.
     */
    public Map<String, Object> summary() {
        final Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("date", DATE_FORMAT.format(LocalDate.now(ZoneOffset.UTC)));
        summary.put("sessionId", sessionId);
        summary.put("totalRequests", sessionRequestCount.get());
        summary.put("sessionDurationMs", System.currentTimeMillis() - sessionStartTime);

        final Map<String, Object> endpoints = new TreeMap<>();
        endpointMetrics.forEach((name, m) -> {
            final Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("invocations", m.invocationCount.get());
            entry.put("successes", m.successCount.get());
            entry.put("failures", m.failureCount.get());
            entry.put("successRate", successRate(m));
            entry.put("avgDurationMs", avgDuration(m));
            entry.put("minDurationMs", m.minDurationMs.get() == Long.MAX_VALUE ? 0 : m.minDurationMs.get());
            entry.put("maxDurationMs", m.maxDurationMs.get());
            entry.put("errorTypes", snapshot(m.errorCounts));
            final Map<String, Long> byKind = new LinkedHashMap<>();
            for (final ErrorKind kind : ErrorKind.values()) {
                final AtomicLong count = m.validationFailures.get(kind);
                if (count != null) byKind.put(kind.name(), count.get());
            }
            entry.put("validationFailures", byKind);
            endpoints.put(name, entry);
        });
        summary.put("endpoints", endpoints);
        return summary;
    }

    /**
     * Write the summary file for today.
     */
    public void generateDailySummary() {
        final Path summaryFile = telemetryDir.resolve("summary_" + DATE_FORMAT.format(LocalDate.now(ZoneOffset.UTC)) + ".json");
        try (Writer writer = Files.newBufferedWriter(summaryFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            new GsonBuilder().setPrettyPrinting().create().toJson(summary(), writer);
            writer.write("\n");
            log.info("Telemetry summary written to {}", summaryFile);
        } catch (IOException e) {
            log.error("Failed to write telemetry summary {}", summaryFile, e);
        }
    }

    /**
     * Log the session end and write the final summary.
     */
    public void shutdown() {
        logSessionEvent("SESSION_END", null);
        generateDailySummary();
    }

    public String getSessionId() {
        return sessionId;
    }

    Path currentLogFile() {
        return telemetryDir.resolve(LOG_FILE_PREFIX + DATE_FORMAT.format(LocalDate.now(ZoneOffset.UTC)) + ".jsonl");
    }

    private synchronized void writeEvent(final TelemetryEvent event) {
        final Path logFile = currentLogFile();
        try {
            Files.writeString(logFile, gson.toJson(event) + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Failed to write telemetry event to {}: {}", logFile, e.getMessage());
        }
    }

    private EndpointMetrics metrics(final String endpoint) {
        return endpointMetrics.computeIfAbsent(endpoint, k -> new EndpointMetrics());
    }

    private static void recordDuration(final EndpointMetrics metrics, final long duration) {
        metrics.totalDurationMs.addAndGet(duration);
        metrics.minDurationMs.updateAndGet(min -> Math.min(min, duration));
        metrics.maxDurationMs.updateAndGet(max -> Math.max(max, duration));
    }

    private static double successRate(final EndpointMetrics metrics) {
        final long invocations = metrics.invocationCount.get();
        return invocations == 0 ? 0.0 : (double) metrics.successCount.get() / invocations;
    }

    private static double avgDuration(final EndpointMetrics metrics) {
        final long completed = metrics.successCount.get() + metrics.failureCount.get();
        return completed == 0 ? 0.0 : (double) metrics.totalDurationMs.get() / completed;
    }

    private static Map<String, Long> snapshot(final Map<String, AtomicLong> counts) {
        final Map<String, Long> result = new TreeMap<>();
        counts.forEach((k, v) -> result.put(k, v.get()));
        return result;
    }
}
