package com.paramguard.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.paramguard.validation.error.ErrorKind;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

class TelemetryInterceptorTest {

    private TelemetryLogger telemetryLogger;
    private HttpExchange exchange;
    private ByteArrayOutputStream responseBody;

    @BeforeEach
    void setUp() {
        telemetryLogger = mock(TelemetryLogger.class);
        when(telemetryLogger.logEndpointStart("getUser", "/users/{id}")).thenReturn(1000L);
        exchange = mock(HttpExchange.class);
        responseBody = new ByteArrayOutputStream();
        when(exchange.getResponseBody()).thenReturn(responseBody);
    }

    private TelemetryInterceptor wrap(final HttpHandler handler) {
        return new TelemetryInterceptor(handler, telemetryLogger, "getUser", "/users/{id}");
    }

    @Test
    void testHandle_SuccessRecordsStatusAndSize() throws IOException {
        byte[] payload = "{\"id\":1}".getBytes(StandardCharsets.UTF_8);
        wrap(ex -> {
            ex.sendResponseHeaders(200, payload.length);
            ex.getResponseBody().write(payload);
        }).handle(exchange);

        verify(exchange).sendResponseHeaders(200, payload.length);
        assertEquals("{\"id\":1}", responseBody.toString(StandardCharsets.UTF_8));
        verify(telemetryLogger).logEndpointSuccess("getUser", "/users/{id}", 1000L, 200, payload.length);
    }

    @Test
    void testHandle_ValidationRejectionRecordsKind() throws IOException {
        when(exchange.getAttribute(ErrorKind.EXCHANGE_ATTRIBUTE)).thenReturn(ErrorKind.TYPE_MISMATCH);

        wrap(ex -> ex.sendResponseHeaders(400, -1)).handle(exchange);

        verify(telemetryLogger).logEndpointFailure("getUser", "/users/{id}", 1000L, 400, "HTTP_400", null,
            ErrorKind.TYPE_MISMATCH);
        verify(telemetryLogger, never()).logEndpointSuccess(eq("getUser"), eq("/users/{id}"), anyLong(),
            eq(400), anyLong());
    }

    @Test
    void testHandle_ServerErrorWithoutKind() throws IOException {
        wrap(ex -> ex.sendResponseHeaders(500, -1)).handle(exchange);

        verify(telemetryLogger).logEndpointFailure(eq("getUser"), eq("/users/{id}"), eq(1000L), eq(500),
            eq("HTTP_500"), isNull(), isNull());
    }

    @Test
    void testHandle_ExceptionIsRecordedAndRethrown() {
        IOException failure = assertThrows(IOException.class,
            () -> wrap(ex -> { throw new IOException("connection reset"); }).handle(exchange));

        assertEquals("connection reset", failure.getMessage());
        verify(telemetryLogger).logEndpointFailure(eq("getUser"), eq("/users/{id}"), eq(1000L), isNull(),
            eq("IOException"), eq("connection reset"), isNull());
    }
}
