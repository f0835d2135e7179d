package com.paramguard.telemetry;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;

import com.paramguard.validation.error.ErrorKind;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpPrincipal;

/**
 * HTTP handler wrapper that records each invocation of an endpoint: status, response size,
 * duration, and the validation failure kind when the request was rejected.
 */
public class TelemetryInterceptor implements HttpHandler {
    private final HttpHandler wrappedHandler;
    private final TelemetryLogger telemetryLogger;
    private final String endpointName;
    private final String pathTemplate;

    public TelemetryInterceptor(final HttpHandler handler, final TelemetryLogger logger,
                                final String endpointName, final String pathTemplate) {
        this.wrappedHandler = handler;
        this.telemetryLogger = logger;
        this.endpointName = endpointName;
        this.pathTemplate = pathTemplate;
    }

    @Override
    public void handle(final HttpExchange exchange) throws IOException {
        final long startTime = telemetryLogger.logEndpointStart(endpointName, pathTemplate);
        final ResponseCapturingExchange wrapper = new ResponseCapturingExchange(exchange);
        String errorType = null;
        String errorMessage = null;

        try {
            wrappedHandler.handle(wrapper);
        } catch (IOException | RuntimeException e) {
            errorType = e.getClass().getSimpleName();
            errorMessage = e.getMessage();
            throw e;
        } finally {
            final int status = wrapper.getCapturedResponseCode();
            if (errorType == null && status >= 200 && status < 300) {
                telemetryLogger.logEndpointSuccess(endpointName, pathTemplate, startTime, status,
                    wrapper.getCapturedResponseSize());
            } else {
                final Object kind = exchange.getAttribute(ErrorKind.EXCHANGE_ATTRIBUTE);
                telemetryLogger.logEndpointFailure(endpointName, pathTemplate, startTime,
                    status > 0 ? status : null,
                    errorType != null ? errorType : "HTTP_" + status,
                    errorMessage,
                    kind instanceof ErrorKind k ? k : null);
            }
        }
    }

    /**
     * Exchange that remembers the status sent and counts the bytes written.
     */
    private static class ResponseCapturingExchange extends HttpExchange {
        private final HttpExchange wrapped;
        private CountingOutputStream responseBody;
        private int responseCode = -1;

        ResponseCapturingExchange(final HttpExchange exchange) {
            this.wrapped = exchange;
        }

        @Override
        public void sendResponseHeaders(final int rCode, final long responseLength) throws IOException {
            this.responseCode = rCode;
            wrapped.sendResponseHeaders(rCode, responseLength);
        }

        @Override
        public OutputStream getResponseBody() {
            if (responseBody == null) {
                responseBody = new CountingOutputStream(wrapped.getResponseBody());
            }
            return responseBody;
        }

        int getCapturedResponseCode() {
            return responseCode;
        }

        long getCapturedResponseSize() {
            return responseBody == null ? 0 : responseBody.count;
        }

        @Override
        public Headers getRequestHeaders() {
            return wrapped.getRequestHeaders();
        }

        @Override
        public Headers getResponseHeaders() {
            return wrapped.getResponseHeaders();
        }

        @Override
        public URI getRequestURI() {
            return wrapped.getRequestURI();
        }

        @Override
        public String getRequestMethod() {
            return wrapped.getRequestMethod();
        }

        @Override
        public HttpContext getHttpContext() {
            return wrapped.getHttpContext();
        }

        @Override
        public void close() {
            wrapped.close();
        }

        @Override
        public InputStream getRequestBody() {
            return wrapped.getRequestBody();
        }

        @Override
        public InetSocketAddress getRemoteAddress() {
            return wrapped.getRemoteAddress();
        }

        @Override
        public int getResponseCode() {
            return responseCode;
        }

        @Override
        public InetSocketAddress getLocalAddress() {
            return wrapped.getLocalAddress();
        }

        @Override
        public String getProtocol() {
            return wrapped.getProtocol();
        }

        @Override
        public Object getAttribute(final String name) {
            return wrapped.getAttribute(name);
        }

        @Override
        public void setAttribute(final String name, final Object value) {
            wrapped.setAttribute(name, value);
        }

        @Override
        public void setStreams(final InputStream i, final OutputStream o) {
            wrapped.setStreams(i, o);
        }

        @Override
        public HttpPrincipal getPrincipal() {
            return wrapped.getPrincipal();
        }
    }

    /**
     * Pass-through stream that counts bytes written.
     */
    private static class CountingOutputStream extends OutputStream {
        private final OutputStream out;
        private long count;

        CountingOutputStream(final OutputStream out) {
            this.out = out;
        }

        @Override
        public void write(final int b) throws IOException {
            out.write(b);
            count++;
        }

        @Override
        public void write(final byte[] b, final int off, final int len) throws IOException {
            out.write(b, off, len);
            count += len;
        }

        @Override
        public void flush() throws IOException {
            out.flush();
        }

        @Override
        public void close() throws IOException {
            out.close();
        }
    }
}
