package com.paramguard.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.paramguard.validation.ParameterSpec;
import com.paramguard.validation.TypeDescriptor;
import com.paramguard.validation.ValidatedParameters;
import com.paramguard.validation.ValidationEngine;
import com.paramguard.validation.ValidationPolicy;
import com.paramguard.validation.ValidationSession;
import com.paramguard.validation.error.ErrorKind;
import com.paramguard.validation.source.Constraints;
import com.paramguard.validation.source.FormBinding;
import com.paramguard.validation.source.JsonBinding;
import com.paramguard.validation.source.RouteBinding;

class ValidationInterceptorTest {

    private static final RoutePattern ROUTE = RoutePattern.compile("/update/{id}");

    private static List<ParameterSpec> specs() {
        return List.of(
            new ParameterSpec("id", TypeDescriptor.plain(Integer.class), new RouteBinding()),
            new ParameterSpec("age", TypeDescriptor.plain(Integer.class),
                JsonBinding.withConstraints(Constraints.builder().minValue(18).build())));
    }

    private static ValidationInterceptor interceptor(final ValidationPolicy policy, final ValidationErrorHandler handler,
                                                     final ValidatedHandler next) {
        return new ValidationInterceptor(ROUTE, new ValidationSession(specs(), new ValidationEngine(), policy), handler, next);
    }

    @Test
    void testHandle_ValidRequestReachesNextStage() throws Exception {
        AtomicReference<ValidatedParameters> seen = new AtomicReference<>();
        ValidationInterceptor interceptor = interceptor(ValidationPolicy.FAIL_FAST, new DefaultValidationErrorHandler(),
            (exchange, params) -> {
                seen.set(params);
                EndpointResponse.ok("done").send(exchange);
            });
        StubExchange exchange = StubExchange.json("POST", "/update/3", "{\"age\": 30}");

        interceptor.handle(exchange);

        assertEquals(200, exchange.status());
        assertEquals("done", exchange.body());
        assertEquals(3, seen.get().get("id"));
        assertEquals(30, seen.get().get("age"));
        assertNull(exchange.getAttribute(ErrorKind.EXCHANGE_ATTRIBUTE));
    }

    @Test
    void testHandle_InvalidRequestShortCircuits() throws Exception {
        AtomicReference<Boolean> called = new AtomicReference<>(false);
        ValidationInterceptor interceptor = interceptor(ValidationPolicy.FAIL_FAST, new DefaultValidationErrorHandler(),
            (exchange, params) -> called.set(true));
        StubExchange exchange = StubExchange.json("POST", "/update/3", "{\"age\": 15}");

        interceptor.handle(exchange);

        assertFalse(called.get());
        assertEquals(400, exchange.status());
        assertEquals(Map.of("error", "Parameter 'age' must be at least 18"), exchange.jsonBody());
        assertSame(ErrorKind.VALIDATION_FAILED, exchange.getAttribute(ErrorKind.EXCHANGE_ATTRIBUTE));
    }

    @Test
    void testHandle_MissingInput() throws Exception {
        ValidationInterceptor interceptor = interceptor(ValidationPolicy.FAIL_FAST, new DefaultValidationErrorHandler(),
            (exchange, params) -> EndpointResponse.ok("never").send(exchange));
        StubExchange exchange = StubExchange.json("POST", "/update/3", "{}");

        interceptor.handle(exchange);

        assertEquals(400, exchange.status());
        assertEquals("Required Json parameter 'age' not given", exchange.jsonBody().get("error"));
    }

    @Test
    void testHandle_MalformedJsonIs400() throws Exception {
        ValidationInterceptor interceptor = interceptor(ValidationPolicy.FAIL_FAST, new DefaultValidationErrorHandler(),
            (exchange, params) -> EndpointResponse.ok("never").send(exchange));
        StubExchange exchange = StubExchange.json("POST", "/update/3", "{oops");

        interceptor.handle(exchange);

        assertEquals(400, exchange.status());
        assertEquals("Request body is not valid JSON", exchange.jsonBody().get("error"));
    }

    @Test
    void testHandle_CollectAllListsEveryError() throws Exception {
        ValidationInterceptor interceptor = interceptor(ValidationPolicy.COLLECT_ALL, new DefaultValidationErrorHandler(),
            (exchange, params) -> EndpointResponse.ok("never").send(exchange));
        StubExchange exchange = StubExchange.json("POST", "/update/abc", "{\"age\": 15}");

        interceptor.handle(exchange);

        assertEquals(400, exchange.status());
        Map<String, Object> body = exchange.jsonBody();
        assertEquals("Parameter 'id' must be type 'Integer', got 'String'", body.get("error"));
        assertEquals(List.of("Parameter 'id' must be type 'Integer', got 'String'", "Parameter 'age' must be at least 18"),
            body.get("errors"));
    }

    @Test
    void testHandle_MisconfiguredSourceIs500() throws Exception {
        List<ParameterSpec> specs = List.of(new ParameterSpec("x", TypeDescriptor.plain(String.class), null));
        ValidationInterceptor interceptor = new ValidationInterceptor(ROUTE, new ValidationSession(specs),
            new DefaultValidationErrorHandler(), (exchange, params) -> EndpointResponse.ok("never").send(exchange));
        StubExchange exchange = StubExchange.get("/update/1");

        interceptor.handle(exchange);

        assertEquals(500, exchange.status());
        assertTrue(((String) exchange.jsonBody().get("error")).startsWith("Invalid parameter source"));
    }

    @Test
    void testHandle_CustomErrorHandlerResponseSentVerbatim() throws Exception {
        ValidationErrorHandler custom = error -> EndpointResponse.of(422,
            Map.of("field", error.parameterName(), "kind", error.kind().name()));
        ValidationInterceptor interceptor = interceptor(ValidationPolicy.FAIL_FAST, custom,
            (exchange, params) -> EndpointResponse.ok("never").send(exchange));
        StubExchange exchange = StubExchange.json("POST", "/update/3", "{\"age\": 15}");

        interceptor.handle(exchange);

        assertEquals(422, exchange.status());
        assertEquals(Map.of("field", "age", "kind", "VALIDATION_FAILED"), exchange.jsonBody());
    }

    @Test
    void testHandle_FormSourceWithoutFormBody() throws Exception {
        List<ParameterSpec> specs = List.of(new ParameterSpec("name", TypeDescriptor.optional(String.class), new FormBinding()));
        AtomicReference<ValidatedParameters> seen = new AtomicReference<>();
        ValidationInterceptor interceptor = new ValidationInterceptor(ROUTE, new ValidationSession(specs),
            new DefaultValidationErrorHandler(), (exchange, params) -> {
                seen.set(params);
                EndpointResponse.of(204, null).send(exchange);
            });
        StubExchange exchange = StubExchange.get("/update/1");

        interceptor.handle(exchange);

        assertEquals(204, exchange.status());
        assertTrue(exchange.isClosed());
        assertTrue(seen.get().contains("name"));
        assertNull(seen.get().get("name"));
    }
}
