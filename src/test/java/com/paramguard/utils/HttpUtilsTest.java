package com.paramguard.utils;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;

/**
 * Unit tests for HttpUtils request parsing and response helpers
 */
public class HttpUtilsTest {

    record Reply(String userName, int itemCount) {}

    @Test
    @DisplayName("parseUrlEncoded decodes keys and values")
    void testParseUrlEncoded_Decodes() {
        Map<String, Object> result = HttpUtils.parseUrlEncoded("new_name=hello%20world&old=a+b");
        assertEquals("hello world", result.get("new_name"));
        assertEquals("a b", result.get("old"));
    }

    @Test
    @DisplayName("parseUrlEncoded turns repeated keys into lists")
    void testParseUrlEncoded_RepeatedKeys() {
        Map<String, Object> result = HttpUtils.parseUrlEncoded("tag=a&tag=b&tag=c&page=1");
        assertEquals(List.of("a", "b", "c"), result.get("tag"));
        assertEquals("1", result.get("page"));
    }

    @Test
    @DisplayName("addValue appends to a copy instead of mutating an existing list")
    void testAddValue_ExistingListNotMutated() {
        List<Object> original = List.of("a", "b");
        Map<String, Object> target = new LinkedHashMap<>();
        target.put("tag", original);

        HttpUtils.addValue(target, "tag", "c");
        HttpUtils.addValue(target, "page", "1");

        assertEquals(List.of("a", "b", "c"), target.get("tag"));
        assertEquals(List.of("a", "b"), original);
        assertEquals("1", target.get("page"));
    }

    @Test
    @DisplayName("parseUrlEncoded skips pairs without a key or '='")
    void testParseUrlEncoded_SkipsMalformedPairs() {
        Map<String, Object> result = HttpUtils.parseUrlEncoded("flag&=x&empty=");
        assertEquals(Map.of("empty", ""), result);
    }

    @Test
    @DisplayName("parseUrlEncoded handles null and empty input")
    void testParseUrlEncoded_Empty() {
        assertTrue(HttpUtils.parseUrlEncoded(null).isEmpty());
        assertTrue(HttpUtils.parseUrlEncoded("").isEmpty());
    }

    @Test
    @DisplayName("decodeUrlParameter returns malformed input unchanged")
    void testDecodeUrlParameter_Malformed() {
        assertEquals("100%", HttpUtils.decodeUrlParameter("100%"));
    }

    @Test
    void testParseQueryParams_UsesRawQuery() {
        HttpExchange exchange = mock(HttpExchange.class);
        when(exchange.getRequestURI()).thenReturn(URI.create("/search?q=a%26b&limit=5"));
        Map<String, Object> params = HttpUtils.parseQueryParams(exchange);
        assertEquals("a&b", params.get("q"));
        assertEquals("5", params.get("limit"));
    }

    @Test
    void testMediaType_StripsParametersAndLowercases() {
        HttpExchange exchange = mock(HttpExchange.class);
        Headers headers = new Headers();
        headers.add("Content-Type", "Application/JSON; charset=UTF-8");
        when(exchange.getRequestHeaders()).thenReturn(headers);
        assertEquals("application/json", HttpUtils.mediaType(exchange));
    }

    @Test
    void testMediaType_Absent() {
        HttpExchange exchange = mock(HttpExchange.class);
        when(exchange.getRequestHeaders()).thenReturn(new Headers());
        assertEquals("", HttpUtils.mediaType(exchange));
    }

    @Test
    void testContentTypeParameter() {
        String contentType = "multipart/form-data; boundary=\"abc123\"";
        assertEquals("abc123", HttpUtils.contentTypeParameter(contentType, "boundary"));
        assertNull(HttpUtils.contentTypeParameter(contentType, "charset"));
        assertNull(HttpUtils.contentTypeParameter(null, "boundary"));
    }

    @Test
    void testReadBody() throws Exception {
        HttpExchange exchange = mock(HttpExchange.class);
        when(exchange.getRequestBody()).thenReturn(new ByteArrayInputStream("payload".getBytes(StandardCharsets.UTF_8)));
        assertArrayEquals("payload".getBytes(StandardCharsets.UTF_8), HttpUtils.readBody(exchange));
    }

    @Test
    void testSendJson_WritesSnakeCaseBody() throws Exception {
        HttpExchange exchange = mock(HttpExchange.class);
        Headers responseHeaders = new Headers();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        when(exchange.getResponseHeaders()).thenReturn(responseHeaders);
        when(exchange.getResponseBody()).thenReturn(out);

        HttpUtils.sendJson(exchange, 201, new Reply("ada", 2));

        String body = out.toString(StandardCharsets.UTF_8);
        assertEquals("{\"user_name\":\"ada\",\"item_count\":2}", body);
        assertEquals(HttpUtils.JSON_CONTENT_TYPE, responseHeaders.getFirst("Content-Type"));
        verify(exchange).sendResponseHeaders(201, body.getBytes(StandardCharsets.UTF_8).length);
    }

    @Test
    void testSendText() throws Exception {
        HttpExchange exchange = mock(HttpExchange.class);
        Headers responseHeaders = new Headers();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        when(exchange.getResponseHeaders()).thenReturn(responseHeaders);
        when(exchange.getResponseBody()).thenReturn(out);

        HttpUtils.sendText(exchange, 200, "héllo");

        assertEquals("héllo", out.toString(StandardCharsets.UTF_8));
        assertEquals(HttpUtils.TEXT_CONTENT_TYPE, responseHeaders.getFirst("Content-Type"));
        verify(exchange).sendResponseHeaders(200, 6);
    }

    @Test
    void testSendEmpty() throws Exception {
        HttpExchange exchange = mock(HttpExchange.class);
        HttpUtils.sendEmpty(exchange, 204);
        verify(exchange).sendResponseHeaders(204, -1);
        verify(exchange).close();
    }
}
