package com.paramguard.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.paramguard.utils.HttpUtils;
import com.paramguard.utils.Json;
import com.paramguard.utils.MultipartParser;
import com.paramguard.validation.source.RequestInputs;
import com.sun.net.httpserver.HttpExchange;

/**
 * Snapshots an exchange into {@link RequestInputs}. The body is read according to its
 * content type: JSON objects feed the JSON source, URL-encoded bodies the form source,
 * multipart bodies the form and file sources.
 */
public final class RequestInputsReader {

    private RequestInputsReader() {}

    /**
     * @param routeParams decoded path variables of the matched route
     * @throws MalformedRequestException when the body does not decode as its content type
     * @throws IOException if the body cannot be read
     */
    public static RequestInputs read(final HttpExchange exchange, final Map<String, String> routeParams)
            throws IOException {
        final RequestInputs.Builder builder = RequestInputs.builder()
            .route(routeParams)
            .query(HttpUtils.parseQueryParams(exchange));

        final String mediaType = HttpUtils.mediaType(exchange);
        if (mediaType.isEmpty()) {
            return builder.build();
        }

        final byte[] body = HttpUtils.readBody(exchange);
        if (mediaType.equals("application/json") || mediaType.endsWith("+json")) {
            try {
                builder.json(Json.readObject(new String(body, StandardCharsets.UTF_8)));
            } catch (IllegalArgumentException e) {
                throw new MalformedRequestException("Request body is not valid JSON", e);
            }
        } else if (mediaType.equals("application/x-www-form-urlencoded")) {
            builder.form(HttpUtils.parseUrlEncoded(new String(body, StandardCharsets.UTF_8)));
        } else if (mediaType.equals("multipart/form-data")) {
            final String boundary = HttpUtils.contentTypeParameter(
                exchange.getRequestHeaders().getFirst("Content-Type"), "boundary");
            try {
                final MultipartParser.Parts parts = MultipartParser.parse(body, boundary);
                builder.form(parts.fields()).files(parts.files());
            } catch (IllegalArgumentException e) {
                throw new MalformedRequestException("Request body is not valid multipart/form-data", e);
            }
        }
        return builder.build();
    }
}
