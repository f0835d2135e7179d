package com.paramguard.utils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.paramguard.validation.source.UploadedFile;

/**
 * Minimal multipart/form-data reader. Text parts become form fields, parts with a filename
 * become {@link UploadedFile}s. Repeated names become lists, as with query parameters.
 */
public final class MultipartParser {
    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] HEADER_END = {'\r', '\n', '\r', '\n'};
    private static final byte[] DASHES = {'-', '-'};

    private MultipartParser() {}

    /** Parsed body: text fields and file parts keyed by part name. */
    public record Parts(Map<String, Object> fields, Map<String, Object> files) {}

    /**
     * Split a multipart body.
     *
     * @throws IllegalArgumentException when the body does not follow the multipart layout
     */
    public static Parts parse(final byte[] body, final String boundary) {
        if (boundary == null || boundary.isEmpty()) {
            throw new IllegalArgumentException("Multipart body without boundary");
        }
        final byte[] delimiter = ("--" + boundary).getBytes(StandardCharsets.ISO_8859_1);
        final byte[] partDelimiter = ("\r\n--" + boundary).getBytes(StandardCharsets.ISO_8859_1);
        final Map<String, Object> fields = new LinkedHashMap<>();
        final Map<String, Object> files = new LinkedHashMap<>();

        int pos = indexOf(body, delimiter, 0);
        if (pos < 0) {
            throw new IllegalArgumentException("Multipart boundary not found");
        }
        pos += delimiter.length;

        while (!startsWith(body, pos, DASHES)) {
            if (startsWith(body, pos, CRLF)) pos += CRLF.length;

            final int headerEnd = indexOf(body, HEADER_END, pos);
            if (headerEnd < 0) {
                throw new IllegalArgumentException("Unterminated multipart headers");
            }
            final String headers = new String(body, pos, headerEnd - pos, StandardCharsets.UTF_8);
            final int contentStart = headerEnd + HEADER_END.length;
            final int contentEnd = indexOf(body, partDelimiter, contentStart);
            if (contentEnd < 0) {
                throw new IllegalArgumentException("Unterminated multipart part");
            }
            addPart(headers, Arrays.copyOfRange(body, contentStart, contentEnd), fields, files);
            pos = contentEnd + partDelimiter.length;
        }
        return new Parts(fields, files);
    }

    private static void addPart(final String headers, final byte[] content,
                                final Map<String, Object> fields, final Map<String, Object> files) {
        String disposition = null;
        String contentType = null;
        for (final String line : headers.split("\r\n")) {
            final int colon = line.indexOf(':');
            if (colon <= 0) continue;
            final String name = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            final String value = line.substring(colon + 1).trim();
            if (name.equals("content-disposition")) {
                disposition = value;
            } else if (name.equals("content-type")) {
                contentType = value;
            }
        }
        final String fieldName = HttpUtils.contentTypeParameter(disposition, "name");
        if (fieldName == null) {
            throw new IllegalArgumentException("Multipart part without a name");
        }
        final String filename = HttpUtils.contentTypeParameter(disposition, "filename");
        if (filename != null) {
            HttpUtils.addValue(files, fieldName, new UploadedFile(fieldName, filename, contentType, content));
        } else {
            HttpUtils.addValue(fields, fieldName, new String(content, StandardCharsets.UTF_8));
        }
    }

    private static boolean startsWith(final byte[] data, final int offset, final byte[] prefix) {
        if (offset + prefix.length > data.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (data[offset + i] != prefix[i]) return false;
        }
        return true;
    }

    private static int indexOf(final byte[] data, final byte[] pattern, final int from) {
        for (int i = Math.max(0, from); i <= data.length - pattern.length; i++) {
            if (startsWith(data, i, pattern)) return i;
        }
        return -1;
    }
}
