package com.paramguard.validation.source;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/**
 * A file part received in a multipart request. Owned by the request that carried it.
 */
public record UploadedFile(String fieldName, String filename, String contentType, byte[] content) {

    public long size() {
        return content.length;
    }

    public InputStream openStream() {
        return new ByteArrayInputStream(content);
    }

    @Override
    public String toString() {
        return "UploadedFile[" + fieldName + ", " + filename + ", " + contentType + ", " + content.length + " bytes]";
    }
}
