package com.paramguard.api;

/**
 * The request body could not be decoded for its declared content type.
 */
public class MalformedRequestException extends RuntimeException {

    public MalformedRequestException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
