package com.paramguard.validation.error;

/**
 * Kinds of parameter validation failure, with the HTTP status each maps to by default.
 */
public enum ErrorKind {
    MISCONFIGURED_SOURCE(500),
    MISSING_INPUT(400),
    TYPE_MISMATCH(400),
    VALIDATION_FAILED(400);

    /** Exchange attribute under which the HTTP layer records the kind of a rejected request. */
    public static final String EXCHANGE_ATTRIBUTE = "paramguard.validation.errorKind";

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
