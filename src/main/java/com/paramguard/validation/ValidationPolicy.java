package com.paramguard.validation;

/**
 * How a session reacts to a failing parameter.
 */
public enum ValidationPolicy {
    /** Stop at the first failing parameter. */
    FAIL_FAST,
    /** Validate every parameter and report all failures. */
    COLLECT_ALL
}
