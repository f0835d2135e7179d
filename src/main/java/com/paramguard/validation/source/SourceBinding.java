package com.paramguard.validation.source;

import java.util.Optional;

import com.paramguard.validation.ResolvedType;
import com.paramguard.validation.error.ConstraintViolationException;

/**
 * How a parameter is read from one request source: lookup, default, coercion and
 * source-specific semantic checks. The validation engine only talks to this interface.
 */
public interface SourceBinding {

    SourceKind kind();

    /** Raw value for {@code name}, or empty when the source does not carry it. */
    default Optional<Object> get(final RequestInputs inputs, final String name) {
        return inputs.get(kind(), name);
    }

    /** Value substituted when the input is absent; empty when there is none. */
    Optional<Object> defaultValue();

    /**
     * Coerce a raw value towards one of the resolved candidate types. Never throws;
     * returns the value unchanged when it cannot be converted.
     */
    Object convert(Object rawValue, ResolvedType type);

    /**
     * Run semantic checks on a value that already conforms to its type.
     */
    void validate(Object value) throws ConstraintViolationException;

    Constraints constraints();
}
