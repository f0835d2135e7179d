package com.paramguard.validation;

import java.util.List;

/**
 * Outcome of normalising a declared type against a raw value: the concrete types a value
 * (or each list element) may have, in declaration order, and the shape flags.
 */
public record ResolvedType(List<Class<?>> candidates, boolean list, boolean optional) {

    public ResolvedType {
        candidates = List.copyOf(candidates);
    }

    /** True when the value is an instance of one of the candidates. */
    public boolean accepts(final Object value) {
        if (value == null) return false;
        for (final Class<?> candidate : candidates) {
            if (candidate.isInstance(value)) return true;
        }
        return false;
    }

    ResolvedType asOptional(final boolean optional) {
        return optional == this.optional ? this : new ResolvedType(candidates, list, optional);
    }
}
