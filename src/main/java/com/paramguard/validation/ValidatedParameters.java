package com.paramguard.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Coerced parameter values of one handler invocation, in declaration order.
 * Absent optional parameters are present with a {@code null} value.
 */
public final class ValidatedParameters {
    private final Map<String, Object> values;

    ValidatedParameters(final Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ValidatedParameters of(final Map<String, Object> values) {
        return new ValidatedParameters(values);
    }

    public Object get(final String name) {
        return values.get(name);
    }

    public <T> T get(final String name, final Class<T> type) {
        return type.cast(values.get(name));
    }

    public boolean contains(final String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
