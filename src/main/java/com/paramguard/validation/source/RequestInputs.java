package com.paramguard.validation.source;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Raw, untyped request values grouped by source. Built once per request and never mutated.
 */
public final class RequestInputs {
    private final Map<SourceKind, Map<String, Object>> sources;

    private RequestInputs(final Map<SourceKind, Map<String, Object>> sources) {
        final Map<SourceKind, Map<String, Object>> copy = new EnumMap<>(SourceKind.class);
        sources.forEach((kind, values) ->
            copy.put(kind, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        this.sources = Collections.unmodifiableMap(copy);
    }

    /**
     * Create a bundle from an explicit mapping. Kinds missing from the mapping are treated
     * as unknown sources by the validation engine.
     */
    public static RequestInputs of(final Map<SourceKind, ? extends Map<String, ?>> sources) {
        final Map<SourceKind, Map<String, Object>> values = new EnumMap<>(SourceKind.class);
        sources.forEach((kind, map) -> values.put(kind, new LinkedHashMap<>(map)));
        return new RequestInputs(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasSource(final SourceKind kind) {
        return kind != null && sources.containsKey(kind);
    }

    /** Values of one source, or an empty map when the source is not part of this bundle. */
    public Map<String, Object> source(final SourceKind kind) {
        return sources.getOrDefault(kind, Map.of());
    }

    public Optional<Object> get(final SourceKind kind, final String name) {
        return Optional.ofNullable(source(kind).get(name));
    }

    @Override
    public String toString() {
        return "RequestInputs" + sources;
    }

    /**
     * Collects values per source. Every source kind is present in the built bundle,
     * empty when nothing was added for it.
     */
    public static final class Builder {
        private final Map<SourceKind, Map<String, Object>> values = new EnumMap<>(SourceKind.class);

        private Builder() {
            for (final SourceKind kind : SourceKind.values()) {
                values.put(kind, new LinkedHashMap<>());
            }
        }

        public Builder put(final SourceKind kind, final String name, final Object value) {
            values.get(kind).put(name, value);
            return this;
        }

        public Builder putAll(final SourceKind kind, final Map<String, ?> entries) {
            values.get(kind).putAll(entries);
            return this;
        }

        public Builder route(final Map<String, ?> entries) {
            return putAll(SourceKind.ROUTE, entries);
        }

        public Builder json(final Map<String, ?> entries) {
            return putAll(SourceKind.JSON, entries);
        }

        public Builder query(final Map<String, ?> entries) {
            return putAll(SourceKind.QUERY, entries);
        }

        public Builder form(final Map<String, ?> entries) {
            return putAll(SourceKind.FORM, entries);
        }

        public Builder files(final Map<String, ?> entries) {
            return putAll(SourceKind.FILE, entries);
        }

        public RequestInputs build() {
            return new RequestInputs(values);
        }
    }
}
