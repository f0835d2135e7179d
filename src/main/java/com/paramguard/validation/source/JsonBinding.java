package com.paramguard.validation.source;

import com.paramguard.validation.ResolvedType;

/**
 * Top-level field of a JSON object body. Values are already decoded, so only numeric
 * types are adjusted.
 */
public class JsonBinding extends AbstractSourceBinding {

    public JsonBinding() {
        this(null, Constraints.none());
    }

    public JsonBinding(final Object defaultValue, final Constraints constraints) {
        super(defaultValue, constraints);
    }

    public static JsonBinding withDefault(final Object defaultValue) {
        return new JsonBinding(defaultValue, Constraints.none());
    }

    public static JsonBinding withConstraints(final Constraints constraints) {
        return new JsonBinding(null, constraints);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.JSON;
    }

    @Override
    public Object convert(final Object rawValue, final ResolvedType type) {
        return ValueCoercion.coerceJson(rawValue, type);
    }
}
