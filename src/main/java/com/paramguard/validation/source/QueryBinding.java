package com.paramguard.validation.source;

import com.paramguard.validation.ResolvedType;

/**
 * Query string parameter. Repeated keys arrive as a list of strings.
 */
public class QueryBinding extends AbstractSourceBinding {

    public QueryBinding() {
        this(null, Constraints.none());
    }

    public QueryBinding(final Object defaultValue, final Constraints constraints) {
        super(defaultValue, constraints);
    }

    public static QueryBinding withDefault(final Object defaultValue) {
        return new QueryBinding(defaultValue, Constraints.none());
    }

    public static QueryBinding withConstraints(final Constraints constraints) {
        return new QueryBinding(null, constraints);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.QUERY;
    }

    @Override
    public Object convert(final Object rawValue, final ResolvedType type) {
        return ValueCoercion.coerceText(rawValue, type);
    }
}
