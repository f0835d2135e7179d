package com.paramguard.validation.source;

import com.paramguard.validation.ResolvedType;

/**
 * Path segment captured by the route template. Values arrive as text.
 */
public class RouteBinding extends AbstractSourceBinding {

    public RouteBinding() {
        this(null, Constraints.none());
    }

    public RouteBinding(final Object defaultValue, final Constraints constraints) {
        super(defaultValue, constraints);
    }

    public static RouteBinding withDefault(final Object defaultValue) {
        return new RouteBinding(defaultValue, Constraints.none());
    }

    public static RouteBinding withConstraints(final Constraints constraints) {
        return new RouteBinding(null, constraints);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.ROUTE;
    }

    @Override
    public Object convert(final Object rawValue, final ResolvedType type) {
        return ValueCoercion.coerceText(rawValue, type);
    }
}
