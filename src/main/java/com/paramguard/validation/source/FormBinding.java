package com.paramguard.validation.source;

import com.paramguard.validation.ResolvedType;

/**
 * URL-encoded or multipart form field. Repeated fields arrive as a list of strings.
 */
public class FormBinding extends AbstractSourceBinding {

    public FormBinding() {
        this(null, Constraints.none());
    }

    public FormBinding(final Object defaultValue, final Constraints constraints) {
        super(defaultValue, constraints);
    }

    public static FormBinding withDefault(final Object defaultValue) {
        return new FormBinding(defaultValue, Constraints.none());
    }

    public static FormBinding withConstraints(final Constraints constraints) {
        return new FormBinding(null, constraints);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.FORM;
    }

    @Override
    public Object convert(final Object rawValue, final ResolvedType type) {
        return ValueCoercion.coerceText(rawValue, type);
    }
}
