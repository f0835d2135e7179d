package com.paramguard.api;

import com.paramguard.validation.source.Constraints;
import com.paramguard.validation.source.FileBinding;
import com.paramguard.validation.source.FormBinding;
import com.paramguard.validation.source.JsonBinding;
import com.paramguard.validation.source.QueryBinding;
import com.paramguard.validation.source.RouteBinding;
import com.paramguard.validation.source.SourceBinding;
import com.paramguard.validation.source.SourceKind;

final class Bindings {

    private Bindings() {}

    static SourceBinding create(final SourceKind kind, final Object defaultValue, final Constraints constraints) {
        return switch (kind) {
            case ROUTE -> new RouteBinding(defaultValue, constraints);
            case JSON -> new JsonBinding(defaultValue, constraints);
            case QUERY -> new QueryBinding(defaultValue, constraints);
            case FORM -> new FormBinding(defaultValue, constraints);
            case FILE -> new FileBinding(constraints);
        };
    }
}
