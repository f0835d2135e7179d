package com.paramguard.api;

import com.paramguard.validation.ParameterSpec;
import com.paramguard.validation.TypeDescriptor;
import com.paramguard.validation.source.Constraints;
import com.paramguard.validation.source.SourceKind;

/**
 * Runtime definition of a single endpoint parameter, built from its source annotation + reflection.
 */
public record EndpointParamDef(
    String name,                // request key, snake_case unless overridden
    SourceKind source,          // where the value is read from
    TypeDescriptor type,        // declared or inferred type
    boolean required,           // no default and not optional
    Object defaultValue,        // parsed default, or null
    Constraints constraints,    // from @Validate
    String description
) {

    ParameterSpec toSpec() {
        return new ParameterSpec(name, type, Bindings.create(source, defaultValue, constraints));
    }
}
