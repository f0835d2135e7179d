package com.paramguard.validation;

import com.paramguard.validation.source.SourceBinding;

/**
 * Declared contract of one handler parameter.
 *
 * @param name         request key the value is looked up under
 * @param declaredType the type as declared, kept unnormalised for error messages
 * @param binding      source the value comes from, with its default and constraints
 */
public record ParameterSpec(String name, TypeDescriptor declaredType, SourceBinding binding) {

    public ParameterSpec {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Parameter name must not be empty");
        }
        if (declaredType == null) {
            throw new IllegalArgumentException("Parameter '" + name + "' has no declared type");
        }
    }
}
