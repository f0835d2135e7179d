package com.paramguard.validation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paramguard.validation.error.ConstraintViolationException;
import com.paramguard.validation.error.InvalidParameterSourceException;
import com.paramguard.validation.error.MissingInputException;
import com.paramguard.validation.error.TypeMismatchException;
import com.paramguard.validation.error.ValidationFailedException;
import com.paramguard.validation.source.RequestInputs;
import com.paramguard.validation.source.SourceBinding;

/**
 * Resolves one parameter against a request: presence, default or optional handling,
 * conversion, type conformance and semantic checks. Stateless and safe to share.
 */
public class ValidationEngine {
    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    /**
     * Validate a single parameter.
     *
     * @return the coerced value, or {@code null} for an absent optional parameter
     * @throws com.paramguard.validation.error.ParameterValidationException when the parameter
     *         is misconfigured, missing, of the wrong type, or rejected by a constraint
     */
    public Object validate(final ParameterSpec spec, final RequestInputs inputs) {
        final String name = spec.name();
        final TypeDescriptor declared = spec.declaredType();
        final SourceBinding binding = spec.binding();

        if (binding == null || !inputs.hasSource(binding.kind())) {
            log.error("Parameter '{}' is bound to an unknown source {}", name, binding == null ? null : binding.kind());
            throw new InvalidParameterSourceException(name, binding == null ? null : binding.kind());
        }

        final Object raw;
        final Optional<Object> supplied = binding.get(inputs, name);
        if (supplied.isPresent()) {
            raw = supplied.get();
        } else if (binding.defaultValue().isPresent()) {
            raw = binding.defaultValue().get();
            log.debug("Parameter '{}' not given, using default {}", name, raw);
        } else if (TypeNormalizer.isOptional(declared)) {
            return null;
        } else {
            log.debug("Required {} parameter '{}' missing", binding.kind(), name);
            throw new MissingInputException(name, binding.kind());
        }

        if (declared instanceof TypeDescriptor.AnyType) {
            return raw;
        }

        final ResolvedType type = TypeNormalizer.normalize(declared, raw);
        final Object converted = binding.convert(raw, type);

        if (!conforms(converted, type)) {
            log.debug("Parameter '{}' rejected: expected {}, got {}", name, declared.displayName(), converted);
            throw new TypeMismatchException(name, declared.displayName(), describeType(converted));
        }

        try {
            binding.validate(converted);
        } catch (ConstraintViolationException e) {
            log.debug("Parameter '{}' failed validation: {}", name, e.getMessage());
            throw new ValidationFailedException(name, declared.displayName(), e.getMessage());
        }
        return converted;
    }

    static boolean conforms(final Object value, final ResolvedType type) {
        if (type.list()) {
            return value instanceof List<?> values && values.stream().allMatch(type::accepts);
        }
        return type.accepts(value);
    }

    static String describeType(final Object value) {
        if (value == null) return "Null";
        if (value instanceof List<?> values) {
            final Set<String> elementTypes = new LinkedHashSet<>();
            for (final Object element : values) {
                elementTypes.add(describeType(element));
            }
            return elementTypes.isEmpty() ? "List" : "List[" + String.join(", ", elementTypes) + "]";
        }
        return value.getClass().getSimpleName();
    }
}
