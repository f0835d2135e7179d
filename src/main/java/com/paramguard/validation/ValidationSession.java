package com.paramguard.validation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.paramguard.validation.error.ParameterValidationException;
import com.paramguard.validation.source.RequestInputs;

/**
 * Validates all declared parameters of a handler, in declaration order. Built once per
 * handler; {@link #run(RequestInputs)} may be called concurrently for different requests.
 */
public final class ValidationSession {
    private final List<ParameterSpec> specs;
    private final ValidationEngine engine;
    private final ValidationPolicy policy;

    public ValidationSession(final List<ParameterSpec> specs) {
        this(specs, new ValidationEngine(), ValidationPolicy.FAIL_FAST);
    }

    public ValidationSession(final List<ParameterSpec> specs, final ValidationEngine engine,
                             final ValidationPolicy policy) {
        final Set<String> names = new HashSet<>();
        for (final ParameterSpec spec : specs) {
            if (!names.add(spec.name())) {
                throw new IllegalArgumentException("Duplicate parameter name: " + spec.name());
            }
        }
        this.specs = List.copyOf(specs);
        this.engine = engine;
        this.policy = policy;
    }

    public ValidationResult run(final RequestInputs inputs) {
        final Map<String, Object> values = new LinkedHashMap<>();
        final List<ParameterValidationException> errors = new ArrayList<>();

        for (final ParameterSpec spec : specs) {
            try {
                values.put(spec.name(), engine.validate(spec, inputs));
            } catch (ParameterValidationException e) {
                errors.add(e);
                if (policy == ValidationPolicy.FAIL_FAST) break;
            }
        }
        return new ValidationResult(new ValidatedParameters(values), errors);
    }

    public List<ParameterSpec> specs() {
        return specs;
    }

    public ValidationPolicy policy() {
        return policy;
    }
}
