package com.paramguard.validation.source;

import java.util.Optional;

import com.paramguard.validation.error.ConstraintViolationException;

/**
 * Holds the default and constraints every binding carries and applies the constraints.
 */
public abstract class AbstractSourceBinding implements SourceBinding {
    private final Object defaultValue;
    private final Constraints constraints;

    protected AbstractSourceBinding(final Object defaultValue, final Constraints constraints) {
        this.defaultValue = defaultValue;
        this.constraints = constraints == null ? Constraints.none() : constraints;
    }

    @Override
    public Optional<Object> defaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    @Override
    public Constraints constraints() {
        return constraints;
    }

    @Override
    public void validate(final Object value) throws ConstraintViolationException {
        constraints.check(value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[default=" + defaultValue + "]";
    }
}
