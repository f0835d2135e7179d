package com.paramguard.validation;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.paramguard.validation.source.ValueCoercion;

/**
 * Turns a declared {@link TypeDescriptor} into the candidate types used for conversion and
 * conformance checking. Unions that contain a list alternative are resolved against the raw
 * value: when the value is a list whose elements all fit that alternative, directly or by
 * lossless numeric widening, the union collapses to the list.
 */
public final class TypeNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TypeNormalizer.class);

    private TypeNormalizer() {}

    /**
     * Normalise a declared type.
     *
     * @param declared the declared type; must not be {@link TypeDescriptor#ANY}
     * @param rawValue the value about to be converted, used for union/list election
     */
    public static ResolvedType normalize(final TypeDescriptor declared, final Object rawValue) {
        if (declared instanceof TypeDescriptor.Plain p) {
            return new ResolvedType(List.of(p.type()), false, false);
        }
        if (declared instanceof TypeDescriptor.ListOf l) {
            return new ResolvedType(l.elementTypes(), true, false);
        }
        if (declared instanceof TypeDescriptor.UnionOf u) {
            return normalizeUnion(u, rawValue);
        }
        throw new IllegalArgumentException("Cannot normalise " + declared.displayName());
    }

    /** Whether an absent value may resolve to null for this declared type. */
    public static boolean isOptional(final TypeDescriptor declared) {
        return declared instanceof TypeDescriptor.UnionOf u && u.containsNull();
    }

    private static ResolvedType normalizeUnion(final TypeDescriptor.UnionOf union, final Object rawValue) {
        final boolean optional = union.containsNull();
        final List<TypeDescriptor> members = union.nonNullMembers();

        if (members.size() == 1) {
            return normalize(members.get(0), rawValue).asOptional(optional);
        }

        if (rawValue instanceof List<?> values) {
            for (final TypeDescriptor member : members) {
                if (member instanceof TypeDescriptor.ListOf l && allMatch(values, l.elementTypes())) {
                    log.debug("Union {} resolved to list alternative {}", union.displayName(), l.displayName());
                    return new ResolvedType(l.elementTypes(), true, optional);
                }
            }
        }

        final List<Class<?>> candidates = new ArrayList<>();
        for (final TypeDescriptor member : members) {
            if (member instanceof TypeDescriptor.Plain p) {
                candidates.add(p.type());
            }
        }
        return new ResolvedType(candidates, false, optional);
    }

    private static boolean allMatch(final List<?> values, final List<Class<?>> types) {
        final ResolvedType elementType = new ResolvedType(types, false, false);
        return values.stream().allMatch(value -> elementType.accepts(value) || widens(value, types));
    }

    // JSON decodes small integers as Integer, so List[Long] must still elect on [1, 2]
    private static boolean widens(final Object value, final List<Class<?>> types) {
        if (!(value instanceof Number number)) return false;
        for (final Class<?> type : types) {
            if (ValueCoercion.widenNumber(number, type).isPresent()) return true;
        }
        return false;
    }
}
