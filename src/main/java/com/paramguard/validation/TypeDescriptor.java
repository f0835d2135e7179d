package com.paramguard.validation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Declared type of a handler parameter: a plain type, a list, a union, or the "any" marker.
 * Optional types are unions containing {@link #NULL}.
 */
public sealed interface TypeDescriptor
        permits TypeDescriptor.Plain, TypeDescriptor.ListOf, TypeDescriptor.UnionOf, TypeDescriptor.AnyType {

    /** Null marker. Only meaningful as a union member. */
    Plain NULL = new Plain(Void.class);

    /** Skips validation entirely; the raw value passes through. */
    AnyType ANY = new AnyType();

    /** Human-readable form used in error messages, e.g. {@code Union[Integer, Double]}. */
    String displayName();

    static Plain plain(final Class<?> type) {
        return new Plain(type);
    }

    static ListOf listOf(final Class<?> elementType) {
        return new ListOf(new Plain(elementType));
    }

    static ListOf listOf(final TypeDescriptor element) {
        return new ListOf(element);
    }

    static UnionOf unionOf(final TypeDescriptor... members) {
        return new UnionOf(Arrays.asList(members));
    }

    static UnionOf unionOf(final Class<?>... types) {
        return new UnionOf(Arrays.stream(types).<TypeDescriptor>map(Plain::new).toList());
    }

    static TypeDescriptor optional(final TypeDescriptor type) {
        if (type instanceof AnyType) return type;
        return new UnionOf(List.of(type, NULL));
    }

    static TypeDescriptor optional(final Class<?> type) {
        return optional(new Plain(type));
    }

    record Plain(Class<?> type) implements TypeDescriptor {
        public Plain {
            if (type == null) throw new IllegalArgumentException("type must not be null");
            type = box(type);
        }

        public boolean isNull() {
            return type == Void.class;
        }

        @Override
        public String displayName() {
            return isNull() ? "Null" : type.getSimpleName();
        }
    }

    record ListOf(TypeDescriptor element) implements TypeDescriptor {
        public ListOf {
            if (element instanceof Plain p) {
                if (p.isNull()) throw new IllegalArgumentException("List element type cannot be the null marker");
            } else if (element instanceof UnionOf u) {
                for (final TypeDescriptor m : u.members()) {
                    if (!(m instanceof Plain p) || p.isNull()) {
                        throw new IllegalArgumentException("List element union may only contain plain types: " + u.displayName());
                    }
                }
            } else {
                throw new IllegalArgumentException("Unsupported list element type: "
                    + (element == null ? "null" : element.displayName()));
            }
        }

        /** Element alternatives, in declaration order. */
        public List<Class<?>> elementTypes() {
            if (element instanceof UnionOf u) {
                return u.members().stream().<Class<?>>map(m -> ((Plain) m).type()).toList();
            }
            return List.of(((Plain) element).type());
        }

        @Override
        public String displayName() {
            return "List[" + element.displayName() + "]";
        }
    }

    record UnionOf(List<TypeDescriptor> members) implements TypeDescriptor {
        public UnionOf {
            if (members == null || members.isEmpty()) {
                throw new IllegalArgumentException("Union needs at least one member");
            }
            final Set<TypeDescriptor> flat = new LinkedHashSet<>();
            for (final TypeDescriptor m : members) {
                if (m instanceof UnionOf nested) {
                    flat.addAll(nested.members());
                } else if (m instanceof Plain || m instanceof ListOf) {
                    flat.add(m);
                } else {
                    throw new IllegalArgumentException("Unsupported union member: " + (m == null ? "null" : m.displayName()));
                }
            }
            members = List.copyOf(flat);
        }

        public boolean containsNull() {
            return members.contains(NULL);
        }

        /** Members other than the null marker. */
        public List<TypeDescriptor> nonNullMembers() {
            final List<TypeDescriptor> result = new ArrayList<>(members);
            result.remove(NULL);
            return result;
        }

        @Override
        public String displayName() {
            final List<TypeDescriptor> rest = nonNullMembers();
            if (containsNull() && rest.size() == 1) {
                return "Optional[" + rest.get(0).displayName() + "]";
            }
            return members.stream()
                .map(TypeDescriptor::displayName)
                .collect(Collectors.joining(", ", "Union[", "]"));
        }
    }

    record AnyType() implements TypeDescriptor {
        @Override
        public String displayName() {
            return "Any";
        }
    }

    private static Class<?> box(final Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == boolean.class) return Boolean.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == char.class) return Character.class;
        return Void.class;
    }
}
