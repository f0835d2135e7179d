package com.paramguard.validation;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import com.paramguard.validation.source.UploadedFile;

/**
 * Builds {@link TypeDescriptor}s from Java reflection types and from type expressions such
 * as {@code Union[List[String], Integer]}.
 */
public final class TypeDescriptors {
    private static final Map<String, Class<?>> SCALARS = Map.ofEntries(
        Map.entry("String", String.class),
        Map.entry("Integer", Integer.class),
        Map.entry("int", Integer.class),
        Map.entry("Long", Long.class),
        Map.entry("long", Long.class),
        Map.entry("Double", Double.class),
        Map.entry("double", Double.class),
        Map.entry("Float", Float.class),
        Map.entry("float", Float.class),
        Map.entry("Boolean", Boolean.class),
        Map.entry("boolean", Boolean.class),
        Map.entry("BigDecimal", BigDecimal.class),
        Map.entry("UploadedFile", UploadedFile.class)
    );

    private TypeDescriptors() {}

    /**
     * Infer a descriptor from a declared Java parameter type.
     *
     * @throws IllegalArgumentException for raw collections and unsupported generic shapes
     */
    public static TypeDescriptor fromJavaType(final Type javaType) {
        if (javaType == Object.class) {
            return TypeDescriptor.ANY;
        }
        if (javaType instanceof Class<?> c) {
            if (Collection.class.isAssignableFrom(c) || c == Optional.class) {
                throw new IllegalArgumentException("Raw " + c.getSimpleName() + " needs a type argument");
            }
            if (c.isArray() || c == void.class) {
                throw new IllegalArgumentException("Unsupported parameter type: " + c.getSimpleName());
            }
            return TypeDescriptor.plain(c);
        }
        if (javaType instanceof ParameterizedType pt && pt.getRawType() instanceof Class<?> raw) {
            final Type[] args = pt.getActualTypeArguments();
            if (args.length == 1 && (raw == List.class || raw == Collection.class)) {
                final TypeDescriptor element = fromJavaType(unwrapWildcard(args[0]));
                if (element instanceof TypeDescriptor.Plain) {
                    return TypeDescriptor.listOf(element);
                }
            }
            if (args.length == 1 && raw == Optional.class) {
                final TypeDescriptor inner = fromJavaType(unwrapWildcard(args[0]));
                if (!(inner instanceof TypeDescriptor.AnyType)) {
                    return TypeDescriptor.optional(inner);
                }
            }
        }
        throw new IllegalArgumentException("Unsupported parameter type: " + javaType.getTypeName());
    }

    private static Type unwrapWildcard(final Type type) {
        if (type instanceof WildcardType w && w.getLowerBounds().length == 0 && w.getUpperBounds().length == 1) {
            return w.getUpperBounds()[0];
        }
        return type;
    }

    /**
     * Parse a type expression. Grammar:
     * <pre>
     *   type := "Any" | "Optional[" type "]" | "Union[" type ("," type)* "]" | "List[" type "]" | scalar
     * </pre>
     *
     * @throws IllegalArgumentException when the expression is malformed or names an unknown type
     */
    public static TypeDescriptor parse(final String expression) {
        final Parser parser = new Parser(expression);
        final TypeDescriptor result = parser.parseType();
        parser.expectEnd();
        return result;
    }

    private static final class Parser {
        private final String input;
        private int pos;

        Parser(final String input) {
            this.input = input == null ? "" : input;
        }

        TypeDescriptor parseType() {
            final int start = skipSpaces();
            final String name = identifier();
            switch (name) {
                case "Any":
                    return TypeDescriptor.ANY;
                case "Optional": {
                    expect('[');
                    final TypeDescriptor inner = parseType();
                    expect(']');
                    return TypeDescriptor.optional(inner);
                }
                case "List": {
                    expect('[');
                    final TypeDescriptor element = parseType();
                    expect(']');
                    return build(() -> TypeDescriptor.listOf(element), start);
                }
                case "Union": {
                    expect('[');
                    final List<TypeDescriptor> members = new ArrayList<>();
                    members.add(parseType());
                    while (peek() == ',') {
                        pos++;
                        members.add(parseType());
                    }
                    expect(']');
                    return build(() -> new TypeDescriptor.UnionOf(members), start);
                }
                default: {
                    final Class<?> scalar = SCALARS.get(name);
                    if (scalar == null) {
                        throw error("Unknown type '" + name + "'", start);
                    }
                    return TypeDescriptor.plain(scalar);
                }
            }
        }

        void expectEnd() {
            skipSpaces();
            if (pos < input.length()) {
                throw error("Unexpected '" + input.charAt(pos) + "'", pos);
            }
        }

        private TypeDescriptor build(final Supplier<TypeDescriptor> factory, final int start) {
            try {
                return factory.get();
            } catch (IllegalArgumentException e) {
                throw error(e.getMessage(), start);
            }
        }

        private String identifier() {
            final int start = pos;
            while (pos < input.length() && Character.isJavaIdentifierPart(input.charAt(pos))) {
                pos++;
            }
            if (start == pos) {
                throw error(pos < input.length() ? "Expected type name at '" + input.charAt(pos) + "'" : "Expected type name", pos);
            }
            return input.substring(start, pos);
        }

        private void expect(final char c) {
            if (peek() != c) {
                throw error("Expected '" + c + "'", pos);
            }
            pos++;
        }

        private char peek() {
            skipSpaces();
            return pos < input.length() ? input.charAt(pos) : '\0';
        }

        private int skipSpaces() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
            return pos;
        }

        private IllegalArgumentException error(final String message, final int at) {
            return new IllegalArgumentException(message + " at position " + at + " in type expression '" + input + "'");
        }
    }
}
