package com.paramguard.api;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.paramguard.validation.TypeDescriptor;
import com.paramguard.validation.source.Constraints;
import com.paramguard.validation.source.UploadedFile;

/**
 * Maps parameter type descriptors and constraints to JSON Schema fragments for the
 * endpoint catalog.
 */
final class ParamSchemas {

    private ParamSchemas() {}

    static Map<String, Object> forParam(final EndpointParamDef param) {
        final Map<String, Object> schema = forType(param.type(), param.constraints());
        schema.put("in", param.source().name().toLowerCase(Locale.ROOT));
        if (param.description() != null && !param.description().isEmpty()) {
            schema.put("description", param.description());
        }
        if (param.defaultValue() != null) {
            schema.put("default", param.defaultValue());
        }
        return schema;
    }

    static Map<String, Object> forType(final TypeDescriptor type, final Constraints constraints) {
        if (type instanceof TypeDescriptor.Plain p) {
            final Map<String, Object> schema = forClass(p.type());
            applyScalarConstraints(schema, constraints);
            return schema;
        }
        if (type instanceof TypeDescriptor.ListOf l) {
            final Map<String, Object> schema = new LinkedHashMap<>();
            schema.put("type", "array");
            schema.put("items", forType(l.element(), constraints));
            if (constraints.minListLength() != null) schema.put("minItems", constraints.minListLength());
            if (constraints.maxListLength() != null) schema.put("maxItems", constraints.maxListLength());
            return schema;
        }
        if (type instanceof TypeDescriptor.UnionOf u) {
            final List<TypeDescriptor> members = u.nonNullMembers();
            if (members.size() == 1) {
                return forType(members.get(0), constraints);
            }
            final List<Object> anyOf = new ArrayList<>();
            for (final TypeDescriptor member : members) {
                anyOf.add(forType(member, constraints));
            }
            if (u.containsNull()) {
                anyOf.add(Map.of("type", "null"));
            }
            final Map<String, Object> schema = new LinkedHashMap<>();
            schema.put("anyOf", anyOf);
            return schema;
        }
        // Any: no restriction
        return new LinkedHashMap<>();
    }

    private static Map<String, Object> forClass(final Class<?> type) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        if (type == String.class) {
            schema.put("type", "string");
        } else if (type == Integer.class || type == Long.class || type == Short.class || type == Byte.class) {
            schema.put("type", "integer");
        } else if (type == Double.class || type == Float.class || type == BigDecimal.class) {
            schema.put("type", "number");
        } else if (type == Boolean.class) {
            schema.put("type", "boolean");
        } else if (type == UploadedFile.class) {
            schema.put("type", "string");
            schema.put("format", "binary");
        } else {
            schema.put("type", "object");
        }
        return schema;
    }

    private static void applyScalarConstraints(final Map<String, Object> schema, final Constraints c) {
        final Object jsonType = schema.get("type");
        if ("string".equals(jsonType) && !schema.containsKey("format")) {
            if (c.minStrLength() != null) schema.put("minLength", c.minStrLength());
            if (c.maxStrLength() != null) schema.put("maxLength", c.maxStrLength());
            if (c.pattern() != null) schema.put("pattern", c.pattern().pattern());
        } else if ("integer".equals(jsonType) || "number".equals(jsonType)) {
            if (c.minValue() != null) schema.put("minimum", c.minValue());
            if (c.maxValue() != null) schema.put("maximum", c.maxValue());
        } else if (c.contentTypes() != null && !c.contentTypes().isEmpty()) {
            schema.put("contentMediaType", c.contentTypes().stream().sorted().toList());
        }
    }
}
