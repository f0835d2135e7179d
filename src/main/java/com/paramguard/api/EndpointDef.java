package com.paramguard.api;

import java.lang.annotation.Annotation;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.paramguard.utils.Json;
import com.paramguard.validation.ParameterSpec;
import com.paramguard.validation.TypeDescriptor;
import com.paramguard.validation.TypeDescriptors;
import com.paramguard.validation.TypeNormalizer;
import com.paramguard.validation.ValidatedParameters;
import com.paramguard.validation.source.Constraints;
import com.paramguard.validation.source.SourceKind;
import com.paramguard.validation.source.ValueCoercion;
import com.sun.net.httpserver.HttpExchange;

/**
 * Runtime endpoint definition built from an @Endpoint-annotated method via reflection.
 * Holds the parameter contracts the validation session runs and threads validated values
 * back into the method by position.
 */
public class EndpointDef {
    private final Object target;
    private final Method method;
    private final String name;              // snake_case method name
    private final String httpMethod;        // upper case
    private final RoutePattern route;
    private final String description;
    private final Class<?> responseType;    // response record type for schema generation
    private final List<EndpointParamDef> params;
    private final List<Argument> arguments; // one per Java parameter

    private EndpointDef(final Object target, final Method method, final Endpoint annotation,
                        final RoutePattern route, final List<EndpointParamDef> params, final List<Argument> arguments) {
        this.target = target;
        this.method = method;
        this.name = Json.toSnakeCase(method.getName());
        this.httpMethod = annotation.method().toUpperCase(Locale.ROOT);
        this.route = route;
        this.description = annotation.description();
        this.responseType = annotation.responseType();
        this.params = List.copyOf(params);
        this.arguments = List.copyOf(arguments);
    }

    /**
     * Build an EndpointDef from an annotated method of a handler object.
     *
     * @throws IllegalStateException when a parameter declaration cannot be served
     */
    public static EndpointDef fromMethod(final Object target, final Method method) {
        final Endpoint annotation = method.getAnnotation(Endpoint.class);
        if (annotation == null) {
            throw new IllegalStateException(method + " is not annotated with @Endpoint");
        }
        final RoutePattern route;
        try {
            route = RoutePattern.compile(annotation.path());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(method.getName() + ": " + e.getMessage(), e);
        }

        final Parameter[] javaParams = method.getParameters();
        final Annotation[][] paramAnnotations = method.getParameterAnnotations();
        final Type[] genericTypes = method.getGenericParameterTypes();

        final List<EndpointParamDef> paramDefs = new ArrayList<>();
        final List<Argument> arguments = new ArrayList<>();
        for (int i = 0; i < javaParams.length; i++) {
            final Class<?> javaType = javaParams[i].getType();
            final SourceAnnotation source = findSourceAnnotation(method, javaParams[i], paramAnnotations[i]);
            if (source == null) {
                if (javaType == HttpExchange.class) {
                    arguments.add(Argument.EXCHANGE);
                } else if (javaType == ValidatedParameters.class) {
                    arguments.add(Argument.PARAMETERS);
                } else {
                    throw new IllegalStateException(describe(method, javaParams[i])
                        + " needs a source annotation (@Route, @Body, @Query, @Form or @File)");
                }
                continue;
            }

            final String paramName = source.name().isEmpty()
                ? Json.toSnakeCase(javaParams[i].getName())
                : source.name();
            final TypeDescriptor type = resolveType(method, javaParams[i], genericTypes[i], source.type());
            checkAssignable(method, javaParams[i], genericTypes[i], type);

            if (source.kind() == SourceKind.ROUTE && !route.variables().contains(paramName)) {
                throw new IllegalStateException(describe(method, javaParams[i])
                    + " is bound to route variable '" + paramName + "' missing from " + route.template());
            }

            final Object defaultValue = source.defaultValue().equals(Endpoint.NO_DEFAULT)
                ? null
                : parseDefault(method, javaParams[i], source.defaultValue(), type);
            final Constraints constraints = toConstraints(javaParams[i].getAnnotation(Validate.class));
            final boolean required = defaultValue == null && !TypeNormalizer.isOptional(type)
                && !(type instanceof TypeDescriptor.AnyType);

            paramDefs.add(new EndpointParamDef(paramName, source.kind(), type, required, defaultValue,
                constraints, source.description()));
            arguments.add(Argument.value(paramName, javaType == Optional.class));
        }

        // Public methods of non-public handler classes still need this
        method.setAccessible(true);
        return new EndpointDef(target, method, annotation, route, paramDefs, arguments);
    }

    /**
     * Parameter contracts in declaration order, ready for a validation session.
     */
    public List<ParameterSpec> toParameterSpecs() {
        return params.stream().map(EndpointParamDef::toSpec).toList();
    }

    /**
     * Call the method with validated values.
     *
     * @throws Exception whatever the method throws, unwrapped
     */
    public Object invoke(final HttpExchange exchange, final ValidatedParameters parameters) throws Exception {
        final Object[] args = new Object[arguments.size()];
        for (int i = 0; i < args.length; i++) {
            final Argument arg = arguments.get(i);
            args[i] = switch (arg.kind()) {
                case EXCHANGE -> exchange;
                case PARAMETERS -> parameters;
                case VALUE -> arg.wrapOptional()
                    ? Optional.ofNullable(parameters.get(arg.name()))
                    : parameters.get(arg.name());
            };
        }
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }

    /**
     * Catalog entry for the /endpoints listing.
     */
    public Map<String, Object> toCatalogEntry() {
        final Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", name);
        entry.put("method", httpMethod);
        entry.put("path", route.template());
        if (!description.isEmpty()) {
            entry.put("description", description);
        }
        entry.put("inputSchema", buildInputSchemaMap());

        final Map<String, Object> outputSchema = SchemaGenerator.outputSchema(responseType);
        if (outputSchema != null) {
            entry.put("outputSchema", outputSchema);
        }
        return entry;
    }

    private Map<String, Object> buildInputSchemaMap() {
        final Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");

        if (!params.isEmpty()) {
            final Map<String, Object> properties = new LinkedHashMap<>();
            for (final EndpointParamDef p : params) {
                properties.put(p.name(), ParamSchemas.forParam(p));
            }
            schema.put("properties", properties);

            final List<String> required = params.stream()
                .filter(EndpointParamDef::required)
                .map(EndpointParamDef::name)
                .toList();
            if (!required.isEmpty()) {
                schema.put("required", required);
            }
        }
        return schema;
    }

    public String getName() { return name; }
    public String getHttpMethod() { return httpMethod; }
    public RoutePattern getRoute() { return route; }
    public String getDescription() { return description; }
    public List<EndpointParamDef> getParams() { return params; }

    @Override
    public String toString() {
        return httpMethod + " " + route.template() + " -> " + method.getDeclaringClass().getSimpleName() + "." + method.getName();
    }

    private static SourceAnnotation findSourceAnnotation(final Method method, final Parameter param,
                                                        final Annotation[] annotations) {
        SourceAnnotation found = null;
        for (final Annotation ann : annotations) {
            final SourceAnnotation candidate = SourceAnnotation.of(ann);
            if (candidate == null) continue;
            if (found != null) {
                throw new IllegalStateException(describe(method, param) + " has more than one source annotation");
            }
            found = candidate;
        }
        return found;
    }

    private static TypeDescriptor resolveType(final Method method, final Parameter param, final Type genericType,
                                              final String expression) {
        try {
            return expression.isEmpty()
                ? TypeDescriptors.fromJavaType(genericType)
                : TypeDescriptors.parse(expression);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(describe(method, param) + ": " + e.getMessage(), e);
        }
    }

    /**
     * Every value the declared type admits must fit the Java parameter.
     */
    private static void checkAssignable(final Method method, final Parameter param, final Type genericType,
                                        final TypeDescriptor declared) {
        final Class<?> javaType = param.getType();
        if (javaType.isPrimitive() && TypeNormalizer.isOptional(declared)) {
            throw new IllegalStateException(describe(method, param) + " is primitive but declared "
                + declared.displayName());
        }
        final Class<?> holder = javaType == Optional.class ? optionalArgument(genericType) : box(javaType);
        if (!fits(declared, holder)) {
            throw new IllegalStateException(describe(method, param) + " of type " + javaType.getSimpleName()
                + " cannot hold " + declared.displayName());
        }
    }

    private static boolean fits(final TypeDescriptor declared, final Class<?> holder) {
        if (declared instanceof TypeDescriptor.Plain p) {
            return p.isNull() || holder.isAssignableFrom(p.type());
        }
        if (declared instanceof TypeDescriptor.ListOf) {
            return holder.isAssignableFrom(List.class);
        }
        if (declared instanceof TypeDescriptor.UnionOf u) {
            return u.members().stream().allMatch(m -> fits(m, holder));
        }
        return holder == Object.class;
    }

    private static Class<?> optionalArgument(final Type genericType) {
        if (genericType instanceof ParameterizedType pt) {
            final Type arg = pt.getActualTypeArguments()[0];
            if (arg instanceof Class<?> c) return c;
            if (arg instanceof ParameterizedType inner && inner.getRawType() instanceof Class<?> raw) return raw;
        }
        return Object.class;
    }

    private static Object parseDefault(final Method method, final Parameter param, final String text,
                                       final TypeDescriptor type) {
        return parseDefault(text, type).orElseThrow(() -> new IllegalStateException(describe(method, param)
            + ": default '" + text + "' is not a valid " + type.displayName()));
    }

    private static Optional<Object> parseDefault(final String text, final TypeDescriptor type) {
        if (type instanceof TypeDescriptor.AnyType) {
            return Optional.of(text);
        }
        if (type instanceof TypeDescriptor.Plain p) {
            return p.isNull() ? Optional.empty() : ValueCoercion.fromText(text, p.type());
        }
        if (type instanceof TypeDescriptor.ListOf l) {
            final List<Object> values = new ArrayList<>();
            if (text.isEmpty()) return Optional.of(values);
            for (final String item : text.split(",", -1)) {
                final Optional<Object> value = l.elementTypes().stream()
                    .map(t -> ValueCoercion.fromText(item.trim(), t))
                    .flatMap(Optional::stream)
                    .findFirst();
                if (value.isEmpty()) return Optional.empty();
                values.add(value.get());
            }
            return Optional.of(values);
        }
        final TypeDescriptor.UnionOf union = (TypeDescriptor.UnionOf) type;
        for (final TypeDescriptor member : union.nonNullMembers()) {
            final Optional<Object> value = parseDefault(text, member);
            if (value.isPresent()) return value;
        }
        return Optional.empty();
    }

    private static Constraints toConstraints(final Validate v) {
        if (v == null) return Constraints.none();
        final Constraints.Builder b = Constraints.builder();
        if (v.minStrLength() >= 0) b.minStrLength(v.minStrLength());
        if (v.maxStrLength() >= 0) b.maxStrLength(v.maxStrLength());
        if (v.minListLength() >= 0) b.minListLength(v.minListLength());
        if (v.maxListLength() >= 0) b.maxListLength(v.maxListLength());
        if (!Double.isNaN(v.minValue())) b.minValue(bound(v.minValue()));
        if (!Double.isNaN(v.maxValue())) b.maxValue(bound(v.maxValue()));
        if (!v.whitelist().isEmpty()) b.whitelist(v.whitelist());
        if (!v.blacklist().isEmpty()) b.blacklist(v.blacklist());
        if (!v.pattern().isEmpty()) b.pattern(v.pattern());
        if (v.contentTypes().length > 0) b.contentTypes(Set.copyOf(Arrays.asList(v.contentTypes())));
        if (v.minBytes() >= 0) b.minBytes(v.minBytes());
        if (v.maxBytes() >= 0) b.maxBytes(v.maxBytes());
        return b.build();
    }

    /** Whole bounds read back as integers so messages say "at least 18", not "18.0". */
    private static Number bound(final double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return (long) value;
        }
        return value;
    }

    private static Class<?> box(final Class<?> type) {
        return type.isPrimitive() ? TypeDescriptor.plain(type).type() : type;
    }

    private static String describe(final Method method, final Parameter param) {
        return method.getDeclaringClass().getSimpleName() + "." + method.getName() + " parameter '" + param.getName() + "'";
    }

    /** Uniform view over the five source annotations. */
    private record SourceAnnotation(SourceKind kind, String name, String defaultValue, String type, String description) {

        static SourceAnnotation of(final Annotation ann) {
            if (ann instanceof Route r) {
                return new SourceAnnotation(SourceKind.ROUTE, r.name(), Endpoint.NO_DEFAULT, r.type(), r.description());
            }
            if (ann instanceof Body b) {
                return new SourceAnnotation(SourceKind.JSON, b.name(), b.defaultValue(), b.type(), b.description());
            }
            if (ann instanceof Query q) {
                return new SourceAnnotation(SourceKind.QUERY, q.name(), q.defaultValue(), q.type(), q.description());
            }
            if (ann instanceof Form f) {
                return new SourceAnnotation(SourceKind.FORM, f.name(), f.defaultValue(), f.type(), f.description());
            }
            if (ann instanceof File f) {
                return new SourceAnnotation(SourceKind.FILE, f.name(), Endpoint.NO_DEFAULT, f.type(), f.description());
            }
            return null;
        }
    }

    private enum ArgumentKind { EXCHANGE, PARAMETERS, VALUE }

    private record Argument(ArgumentKind kind, String name, boolean wrapOptional) {
        static final Argument EXCHANGE = new Argument(ArgumentKind.EXCHANGE, null, false);
        static final Argument PARAMETERS = new Argument(ArgumentKind.PARAMETERS, null, false);

        static Argument value(final String name, final boolean wrapOptional) {
            return new Argument(ArgumentKind.VALUE, name, wrapOptional);
        }
    }
}
