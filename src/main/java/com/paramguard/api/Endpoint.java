package com.paramguard.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as an HTTP endpoint whose parameters are validated before it runs.
 * Reflection discovers annotated methods at registration; each parameter must carry one
 * source annotation ({@link Route}, {@link Body}, {@link Query}, {@link Form}, {@link File})
 * or be of type {@code HttpExchange} or {@code ValidatedParameters}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Endpoint {
    /** Sentinel value indicating a parameter has no default. */
    String NO_DEFAULT = "\0__NO_DEFAULT__";

    /** Path template, e.g. {@code /update/{id}}. */
    String path();

    /** HTTP method accepted by this endpoint. */
    String method() default "GET";

    /** Endpoint description shown in the /endpoints catalog. */
    String description() default "";

    /** Response record type, used to derive the output schema. Void.class means none. */
    Class<?> responseType() default Void.class;
}
