package com.paramguard.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a parameter to a top-level field of a JSON object request body.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Body {
    /** Request key; empty means the parameter name in snake_case. */
    String name() default "";

    /** Default as text, parsed with the parameter's type, or {@link Endpoint#NO_DEFAULT}. */
    String defaultValue() default Endpoint.NO_DEFAULT;

    /** Type expression overriding the Java type, e.g. {@code Union[Integer, Double]}. */
    String type() default "";

    String description() default "";
}
