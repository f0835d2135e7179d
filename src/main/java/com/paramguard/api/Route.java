package com.paramguard.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a parameter to a {@code {name}} segment of the endpoint's path template.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Route {
    /** Template variable name; empty means the parameter name in snake_case. */
    String name() default "";

    /** Type expression overriding the Java type, e.g. {@code Union[Integer, Double]}. */
    String type() default "";

    String description() default "";
}
