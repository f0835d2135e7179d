package com.paramguard.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Semantic constraints for a source-annotated parameter. Unset attributes keep their
 * sentinel defaults (-1, NaN, empty) and are ignored.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Validate {
    int minStrLength() default -1;

    int maxStrLength() default -1;

    int minListLength() default -1;

    int maxListLength() default -1;

    double minValue() default Double.NaN;

    double maxValue() default Double.NaN;

    /** Characters a string may consist of. */
    String whitelist() default "";

    /** Characters a string must not contain. */
    String blacklist() default "";

    /** Regular expression a string must match entirely. */
    String pattern() default "";

    /** Accepted content types of an uploaded file. */
    String[] contentTypes() default {};

    long minBytes() default -1;

    long maxBytes() default -1;
}
