package com.paramguard.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a parameter to an uploaded file part of a multipart request. The parameter type is
 * {@code UploadedFile}, {@code List<UploadedFile>} or {@code Optional<UploadedFile>}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface File {
    /** Part name; empty means the parameter name in snake_case. */
    String name() default "";

    String type() default "";

    String description() default "";
}
