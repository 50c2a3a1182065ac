package com.hargapangan.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Null or a known commodity category code (beras, cabai, ...).
 * Error code for API: INVALID_CATEGORY.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = CategoryCodeValidator.class)
public @interface CategoryCode {

    String message() default "INVALID_CATEGORY";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
