package com.teachertraining.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import jakarta.validation.ReportAsSingleViolation;
import jakarta.validation.constraints.Pattern;
import org.hibernate.validator.constraints.URL;

import java.lang.annotation.*;

/**
 * An absolute http or https URL with a host. Hosts with underscores or
 * non-ASCII characters and unescaped spaces in the path are accepted.
 * {@code null} is valid; pair with {@code @NotNull} for required fields.
 */
@URL
@Pattern(regexp = "(?i)https?://[^/?#\\s]+.*")
@ReportAsSingleViolation
@Documented
@Constraint(validatedBy = {})
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT, ElementType.TYPE_USE})
@Retention(RetentionPolicy.RUNTIME)
public @interface HttpUrl {
    String message() default "must be a valid absolute http(s) URL";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
