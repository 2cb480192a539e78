package io.urlcrypt.core.schema;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a record component or field as carrying an encrypted value. Read once by {@link
 * TargetShapes#fromType(Class)}; never inspected per request.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD})
public @interface Encrypted {

    /** Suppress this field from the aggregated warning when it fails to decrypt. */
    boolean ignoreWarning() default false;
}
