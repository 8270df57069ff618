package dev.fumaz.ambit.annotation;

import java.lang.annotation.*;

/**
 * Marks a class bound by identifier as transient, constructed anew on every lookup.
 */
@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Transient {
}
