package dev.fumaz.ambit.annotation;

import java.lang.annotation.*;

/**
 * Marks a class bound by identifier as a singleton, cached in the root scope.
 */
@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Singleton {
}
