package dev.fumaz.ambit.annotation;

import java.lang.annotation.*;

/**
 * Marks a class bound by identifier as scoped, cached once per active scope.
 */
@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Scoped {
}
