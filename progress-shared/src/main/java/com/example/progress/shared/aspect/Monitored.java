package com.example.progress.shared.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean, or a single method, whose calls {@link MonitoringAspect} times and counts.
 * On a type every public method is covered.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface Monitored {

    /** Layer tag, {@code "service"} or {@code "controller"}; becomes part of the meter name. */
    String value();
}
