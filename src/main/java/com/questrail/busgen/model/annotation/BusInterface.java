package com.questrail.busgen.model.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Java type as the description of a bus interface.
 *
 * @see AnnotatedInterfaceReader
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface BusInterface {

    /** Dotted interface name, e.g. {@code org.example.Calculator}. */
    String name();

    /** Documentation rendered as a comment before the interface element. */
    String doc() default "";
}
