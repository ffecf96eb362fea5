package com.questrail.busgen.model.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface BusMethod {

    /**
     * Override of the wire name, stored verbatim.
     * The default is the PascalCase form of the Java method name.
     */
    String name() default "";

    String doc() default "";

    /**
     * Position among the interface's members of the same kind; members with
     * equal order are sorted by wire name.
     */
    int order() default Integer.MAX_VALUE;
}
