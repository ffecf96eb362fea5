package com.questrail.busgen.model.annotation;

import com.questrail.busgen.model.ChangeNotify;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a property accessor. A getter ({@code getX()} or {@code isX()})
 * makes the property readable, a setter ({@code setX(value)}) makes it
 * writable; annotating both gives {@code readwrite} access.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface BusProperty {

    /**
     * Override of the wire name, stored verbatim.
     * The default is the PascalCase form of the accessor name without its
     * {@code get}, {@code is} or {@code set} prefix.
     */
    String name() default "";

    ChangeNotify emitsChangedSignal() default ChangeNotify.TRUE;

    String doc() default "";

    /**
     * Position among the interface's members of the same kind; members with
     * equal order are sorted by wire name.
     */
    int order() default Integer.MAX_VALUE;
}
