package com.questrail.busgen.model.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names a method or signal argument. Without it the Java parameter name is
 * used when the class was compiled with {@code -parameters}, otherwise the
 * argument stays unnamed.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface BusArg {

    String value();
}
