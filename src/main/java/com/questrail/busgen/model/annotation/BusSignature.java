package com.questrail.busgen.model.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Wire type override.
 *
 * <p>The default wire type is inferred from the "natural" Java type:</p>
 * <ul>
 *   <li>{@code short} is {@code n}, not {@code q}</li>
 *   <li>{@code int} is {@code i}, not {@code u}</li>
 *   <li>{@code long} is {@code x}, not {@code t}</li>
 * </ul>
 * Unsigned types and struct values therefore need an explicit signature.
 *
 * <p>On a parameter the value must be a single complete type. On a method it
 * describes the return value; a method signature listing several complete
 * types (e.g. {@code us}) declares one output argument per type, and the Java
 * method then returns a {@link com.questrail.busgen.value.Struct}.</p>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.PARAMETER})
public @interface BusSignature {

    String value();
}
