package com.questrail.busgen.model;

import java.util.Objects;

/**
 * A D-Bus {@code <annotation name="..." value="..."/>} attached to an
 * interface, member or argument.
 */
public record AnnotationSpec(String name, String value)
{
    public AnnotationSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
