package com.questrail.busgen.dispatch;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Server-side accessors of one property. A readable property needs a getter;
 * a property with a setter binding needs a setter.
 */
public record PropertyHandler(Optional<Supplier<?>> getter, Optional<Consumer<Object>> setter)
{
    public PropertyHandler {
        Objects.requireNonNull(getter, "getter");
        Objects.requireNonNull(setter, "setter");
    }

    public static PropertyHandler readOnly(Supplier<?> getter) {
        return new PropertyHandler(Optional.of(getter), Optional.empty());
    }

    public static PropertyHandler writeOnly(Consumer<Object> setter) {
        return new PropertyHandler(Optional.empty(), Optional.of(setter));
    }

    public static PropertyHandler readWrite(Supplier<?> getter, Consumer<Object> setter) {
        return new PropertyHandler(Optional.of(getter), Optional.of(setter));
    }
}
