package com.questrail.busgen.value;

import com.questrail.busgen.signature.TypeSignature;

import java.util.Objects;

/**
 * Native value of a variant (wire code {@code v}): a value together with the
 * single complete type that describes it.
 */
public record Variant(TypeSignature signature, Object value)
{
    public Variant {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(value, "value");
        if (!signature.isSingle()) {
            throw new IllegalArgumentException("Variant signature must be a single complete type: '" + signature + "'");
        }
        if (!ValueShapes.conforms(signature.single(), value)) {
            throw new IllegalArgumentException("Value " + value + " does not conform to variant signature '" + signature + "'");
        }
    }

    /**
     * Creates a variant for a value whose signature can be inferred from its
     * Java class (scalars, strings, paths, signatures, nested variants).
     *
     * @throws IllegalArgumentException if the signature cannot be inferred
     */
    public static Variant of(Object value) {
        return new Variant(ValueShapes.inferSignature(value), value);
    }

    public static Variant of(String signature, Object value) {
        return new Variant(TypeSignature.parseSingle(signature), value);
    }

    public <T> T get() {
        return ValueShapes.cast(value);
    }
}
