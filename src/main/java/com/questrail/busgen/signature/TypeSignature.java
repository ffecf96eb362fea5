package com.questrail.busgen.signature;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TypeSignature
 * -----------------------------------------------------------------------------
 * A parsed wire signature: an ordered sequence of complete types.
 *
 * <p>A message body signature may hold any number of complete types (including
 * none); an argument or property signature holds exactly one. The textual form
 * returned by {@link #toText()} is the inverse of {@link #parse(String)} for
 * every value the parser produces.</p>
 */
public final class TypeSignature
{
    public static final TypeSignature EMPTY = new TypeSignature(List.of());

    private final List<SignatureType> types;
    private final String text;

    private TypeSignature(List<SignatureType> types) {
        this.types = List.copyOf(types);
        StringBuilder sb = new StringBuilder();
        for (SignatureType t : this.types) {
            t.appendTo(sb);
        }
        this.text = sb.toString();
    }

    /**
     * Parses signature text.
     *
     * @throws SignatureException if the text is malformed or too deep
     */
    public static TypeSignature parse(String text) {
        return SignatureParser.parse(text);
    }

    /**
     * Parses signature text that must contain exactly one complete type.
     *
     * @throws SignatureException if the text is malformed or holds zero or
     *         several complete types
     */
    public static TypeSignature parseSingle(String text) {
        TypeSignature sig = SignatureParser.parse(text);
        if (!sig.isSingle()) {
            throw new SignatureException(SignatureException.Kind.NOT_SINGLE_TYPE, text, 0,
                    "Expected exactly one complete type, found " + sig.size());
        }
        return sig;
    }

    public static TypeSignature of(SignatureType... types) {
        return of(List.of(types));
    }

    public static TypeSignature of(List<SignatureType> types) {
        return types.isEmpty() ? EMPTY : new TypeSignature(types);
    }

    /**
     * Concatenates the complete types of several signatures in order.
     */
    public static TypeSignature concat(List<TypeSignature> parts) {
        List<SignatureType> all = new ArrayList<>();
        for (TypeSignature part : parts) {
            all.addAll(part.types);
        }
        return of(all);
    }

    public List<SignatureType> types() {
        return types;
    }

    public int size() {
        return types.size();
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }

    public boolean isSingle() {
        return types.size() == 1;
    }

    /**
     * Returns the only complete type of a single-type signature.
     *
     * @throws IllegalStateException if this signature is not a single type
     */
    public SignatureType single() {
        if (!isSingle()) {
            throw new IllegalStateException("Signature '" + text + "' is not a single complete type");
        }
        return types.get(0);
    }

    /**
     * Wraps all complete types of this signature into one struct type, e.g.
     * {@code us} becomes {@code (us)}.
     */
    public TypeSignature asStruct() {
        return of(SignatureType.struct(types));
    }

    public String toText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeSignature that)) return false;
        return text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
