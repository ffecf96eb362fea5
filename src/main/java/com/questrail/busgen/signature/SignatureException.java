package com.questrail.busgen.signature;

import java.util.Objects;

/**
 * Indicates that a wire signature text is malformed or exceeds a protocol limit.
 *
 * <p>Signature failures are never partially recovered: the parse call that
 * raised this exception produced no value. The {@link Kind} identifies the
 * failure class and {@link #position()} the offending character index.</p>
 */
public final class SignatureException extends RuntimeException
{
    public enum Kind {
        /** The text ended where a complete type was required. */
        UNEXPECTED_END,
        /** A character that is not a type code. */
        UNKNOWN_TYPE_CODE,
        /** A container closed without opening, or opened without closing. */
        UNMATCHED_CONTAINER,
        /** Array or struct nesting beyond the protocol limit. */
        NESTING_TOO_DEEP,
        /** A struct with no fields. */
        EMPTY_CONTAINER,
        /** A dict-entry key that is not a basic type. */
        INVALID_DICT_KEY,
        /** The text exceeds the maximum signature length. */
        TOO_LONG,
        /** Exactly one complete type was required. */
        NOT_SINGLE_TYPE
    }

    private final Kind kind;
    private final String signature;
    private final int position;

    public SignatureException(Kind kind, String signature, int position, String message) {
        super(message + " in signature '" + signature + "' at position " + position);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.signature = signature;
        this.position = position;
    }

    public Kind kind() {
        return kind;
    }

    public String signature() {
        return signature;
    }

    public int position() {
        return position;
    }
}
