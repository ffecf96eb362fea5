package com.questrail.busgen.signature;

import java.util.ArrayList;
import java.util.List;

import static com.questrail.busgen.signature.SignatureException.Kind.*;

/**
 * SignatureParser
 * -----------------------------------------------------------------------------
 * Single left-to-right scan over wire signature text.
 *
 * <p>The scan tracks array and struct nesting counters and fails on the first
 * violation: a closing bracket without an opening one, an unknown code, depth
 * beyond the protocol limits, or premature end of text. No recovery is
 * attempted; signatures are short and a malformed one is a caller bug.</p>
 *
 * <p>Protocol limits (D-Bus specification, "Valid Signatures"):</p>
 * <ul>
 *   <li>at most {@value #MAX_LENGTH} characters</li>
 *   <li>at most {@value #MAX_ARRAY_DEPTH} nested arrays</li>
 *   <li>at most {@value #MAX_STRUCT_DEPTH} nested structs and dict entries</li>
 *   <li>at most {@value #MAX_TOTAL_DEPTH} containers overall</li>
 * </ul>
 */
public final class SignatureParser
{
    public static final int MAX_LENGTH = 255;
    public static final int MAX_ARRAY_DEPTH = 32;
    public static final int MAX_STRUCT_DEPTH = 32;
    public static final int MAX_TOTAL_DEPTH = MAX_ARRAY_DEPTH + MAX_STRUCT_DEPTH;

    private final String text;
    private int pos;

    private SignatureParser(String text) {
        this.text = text;
    }

    public static TypeSignature parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("signature text must not be null");
        }
        if (text.length() > MAX_LENGTH) {
            throw new SignatureException(TOO_LONG, text, MAX_LENGTH,
                    "Signature longer than " + MAX_LENGTH + " characters");
        }
        SignatureParser parser = new SignatureParser(text);
        List<SignatureType> types = new ArrayList<>();
        while (parser.pos < text.length()) {
            types.add(parser.completeType(0, 0));
        }
        return TypeSignature.of(types);
    }

    private SignatureType completeType(int arrayDepth, int structDepth) {
        if (pos >= text.length()) {
            throw fail(UNEXPECTED_END, "Expected a complete type");
        }
        final char c = text.charAt(pos);
        switch (c) {
            case 'a':
                return array(arrayDepth + 1, structDepth);
            case '(':
                return struct(arrayDepth, structDepth + 1);
            case ')':
            case '}':
                throw fail(UNMATCHED_CONTAINER, "'" + c + "' closes a container that was never opened");
            case '{':
                throw fail(UNMATCHED_CONTAINER, "Dict entry outside of an array");
            case 'v':
                pos++;
                return SignatureType.variant();
            default:
                TypeCode code = TypeCode.of(c)
                        .filter(TypeCode::isBasic)
                        .orElseThrow(() -> fail(UNKNOWN_TYPE_CODE, "Unknown type code '" + c + "'"));
                pos++;
                return SignatureType.basic(code);
        }
    }

    private SignatureType array(int arrayDepth, int structDepth) {
        checkDepth(arrayDepth, structDepth);
        pos++; // 'a'
        if (pos < text.length() && text.charAt(pos) == '{') {
            return SignatureType.array(dictEntry(arrayDepth, structDepth + 1));
        }
        return SignatureType.array(completeType(arrayDepth, structDepth));
    }

    private SignatureType struct(int arrayDepth, int structDepth) {
        checkDepth(arrayDepth, structDepth);
        final int open = pos;
        pos++; // '('
        List<SignatureType> fields = new ArrayList<>();
        while (true) {
            if (pos >= text.length()) {
                pos = open;
                throw fail(UNMATCHED_CONTAINER, "Struct is never closed");
            }
            if (text.charAt(pos) == ')') {
                if (fields.isEmpty()) {
                    throw fail(EMPTY_CONTAINER, "Struct has no fields");
                }
                pos++;
                return SignatureType.struct(fields);
            }
            fields.add(completeType(arrayDepth, structDepth));
        }
    }

    private SignatureType dictEntry(int arrayDepth, int structDepth) {
        checkDepth(arrayDepth, structDepth);
        final int open = pos;
        pos++; // '{'
        if (pos >= text.length()) {
            throw fail(UNEXPECTED_END, "Dict entry has no key type");
        }
        final int keyPos = pos;
        SignatureType key = completeType(arrayDepth, structDepth);
        if (!(key instanceof SignatureType.BasicType)) {
            pos = keyPos;
            throw fail(INVALID_DICT_KEY, "Dict entry key must be a basic type, found '" + key.toText() + "'");
        }
        if (pos >= text.length()) {
            throw fail(UNEXPECTED_END, "Dict entry has no value type");
        }
        if (text.charAt(pos) == '}') {
            throw fail(UNMATCHED_CONTAINER, "Dict entry must hold exactly two types");
        }
        SignatureType value = completeType(arrayDepth, structDepth);
        if (pos >= text.length()) {
            pos = open;
            throw fail(UNMATCHED_CONTAINER, "Dict entry is never closed");
        }
        if (text.charAt(pos) != '}') {
            throw fail(UNMATCHED_CONTAINER, "Dict entry must hold exactly two types");
        }
        pos++;
        return SignatureType.dictEntry(key, value);
    }

    private void checkDepth(int arrayDepth, int structDepth) {
        if (arrayDepth > MAX_ARRAY_DEPTH) {
            throw fail(NESTING_TOO_DEEP, "More than " + MAX_ARRAY_DEPTH + " nested arrays");
        }
        if (structDepth > MAX_STRUCT_DEPTH) {
            throw fail(NESTING_TOO_DEEP, "More than " + MAX_STRUCT_DEPTH + " nested structs");
        }
        if (arrayDepth + structDepth > MAX_TOTAL_DEPTH) {
            throw fail(NESTING_TOO_DEEP, "More than " + MAX_TOTAL_DEPTH + " nested containers");
        }
    }

    private SignatureException fail(SignatureException.Kind kind, String message) {
        return new SignatureException(kind, text, pos, message);
    }
}
