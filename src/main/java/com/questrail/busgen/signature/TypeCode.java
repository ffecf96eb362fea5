package com.questrail.busgen.signature;

import java.util.Optional;

/**
 * TypeCode
 * -----------------------------------------------------------------------------
 * The single-character type codes of the D-Bus wire signature language.
 *
 * <p>Basic codes describe fixed scalars and string-like values and are the only
 * codes permitted as dict-entry keys. Container codes ({@code a}, {@code (},
 * {@code {}) open a nested type; {@code v} is a variant whose inner type is
 * carried with the value rather than in the signature.</p>
 */
public enum TypeCode
{
    BYTE('y', true),
    BOOLEAN('b', true),
    INT16('n', true),
    UINT16('q', true),
    INT32('i', true),
    UINT32('u', true),
    INT64('x', true),
    UINT64('t', true),
    DOUBLE('d', true),
    UNIX_FD('h', true),
    STRING('s', true),
    OBJECT_PATH('o', true),
    SIGNATURE('g', true),
    VARIANT('v', false),
    ARRAY('a', false),
    STRUCT('(', false),
    DICT_ENTRY('{', false);

    private final char code;
    private final boolean basic;

    TypeCode(char code, boolean basic) {
        this.code = code;
        this.basic = basic;
    }

    public char code() {
        return code;
    }

    /**
     * Returns {@code true} for codes that may appear as a dict-entry key.
     */
    public boolean isBasic() {
        return basic;
    }

    /**
     * Looks up the type code for an opening signature character.
     *
     * @param c signature character
     * @return the matching code, or empty for closing brackets and unknown characters
     */
    public static Optional<TypeCode> of(char c) {
        for (TypeCode t : values()) {
            if (t.code == c) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
