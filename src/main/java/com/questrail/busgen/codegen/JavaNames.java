package com.questrail.busgen.codegen;

import com.questrail.busgen.model.WireNames;

import java.util.HashSet;
import java.util.Set;

/**
 * Java identifiers and literals for generated source.
 */
public final class JavaNames
{
    private static final Set<String> RESERVED = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "var", "yield", "record", "sealed", "permits",
            "_");

    private static final String[] OBJECT_METHODS = {
            "clone", "equals", "finalize", "getClass", "hashCode", "notify", "notifyAll", "toString", "wait"};

    private JavaNames() {}

    /** A scope for method names of a generated class; {@code Object}'s methods are taken. */
    public static Scope memberScope(String... reserved) {
        Scope scope = new Scope(reserved);
        scope.taken.addAll(Set.of(OBJECT_METHODS));
        return scope;
    }

    /**
     * {@code name} as a legal Java identifier: reserved words get a trailing
     * underscore.
     */
    public static String safe(String name) {
        if (!WireNames.isValidIdentifier(name)) {
            throw new IllegalArgumentException("Not an identifier: '" + name + "'");
        }
        return RESERVED.contains(name) ? name + "_" : name;
    }

    public static String capitalize(String name) {
        return name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    public static String decapitalize(String name) {
        return name.isEmpty() ? name : Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    /** Java string literal for {@code value}, quotes included. */
    public static String stringLiteral(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Hands out distinct identifiers within one scope; a taken name gets a
     * numeric suffix ({@code getName}, {@code getName2}, ...).
     */
    public static final class Scope
    {
        private final Set<String> taken = new HashSet<>();

        public Scope(String... reserved) {
            taken.addAll(Set.of(reserved));
        }

        public String claim(String base) {
            String name = safe(base);
            if (taken.add(name)) {
                return name;
            }
            for (int i = 2; ; i++) {
                String candidate = name + i;
                if (taken.add(candidate)) {
                    return candidate;
                }
            }
        }
    }
}
