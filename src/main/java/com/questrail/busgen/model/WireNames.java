package com.questrail.busgen.model;

/**
 * WireNames
 * -----------------------------------------------------------------------------
 * Naming rules between native identifiers and wire member names.
 *
 * <p>The default wire name of a method, property or signal is the PascalCase
 * form of its native identifier with underscores removed: {@code a_test} and
 * {@code aTest} both become {@code ATest}. An explicit rename always takes
 * precedence and is stored verbatim. The derivation never fails; invalid
 * identifiers are rejected when the model is constructed.</p>
 *
 * <p>The reverse direction, used when a model is read from introspection data,
 * splits a wire name at case boundaries: {@code CheckRENAMING} becomes
 * {@code check_renaming} ({@link #toSnakeCase}) or {@code checkRenaming}
 * ({@link #toLowerCamelCase}).</p>
 */
public final class WireNames
{
    public static final int MAX_NAME_LENGTH = 255;

    private WireNames() {}

    public static String toPascalCase(String nativeName) {
        StringBuilder sb = new StringBuilder(nativeName.length());
        boolean upperNext = true;
        for (int i = 0; i < nativeName.length(); i++) {
            char c = nativeName.charAt(i);
            if (c == '_') {
                upperNext = true;
            } else if (upperNext) {
                sb.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String toSnakeCase(String wireName) {
        StringBuilder sb = new StringBuilder(wireName.length() + 4);
        for (int i = 0; i < wireName.length(); i++) {
            char c = wireName.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && sb.length() > 0 && sb.charAt(sb.length() - 1) != '_') {
                    char prev = wireName.charAt(i - 1);
                    boolean nextLower = i + 1 < wireName.length() && Character.isLowerCase(wireName.charAt(i + 1));
                    if (Character.isLowerCase(prev) || Character.isDigit(prev)
                            || (Character.isUpperCase(prev) && nextLower)) {
                        sb.append('_');
                    }
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String toLowerCamelCase(String wireName) {
        String snake = toSnakeCase(wireName);
        StringBuilder sb = new StringBuilder(snake.length());
        boolean upperNext = false;
        for (int i = 0; i < snake.length(); i++) {
            char c = snake.charAt(i);
            if (c == '_') {
                upperNext = sb.length() > 0;
            } else if (upperNext) {
                sb.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * {@code [A-Za-z_][A-Za-z0-9_]*}; the rule for native identifiers, member
     * names and the elements of an interface name.
     */
    public static boolean isValidIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean letter = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
            boolean digit = c >= '0' && c <= '9';
            if (!(letter || (digit && i > 0))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isValidMemberName(String name) {
        return isValidIdentifier(name) && name.length() <= MAX_NAME_LENGTH;
    }

    /**
     * At least two dot-separated identifier elements, at most
     * {@value #MAX_NAME_LENGTH} characters.
     */
    public static boolean isValidInterfaceName(String name) {
        if (name == null || name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            return false;
        }
        String[] elements = name.split("\\.", -1);
        if (elements.length < 2) {
            return false;
        }
        for (String element : elements) {
            if (!isValidIdentifier(element)) {
                return false;
            }
        }
        return true;
    }
}
