package com.questrail.busgen.value;

import java.util.Objects;

/**
 * Strongly typed D-Bus object path (wire code {@code o}).
 *
 * <p>A valid path starts with {@code /}, consists of {@code /}-separated
 * elements of {@code [A-Za-z0-9_]} characters, has no empty elements and no
 * trailing slash except for the root path {@code /} itself.</p>
 */
public final class ObjectPath
{
    public static final ObjectPath ROOT = new ObjectPath("/");

    private final String value;

    private ObjectPath(String value) {
        this.value = value;
    }

    /**
     * Creates an object path.
     *
     * @throws IllegalArgumentException if {@code value} is not a valid object path
     */
    public static ObjectPath of(String value) {
        Objects.requireNonNull(value, "value");
        if (!isValid(value)) {
            throw new IllegalArgumentException("Invalid object path: '" + value + "'");
        }
        return "/".equals(value) ? ROOT : new ObjectPath(value);
    }

    public static boolean isValid(String value) {
        if (value == null || value.isEmpty() || value.charAt(0) != '/') {
            return false;
        }
        if (value.length() == 1) {
            return true;
        }
        if (value.charAt(value.length() - 1) == '/') {
            return false;
        }
        boolean previousSlash = true;
        for (int i = 1; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '/') {
                if (previousSlash) {
                    return false;
                }
                previousSlash = true;
            } else if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_') {
                previousSlash = false;
            } else {
                return false;
            }
        }
        return true;
    }

    public String value() {
        return value;
    }

    public boolean isRoot() {
        return this == ROOT;
    }

    /**
     * Returns {@code true} if this path lies strictly below {@code ancestor}.
     */
    public boolean isDescendantOf(ObjectPath ancestor) {
        if (ancestor.isRoot()) {
            return !isRoot();
        }
        return value.startsWith(ancestor.value + "/");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectPath that)) return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
