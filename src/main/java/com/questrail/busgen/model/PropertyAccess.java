package com.questrail.busgen.model;

/**
 * Access mode of a property, as carried by the {@code access} attribute.
 */
public enum PropertyAccess
{
    READ("read"),
    WRITE("write"),
    READWRITE("readwrite");

    private final String wireName;

    PropertyAccess(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isReadable() {
        return this != WRITE;
    }

    public boolean isWritable() {
        return this != READ;
    }

    public static PropertyAccess of(boolean readable, boolean writable) {
        if (readable && writable) return READWRITE;
        if (writable) return WRITE;
        return READ;
    }

    /**
     * @throws IllegalArgumentException for an unknown access value
     */
    public static PropertyAccess fromWire(String value) {
        for (PropertyAccess a : values()) {
            if (a.wireName.equals(value)) {
                return a;
            }
        }
        throw new IllegalArgumentException("Invalid property access: '" + value + "'");
    }
}
