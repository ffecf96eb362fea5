package com.questrail.busgen.model;

/**
 * Direction of a method argument as seen from the callee.
 */
public enum Direction
{
    IN("in"),
    OUT("out");

    private final String wireName;

    Direction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @throws IllegalArgumentException for anything other than {@code in} or {@code out}
     */
    public static Direction fromWire(String value) {
        for (Direction d : values()) {
            if (d.wireName.equals(value)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Invalid argument direction: '" + value + "'");
    }
}
