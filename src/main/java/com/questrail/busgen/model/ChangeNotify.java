package com.questrail.busgen.model;

/**
 * ChangeNotify
 * -----------------------------------------------------------------------------
 * Change-notification policy of a property, carried on the wire by the
 * {@value #ANNOTATION} annotation.
 *
 * <ul>
 *   <li>{@link #TRUE}: a setter emits {@code PropertiesChanged} with the new value</li>
 *   <li>{@link #INVALIDATES}: a setter emits {@code PropertiesChanged} listing the
 *       property as invalidated, without its value</li>
 *   <li>{@link #CONST}: the value never changes after construction; no setter exists</li>
 *   <li>{@link #FALSE}: the value may change but no signal is emitted</li>
 * </ul>
 *
 * <p>This is a protocol-visible contract: remote caches rely on it.</p>
 */
public enum ChangeNotify
{
    TRUE("true"),
    INVALIDATES("invalidates"),
    CONST("const"),
    FALSE("false");

    public static final String ANNOTATION = "org.freedesktop.DBus.Property.EmitsChangedSignal";

    private final String annotationValue;

    ChangeNotify(String annotationValue) {
        this.annotationValue = annotationValue;
    }

    public String annotationValue() {
        return annotationValue;
    }

    /**
     * @throws IllegalArgumentException for an unknown annotation value
     */
    public static ChangeNotify fromAnnotation(String value) {
        for (ChangeNotify c : values()) {
            if (c.annotationValue.equals(value)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Invalid " + ANNOTATION + " value: '" + value + "'");
    }
}
