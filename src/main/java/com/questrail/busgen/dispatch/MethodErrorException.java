package com.questrail.busgen.dispatch;

import java.util.Objects;

/**
 * Thrown by a handler (or by the dispatcher itself) to answer a call with a
 * named D-Bus error instead of a method return.
 */
public final class MethodErrorException extends RuntimeException
{
    public static final String FAILED = "org.freedesktop.DBus.Error.Failed";
    public static final String UNKNOWN_METHOD = "org.freedesktop.DBus.Error.UnknownMethod";
    public static final String UNKNOWN_OBJECT = "org.freedesktop.DBus.Error.UnknownObject";
    public static final String UNKNOWN_INTERFACE = "org.freedesktop.DBus.Error.UnknownInterface";
    public static final String UNKNOWN_PROPERTY = "org.freedesktop.DBus.Error.UnknownProperty";
    public static final String PROPERTY_READ_ONLY = "org.freedesktop.DBus.Error.PropertyReadOnly";
    public static final String INVALID_ARGS = "org.freedesktop.DBus.Error.InvalidArgs";

    private final String errorName;

    public MethodErrorException(String errorName, String message) {
        super(message);
        this.errorName = Objects.requireNonNull(errorName, "errorName");
    }

    public MethodErrorException(String errorName, String message, Throwable cause) {
        super(message, cause);
        this.errorName = Objects.requireNonNull(errorName, "errorName");
    }

    public String errorName() {
        return errorName;
    }
}
