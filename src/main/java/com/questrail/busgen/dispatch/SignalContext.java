package com.questrail.busgen.dispatch;

import com.questrail.busgen.bus.BusConnection;
import com.questrail.busgen.value.ObjectPath;

import java.util.Objects;

/**
 * Where emitted signals go: the connection and the object path they are
 * emitted from.
 */
public record SignalContext(BusConnection connection, ObjectPath path)
{
    public SignalContext {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(path, "path");
    }
}
