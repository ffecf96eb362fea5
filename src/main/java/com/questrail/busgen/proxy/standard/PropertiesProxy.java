package com.questrail.busgen.proxy.standard;

import com.questrail.busgen.bus.BusConnection;
import com.questrail.busgen.model.StandardInterfaceSpecs;
import com.questrail.busgen.proxy.InterfaceProxy;
import com.questrail.busgen.signal.SignalSubscription;
import com.questrail.busgen.value.ObjectPath;
import com.questrail.busgen.value.Variant;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Proxy for {@code org.freedesktop.DBus.Properties}, untyped: values travel as
 * {@link Variant}s. Typed access to one interface's properties goes through
 * {@link InterfaceProxy#getProperty(String)}.
 */
public final class PropertiesProxy
{
    private final InterfaceProxy proxy;

    public PropertiesProxy(BusConnection connection, String destination, ObjectPath path) {
        this.proxy = InterfaceProxy.builder(connection, StandardInterfaceSpecs.PROPERTIES)
                .destination(destination)
                .path(path)
                .build();
    }

    public CompletableFuture<Variant> get(String interfaceName, String propertyName) {
        return proxy.invoke("Get", interfaceName, propertyName);
    }

    public CompletableFuture<Void> set(String interfaceName, String propertyName, Variant value) {
        return proxy.invoke("Set", interfaceName, propertyName, value);
    }

    public CompletableFuture<Map<String, Variant>> getAll(String interfaceName) {
        return proxy.invoke("GetAll", interfaceName);
    }

    /**
     * {@code PropertiesChanged(interface_name, changed_properties, invalidated_properties)}.
     */
    public SignalSubscription receivePropertiesChanged() {
        return proxy.receiveSignal("PropertiesChanged");
    }
}
