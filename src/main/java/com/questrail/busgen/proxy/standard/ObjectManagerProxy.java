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
 * Proxy for {@code org.freedesktop.DBus.ObjectManager}.
 */
public final class ObjectManagerProxy
{
    private final InterfaceProxy proxy;

    public ObjectManagerProxy(BusConnection connection, String destination, ObjectPath path) {
        this.proxy = InterfaceProxy.builder(connection, StandardInterfaceSpecs.OBJECT_MANAGER)
                .destination(destination)
                .path(path)
                .build();
    }

    public CompletableFuture<Map<ObjectPath, Map<String, Map<String, Variant>>>> getManagedObjects() {
        return proxy.invoke("GetManagedObjects");
    }

    public SignalSubscription receiveInterfacesAdded() {
        return proxy.receiveSignal("InterfacesAdded");
    }

    public SignalSubscription receiveInterfacesRemoved() {
        return proxy.receiveSignal("InterfacesRemoved");
    }
}
