package com.questrail.busgen.proxy.standard;

import com.questrail.busgen.bus.BusConnection;
import com.questrail.busgen.model.StandardInterfaceSpecs;
import com.questrail.busgen.proxy.InterfaceProxy;
import com.questrail.busgen.value.ObjectPath;

import java.util.concurrent.CompletableFuture;

/**
 * Proxy for {@code org.freedesktop.DBus.Peer}.
 */
public final class PeerProxy
{
    private final InterfaceProxy proxy;

    public PeerProxy(BusConnection connection, String destination, ObjectPath path) {
        this.proxy = InterfaceProxy.builder(connection, StandardInterfaceSpecs.PEER)
                .destination(destination)
                .path(path)
                .build();
    }

    public CompletableFuture<Void> ping() {
        return proxy.invoke("Ping");
    }

    public CompletableFuture<String> getMachineId() {
        return proxy.invoke("GetMachineId");
    }
}
