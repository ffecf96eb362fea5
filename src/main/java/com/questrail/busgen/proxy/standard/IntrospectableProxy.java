package com.questrail.busgen.proxy.standard;

import com.questrail.busgen.bus.BusConnection;
import com.questrail.busgen.model.IntrospectionNode;
import com.questrail.busgen.model.StandardInterfaceSpecs;
import com.questrail.busgen.proxy.InterfaceProxy;
import com.questrail.busgen.value.ObjectPath;
import com.questrail.busgen.xml.IntrospectionParser;

import java.util.concurrent.CompletableFuture;

/**
 * Proxy for {@code org.freedesktop.DBus.Introspectable}.
 */
public final class IntrospectableProxy
{
    private final InterfaceProxy proxy;

    public IntrospectableProxy(BusConnection connection, String destination, ObjectPath path) {
        this.proxy = InterfaceProxy.builder(connection, StandardInterfaceSpecs.INTROSPECTABLE)
                .destination(destination)
                .path(path)
                .build();
    }

    public CompletableFuture<String> introspect() {
        return proxy.invoke("Introspect");
    }

    /** The introspection document, parsed. */
    public CompletableFuture<IntrospectionNode> introspectNode() {
        return introspect().thenApply(IntrospectionParser::parse);
    }
}
