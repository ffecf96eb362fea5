package com.questrail.busgen.model;

import java.util.List;

/**
 * The well-known interfaces every bus object may implement. The descriptions
 * match the freedesktop D-Bus specification and back the pre-existing standard
 * proxies as well as the built-in handling in
 * {@link com.questrail.busgen.dispatch.ObjectServer}.
 */
public final class StandardInterfaceSpecs
{
    public static final String PREFIX = "org.freedesktop.DBus";

    public static final InterfaceSpec PEER = InterfaceSpec.builder("org.freedesktop.DBus.Peer")
            .method(MethodSpec.wire("Ping").build())
            .method(MethodSpec.wire("GetMachineId").out("machine_uuid", "s").build())
            .build();

    public static final InterfaceSpec INTROSPECTABLE = InterfaceSpec.builder("org.freedesktop.DBus.Introspectable")
            .method(MethodSpec.wire("Introspect").out("xml_data", "s").build())
            .build();

    public static final InterfaceSpec PROPERTIES = InterfaceSpec.builder("org.freedesktop.DBus.Properties")
            .method(MethodSpec.wire("Get")
                    .in("interface_name", "s")
                    .in("property_name", "s")
                    .out("value", "v")
                    .build())
            .method(MethodSpec.wire("Set")
                    .in("interface_name", "s")
                    .in("property_name", "s")
                    .in("value", "v")
                    .build())
            .method(MethodSpec.wire("GetAll")
                    .in("interface_name", "s")
                    .out("props", "a{sv}")
                    .build())
            .signal(SignalSpec.wire("PropertiesChanged")
                    .arg("interface_name", "s")
                    .arg("changed_properties", "a{sv}")
                    .arg("invalidated_properties", "as")
                    .build())
            .build();

    public static final InterfaceSpec OBJECT_MANAGER = InterfaceSpec.builder("org.freedesktop.DBus.ObjectManager")
            .method(MethodSpec.wire("GetManagedObjects")
                    .out("object_paths_interfaces_and_properties", "a{oa{sa{sv}}}")
                    .build())
            .signal(SignalSpec.wire("InterfacesAdded")
                    .arg("object_path", "o")
                    .arg("interfaces_and_properties", "a{sa{sv}}")
                    .build())
            .signal(SignalSpec.wire("InterfacesRemoved")
                    .arg("object_path", "o")
                    .arg("interfaces", "as")
                    .build())
            .build();

    public static final List<InterfaceSpec> ALL = List.of(PEER, INTROSPECTABLE, PROPERTIES, OBJECT_MANAGER);

    private StandardInterfaceSpecs() {
    }
}
