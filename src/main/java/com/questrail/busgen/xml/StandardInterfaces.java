package com.questrail.busgen.xml;

import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.StandardInterfaceSpecs;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Separates the platform's well-known interfaces from the interfaces that
 * need generated bindings. Well-known interfaces are those whose name starts
 * with a reserved prefix ({@value StandardInterfaceSpecs#PREFIX} by default);
 * pre-existing proxies in {@value #STANDARD_PROXY_PACKAGE} cover them.
 */
public final class StandardInterfaces
{
    public static final String STANDARD_PROXY_PACKAGE = "com.questrail.busgen.proxy.standard";

    private StandardInterfaces() {}

    public record Partition(List<InterfaceSpec> standard, List<InterfaceSpec> needed) {
        public Partition {
            standard = List.copyOf(standard);
            needed = List.copyOf(needed);
        }
    }

    public static Partition partition(List<InterfaceSpec> interfaces, String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        List<InterfaceSpec> standard = new ArrayList<>();
        List<InterfaceSpec> needed = new ArrayList<>();
        for (InterfaceSpec iface : interfaces) {
            (iface.name().startsWith(prefix) ? standard : needed).add(iface);
        }
        return new Partition(standard, needed);
    }

    public static Partition partition(List<InterfaceSpec> interfaces) {
        return partition(interfaces, StandardInterfaceSpecs.PREFIX);
    }

    /**
     * Fully qualified name of the pre-existing proxy class for a well-known
     * interface, e.g. {@code ...proxy.standard.PropertiesProxy}.
     */
    public static String proxyClassName(InterfaceSpec iface) {
        return STANDARD_PROXY_PACKAGE + "." + iface.simpleName() + "Proxy";
    }
}
