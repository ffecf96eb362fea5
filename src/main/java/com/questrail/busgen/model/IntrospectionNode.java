package com.questrail.busgen.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One level of an introspection document: the interfaces implemented at an
 * object path and its child nodes. The root node of a document usually has
 * no name; child nodes are named by their path element relative to the parent.
 * Each level owns its children exclusively.
 */
public record IntrospectionNode(
        Optional<String> name,
        List<InterfaceSpec> interfaces,
        List<IntrospectionNode> children
) {
    public IntrospectionNode {
        Objects.requireNonNull(name, "name");
        interfaces = List.copyOf(interfaces);
        children = List.copyOf(children);
    }

    public static IntrospectionNode root(List<InterfaceSpec> interfaces, List<IntrospectionNode> children) {
        return new IntrospectionNode(Optional.empty(), interfaces, children);
    }

    public static IntrospectionNode child(String name) {
        return new IntrospectionNode(Optional.of(name), List.of(), List.of());
    }

    public Optional<InterfaceSpec> findInterface(String interfaceName) {
        return interfaces.stream().filter(i -> i.name().equals(interfaceName)).findFirst();
    }
}
