package com.questrail.busgen.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * InterfaceSpec
 * -----------------------------------------------------------------------------
 * Declarative description of one bus interface: its dotted name and the
 * methods, properties and signals it exposes, each in declaration order.
 *
 * <p>Instances are immutable and are built either through {@link #builder(String)}
 * (hand-written descriptions), by
 * {@link com.questrail.busgen.model.annotation.AnnotatedInterfaceReader} from an
 * annotated Java type, or by the introspection parser from an XML document.
 * All three paths produce the same shape and apply the same validation.</p>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code name} is a dot-separated identifier sequence of at least two elements</li>
 *   <li>wire names are unique per member kind</li>
 * </ul>
 */
public record InterfaceSpec(
        String name,
        List<MethodSpec> methods,
        List<PropertySpec> properties,
        List<SignalSpec> signals,
        Optional<String> doc,
        List<AnnotationSpec> annotations
) {
    public InterfaceSpec {
        Objects.requireNonNull(doc, "doc");
        methods = List.copyOf(methods);
        properties = List.copyOf(properties);
        signals = List.copyOf(signals);
        annotations = List.copyOf(annotations);
        if (!WireNames.isValidInterfaceName(name)) {
            throw ModelValidationException.forInterface(name, "Invalid interface name");
        }
        requireUnique(name, "method", methods, MethodSpec::wireName);
        requireUnique(name, "property", properties, PropertySpec::wireName);
        requireUnique(name, "signal", signals, SignalSpec::wireName);
    }

    public Optional<MethodSpec> method(String wireName) {
        return methods.stream().filter(m -> m.wireName().equals(wireName)).findFirst();
    }

    public Optional<PropertySpec> property(String wireName) {
        return properties.stream().filter(p -> p.wireName().equals(wireName)).findFirst();
    }

    public Optional<SignalSpec> signal(String wireName) {
        return signals.stream().filter(s -> s.wireName().equals(wireName)).findFirst();
    }

    /**
     * Last element of the dotted name, e.g. {@code Properties} for
     * {@code org.freedesktop.DBus.Properties}.
     */
    public String simpleName() {
        return name.substring(name.lastIndexOf('.') + 1);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static <T> void requireUnique(String iface, String kind, List<T> members, Function<T, String> wireName) {
        Set<String> seen = new HashSet<>();
        for (T member : members) {
            String n = wireName.apply(member);
            if (!seen.add(n)) {
                throw new ModelValidationException(iface, n, "Duplicate " + kind + " wire name");
            }
        }
    }

    public static final class Builder {
        private final String name;
        private final List<MethodSpec> methods = new ArrayList<>();
        private final List<PropertySpec> properties = new ArrayList<>();
        private final List<SignalSpec> signals = new ArrayList<>();
        private final List<AnnotationSpec> annotations = new ArrayList<>();
        private String doc;

        private Builder(String name) {
            this.name = name;
        }

        public Builder method(MethodSpec method) {
            methods.add(Objects.requireNonNull(method, "method"));
            return this;
        }

        public Builder property(PropertySpec property) {
            properties.add(Objects.requireNonNull(property, "property"));
            return this;
        }

        public Builder signal(SignalSpec signal) {
            signals.add(Objects.requireNonNull(signal, "signal"));
            return this;
        }

        public Builder doc(String doc) {
            this.doc = doc;
            return this;
        }

        public Builder annotation(String name, String value) {
            annotations.add(new AnnotationSpec(name, value));
            return this;
        }

        public InterfaceSpec build() {
            return new InterfaceSpec(name, methods, properties, signals, Optional.ofNullable(doc), annotations);
        }
    }
}
