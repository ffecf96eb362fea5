package com.questrail.busgen.model;

import com.questrail.busgen.signature.TypeSignature;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A method or signal argument: optional name, direction and a single
 * complete wire type.
 */
public record ArgSpec(
        Optional<String> name,
        Direction direction,
        TypeSignature type,
        List<AnnotationSpec> annotations
) {
    public ArgSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(type, "type");
        annotations = List.copyOf(annotations);
        if (!type.isSingle()) {
            throw ModelValidationException.forMember(name.orElse("<unnamed>"),
                    "Argument type must be a single complete type, found '" + type + "'");
        }
        if (name.isPresent() && name.get().isEmpty()) {
            throw ModelValidationException.forMember("<unnamed>", "Argument name must not be empty");
        }
    }

    public static ArgSpec in(String name, String type) {
        return new ArgSpec(Optional.ofNullable(name), Direction.IN, TypeSignature.parseSingle(type), List.of());
    }

    public static ArgSpec in(String type) {
        return in(null, type);
    }

    public static ArgSpec out(String name, String type) {
        return new ArgSpec(Optional.ofNullable(name), Direction.OUT, TypeSignature.parseSingle(type), List.of());
    }

    public static ArgSpec out(String type) {
        return out(null, type);
    }

    public ArgSpec withAnnotations(List<AnnotationSpec> annotations) {
        return new ArgSpec(name, direction, type, annotations);
    }
}
