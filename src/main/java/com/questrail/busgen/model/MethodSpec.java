package com.questrail.busgen.model;

import com.questrail.busgen.signature.TypeSignature;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MethodSpec
 * -----------------------------------------------------------------------------
 * A method of an interface: wire name, native name, ordered input and output
 * arguments and optional documentation.
 *
 * <h2>Return value shape</h2>
 * A wire method has exactly one reply body. On the native side a method with
 * no outputs returns nothing, a method with one output returns that value
 * unwrapped, and a method with several outputs returns them wrapped into one
 * struct-typed value: outputs {@code u, s} give the return signature
 * {@code (us)} (see {@link #returnSignature()}). The introspection document
 * still lists one {@code out} argument per output.
 */
public record MethodSpec(
        String wireName,
        String nativeName,
        List<ArgSpec> inputs,
        List<ArgSpec> outputs,
        Optional<String> doc,
        List<AnnotationSpec> annotations
) {
    public MethodSpec {
        Objects.requireNonNull(doc, "doc");
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        annotations = List.copyOf(annotations);
        MemberNames.check(wireName, nativeName);
        for (ArgSpec arg : inputs) {
            if (arg.direction() != Direction.IN) {
                throw ModelValidationException.forMember(wireName, "Input argument declared with direction 'out'");
            }
        }
        for (ArgSpec arg : outputs) {
            if (arg.direction() != Direction.OUT) {
                throw ModelValidationException.forMember(wireName, "Output argument declared with direction 'in'");
            }
        }
    }

    /** Body signature of the method call. */
    public TypeSignature inputSignature() {
        return MemberNames.signatureOf(inputs);
    }

    /** Body signature of the method reply. */
    public TypeSignature outputSignature() {
        return MemberNames.signatureOf(outputs);
    }

    /**
     * Signature of the native return value: empty for no outputs, the single
     * output type, or a struct of all outputs.
     */
    public Optional<TypeSignature> returnSignature() {
        if (outputs.isEmpty()) {
            return Optional.empty();
        }
        TypeSignature out = outputSignature();
        return Optional.of(outputs.size() == 1 ? out : out.asStruct());
    }

    /**
     * Starts a method declared by its native name; the wire name defaults to the
     * PascalCase form unless {@link Builder#rename(String)} is used.
     */
    public static Builder builder(String nativeName) {
        return new Builder(nativeName, null);
    }

    /**
     * Starts a method known by its wire name, as read from introspection data.
     */
    public static Builder wire(String wireName) {
        return new Builder(MemberNames.nativeFor(wireName), wireName);
    }

    public static final class Builder {
        private final String nativeName;
        private String wireName;
        private final List<ArgSpec> inputs = new ArrayList<>();
        private final List<ArgSpec> outputs = new ArrayList<>();
        private final List<AnnotationSpec> annotations = new ArrayList<>();
        private String doc;

        private Builder(String nativeName, String wireName) {
            this.nativeName = nativeName;
            this.wireName = wireName;
        }

        public Builder rename(String wireName) {
            this.wireName = wireName;
            return this;
        }

        public Builder in(String name, String type) {
            inputs.add(ArgSpec.in(name, type));
            return this;
        }

        public Builder out(String type) {
            outputs.add(ArgSpec.out(type));
            return this;
        }

        public Builder out(String name, String type) {
            outputs.add(ArgSpec.out(name, type));
            return this;
        }

        /**
         * Adds an argument; its direction decides whether it is an input or an output.
         */
        public Builder arg(ArgSpec arg) {
            (arg.direction() == Direction.IN ? inputs : outputs).add(arg);
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

        public MethodSpec build() {
            String wire = wireName != null ? wireName : WireNames.toPascalCase(nativeName);
            return new MethodSpec(wire, nativeName, inputs, outputs, Optional.ofNullable(doc), annotations);
        }
    }
}
