package com.questrail.busgen.model;

import com.questrail.busgen.signature.TypeSignature;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A signal of an interface. All arguments are positional inputs; names are
 * optional.
 */
public record SignalSpec(
        String wireName,
        String nativeName,
        List<ArgSpec> args,
        Optional<String> doc,
        List<AnnotationSpec> annotations
) {
    public SignalSpec {
        Objects.requireNonNull(doc, "doc");
        args = List.copyOf(args);
        annotations = List.copyOf(annotations);
        MemberNames.check(wireName, nativeName);
        for (ArgSpec arg : args) {
            if (arg.direction() != Direction.IN) {
                throw ModelValidationException.forMember(wireName,
                        "Signal argument '" + arg.name().orElse("<unnamed>") + "' declared with direction 'out'");
            }
        }
    }

    public TypeSignature signature() {
        return MemberNames.signatureOf(args);
    }

    public static Builder builder(String nativeName) {
        return new Builder(nativeName, null);
    }

    public static Builder wire(String wireName) {
        return new Builder(MemberNames.nativeFor(wireName), wireName);
    }

    public static final class Builder {
        private final String nativeName;
        private String wireName;
        private final List<ArgSpec> args = new ArrayList<>();
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

        public Builder arg(String name, String type) {
            args.add(ArgSpec.in(name, type));
            return this;
        }

        public Builder arg(String type) {
            args.add(ArgSpec.in(type));
            return this;
        }

        public Builder arg(ArgSpec arg) {
            args.add(arg);
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

        public SignalSpec build() {
            String wire = wireName != null ? wireName : WireNames.toPascalCase(nativeName);
            return new SignalSpec(wire, nativeName, args, Optional.ofNullable(doc), annotations);
        }
    }
}
