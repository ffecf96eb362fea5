package com.questrail.busgen.model;

import com.questrail.busgen.signature.TypeSignature;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A property of an interface.
 *
 * <p>The {@link ChangeNotify} policy is kept as a field; the
 * {@value ChangeNotify#ANNOTATION} annotation is never part of
 * {@link #annotations()} and is rendered from {@link #changeNotify()} instead.</p>
 */
public record PropertySpec(
        String wireName,
        String nativeName,
        TypeSignature type,
        PropertyAccess access,
        ChangeNotify changeNotify,
        Optional<String> doc,
        List<AnnotationSpec> annotations
) {
    public PropertySpec {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(access, "access");
        Objects.requireNonNull(changeNotify, "changeNotify");
        Objects.requireNonNull(doc, "doc");
        MemberNames.check(wireName, nativeName);
        if (!type.isSingle()) {
            throw ModelValidationException.forMember(wireName,
                    "Property type must be a single complete type, found '" + type + "'");
        }
        annotations = annotations.stream()
                .filter(a -> !ChangeNotify.ANNOTATION.equals(a.name()))
                .toList();
    }

    public boolean isReadable() {
        return access.isReadable();
    }

    public boolean isWritable() {
        return access.isWritable();
    }

    /**
     * A setter binding exists only for writable properties that are not
     * {@link ChangeNotify#CONST}.
     */
    public boolean hasSetter() {
        return access.isWritable() && changeNotify != ChangeNotify.CONST;
    }

    public static Builder builder(String nativeName, String type) {
        return new Builder(nativeName, null, type);
    }

    public static Builder wire(String wireName, String type) {
        return new Builder(MemberNames.nativeFor(wireName), wireName, type);
    }

    public static final class Builder {
        private final String nativeName;
        private String wireName;
        private final TypeSignature type;
        private PropertyAccess access = PropertyAccess.READ;
        private ChangeNotify changeNotify = ChangeNotify.TRUE;
        private boolean changeNotifySet;
        private final List<AnnotationSpec> annotations = new ArrayList<>();
        private String doc;

        private Builder(String nativeName, String wireName, String type) {
            this.nativeName = nativeName;
            this.wireName = wireName;
            this.type = TypeSignature.parseSingle(type);
        }

        public Builder rename(String wireName) {
            this.wireName = wireName;
            return this;
        }

        public Builder access(PropertyAccess access) {
            this.access = access;
            return this;
        }

        public Builder changeNotify(ChangeNotify changeNotify) {
            this.changeNotify = Objects.requireNonNull(changeNotify, "changeNotify");
            this.changeNotifySet = true;
            return this;
        }

        /**
         * Applies an interface-wide policy unless the property declared its own.
         */
        public Builder inheritChangeNotify(ChangeNotify interfaceDefault) {
            if (!changeNotifySet) {
                this.changeNotify = interfaceDefault;
            }
            return this;
        }

        public Builder doc(String doc) {
            this.doc = doc;
            return this;
        }

        /**
         * Adds an annotation; {@value ChangeNotify#ANNOTATION} sets the change
         * notification policy instead of being stored.
         */
        public Builder annotation(String name, String value) {
            if (ChangeNotify.ANNOTATION.equals(name)) {
                changeNotify(ChangeNotify.fromAnnotation(value));
            } else {
                annotations.add(new AnnotationSpec(name, value));
            }
            return this;
        }

        public PropertySpec build() {
            String wire = wireName != null ? wireName : WireNames.toPascalCase(nativeName);
            return new PropertySpec(wire, nativeName, type, access, changeNotify, Optional.ofNullable(doc), annotations);
        }
    }
}
