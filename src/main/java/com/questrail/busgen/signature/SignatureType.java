package com.questrail.busgen.signature;

import java.util.List;
import java.util.Objects;

/**
 * SignatureType
 * -----------------------------------------------------------------------------
 * One complete type of a wire signature.
 *
 * <p>Instances are produced only by {@link SignatureParser} or by the factory
 * methods on this interface; all of them are immutable and compare by
 * structure. {@link #toText()} renders the exact text the parser accepted.</p>
 */
public sealed interface SignatureType
        permits SignatureType.BasicType,
                SignatureType.VariantType,
                SignatureType.ArrayType,
                SignatureType.StructType,
                SignatureType.DictEntryType
{
    TypeCode code();

    void appendTo(StringBuilder out);

    default String toText() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }

    static SignatureType basic(TypeCode code) {
        return new BasicType(code);
    }

    static SignatureType variant() {
        return VariantType.INSTANCE;
    }

    static SignatureType array(SignatureType element) {
        return new ArrayType(element);
    }

    static SignatureType struct(List<SignatureType> fields) {
        return new StructType(fields);
    }

    static SignatureType dictEntry(SignatureType key, SignatureType value) {
        return new DictEntryType(key, value);
    }

    /** A scalar or string-like type. */
    record BasicType(TypeCode code) implements SignatureType {
        public BasicType {
            Objects.requireNonNull(code, "code");
            if (!code.isBasic()) {
                throw new IllegalArgumentException("Not a basic type code: " + code);
            }
        }

        @Override
        public void appendTo(StringBuilder out) {
            out.append(code.code());
        }
    }

    /** A variant; its inner type travels with each value. */
    record VariantType() implements SignatureType {
        static final VariantType INSTANCE = new VariantType();

        @Override
        public TypeCode code() {
            return TypeCode.VARIANT;
        }

        @Override
        public void appendTo(StringBuilder out) {
            out.append('v');
        }
    }

    /** An array; an array of dict entries is a dictionary. */
    record ArrayType(SignatureType element) implements SignatureType {
        public ArrayType {
            Objects.requireNonNull(element, "element");
        }

        @Override
        public TypeCode code() {
            return TypeCode.ARRAY;
        }

        public boolean isDictionary() {
            return element instanceof DictEntryType;
        }

        @Override
        public void appendTo(StringBuilder out) {
            out.append('a');
            element.appendTo(out);
        }
    }

    /** A struct of one or more fields. */
    record StructType(List<SignatureType> fields) implements SignatureType {
        public StructType {
            fields = List.copyOf(fields);
            if (fields.isEmpty()) {
                throw new IllegalArgumentException("Struct must have at least one field");
            }
        }

        @Override
        public TypeCode code() {
            return TypeCode.STRUCT;
        }

        @Override
        public void appendTo(StringBuilder out) {
            out.append('(');
            for (SignatureType field : fields) {
                field.appendTo(out);
            }
            out.append(')');
        }
    }

    /** A key/value pair; only valid as the element of an array. */
    record DictEntryType(SignatureType key, SignatureType value) implements SignatureType {
        public DictEntryType {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            if (!(key instanceof BasicType)) {
                throw new IllegalArgumentException("Dict entry key must be a basic type: " + key.toText());
            }
        }

        @Override
        public TypeCode code() {
            return TypeCode.DICT_ENTRY;
        }

        @Override
        public void appendTo(StringBuilder out) {
            out.append('{');
            key.appendTo(out);
            value.appendTo(out);
            out.append('}');
        }
    }
}
