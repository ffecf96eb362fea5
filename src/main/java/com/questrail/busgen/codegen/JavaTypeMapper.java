package com.questrail.busgen.codegen;

import com.questrail.busgen.signature.SignatureType;
import com.questrail.busgen.signature.TypeSignature;

import java.util.Set;

/**
 * Java source type of a wire type, following
 * {@link com.questrail.busgen.value.ValueShapes#javaClass}: unsigned types use
 * the next wider signed type, arrays are {@code List}s, dictionaries are
 * {@code Map}s and structs are {@code Struct}s. Every referenced class is added
 * to the caller's import set.
 */
public final class JavaTypeMapper
{
    private static final String VALUE = "com.questrail.busgen.value.";

    private JavaTypeMapper() {}

    /** Reference type, usable as a type argument. */
    public static String boxed(SignatureType type, Set<String> imports) {
        if (type instanceof SignatureType.BasicType b) {
            return switch (b.code()) {
                case BYTE -> "Byte";
                case BOOLEAN -> "Boolean";
                case INT16 -> "Short";
                case UINT16, INT32, UNIX_FD -> "Integer";
                case UINT32, INT64, UINT64 -> "Long";
                case DOUBLE -> "Double";
                case STRING -> "String";
                case OBJECT_PATH -> use(imports, VALUE + "ObjectPath");
                case SIGNATURE -> use(imports, "com.questrail.busgen.signature.TypeSignature");
                default -> throw new IllegalStateException("Not a basic type: " + b);
            };
        }
        if (type instanceof SignatureType.VariantType) {
            return use(imports, VALUE + "Variant");
        }
        if (type instanceof SignatureType.StructType) {
            return use(imports, VALUE + "Struct");
        }
        if (type instanceof SignatureType.ArrayType a) {
            if (a.element() instanceof SignatureType.DictEntryType e) {
                return use(imports, "java.util.Map") + "<" + boxed(e.key(), imports) + ", "
                        + boxed(e.value(), imports) + ">";
            }
            return use(imports, "java.util.List") + "<" + boxed(a.element(), imports) + ">";
        }
        throw new IllegalStateException("Dict entry outside an array: " + type.toText());
    }

    /** Parameter type: primitives for scalars, otherwise {@link #boxed}. */
    public static String parameter(SignatureType type, Set<String> imports) {
        if (type instanceof SignatureType.BasicType b) {
            switch (b.code()) {
                case BYTE: return "byte";
                case BOOLEAN: return "boolean";
                case INT16: return "short";
                case UINT16: case INT32: case UNIX_FD: return "int";
                case UINT32: case INT64: case UINT64: return "long";
                case DOUBLE: return "double";
                default: break;
            }
        }
        return boxed(type, imports);
    }

    /**
     * Native return type of a method with the given outputs: {@code Void},
     * the single output, or {@code Struct}.
     */
    public static String returnType(TypeSignature outputs, Set<String> imports) {
        if (outputs.isEmpty()) {
            return "Void";
        }
        if (outputs.size() == 1) {
            return boxed(outputs.single(), imports);
        }
        return use(imports, VALUE + "Struct");
    }

    private static String use(Set<String> imports, String qualified) {
        imports.add(qualified);
        return qualified.substring(qualified.lastIndexOf('.') + 1);
    }
}
