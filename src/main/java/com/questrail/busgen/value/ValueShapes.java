package com.questrail.busgen.value;

import com.questrail.busgen.signature.SignatureType;
import com.questrail.busgen.signature.TypeCode;
import com.questrail.busgen.signature.TypeSignature;

import java.util.List;
import java.util.Map;

/**
 * ValueShapes
 * -----------------------------------------------------------------------------
 * Mapping between wire types and the Java value shapes used to carry them.
 *
 * <table>
 *   <caption>Native shapes</caption>
 *   <tr><th>Code</th><th>Java class</th></tr>
 *   <tr><td>y</td><td>{@link Byte}</td></tr>
 *   <tr><td>b</td><td>{@link Boolean}</td></tr>
 *   <tr><td>n</td><td>{@link Short}</td></tr>
 *   <tr><td>q</td><td>{@link Integer} (0..65535)</td></tr>
 *   <tr><td>i, h</td><td>{@link Integer}</td></tr>
 *   <tr><td>u</td><td>{@link Long} (0..4294967295)</td></tr>
 *   <tr><td>x, t</td><td>{@link Long} ({@code t} carries the raw 64 bits)</td></tr>
 *   <tr><td>d</td><td>{@link Double}</td></tr>
 *   <tr><td>s</td><td>{@link String}</td></tr>
 *   <tr><td>o</td><td>{@link ObjectPath}</td></tr>
 *   <tr><td>g</td><td>{@link TypeSignature}</td></tr>
 *   <tr><td>v</td><td>{@link Variant}</td></tr>
 *   <tr><td>a{..}</td><td>{@link Map}</td></tr>
 *   <tr><td>a..</td><td>{@link List}</td></tr>
 *   <tr><td>(..)</td><td>{@link Struct}</td></tr>
 * </table>
 */
public final class ValueShapes
{
    private ValueShapes() {}

    /**
     * Hands out a carried value at the type the caller asks for. A wrong
     * guess fails with {@link ClassCastException} where the value is used.
     */
    @SuppressWarnings("unchecked")
    public static <T> T cast(Object value) {
        return (T) value;
    }

    /**
     * Returns the Java class that carries values of {@code type}.
     */
    public static Class<?> javaClass(SignatureType type) {
        if (type instanceof SignatureType.ArrayType array) {
            return array.isDictionary() ? Map.class : List.class;
        }
        return switch (type.code()) {
            case BYTE -> Byte.class;
            case BOOLEAN -> Boolean.class;
            case INT16 -> Short.class;
            case UINT16, INT32, UNIX_FD -> Integer.class;
            case UINT32, INT64, UINT64 -> Long.class;
            case DOUBLE -> Double.class;
            case STRING -> String.class;
            case OBJECT_PATH -> ObjectPath.class;
            case SIGNATURE -> TypeSignature.class;
            case VARIANT -> Variant.class;
            case STRUCT -> Struct.class;
            case ARRAY, DICT_ENTRY -> throw new IllegalArgumentException("No standalone value shape for " + type.toText());
        };
    }

    /**
     * Checks that {@code value} is a well-formed native value of {@code type},
     * including unsigned ranges, struct arity and nested element types.
     */
    public static boolean conforms(SignatureType type, Object value) {
        if (value == null) {
            return false;
        }
        if (type instanceof SignatureType.ArrayType array) {
            return conformsArray(array, value);
        }
        if (type instanceof SignatureType.StructType struct) {
            if (!(value instanceof Struct s) || s.size() != struct.fields().size()) {
                return false;
            }
            for (int i = 0; i < s.size(); i++) {
                if (!conforms(struct.fields().get(i), s.fields().get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (!javaClass(type).isInstance(value)) {
            return false;
        }
        return switch (type.code()) {
            case UINT16 -> inRange(((Integer) value).longValue(), 0, 0xFFFF);
            case UINT32 -> inRange((Long) value, 0, 0xFFFF_FFFFL);
            case STRING -> ((String) value).indexOf('\0') < 0;
            default -> true;
        };
    }

    /**
     * Checks a whole message body against a body signature.
     */
    public static boolean conforms(TypeSignature signature, List<?> values) {
        if (values.size() != signature.size()) {
            return false;
        }
        for (int i = 0; i < values.size(); i++) {
            if (!conforms(signature.types().get(i), values.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Infers the wire signature of a scalar, string-like or variant value.
     * Containers are ambiguous (an empty list has no element type) and must be
     * given an explicit signature.
     *
     * @throws IllegalArgumentException if no signature can be inferred
     */
    public static TypeSignature inferSignature(Object value) {
        TypeCode code;
        if (value instanceof Byte) code = TypeCode.BYTE;
        else if (value instanceof Boolean) code = TypeCode.BOOLEAN;
        else if (value instanceof Short) code = TypeCode.INT16;
        else if (value instanceof Integer) code = TypeCode.INT32;
        else if (value instanceof Long) code = TypeCode.INT64;
        else if (value instanceof Double) code = TypeCode.DOUBLE;
        else if (value instanceof String) code = TypeCode.STRING;
        else if (value instanceof ObjectPath) code = TypeCode.OBJECT_PATH;
        else if (value instanceof TypeSignature) code = TypeCode.SIGNATURE;
        else if (value instanceof Variant) return TypeSignature.of(SignatureType.variant());
        else {
            throw new IllegalArgumentException("Cannot infer a signature for "
                    + (value == null ? "null" : value.getClass().getName()));
        }
        return TypeSignature.of(SignatureType.basic(code));
    }

    private static boolean conformsArray(SignatureType.ArrayType array, Object value) {
        if (array.isDictionary()) {
            if (!(value instanceof Map<?, ?> map)) {
                return false;
            }
            SignatureType.DictEntryType entry = (SignatureType.DictEntryType) array.element();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!conforms(entry.key(), e.getKey()) || !conforms(entry.value(), e.getValue())) {
                    return false;
                }
            }
            return true;
        }
        if (!(value instanceof List<?> list)) {
            return false;
        }
        for (Object element : list) {
            if (!conforms(array.element(), element)) {
                return false;
            }
        }
        return true;
    }

    private static boolean inRange(long v, long min, long max) {
        return v >= min && v <= max;
    }
}
