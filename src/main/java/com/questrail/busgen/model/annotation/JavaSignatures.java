package com.questrail.busgen.model.annotation;

import com.questrail.busgen.signature.SignatureType;
import com.questrail.busgen.signature.TypeCode;
import com.questrail.busgen.signature.TypeSignature;
import com.questrail.busgen.value.ObjectPath;
import com.questrail.busgen.value.Variant;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Natural wire type of a Java type, or empty when the type carries no
 * unambiguous wire type (structs, raw collections, unsupported classes).
 */
final class JavaSignatures
{
    private JavaSignatures() {}

    static Optional<SignatureType> infer(Type type) {
        if (type instanceof Class<?> c) {
            return basic(c).map(SignatureType::basic)
                    .or(() -> c == Variant.class ? Optional.of(SignatureType.variant()) : Optional.empty());
        }
        if (type instanceof ParameterizedType p && p.getRawType() instanceof Class<?> raw) {
            Type[] args = p.getActualTypeArguments();
            if (raw == List.class) {
                return infer(args[0]).map(SignatureType::array);
            }
            if (raw == Map.class) {
                Optional<SignatureType> key = infer(args[0]).filter(k -> k.code().isBasic());
                Optional<SignatureType> value = infer(args[1]);
                if (key.isPresent() && value.isPresent()) {
                    return Optional.of(SignatureType.array(SignatureType.dictEntry(key.get(), value.get())));
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<TypeCode> basic(Class<?> c) {
        if (c == byte.class || c == Byte.class) return Optional.of(TypeCode.BYTE);
        if (c == boolean.class || c == Boolean.class) return Optional.of(TypeCode.BOOLEAN);
        if (c == short.class || c == Short.class) return Optional.of(TypeCode.INT16);
        if (c == int.class || c == Integer.class) return Optional.of(TypeCode.INT32);
        if (c == long.class || c == Long.class) return Optional.of(TypeCode.INT64);
        if (c == double.class || c == Double.class) return Optional.of(TypeCode.DOUBLE);
        if (c == String.class) return Optional.of(TypeCode.STRING);
        if (c == ObjectPath.class) return Optional.of(TypeCode.OBJECT_PATH);
        if (c == TypeSignature.class) return Optional.of(TypeCode.SIGNATURE);
        return Optional.empty();
    }
}
