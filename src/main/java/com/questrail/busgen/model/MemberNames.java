package com.questrail.busgen.model;

import com.questrail.busgen.signature.TypeSignature;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared member validation for methods, properties and signals.
 */
final class MemberNames
{
    private MemberNames() {}

    static void check(String wireName, String nativeName) {
        if (nativeName == null || !WireNames.isValidIdentifier(nativeName)) {
            throw ModelValidationException.forMember(String.valueOf(nativeName),
                    "Invalid native identifier '" + nativeName + "'");
        }
        if (wireName == null || !WireNames.isValidMemberName(wireName)) {
            throw ModelValidationException.forMember(nativeName,
                    "Invalid wire member name '" + wireName + "'");
        }
    }

    /**
     * Native name for a member read by its wire name; falls back to the wire
     * name when the case split leaves nothing (e.g. {@code _}).
     */
    static String nativeFor(String wireName) {
        String camel = WireNames.toLowerCamelCase(wireName);
        return camel.isEmpty() ? wireName : camel;
    }

    static TypeSignature signatureOf(List<ArgSpec> args) {
        List<TypeSignature> parts = new ArrayList<>(args.size());
        for (ArgSpec arg : args) {
            parts.add(arg.type());
        }
        return TypeSignature.concat(parts);
    }
}
