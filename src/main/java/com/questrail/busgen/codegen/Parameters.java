package com.questrail.busgen.codegen;

import com.questrail.busgen.model.ArgSpec;
import com.questrail.busgen.model.WireNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Java parameter list for a sequence of arguments.
 */
record Parameters(List<String> names, List<String> types)
{
    /**
     * @param reserved names the generated body already uses; arguments avoid them
     */
    static Parameters of(List<ArgSpec> args, Set<String> imports, String... reserved) {
        JavaNames.Scope scope = new JavaNames.Scope(reserved);
        List<String> names = new ArrayList<>();
        List<String> types = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            ArgSpec arg = args.get(i);
            String base = arg.name().map(WireNames::toLowerCamelCase).orElse("");
            names.add(scope.claim(WireNames.isValidIdentifier(base) ? base : "arg" + i));
            types.add(JavaTypeMapper.parameter(arg.type().single(), imports));
        }
        return new Parameters(names, types);
    }

    /** {@code int a, String b} */
    String declaration() {
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            parts.add(types.get(i) + " " + names.get(i));
        }
        return String.join(", ", parts);
    }

    /** {@code , a, b}: the names as trailing call arguments. */
    String trailingArguments() {
        StringBuilder sb = new StringBuilder();
        for (String n : names) {
            sb.append(", ").append(n);
        }
        return sb.toString();
    }
}
