package com.questrail.busgen.codegen;

import com.questrail.busgen.model.AnnotationSpec;
import com.questrail.busgen.model.ArgSpec;
import com.questrail.busgen.model.ChangeNotify;
import com.questrail.busgen.model.Direction;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.MethodSpec;
import com.questrail.busgen.model.PropertyAccess;
import com.questrail.busgen.model.PropertySpec;
import com.questrail.busgen.model.SignalSpec;

import java.util.List;
import java.util.Set;

import static com.questrail.busgen.codegen.JavaNames.stringLiteral;

/**
 * Writes the Java expression that rebuilds an {@link InterfaceSpec} through
 * its builders, so generated code carries the exact description it was
 * generated from.
 */
final class SpecLiteral
{
    private static final String MODEL = "com.questrail.busgen.model.";

    private SpecLiteral() {}

    static void write(InterfaceSpec spec, String constant, SourceWriter out, Set<String> imports) {
        imports.add(MODEL + "InterfaceSpec");
        out.line("public static final InterfaceSpec " + constant + " = InterfaceSpec.builder("
                + stringLiteral(spec.name()) + ")");
        out.indent().indent();
        spec.doc().ifPresent(d -> out.line(".doc(" + stringLiteral(d) + ")"));
        for (AnnotationSpec a : spec.annotations()) {
            out.line(annotation(a));
        }
        for (MethodSpec m : spec.methods()) {
            imports.add(MODEL + "MethodSpec");
            out.line(".method(MethodSpec.wire(" + stringLiteral(m.wireName()) + ")");
            out.indent().indent();
            m.doc().ifPresent(d -> out.line(".doc(" + stringLiteral(d) + ")"));
            for (ArgSpec arg : m.inputs()) {
                out.line(".arg(" + arg(arg, imports) + ")");
            }
            for (ArgSpec arg : m.outputs()) {
                out.line(".arg(" + arg(arg, imports) + ")");
            }
            for (AnnotationSpec a : m.annotations()) {
                out.line(annotation(a));
            }
            out.line(".build())");
            out.outdent().outdent();
        }
        for (SignalSpec s : spec.signals()) {
            imports.add(MODEL + "SignalSpec");
            out.line(".signal(SignalSpec.wire(" + stringLiteral(s.wireName()) + ")");
            out.indent().indent();
            s.doc().ifPresent(d -> out.line(".doc(" + stringLiteral(d) + ")"));
            for (ArgSpec arg : s.args()) {
                out.line(".arg(" + arg(arg, imports) + ")");
            }
            for (AnnotationSpec a : s.annotations()) {
                out.line(annotation(a));
            }
            out.line(".build())");
            out.outdent().outdent();
        }
        for (PropertySpec p : spec.properties()) {
            imports.add(MODEL + "PropertySpec");
            out.line(".property(PropertySpec.wire(" + stringLiteral(p.wireName()) + ", "
                    + stringLiteral(p.type().toText()) + ")");
            out.indent().indent();
            if (p.access() != PropertyAccess.READ) {
                imports.add(MODEL + "PropertyAccess");
                out.line(".access(PropertyAccess." + p.access().name() + ")");
            }
            if (p.changeNotify() != ChangeNotify.TRUE) {
                imports.add(MODEL + "ChangeNotify");
                out.line(".changeNotify(ChangeNotify." + p.changeNotify().name() + ")");
            }
            p.doc().ifPresent(d -> out.line(".doc(" + stringLiteral(d) + ")"));
            for (AnnotationSpec a : p.annotations()) {
                out.line(annotation(a));
            }
            out.line(".build())");
            out.outdent().outdent();
        }
        out.line(".build();");
        out.outdent().outdent();
    }

    private static String arg(ArgSpec arg, Set<String> imports) {
        imports.add(MODEL + "ArgSpec");
        String factory = arg.direction() == Direction.IN ? "ArgSpec.in(" : "ArgSpec.out(";
        String expr = factory
                + arg.name().map(n -> stringLiteral(n) + ", ").orElse("")
                + stringLiteral(arg.type().toText()) + ")";
        if (arg.annotations().isEmpty()) {
            return expr;
        }
        imports.add(MODEL + "AnnotationSpec");
        imports.add("java.util.List");
        StringBuilder sb = new StringBuilder(expr).append(".withAnnotations(List.of(");
        List<AnnotationSpec> annotations = arg.annotations();
        for (int i = 0; i < annotations.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            AnnotationSpec a = annotations.get(i);
            sb.append("new AnnotationSpec(").append(stringLiteral(a.name())).append(", ")
                    .append(stringLiteral(a.value())).append(')');
        }
        return sb.append("))").toString();
    }

    private static String annotation(AnnotationSpec a) {
        return ".annotation(" + stringLiteral(a.name()) + ", " + stringLiteral(a.value()) + ")";
    }
}
