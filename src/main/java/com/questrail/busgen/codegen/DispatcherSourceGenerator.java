package com.questrail.busgen.codegen;

import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.MethodSpec;
import com.questrail.busgen.model.PropertySpec;
import com.questrail.busgen.model.SignalSpec;
import com.questrail.busgen.model.WireNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.questrail.busgen.codegen.JavaNames.capitalize;
import static com.questrail.busgen.codegen.JavaNames.stringLiteral;

/**
 * Emits the abstract server-side skeleton of one interface.
 *
 * <p>Implementors override one method per wire method and one accessor per
 * property binding; {@code dispatcher()} wires them into an
 * {@link com.questrail.busgen.dispatch.InterfaceDispatcher} built from the
 * proxy's {@code SPEC}. Signals get {@code emitX(context, ...)} helpers.</p>
 */
public final class DispatcherSourceGenerator
{
    private DispatcherSourceGenerator() {}

    public static String className(InterfaceSpec spec) {
        return JavaNames.safe(spec.simpleName()) + "Dispatcher";
    }

    public static void generate(InterfaceSpec spec, String className, String proxyClassName,
                                SourceWriter out, Set<String> imports) {
        imports.add("com.questrail.busgen.dispatch.InterfaceDispatcher");

        out.javadoc("Server skeleton for {@code " + spec.name() + "}.");
        out.open("public abstract static class " + className);
        out.line("private InterfaceDispatcher dispatcher;");

        JavaNames.Scope names = JavaNames.memberScope("dispatcher");
        List<String> routes = new ArrayList<>();
        boolean unchecked = false;

        for (MethodSpec m : spec.methods()) {
            Parameters params = Parameters.of(m.inputs(), imports);
            String returnType = m.outputs().isEmpty() ? "void"
                    : m.outputs().size() == 1 ? JavaTypeMapper.parameter(m.outputs().get(0).type().single(), imports)
                    : JavaTypeMapper.returnType(m.outputSignature(), imports);
            String name = names.claim(m.nativeName());
            out.blank();
            m.doc().ifPresent(out::javadoc);
            out.line("protected abstract " + returnType + " " + name + "(" + params.declaration() + ") throws Exception;");

            List<String> callArgs = new ArrayList<>();
            for (int i = 0; i < params.names().size(); i++) {
                String boxed = JavaTypeMapper.boxed(m.inputs().get(i).type().single(), imports);
                unchecked |= boxed.contains("<");
                callArgs.add("call.<" + boxed + ">arg(" + i + ")");
            }
            String invocation = name + "(" + String.join(", ", callArgs) + ")";
            routes.add(".method(" + stringLiteral(m.wireName()) + ", call -> "
                    + (m.outputs().isEmpty() ? "{ " + invocation + "; return null; })" : invocation + ")"));
        }

        for (PropertySpec p : spec.properties()) {
            imports.add("com.questrail.busgen.dispatch.PropertyHandler");
            String pascal = capitalize(p.nativeName());
            String type = JavaTypeMapper.parameter(p.type().single(), imports);
            String getter = null;
            String setter = null;
            if (p.isReadable()) {
                getter = names.claim("get" + pascal);
                out.blank();
                p.doc().ifPresent(out::javadoc);
                out.line("protected abstract " + type + " " + getter + "();");
            }
            if (p.hasSetter()) {
                setter = names.claim("set" + pascal);
                out.blank();
                out.line("protected abstract void " + setter + "(" + type + " value);");
            }
            if (getter == null && setter == null) {
                continue;
            }
            String boxed = JavaTypeMapper.boxed(p.type().single(), imports);
            String assign = setter == null ? null : "value -> " + setter + "((" + boxed + ") value)";
            unchecked |= setter != null && boxed.contains("<");
            String handler;
            if (setter == null) {
                handler = "PropertyHandler.readOnly(this::" + getter + ")";
            } else if (getter == null) {
                handler = "PropertyHandler.writeOnly(" + assign + ")";
            } else {
                handler = "PropertyHandler.readWrite(this::" + getter + ", " + assign + ")";
            }
            routes.add(".property(" + stringLiteral(p.wireName()) + ", " + handler + ")");
        }

        for (SignalSpec s : spec.signals()) {
            imports.add("com.questrail.busgen.dispatch.SignalContext");
            imports.add("java.util.concurrent.CompletableFuture");
            Parameters params = Parameters.of(s.args(), imports, "context");
            String declaration = params.names().isEmpty()
                    ? "SignalContext context"
                    : "SignalContext context, " + params.declaration();
            out.blank();
            s.doc().ifPresent(out::javadoc);
            out.open("public CompletableFuture<Void> "
                    + names.claim("emit" + capitalize(WireNames.toLowerCamelCase(s.wireName())))
                    + "(" + declaration + ")");
            out.line("return dispatcher().emitSignal(context, " + stringLiteral(s.wireName())
                    + params.trailingArguments() + ");");
            out.close();
        }

        out.blank();
        if (unchecked) {
            out.line("@SuppressWarnings(\"unchecked\")");
        }
        out.open("public synchronized InterfaceDispatcher dispatcher()");
        out.open("if (dispatcher == null)");
        out.line("dispatcher = InterfaceDispatcher.builder(" + proxyClassName + ".SPEC)");
        out.indent().indent();
        for (String route : routes) {
            out.line(route);
        }
        out.line(".build();");
        out.outdent().outdent();
        out.close();
        out.line("return dispatcher;");
        out.close();
        out.close();
    }
}
