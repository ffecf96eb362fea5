package com.questrail.busgen.codegen;

import com.questrail.busgen.config.GeneratorConfig;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.MethodSpec;
import com.questrail.busgen.model.PropertySpec;
import com.questrail.busgen.model.SignalSpec;
import com.questrail.busgen.model.WireNames;

import java.util.Set;

import static com.questrail.busgen.codegen.JavaNames.capitalize;
import static com.questrail.busgen.codegen.JavaNames.stringLiteral;

/**
 * ProxySourceGenerator
 * =============================================================================
 * Emits the client proxy class for one interface as a static nested class.
 *
 * <h2>Generated members</h2>
 * <ul>
 *   <li>{@code SPEC}: the interface description, rebuilt with the model builders</li>
 *   <li>{@code DEFAULT_SERVICE} / {@code DEFAULT_PATH} and a one-argument
 *       constructor when the configuration names a live service and path</li>
 *   <li>per method: a call returning {@code CompletableFuture} of the native
 *       return value ({@code Void}, the single output, or {@code Struct})</li>
 *   <li>per readable property: {@code getX()}; per property with a setter
 *       binding: {@code setX(value)}. Constant and read-only properties get no
 *       setter.</li>
 *   <li>per signal: {@code receiveX()} returning a {@code SignalSubscription}</li>
 * </ul>
 */
public final class ProxySourceGenerator
{
    private ProxySourceGenerator() {}

    public static String className(InterfaceSpec spec) {
        return JavaNames.safe(spec.simpleName()) + "Proxy";
    }

    public static void generate(InterfaceSpec spec, String className, GeneratorConfig config,
                                SourceWriter out, Set<String> imports) {
        imports.add("com.questrail.busgen.bus.BusConnection");
        imports.add("com.questrail.busgen.proxy.InterfaceProxy");
        imports.add("com.questrail.busgen.value.ObjectPath");
        imports.add("java.util.Objects");

        spec.doc().ifPresentOrElse(out::javadoc, () -> out.javadoc("Proxy for {@code " + spec.name() + "}."));
        out.open("public static final class " + className);

        SpecLiteral.write(spec, "SPEC", out, imports);
        boolean defaults = config.defaultService().isPresent() && config.defaultPath().isPresent();
        if (defaults) {
            out.blank();
            out.line("public static final String DEFAULT_SERVICE = " + stringLiteral(config.defaultService().get()) + ";");
            out.line("public static final String DEFAULT_PATH = " + stringLiteral(config.defaultPath().get()) + ";");
        }
        out.blank();
        out.line("private final InterfaceProxy proxy;");
        out.blank();

        if (defaults) {
            out.open("public " + className + "(BusConnection connection)");
            out.line("this(connection, DEFAULT_SERVICE, ObjectPath.of(DEFAULT_PATH));");
            out.close();
            out.blank();
        }
        out.open("public " + className + "(BusConnection connection, String destination, ObjectPath path)");
        out.line("this(InterfaceProxy.builder(connection, SPEC).destination(destination).path(path).build());");
        out.close();
        out.blank();
        out.open("public " + className + "(InterfaceProxy proxy)");
        out.line("this.proxy = Objects.requireNonNull(proxy, \"proxy\");");
        out.close();
        out.blank();
        out.open("public InterfaceProxy proxy()");
        out.line("return proxy;");
        out.close();

        JavaNames.Scope names = JavaNames.memberScope("proxy");
        for (MethodSpec m : spec.methods()) {
            writeMethod(m, names, out, imports);
        }
        for (PropertySpec p : spec.properties()) {
            writeProperty(p, names, out, imports);
        }
        for (SignalSpec s : spec.signals()) {
            writeSignal(s, names, out, imports);
        }
        out.close();
    }

    private static void writeMethod(MethodSpec m, JavaNames.Scope names, SourceWriter out, Set<String> imports) {
        imports.add("java.util.concurrent.CompletableFuture");
        Parameters params = Parameters.of(m.inputs(), imports, "proxy");
        String returnType = JavaTypeMapper.returnType(m.outputSignature(), imports);
        out.blank();
        m.doc().ifPresent(out::javadoc);
        out.open("public CompletableFuture<" + returnType + "> " + names.claim(m.nativeName())
                + "(" + params.declaration() + ")");
        out.line("return proxy.invoke(" + stringLiteral(m.wireName()) + params.trailingArguments() + ");");
        out.close();
    }

    private static void writeProperty(PropertySpec p, JavaNames.Scope names, SourceWriter out, Set<String> imports) {
        imports.add("java.util.concurrent.CompletableFuture");
        String pascal = capitalize(p.nativeName());
        if (p.isReadable()) {
            out.blank();
            p.doc().ifPresent(out::javadoc);
            out.open("public CompletableFuture<" + JavaTypeMapper.boxed(p.type().single(), imports) + "> "
                    + names.claim("get" + pascal) + "()");
            out.line("return proxy.getProperty(" + stringLiteral(p.wireName()) + ");");
            out.close();
        }
        if (p.hasSetter()) {
            out.blank();
            String type = JavaTypeMapper.parameter(p.type().single(), imports);
            out.open("public CompletableFuture<Void> " + names.claim("set" + pascal) + "(" + type + " value)");
            out.line("return proxy.setProperty(" + stringLiteral(p.wireName()) + ", value);");
            out.close();
        }
    }

    private static void writeSignal(SignalSpec s, JavaNames.Scope names, SourceWriter out, Set<String> imports) {
        imports.add("com.questrail.busgen.signal.SignalSubscription");
        out.blank();
        StringBuilder doc = new StringBuilder();
        s.doc().ifPresent(d -> doc.append(d).append("\n\n"));
        doc.append("Arguments: ");
        if (s.args().isEmpty()) {
            doc.append("none.");
        } else {
            for (int i = 0; i < s.args().size(); i++) {
                if (i > 0) {
                    doc.append(", ");
                }
                doc.append("{@code ").append(s.args().get(i).name().orElse("arg" + i))
                        .append(": ").append(s.args().get(i).type()).append('}');
            }
            doc.append('.');
        }
        out.javadoc(doc.toString());
        out.open("public SignalSubscription " + names.claim("receive" + capitalize(WireNames.toLowerCamelCase(s.wireName())))
                + "()");
        out.line("return proxy.receiveSignal(" + stringLiteral(s.wireName()) + ");");
        out.close();
    }
}
