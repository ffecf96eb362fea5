package com.questrail.busgen.xml;

import com.questrail.busgen.model.AnnotationSpec;
import com.questrail.busgen.model.ArgSpec;
import com.questrail.busgen.model.ChangeNotify;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.IntrospectionNode;
import com.questrail.busgen.model.MethodSpec;
import com.questrail.busgen.model.PropertySpec;
import com.questrail.busgen.model.SignalSpec;

import java.util.List;
import java.util.Optional;

/**
 * IntrospectionWriter
 * =============================================================================
 * Deterministic serialization of the interface model to introspection XML.
 *
 * <h2>Layout</h2>
 * <ul>
 *   <li>two spaces of indentation per nesting level</li>
 *   <li>within an interface: its annotations, then methods, then signals, then
 *       properties, each kind in declaration order</li>
 *   <li>methods and signals are always written with an open and a close tag;
 *       args, properties and annotations are self-closing unless they carry
 *       annotations of their own</li>
 *   <li>documentation is rendered by {@link DocComments} immediately before
 *       the element it documents</li>
 * </ul>
 *
 * <p>The output of {@link #writeInterface} is what a dispatcher answers to
 * {@code Introspect} for that interface, so it must never depend on anything
 * but the {@link InterfaceSpec}.</p>
 */
public final class IntrospectionWriter
{
    public static final String DOCTYPE =
            "<!DOCTYPE node PUBLIC \"-//freedesktop//DTD D-BUS Object Introspection 1.0//EN\"\n"
            + " \"http://www.freedesktop.org/standards/dbus/1.0/introspect.dtd\">\n";

    private static final String INDENT = "  ";

    private IntrospectionWriter() {}

    public static String toXml(InterfaceSpec iface) {
        StringBuilder out = new StringBuilder();
        writeInterface(iface, out, 0);
        return out.toString();
    }

    /**
     * Full introspection document for a node, DOCTYPE header included.
     */
    public static String writeNode(IntrospectionNode node) {
        StringBuilder out = new StringBuilder(DOCTYPE);
        writeNode(node, out, 0);
        return out.toString();
    }

    public static void writeInterface(InterfaceSpec iface, StringBuilder out, int level) {
        String indent = INDENT.repeat(level);
        doc(iface.doc(), indent, out);
        out.append(indent).append("<interface name=\"").append(escape(iface.name())).append("\">\n");
        writeAnnotations(iface.annotations(), out, level + 1);
        for (MethodSpec m : iface.methods()) {
            writeMethod(m, out, level + 1);
        }
        for (SignalSpec s : iface.signals()) {
            writeSignal(s, out, level + 1);
        }
        ChangeNotify inherited = interfaceChangeNotify(iface);
        for (PropertySpec p : iface.properties()) {
            writeProperty(p, inherited, out, level + 1);
        }
        out.append(indent).append("</interface>\n");
    }

    private static void writeNode(IntrospectionNode node, StringBuilder out, int level) {
        String indent = INDENT.repeat(level);
        out.append(indent).append("<node");
        node.name().ifPresent(n -> out.append(" name=\"").append(escape(n)).append('"'));
        if (level > 0 && node.interfaces().isEmpty() && node.children().isEmpty()) {
            out.append("/>\n");
            return;
        }
        out.append(">\n");
        for (InterfaceSpec iface : node.interfaces()) {
            writeInterface(iface, out, level + 1);
        }
        for (IntrospectionNode child : node.children()) {
            writeNode(child, out, level + 1);
        }
        out.append(indent).append("</node>\n");
    }

    private static void writeMethod(MethodSpec m, StringBuilder out, int level) {
        String indent = INDENT.repeat(level);
        doc(m.doc(), indent, out);
        out.append(indent).append("<method name=\"").append(escape(m.wireName())).append("\">\n");
        for (ArgSpec arg : m.inputs()) {
            writeArg(arg, true, out, level + 1);
        }
        for (ArgSpec arg : m.outputs()) {
            writeArg(arg, true, out, level + 1);
        }
        writeAnnotations(m.annotations(), out, level + 1);
        out.append(indent).append("</method>\n");
    }

    private static void writeSignal(SignalSpec s, StringBuilder out, int level) {
        String indent = INDENT.repeat(level);
        doc(s.doc(), indent, out);
        out.append(indent).append("<signal name=\"").append(escape(s.wireName())).append("\">\n");
        for (ArgSpec arg : s.args()) {
            writeArg(arg, false, out, level + 1);
        }
        writeAnnotations(s.annotations(), out, level + 1);
        out.append(indent).append("</signal>\n");
    }

    /** Policy a property without its own annotation gets when the interface is read back. */
    private static ChangeNotify interfaceChangeNotify(InterfaceSpec iface) {
        for (AnnotationSpec a : iface.annotations()) {
            if (ChangeNotify.ANNOTATION.equals(a.name())) {
                try {
                    return ChangeNotify.fromAnnotation(a.value());
                } catch (IllegalArgumentException e) {
                    return ChangeNotify.TRUE;
                }
            }
        }
        return ChangeNotify.TRUE;
    }

    private static void writeProperty(PropertySpec p, ChangeNotify inherited, StringBuilder out, int level) {
        String indent = INDENT.repeat(level);
        doc(p.doc(), indent, out);
        out.append(indent)
                .append("<property name=\"").append(escape(p.wireName()))
                .append("\" type=\"").append(escape(p.type().toText()))
                .append("\" access=\"").append(p.access().wireName()).append('"');
        boolean notify = p.changeNotify() != inherited;
        if (!notify && p.annotations().isEmpty()) {
            out.append("/>\n");
            return;
        }
        out.append(">\n");
        if (notify) {
            writeAnnotation(new AnnotationSpec(ChangeNotify.ANNOTATION, p.changeNotify().annotationValue()),
                    out, level + 1);
        }
        writeAnnotations(p.annotations(), out, level + 1);
        out.append(indent).append("</property>\n");
    }

    private static void writeArg(ArgSpec arg, boolean withDirection, StringBuilder out, int level) {
        String indent = INDENT.repeat(level);
        out.append(indent).append("<arg");
        arg.name().ifPresent(n -> out.append(" name=\"").append(escape(n)).append('"'));
        out.append(" type=\"").append(escape(arg.type().toText())).append('"');
        if (withDirection) {
            out.append(" direction=\"").append(arg.direction().wireName()).append('"');
        }
        if (arg.annotations().isEmpty()) {
            out.append("/>\n");
            return;
        }
        out.append(">\n");
        writeAnnotations(arg.annotations(), out, level + 1);
        out.append(indent).append("</arg>\n");
    }

    private static void writeAnnotations(List<AnnotationSpec> annotations, StringBuilder out, int level) {
        for (AnnotationSpec a : annotations) {
            writeAnnotation(a, out, level);
        }
    }

    private static void writeAnnotation(AnnotationSpec a, StringBuilder out, int level) {
        out.append(INDENT.repeat(level))
                .append("<annotation name=\"").append(escape(a.name()))
                .append("\" value=\"").append(escape(a.value())).append("\"/>\n");
    }

    private static void doc(Optional<String> doc, String indent, StringBuilder out) {
        doc.ifPresent(d -> DocComments.render(d, indent, out));
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
