package com.questrail.busgen.xml;

import com.questrail.busgen.model.ChangeNotify;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.IntrospectionNode;
import com.questrail.busgen.model.MethodSpec;
import com.questrail.busgen.model.PropertyAccess;
import com.questrail.busgen.model.PropertySpec;
import com.questrail.busgen.model.SignalSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IntrospectionWriterTest
 * -----------------------------------------------------------------------------
 * Byte-exact introspection output: element order, indentation, documentation
 * blocks and the open/self-closing choice per element.
 */
final class IntrospectionWriterTest
{
    static final InterfaceSpec TEST_INTERFACE = InterfaceSpec.builder("org.example.busgen.Test")
            .method(MethodSpec.wire("NoArg")
                    .doc("Testing `no_arg` documentation is reflected in XML.")
                    .build())
            .method(MethodSpec.wire("StrU32").in("val", "s").out("u").build())
            .method(MethodSpec.wire("ManyOutput").out("u").out("s").build())
            .method(MethodSpec.wire("PairOutput").out("(us)").build())
            .method(MethodSpec.wire("CheckVEC").out("ay").build())
            .signal(SignalSpec.wire("Signal")
                    .doc("Emit a signal.")
                    .arg("arg", "y")
                    .arg("other", "s")
                    .build())
            .property(PropertySpec.wire("MyCustomProperty", "u").access(PropertyAccess.READWRITE).build())
            .property(PropertySpec.wire("MyProp", "q")
                    .access(PropertyAccess.READWRITE)
                    .doc("Testing my_prop documentation is reflected in XML.\n\nAnd that too.")
                    .build())
            .build();

    static final String EXPECTED_XML =
            "<interface name=\"org.example.busgen.Test\">\n"
            + "  <!--\n"
            + "   Testing `no_arg` documentation is reflected in XML.\n"
            + "   -->\n"
            + "  <method name=\"NoArg\">\n"
            + "  </method>\n"
            + "  <method name=\"StrU32\">\n"
            + "    <arg name=\"val\" type=\"s\" direction=\"in\"/>\n"
            + "    <arg type=\"u\" direction=\"out\"/>\n"
            + "  </method>\n"
            + "  <method name=\"ManyOutput\">\n"
            + "    <arg type=\"u\" direction=\"out\"/>\n"
            + "    <arg type=\"s\" direction=\"out\"/>\n"
            + "  </method>\n"
            + "  <method name=\"PairOutput\">\n"
            + "    <arg type=\"(us)\" direction=\"out\"/>\n"
            + "  </method>\n"
            + "  <method name=\"CheckVEC\">\n"
            + "    <arg type=\"ay\" direction=\"out\"/>\n"
            + "  </method>\n"
            + "  <!--\n"
            + "   Emit a signal.\n"
            + "   -->\n"
            + "  <signal name=\"Signal\">\n"
            + "    <arg name=\"arg\" type=\"y\"/>\n"
            + "    <arg name=\"other\" type=\"s\"/>\n"
            + "  </signal>\n"
            + "  <property name=\"MyCustomProperty\" type=\"u\" access=\"readwrite\"/>\n"
            + "  <!--\n"
            + "   Testing my_prop documentation is reflected in XML.\n"
            + "\n"
            + "   And that too.\n"
            + "   -->\n"
            + "  <property name=\"MyProp\" type=\"q\" access=\"readwrite\"/>\n"
            + "</interface>\n";

    @Test
    void writesInterfaceExactly()
    {
        assertEquals(EXPECTED_XML, IntrospectionWriter.toXml(TEST_INTERFACE));
    }

    @Test
    void propertyWithNonDefaultNotificationCarriesAnnotation()
    {
        InterfaceSpec spec = InterfaceSpec.builder("org.example.P")
                .property(PropertySpec.wire("Version", "s").changeNotify(ChangeNotify.CONST).build())
                .build();

        String expected =
                "<interface name=\"org.example.P\">\n"
                + "  <property name=\"Version\" type=\"s\" access=\"read\">\n"
                + "    <annotation name=\"org.freedesktop.DBus.Property.EmitsChangedSignal\" value=\"const\"/>\n"
                + "  </property>\n"
                + "</interface>\n";
        assertEquals(expected, IntrospectionWriter.toXml(spec));
    }

    @Test
    void memberAnnotationsFollowArguments()
    {
        InterfaceSpec spec = InterfaceSpec.builder("org.example.A")
                .annotation("org.example.Level", "interface")
                .method(MethodSpec.wire("Old")
                        .in("x", "i")
                        .annotation("org.freedesktop.DBus.Deprecated", "true")
                        .build())
                .build();

        String expected =
                "<interface name=\"org.example.A\">\n"
                + "  <annotation name=\"org.example.Level\" value=\"interface\"/>\n"
                + "  <method name=\"Old\">\n"
                + "    <arg name=\"x\" type=\"i\" direction=\"in\"/>\n"
                + "    <annotation name=\"org.freedesktop.DBus.Deprecated\" value=\"true\"/>\n"
                + "  </method>\n"
                + "</interface>\n";
        assertEquals(expected, IntrospectionWriter.toXml(spec));
    }

    @Test
    void nodeDocumentHasDoctypeAndChildren()
    {
        IntrospectionNode node = IntrospectionNode.root(
                List.of(InterfaceSpec.builder("org.example.Empty").build()),
                List.of(IntrospectionNode.child("child")));

        String expected = IntrospectionWriter.DOCTYPE
                + "<node>\n"
                + "  <interface name=\"org.example.Empty\">\n"
                + "  </interface>\n"
                + "  <node name=\"child\"/>\n"
                + "</node>\n";
        assertEquals(expected, IntrospectionWriter.writeNode(node));
    }

    @Test
    void attributeValuesAreEscaped()
    {
        assertEquals("a&lt;b&gt;&amp;&quot;", IntrospectionWriter.escape("a<b>&\""));
    }

    private static InterfaceSpec reparse(InterfaceSpec spec)
    {
        String xml = IntrospectionWriter.writeNode(IntrospectionNode.root(List.of(spec), List.of()));
        return IntrospectionParser.parse(xml).interfaces().get(0);
    }

    @Test
    void propertyNotificationSurvivesInterfaceDefault()
    {
        InterfaceSpec spec = InterfaceSpec.builder("org.example.Quiet")
                .annotation(ChangeNotify.ANNOTATION, "false")
                .property(PropertySpec.wire("Loud", "s").changeNotify(ChangeNotify.TRUE).build())
                .property(PropertySpec.wire("Silent", "s").inheritChangeNotify(ChangeNotify.FALSE).build())
                .build();

        String xml = IntrospectionWriter.toXml(spec);
        assertTrue(xml.contains("  <property name=\"Loud\" type=\"s\" access=\"read\">\n"
                + "    <annotation name=\"org.freedesktop.DBus.Property.EmitsChangedSignal\" value=\"true\"/>\n"), xml);
        assertTrue(xml.contains("  <property name=\"Silent\" type=\"s\" access=\"read\"/>\n"), xml);

        InterfaceSpec once = reparse(spec);
        assertEquals(ChangeNotify.TRUE, once.property("Loud").orElseThrow().changeNotify());
        assertEquals(ChangeNotify.FALSE, once.property("Silent").orElseThrow().changeNotify());
        assertEquals(xml, IntrospectionWriter.toXml(once));
    }

    @Test
    void docWithDoubleHyphenStaysWellFormed()
    {
        InterfaceSpec spec = InterfaceSpec.builder("org.example.Cli")
                .method(MethodSpec.wire("Run").doc("Use --verbose for details -").build())
                .build();

        String xml = IntrospectionWriter.toXml(spec);
        assertFalse(xml.contains("--verbose"));

        InterfaceSpec once = reparse(spec);
        assertEquals("Use - -verbose for details -", once.method("Run").orElseThrow().doc().orElseThrow());
        assertEquals(xml, IntrospectionWriter.toXml(once));
    }
}
