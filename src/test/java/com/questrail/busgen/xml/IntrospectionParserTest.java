package com.questrail.busgen.xml;

import com.questrail.busgen.model.ChangeNotify;
import com.questrail.busgen.model.Direction;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.IntrospectionNode;
import com.questrail.busgen.model.MethodSpec;
import com.questrail.busgen.model.ModelValidationException;
import com.questrail.busgen.model.PropertyAccess;
import com.questrail.busgen.model.PropertySpec;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IntrospectionParserTest
 * -----------------------------------------------------------------------------
 * Structural parsing of introspection documents, including the lenient mode
 * that keeps valid sibling interfaces when one interface is defective.
 */
final class IntrospectionParserTest
{
    private static String node(String body)
    {
        return IntrospectionWriter.DOCTYPE + "<node>\n" + body + "</node>\n";
    }

    @Test
    void parsesWrittenInterfaceBackToTheSameModel()
    {
        IntrospectionNode parsed = IntrospectionParser.parse(node(IntrospectionWriterTest.EXPECTED_XML));

        assertEquals(1, parsed.interfaces().size());
        InterfaceSpec spec = parsed.interfaces().get(0);
        assertEquals(IntrospectionWriterTest.EXPECTED_XML, IntrospectionWriter.toXml(spec));

        assertEquals("Testing `no_arg` documentation is reflected in XML.",
                spec.method("NoArg").orElseThrow().doc().orElseThrow());
        assertEquals("Testing my_prop documentation is reflected in XML.\n\nAnd that too.",
                spec.property("MyProp").orElseThrow().doc().orElseThrow());
        assertEquals("(us)", spec.method("PairOutput").orElseThrow().outputSignature().toText());
        assertEquals("us", spec.method("ManyOutput").orElseThrow().outputSignature().toText());
    }

    @Test
    void writingTheParsedNodeIsIdempotent()
    {
        String once = IntrospectionWriter.writeNode(IntrospectionParser.parse(node(IntrospectionWriterTest.EXPECTED_XML)));
        String twice = IntrospectionWriter.writeNode(IntrospectionParser.parse(once));
        assertEquals(once, twice);
    }

    @Test
    void argumentWithoutDirectionIsAnInput()
    {
        IntrospectionNode parsed = IntrospectionParser.parse(node(
                "<interface name=\"org.example.I\">"
                + "<method name=\"Take\"><arg name=\"x\" type=\"i\"/></method>"
                + "</interface>"));

        MethodSpec take = parsed.findInterface("org.example.I").orElseThrow().method("Take").orElseThrow();
        assertEquals(Direction.IN, take.inputs().get(0).direction());
        assertTrue(take.outputs().isEmpty());
    }

    @Test
    void unknownElementsAndAttributesAreSkipped()
    {
        IntrospectionNode parsed = IntrospectionParser.parse(node(
                "<interface name=\"org.example.I\" extra=\"1\">"
                + "<vendor:thing xmlns:vendor=\"urn:x\"><method name=\"Hidden\"/></vendor:thing>"
                + "<method name=\"Visible\"><unknown/></method>"
                + "</interface>"));

        InterfaceSpec spec = parsed.interfaces().get(0);
        assertEquals(1, spec.methods().size());
        assertEquals("Visible", spec.methods().get(0).wireName());
    }

    @Test
    void missingRequiredAttributeFailsTheDocument()
    {
        XmlParseException e = assertThrows(XmlParseException.class, () -> IntrospectionParser.parse(node(
                "<interface name=\"org.example.I\"><property name=\"P\" access=\"read\"/></interface>")));
        assertTrue(e.getMessage().contains("'type'"));
        assertTrue(e.line().isPresent());

        assertThrows(XmlParseException.class, () -> IntrospectionParser.parse(node("<interface/>")));
        assertThrows(XmlParseException.class, () -> IntrospectionParser.parse(node(
                "<interface name=\"org.example.I\"><method name=\"M\"><arg name=\"x\"/></method></interface>")));
    }

    @Test
    void invalidAccessOrDirectionFailsTheDocument()
    {
        assertThrows(XmlParseException.class, () -> IntrospectionParser.parse(node(
                "<interface name=\"org.example.I\"><property name=\"P\" type=\"s\" access=\"rw\"/></interface>")));
        assertThrows(XmlParseException.class, () -> IntrospectionParser.parse(node(
                "<interface name=\"org.example.I\"><method name=\"M\"><arg type=\"s\" direction=\"inout\"/></method></interface>")));
    }

    @Test
    void malformedDocumentFails()
    {
        assertThrows(XmlParseException.class, () -> IntrospectionParser.parse("<node><interface name=\"a.b\">"));
        assertThrows(XmlParseException.class, () -> IntrospectionParser.parse("<notanode/>"));
        assertThrows(XmlParseException.class, () -> IntrospectionParser.parse(""));
    }

    @Test
    void modelDefectFailsStrictParse()
    {
        String xml = node(
                "<interface name=\"org.example.Bad\">"
                + "<signal name=\"S\"><arg type=\"s\" direction=\"out\"/></signal>"
                + "</interface>");

        ModelValidationException e = assertThrows(ModelValidationException.class, () -> IntrospectionParser.parse(xml));
        assertEquals("org.example.Bad", e.interfaceName().orElseThrow());
        assertEquals("S", e.member().orElseThrow());
    }

    @Test
    void lenientParseKeepsValidSiblings()
    {
        String xml = node(
                "<interface name=\"org.example.Bad\">"
                + "<method name=\"M\"><arg type=\"a{vs}\" direction=\"in\"/></method>"
                + "<method name=\"After\"/>"
                + "</interface>"
                + "<interface name=\"org.example.Dup\">"
                + "<method name=\"Same\"/><method name=\"Same\"/>"
                + "</interface>"
                + "<interface name=\"org.example.Good\">"
                + "<method name=\"Fine\"/>"
                + "</interface>");

        List<ModelValidationException> rejected = new ArrayList<>();
        IntrospectionNode parsed = IntrospectionParser.parse(
                new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), rejected::add);

        assertEquals(1, parsed.interfaces().size());
        assertEquals("org.example.Good", parsed.interfaces().get(0).name());
        assertEquals(2, rejected.size());
        assertEquals("org.example.Bad", rejected.get(0).interfaceName().orElseThrow());
        assertEquals("org.example.Dup", rejected.get(1).interfaceName().orElseThrow());
    }

    @Test
    void readsAnnotationsAndChangeNotification()
    {
        IntrospectionNode parsed = IntrospectionParser.parse(node(
                "<interface name=\"org.example.I\">"
                + "<annotation name=\"org.freedesktop.DBus.Property.EmitsChangedSignal\" value=\"invalidates\"/>"
                + "<property name=\"A\" type=\"s\" access=\"read\"/>"
                + "<property name=\"B\" type=\"u\" access=\"readwrite\">"
                + "<annotation name=\"org.freedesktop.DBus.Property.EmitsChangedSignal\" value=\"const\"/>"
                + "<annotation name=\"org.example.Unit\" value=\"ms\"/>"
                + "</property>"
                + "</interface>"));

        InterfaceSpec spec = parsed.interfaces().get(0);
        PropertySpec a = spec.property("A").orElseThrow();
        PropertySpec b = spec.property("B").orElseThrow();
        assertEquals(ChangeNotify.INVALIDATES, a.changeNotify());
        assertEquals(ChangeNotify.CONST, b.changeNotify());
        assertEquals(PropertyAccess.READWRITE, b.access());
        assertFalse(b.hasSetter());
        assertEquals("ms", b.annotations().get(0).value());
    }

    @Test
    void readsNestedNodes()
    {
        IntrospectionNode parsed = IntrospectionParser.parse(node(
                "<interface name=\"org.example.Root\"/>"
                + "<node name=\"child\"><interface name=\"org.example.Child\"/><node name=\"leaf\"/></node>"));

        assertEquals(1, parsed.children().size());
        IntrospectionNode child = parsed.children().get(0);
        assertEquals("child", child.name().orElseThrow());
        assertTrue(child.findInterface("org.example.Child").isPresent());
        assertEquals("leaf", child.children().get(0).name().orElseThrow());
    }

    @Test
    void commentSeparatedByOtherContentIsNotDocumentation()
    {
        IntrospectionNode parsed = IntrospectionParser.parse(node(
                "<interface name=\"org.example.I\">"
                + "<!-- belongs to nothing --><annotation name=\"x.y\" value=\"z\"/>"
                + "<method name=\"M\"/>"
                + "</interface>"));

        assertTrue(parsed.interfaces().get(0).method("M").orElseThrow().doc().isEmpty());
    }
}
