package com.questrail.busgen.xml;

import com.questrail.busgen.model.AnnotationSpec;
import com.questrail.busgen.model.ArgSpec;
import com.questrail.busgen.model.ChangeNotify;
import com.questrail.busgen.model.Direction;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.IntrospectionNode;
import com.questrail.busgen.model.MethodSpec;
import com.questrail.busgen.model.ModelValidationException;
import com.questrail.busgen.model.PropertyAccess;
import com.questrail.busgen.model.PropertySpec;
import com.questrail.busgen.model.SignalSpec;
import com.questrail.busgen.signature.SignatureException;
import com.questrail.busgen.signature.TypeSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * IntrospectionParser
 * =============================================================================
 * Structural parser of introspection XML into an {@link IntrospectionNode}
 * tree.
 *
 * <h2>Recognized structure</h2>
 * {@code node}, {@code interface}, {@code method}, {@code signal},
 * {@code property}, {@code arg} and {@code annotation} elements. Unknown
 * elements (with their content) and unknown attributes are skipped. An XML
 * comment immediately preceding an element becomes that element's
 * documentation.
 *
 * <h2>Required attributes</h2>
 * {@code interface@name}, {@code method@name}, {@code signal@name},
 * {@code property@name}, {@code property@type}, {@code property@access},
 * {@code arg@type}, {@code annotation@name} and {@code annotation@value}.
 * A missing one is an {@link XmlParseException}, as is a malformed document.
 * A method argument without {@code direction} is an input.
 *
 * <h2>Model defects</h2>
 * A well-formed document can still describe an invalid interface (duplicate
 * member names, malformed type signatures, signal arguments with direction
 * {@code out}). {@link #parse(InputStream)} fails with a
 * {@link ModelValidationException}; {@link #parse(InputStream, Consumer)} reports
 * the defect, drops that interface and keeps its siblings.
 *
 * <p>DTD processing and external entities are disabled.</p>
 */
public final class IntrospectionParser
{
    private static final Logger log = LoggerFactory.getLogger(IntrospectionParser.class);

    private final XMLStreamReader reader;
    private final Consumer<ModelValidationException> rejected;
    private String pendingDoc;
    private ModelValidationException defect;

    private IntrospectionParser(XMLStreamReader reader, Consumer<ModelValidationException> rejected) {
        this.reader = reader;
        this.rejected = rejected;
    }

    public static IntrospectionNode parse(String xml) {
        return parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    public static IntrospectionNode parse(InputStream in) {
        return parse(in, e -> {
            throw e;
        });
    }

    /**
     * Parses a document, handing each interface that fails model validation to
     * {@code rejected} instead of failing the document.
     */
    public static IntrospectionNode parse(InputStream in, Consumer<ModelValidationException> rejected) {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(rejected, "rejected");
        XMLStreamReader reader;
        try {
            reader = factory().createXMLStreamReader(in);
        } catch (XMLStreamException e) {
            throw new XmlParseException("Cannot read introspection document: " + e.getMessage(), e);
        }
        try {
            return new IntrospectionParser(reader, rejected).document();
        } catch (XMLStreamException e) {
            Location loc = e.getLocation();
            throw new XmlParseException("Malformed introspection document: " + e.getMessage(),
                    loc != null ? loc.getLineNumber() : -1, loc != null ? loc.getColumnNumber() : -1);
        } finally {
            try {
                reader.close();
            } catch (XMLStreamException e) {
                log.debug("Failed to close XML reader", e);
            }
        }
    }

    private static XMLInputFactory factory() {
        XMLInputFactory f = XMLInputFactory.newFactory();
        f.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        f.setProperty(XMLInputFactory.IS_COALESCING, true);
        return f;
    }

    private IntrospectionNode document() throws XMLStreamException {
        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                if (!"node".equals(reader.getLocalName())) {
                    throw error("Root element must be <node>, found <" + reader.getLocalName() + ">");
                }
                return node();
            }
        }
        throw error("Document has no <node> element");
    }

    /** Reader positioned on a {@code node} start tag; returns after its end tag. */
    private IntrospectionNode node() throws XMLStreamException {
        Optional<String> name = optionalAttribute("name");
        List<InterfaceSpec> interfaces = new ArrayList<>();
        List<IntrospectionNode> children = new ArrayList<>();
        pendingDoc = null;
        while (true) {
            int event = nextChild();
            if (event == XMLStreamConstants.END_ELEMENT) {
                return new IntrospectionNode(name, interfaces, children);
            }
            switch (reader.getLocalName()) {
                case "interface" -> interfaceElement().ifPresent(interfaces::add);
                case "node" -> children.add(node());
                default -> skipElement();
            }
        }
    }

    private Optional<InterfaceSpec> interfaceElement() throws XMLStreamException {
        String name = requiredAttribute("interface", "name");
        InterfaceSpec.Builder b = InterfaceSpec.builder(name);
        String doc = takeDoc();
        if (doc != null) {
            b.doc(doc);
        }
        List<PropertySpec.Builder> properties = new ArrayList<>();
        ChangeNotify inherited = null;
        defect = null;
        while (true) {
            int event = nextChild();
            if (event == XMLStreamConstants.END_ELEMENT) {
                break;
            }
            // member builders validate after the member's end tag has been read
            try {
                switch (reader.getLocalName()) {
                    case "method" -> b.method(method());
                    case "signal" -> b.signal(signal());
                    case "property" -> property().ifPresent(properties::add);
                    case "annotation" -> {
                        AnnotationSpec a = annotation();
                        b.annotation(a.name(), a.value());
                        if (ChangeNotify.ANNOTATION.equals(a.name())) {
                            inherited = changeNotify(a.value());
                        }
                    }
                    default -> skipElement();
                }
            } catch (ModelValidationException e) {
                recordDefect(e);
            }
        }
        try {
            if (defect != null) {
                throw defect;
            }
            for (PropertySpec.Builder p : properties) {
                if (inherited != null) {
                    p.inheritChangeNotify(inherited);
                }
                b.property(p.build());
            }
            return Optional.of(b.build());
        } catch (ModelValidationException e) {
            rejected.accept(e.interfaceName().isPresent() ? e : e.withInterface(name));
            return Optional.empty();
        } finally {
            defect = null;
        }
    }

    private MethodSpec method() throws XMLStreamException {
        String name = requiredAttribute("method", "name");
        MethodSpec.Builder b = MethodSpec.wire(name);
        String doc = takeDoc();
        if (doc != null) {
            b.doc(doc);
        }
        memberChildren(name, true, b::arg, a -> b.annotation(a.name(), a.value()));
        return b.build();
    }

    private SignalSpec signal() throws XMLStreamException {
        String name = requiredAttribute("signal", "name");
        SignalSpec.Builder b = SignalSpec.wire(name);
        String doc = takeDoc();
        if (doc != null) {
            b.doc(doc);
        }
        memberChildren(name, false, b::arg, a -> b.annotation(a.name(), a.value()));
        return b.build();
    }

    private Optional<PropertySpec.Builder> property() throws XMLStreamException {
        String name = requiredAttribute("property", "name");
        String type = requiredAttribute("property", "type");
        String access = requiredAttribute("property", "access");
        PropertyAccess parsedAccess;
        try {
            parsedAccess = PropertyAccess.fromWire(access);
        } catch (IllegalArgumentException e) {
            throw error("Invalid access '" + access + "' on property '" + name + "'");
        }
        String doc = takeDoc();
        ChangeNotify notify = null;
        List<AnnotationSpec> annotations = new ArrayList<>();
        while (true) {
            int event = nextChild();
            if (event == XMLStreamConstants.END_ELEMENT) {
                break;
            }
            if ("annotation".equals(reader.getLocalName())) {
                AnnotationSpec a = annotation();
                if (ChangeNotify.ANNOTATION.equals(a.name())) {
                    notify = changeNotify(a.value());
                } else {
                    annotations.add(a);
                }
            } else {
                skipElement();
            }
        }
        Optional<TypeSignature> parsedType = signature(name, type);
        if (parsedType.isEmpty()) {
            return Optional.empty();
        }
        PropertySpec.Builder b = PropertySpec.wire(name, parsedType.get().toText()).access(parsedAccess);
        if (doc != null) {
            b.doc(doc);
        }
        if (notify != null) {
            b.changeNotify(notify);
        }
        annotations.forEach(a -> b.annotation(a.name(), a.value()));
        return Optional.of(b);
    }

    private void memberChildren(String member, boolean method, Consumer<ArgSpec> args,
                                Consumer<AnnotationSpec> annotations) throws XMLStreamException {
        while (true) {
            int event = nextChild();
            if (event == XMLStreamConstants.END_ELEMENT) {
                return;
            }
            switch (reader.getLocalName()) {
                case "arg" -> arg(member, method).ifPresent(args);
                case "annotation" -> annotations.accept(annotation());
                default -> skipElement();
            }
        }
    }

    /** Empty when the argument is defective; the defect is recorded. */
    private Optional<ArgSpec> arg(String member, boolean method) throws XMLStreamException {
        Optional<String> name = optionalAttribute("name");
        String typeText = requiredAttribute("arg", "type");
        Optional<String> directionText = optionalAttribute("direction");
        Direction direction = Direction.IN;
        if (directionText.isPresent()) {
            try {
                direction = Direction.fromWire(directionText.get());
            } catch (IllegalArgumentException e) {
                throw error("Invalid direction '" + directionText.get() + "' on argument of '" + member + "'");
            }
        }
        List<AnnotationSpec> annotations = new ArrayList<>();
        while (true) {
            int event = nextChild();
            if (event == XMLStreamConstants.END_ELEMENT) {
                break;
            }
            if ("annotation".equals(reader.getLocalName())) {
                annotations.add(annotation());
            } else {
                skipElement();
            }
        }
        if (!method && direction == Direction.OUT) {
            recordDefect(ModelValidationException.forMember(member,
                    "Signal argument '" + name.orElse("<unnamed>") + "' declared with direction 'out'"));
            return Optional.empty();
        }
        Optional<TypeSignature> type = signature(member, typeText);
        if (type.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ArgSpec(name, direction, type.get(), annotations));
        } catch (ModelValidationException e) {
            recordDefect(new ModelValidationException(null, member, e.reason()));
            return Optional.empty();
        }
    }

    private AnnotationSpec annotation() throws XMLStreamException {
        AnnotationSpec a = new AnnotationSpec(requiredAttribute("annotation", "name"),
                requiredAttribute("annotation", "value"));
        skipElement();
        return a;
    }

    private ChangeNotify changeNotify(String value) {
        try {
            return ChangeNotify.fromAnnotation(value);
        } catch (IllegalArgumentException e) {
            throw error(e.getMessage());
        }
    }

    private Optional<TypeSignature> signature(String member, String text) {
        try {
            return Optional.of(TypeSignature.parseSingle(text));
        } catch (SignatureException e) {
            recordDefect(new ModelValidationException(null, member, e.getMessage()));
            return Optional.empty();
        }
    }

    private void recordDefect(ModelValidationException e) {
        if (defect == null) {
            defect = e;
        }
    }

    /**
     * Advances to the next child start tag or to the end tag of the current
     * element, collecting comments as pending documentation.
     */
    private int nextChild() throws XMLStreamException {
        while (true) {
            int event = reader.next();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT:
                    return event;
                case XMLStreamConstants.END_ELEMENT:
                    pendingDoc = null;
                    return event;
                case XMLStreamConstants.COMMENT:
                    pendingDoc = DocComments.fromComment(reader.getText()).orElse(null);
                    break;
                case XMLStreamConstants.CHARACTERS:
                case XMLStreamConstants.CDATA:
                    if (!reader.isWhiteSpace()) {
                        pendingDoc = null;
                    }
                    break;
                case XMLStreamConstants.END_DOCUMENT:
                    throw error("Unexpected end of document");
                default:
                    break;
            }
        }
    }

    private String takeDoc() {
        String doc = pendingDoc;
        pendingDoc = null;
        return doc;
    }

    /** Reader positioned on a start tag; returns after the matching end tag. */
    private void skipElement() throws XMLStreamException {
        int depth = 1;
        while (depth > 0) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                depth++;
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                depth--;
            }
        }
        pendingDoc = null;
    }

    private String requiredAttribute(String element, String attribute) {
        return optionalAttribute(attribute)
                .orElseThrow(() -> error("Missing required attribute '" + attribute + "' on <" + element + ">"));
    }

    private Optional<String> optionalAttribute(String attribute) {
        return Optional.ofNullable(reader.getAttributeValue(null, attribute));
    }

    private XmlParseException error(String message) {
        Location loc = reader.getLocation();
        return new XmlParseException(message, loc.getLineNumber(), loc.getColumnNumber());
    }
}
