package com.questrail.busgen.dispatch;

import com.questrail.busgen.bus.Message;
import com.questrail.busgen.model.ChangeNotify;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.MethodSpec;
import com.questrail.busgen.model.PropertySpec;
import com.questrail.busgen.model.SignalSpec;
import com.questrail.busgen.model.StandardInterfaceSpecs;
import com.questrail.busgen.observability.BusObservabilitySink;
import com.questrail.busgen.observability.DispatchErrorEvent;
import com.questrail.busgen.observability.NullObservabilitySink;
import com.questrail.busgen.observability.PropertyChangedEvent;
import com.questrail.busgen.signature.TypeSignature;
import com.questrail.busgen.value.Struct;
import com.questrail.busgen.value.ValueShapes;
import com.questrail.busgen.value.Variant;
import com.questrail.busgen.xml.IntrospectionWriter;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * InterfaceDispatcher
 * =============================================================================
 * Server side of one interface: routes inbound calls to handlers, answers
 * property access, produces the interface's introspection text and emits its
 * signals.
 *
 * <h2>Routing</h2>
 * The routing table maps wire method names to handlers. It is built once, in
 * declaration order, and every declared method must have a handler. A call
 * whose body does not match the method's input signature is answered with
 * {@value MethodErrorException#INVALID_ARGS} without reaching the handler.
 *
 * <h2>Property change notification</h2>
 * {@link #setProperty} stores the value through the setter and then, per the
 * property's {@link ChangeNotify} policy, emits
 * {@code org.freedesktop.DBus.Properties.PropertiesChanged}:
 * <ul>
 *   <li>{@code TRUE}: with the new value under {@code changed_properties}</li>
 *   <li>{@code INVALIDATES}: with the name under {@code invalidated_properties}</li>
 *   <li>{@code FALSE}: nothing</li>
 * </ul>
 * {@code CONST} properties have no setter binding and cannot be set.
 *
 * <h2>Introspection</h2>
 * {@link #introspect()} is exactly what {@link IntrospectionWriter} produces for
 * the same {@link InterfaceSpec}.
 */
public final class InterfaceDispatcher
{
    private static final TypeSignature PROPERTIES_CHANGED = StandardInterfaceSpecs.PROPERTIES
            .signal("PropertiesChanged").orElseThrow().signature();

    private final InterfaceSpec spec;
    private final Map<String, MethodHandler> routes;
    private final Map<String, PropertyHandler> properties;
    private final BusObservabilitySink sink;

    private InterfaceDispatcher(Builder b) {
        this.spec = b.spec;
        this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(b.routes));
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(b.properties));
        this.sink = b.sink;
    }

    public static Builder builder(InterfaceSpec spec) {
        return new Builder(spec);
    }

    public InterfaceSpec spec() {
        return spec;
    }

    public String interfaceName() {
        return spec.name();
    }

    /** Wire method names in routing order. */
    public List<String> routes() {
        return List.copyOf(routes.keySet());
    }

    public String introspect() {
        return IntrospectionWriter.toXml(spec);
    }

    /**
     * Answers a method call addressed to this interface. Never throws: every
     * failure becomes an error reply, reported to the observability sink.
     *
     * @return the method return or error reply for {@code call}
     */
    public Message dispatch(Message call, SignalContext context) {
        String member = call.member().orElse("");
        MethodSpec method = spec.method(member).orElse(null);
        if (method == null) {
            return error(call, context, MethodErrorException.UNKNOWN_METHOD,
                    "Unknown method '" + member + "' on interface " + spec.name(), null);
        }
        TypeSignature in = method.inputSignature();
        if (!call.signature().equals(in)) {
            return error(call, context, MethodErrorException.INVALID_ARGS,
                    "Method " + member + " expects '" + in + "', got '" + call.signature() + "'", null);
        }
        Object result;
        try {
            result = routes.get(method.wireName()).handle(new MethodCall(method, call.body(), call, context));
        } catch (MethodErrorException e) {
            return error(call, context, e.errorName(), String.valueOf(e.getMessage()), e.getCause());
        } catch (Exception e) {
            return error(call, context, MethodErrorException.FAILED,
                    "Handler of " + spec.name() + "." + member + " failed: " + e.getMessage(), e);
        }
        List<Object> body = replyBody(method, result);
        TypeSignature out = method.outputSignature();
        if (!ValueShapes.conforms(out, body)) {
            return error(call, context, MethodErrorException.FAILED,
                    "Handler of " + spec.name() + "." + member + " returned a value not matching '" + out + "'", null);
        }
        return Message.methodReturn(call, out, body);
    }

    private Message error(Message call, SignalContext context, String errorName, String message, Throwable cause) {
        sink.onDispatchError(new DispatchErrorEvent(Instant.now(), context.path().value(), spec.name(),
                call.member().orElse(""), errorName, message, cause));
        return Message.error(call, errorName, message);
    }

    private static List<Object> replyBody(MethodSpec method, Object result) {
        return switch (method.outputs().size()) {
            case 0 -> List.of();
            case 1 -> Collections.singletonList(result);
            default -> result instanceof Struct s ? s.fields() : Collections.singletonList(result);
        };
    }

    /**
     * @throws MethodErrorException {@value MethodErrorException#UNKNOWN_PROPERTY},
     *         {@value MethodErrorException#INVALID_ARGS} for a write-only property, or
     *         {@value MethodErrorException#FAILED} when the getter fails
     */
    public Variant getProperty(String wireName) {
        PropertySpec p = property(wireName);
        if (!p.isReadable()) {
            throw new MethodErrorException(MethodErrorException.INVALID_ARGS,
                    "Property " + spec.name() + "." + wireName + " is not readable");
        }
        Object value;
        try {
            value = properties.get(p.wireName()).getter().orElseThrow().get();
        } catch (MethodErrorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MethodErrorException(MethodErrorException.FAILED,
                    "Getter of " + spec.name() + "." + wireName + " failed: " + e.getMessage(), e);
        }
        if (!ValueShapes.conforms(p.type().single(), value)) {
            throw new MethodErrorException(MethodErrorException.FAILED,
                    "Getter of " + spec.name() + "." + wireName + " returned a value not matching '" + p.type() + "'");
        }
        return new Variant(p.type(), value);
    }

    /** All readable properties, in declaration order. */
    public Map<String, Variant> getAllProperties() {
        Map<String, Variant> all = new LinkedHashMap<>();
        for (PropertySpec p : spec.properties()) {
            if (p.isReadable()) {
                all.put(p.wireName(), getProperty(p.wireName()));
            }
        }
        return all;
    }

    /**
     * Stores a new value and emits the change notification its policy asks for.
     *
     * @return completes when the notification (if any) has been sent
     * @throws MethodErrorException for an unknown property, a property without
     *         setter, or a value not matching the property type
     */
    public CompletableFuture<Void> setProperty(SignalContext context, String wireName, Object value) {
        PropertySpec p = property(wireName);
        if (!p.hasSetter()) {
            throw new MethodErrorException(MethodErrorException.PROPERTY_READ_ONLY,
                    "Property " + spec.name() + "." + wireName + " is read-only");
        }
        if (!ValueShapes.conforms(p.type().single(), value)) {
            throw new MethodErrorException(MethodErrorException.INVALID_ARGS,
                    "Value for " + spec.name() + "." + wireName + " does not match '" + p.type() + "'");
        }
        try {
            properties.get(p.wireName()).setter().orElseThrow().accept(value);
        } catch (MethodErrorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MethodErrorException(MethodErrorException.FAILED,
                    "Setter of " + spec.name() + "." + wireName + " failed: " + e.getMessage(), e);
        }
        sink.onPropertyChanged(new PropertyChangedEvent(Instant.now(), context.path().value(),
                spec.name(), p.wireName(), p.changeNotify()));

        return switch (p.changeNotify()) {
            case TRUE -> propertiesChanged(context, Map.of(p.wireName(), new Variant(p.type(), value)), List.of());
            case INVALIDATES -> propertiesChanged(context, Map.of(), List.of(p.wireName()));
            case FALSE, CONST -> CompletableFuture.completedFuture(null);
        };
    }

    /**
     * Sends {@code PropertiesChanged} for this interface.
     */
    public CompletableFuture<Void> propertiesChanged(SignalContext context, Map<String, Variant> changed,
                                                     List<String> invalidated) {
        Message signal = Message.signal(context.path(), StandardInterfaceSpecs.PROPERTIES.name(), "PropertiesChanged")
                .body(PROPERTIES_CHANGED, List.of(spec.name(), changed, invalidated))
                .build();
        return context.connection().send(signal);
    }

    /**
     * Emits one of the interface's signals from {@code context.path()}.
     *
     * @throws IllegalArgumentException for an undeclared signal or arguments not
     *         matching its signature
     */
    public CompletableFuture<Void> emitSignal(SignalContext context, String signalWireName, Object... args) {
        SignalSpec signal = spec.signal(signalWireName).orElseThrow(() -> new IllegalArgumentException(
                "Interface " + spec.name() + " declares no signal '" + signalWireName + "'"));
        List<Object> body = Arrays.asList(args);
        if (!ValueShapes.conforms(signal.signature(), body)) {
            throw new IllegalArgumentException("Arguments of signal " + spec.name() + "." + signalWireName
                    + " do not match '" + signal.signature() + "'");
        }
        Message message = Message.signal(context.path(), spec.name(), signal.wireName())
                .body(signal.signature(), body)
                .build();
        return context.connection().send(message);
    }

    private PropertySpec property(String wireName) {
        return spec.property(wireName).orElseThrow(() -> new MethodErrorException(
                MethodErrorException.UNKNOWN_PROPERTY,
                "Unknown property '" + wireName + "' on interface " + spec.name()));
    }

    public static final class Builder
    {
        private final InterfaceSpec spec;
        private final Map<String, MethodHandler> routes = new LinkedHashMap<>();
        private final Map<String, PropertyHandler> properties = new LinkedHashMap<>();
        private BusObservabilitySink sink = NullObservabilitySink.INSTANCE;

        private Builder(InterfaceSpec spec) {
            this.spec = Objects.requireNonNull(spec, "spec");
        }

        public Builder method(String wireName, MethodHandler handler) {
            Objects.requireNonNull(handler, "handler");
            if (spec.method(wireName).isEmpty()) {
                throw new IllegalArgumentException("Interface " + spec.name() + " declares no method '" + wireName + "'");
            }
            routes.put(wireName, handler);
            return this;
        }

        public Builder property(String wireName, PropertyHandler handler) {
            Objects.requireNonNull(handler, "handler");
            PropertySpec p = spec.property(wireName).orElseThrow(() -> new IllegalArgumentException(
                    "Interface " + spec.name() + " declares no property '" + wireName + "'"));
            if (handler.setter().isPresent() && !p.hasSetter()) {
                throw new IllegalArgumentException("Property " + spec.name() + "." + wireName
                        + (p.changeNotify() == ChangeNotify.CONST ? " is constant" : " is not writable")
                        + " and cannot have a setter");
            }
            properties.put(wireName, handler);
            return this;
        }

        public Builder observability(BusObservabilitySink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * @throws IllegalStateException if a declared method has no handler or a
         *         property lacks a required accessor
         */
        public InterfaceDispatcher build() {
            // routing table keeps declaration order regardless of registration order
            Map<String, MethodHandler> ordered = new LinkedHashMap<>();
            for (MethodSpec m : spec.methods()) {
                MethodHandler h = routes.get(m.wireName());
                if (h == null) {
                    throw new IllegalStateException("No handler for method " + spec.name() + "." + m.wireName());
                }
                ordered.put(m.wireName(), h);
            }
            routes.clear();
            routes.putAll(ordered);
            for (PropertySpec p : spec.properties()) {
                PropertyHandler h = properties.get(p.wireName());
                boolean needsGetter = p.isReadable();
                boolean needsSetter = p.hasSetter();
                if ((needsGetter || needsSetter) && h == null) {
                    throw new IllegalStateException("No handler for property " + spec.name() + "." + p.wireName());
                }
                if (needsGetter && h.getter().isEmpty()) {
                    throw new IllegalStateException("No getter for property " + spec.name() + "." + p.wireName());
                }
                if (needsSetter && h.setter().isEmpty()) {
                    throw new IllegalStateException("No setter for property " + spec.name() + "." + p.wireName());
                }
            }
            return new InterfaceDispatcher(this);
        }
    }
}
