package com.questrail.busgen.proxy;

import com.questrail.busgen.bus.BusConnection;
import com.questrail.busgen.bus.Message;
import com.questrail.busgen.bus.MessageType;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.MethodSpec;
import com.questrail.busgen.model.PropertySpec;
import com.questrail.busgen.model.StandardInterfaceSpecs;
import com.questrail.busgen.observability.BusObservabilitySink;
import com.questrail.busgen.observability.CallFailedEvent;
import com.questrail.busgen.observability.NullObservabilitySink;
import com.questrail.busgen.signal.SignalMatcher;
import com.questrail.busgen.signal.SignalSubscription;
import com.questrail.busgen.signature.TypeSignature;
import com.questrail.busgen.value.ObjectPath;
import com.questrail.busgen.value.Struct;
import com.questrail.busgen.value.ValueShapes;
import com.questrail.busgen.value.Variant;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * InterfaceProxy
 * =============================================================================
 * Client side of one interface on one remote object.
 *
 * <h2>Calls</h2>
 * {@link #call(String, Object...)} marshals the arguments positionally against
 * the method's input signature, sends the call to the interface and the
 * method's wire name, and checks the reply body against the output signature.
 * {@link #invoke(String, Object...)} additionally applies the native return
 * shape: nothing, the single output, or a {@link Struct} of all outputs.
 *
 * <h2>Properties</h2>
 * Getters and setters go through {@code org.freedesktop.DBus.Properties}, never
 * through the interface's own methods. A property without a setter (not
 * writable, or {@code const}) cannot be set.
 *
 * <h2>Failures</h2>
 * Arguments that do not fit the declared signature are a caller bug and are
 * rejected synchronously with {@link IllegalArgumentException}. Everything the
 * remote side or the transport does wrong completes the returned future with a
 * {@link CallException} and is reported to the observability sink.
 */
public final class InterfaceProxy
{
    private static final String PROPERTIES = StandardInterfaceSpecs.PROPERTIES.name();
    private static final TypeSignature VARIANT = TypeSignature.parse("v");
    private static final TypeSignature PROPERTY_MAP = TypeSignature.parse("a{sv}");

    private final BusConnection connection;
    private final InterfaceSpec spec;
    private final String destination;
    private final ObjectPath path;
    private final BusObservabilitySink sink;

    private InterfaceProxy(Builder b) {
        this.connection = Objects.requireNonNull(b.connection, "connection");
        this.spec = Objects.requireNonNull(b.spec, "spec");
        this.path = Objects.requireNonNull(b.path, "path");
        this.destination = b.destination;
        this.sink = b.sink;
    }

    public static Builder builder(BusConnection connection, InterfaceSpec spec) {
        return new Builder(connection, spec);
    }

    public InterfaceSpec spec() {
        return spec;
    }

    public Optional<String> destination() {
        return Optional.ofNullable(destination);
    }

    public ObjectPath path() {
        return path;
    }

    public BusConnection connection() {
        return connection;
    }

    /**
     * Calls a method and completes with the reply body, one value per output.
     */
    public CompletableFuture<List<Object>> call(String methodWireName, Object... args) {
        MethodSpec method = spec.method(methodWireName).orElseThrow(() -> new IllegalArgumentException(
                "Interface " + spec.name() + " declares no method '" + methodWireName + "'"));
        TypeSignature in = method.inputSignature();
        List<Object> body = Arrays.asList(args);
        if (!ValueShapes.conforms(in, body)) {
            throw new IllegalArgumentException("Arguments of " + spec.name() + "." + methodWireName
                    + " do not match signature '" + in + "'");
        }
        Message call = Message.methodCall(path, spec.name(), method.wireName())
                .destination(destination)
                .body(in, body)
                .build();
        TypeSignature out = method.outputSignature();
        return exchange(method.wireName(), call, reply -> {
            if (!reply.signature().equals(out)) {
                throw CallException.typeMismatch(spec.name(), method.wireName(),
                        "reply signature '" + reply.signature() + "' does not match declared '" + out + "'");
            }
            return reply.body();
        });
    }

    /**
     * Calls a method and completes with its native return value: {@code null}
     * for no outputs, the single output, or a {@link Struct} of all outputs.
     */
    public <T> CompletableFuture<T> invoke(String methodWireName, Object... args) {
        MethodSpec method = spec.method(methodWireName).orElseThrow(() -> new IllegalArgumentException(
                "Interface " + spec.name() + " declares no method '" + methodWireName + "'"));
        int outputs = method.outputs().size();
        return call(methodWireName, args).thenApply(body -> {
            if (outputs == 0) {
                return null;
            }
            return ValueShapes.<T>cast(outputs == 1 ? body.get(0) : new Struct(body));
        });
    }

    public <T> CompletableFuture<T> getProperty(String propertyWireName) {
        PropertySpec property = property(propertyWireName);
        if (!property.isReadable()) {
            throw new IllegalArgumentException("Property " + spec.name() + "." + propertyWireName + " is not readable");
        }
        Message call = Message.methodCall(path, PROPERTIES, "Get")
                .destination(destination)
                .body("ss", spec.name(), property.wireName())
                .build();
        return exchange(property.wireName(), call, reply -> {
            if (!reply.signature().equals(VARIANT)) {
                throw CallException.typeMismatch(spec.name(), property.wireName(),
                        "Get replied with '" + reply.signature() + "' instead of a variant");
            }
            Variant v = (Variant) reply.body().get(0);
            if (!v.signature().equals(property.type())) {
                throw CallException.typeMismatch(spec.name(), property.wireName(),
                        "property value has type '" + v.signature() + "', declared '" + property.type() + "'");
            }
            return ValueShapes.<T>cast(v.value());
        });
    }

    /**
     * @throws IllegalArgumentException if the property has no setter or the value
     *         does not fit its type
     */
    public CompletableFuture<Void> setProperty(String propertyWireName, Object value) {
        PropertySpec property = property(propertyWireName);
        if (!property.hasSetter()) {
            throw new IllegalArgumentException("Property " + spec.name() + "." + propertyWireName + " has no setter");
        }
        Variant v = new Variant(property.type(), value);
        Message call = Message.methodCall(path, PROPERTIES, "Set")
                .destination(destination)
                .body("ssv", spec.name(), property.wireName(), v)
                .build();
        return exchange(property.wireName(), call, reply -> null);
    }

    /**
     * All readable properties of the interface, by wire name.
     */
    public CompletableFuture<Map<String, Variant>> getAllProperties() {
        Message call = Message.methodCall(path, PROPERTIES, "GetAll")
                .destination(destination)
                .body("s", spec.name())
                .build();
        return exchange("GetAll", call, reply -> {
            if (!reply.signature().equals(PROPERTY_MAP)) {
                throw CallException.typeMismatch(spec.name(), "GetAll",
                        "GetAll replied with '" + reply.signature() + "'");
            }
            return ValueShapes.<Map<String, Variant>>cast(reply.body().get(0));
        });
    }

    /**
     * Subscription to a signal of this interface emitted from this proxy's
     * object path. The subscription is already active.
     */
    public SignalSubscription receiveSignal(String signalWireName) {
        SignalMatcher matcher = SignalMatcher.of(spec, signalWireName).atPath(path);
        return new SignalSubscription(connection, matcher, sink).subscribe();
    }

    private PropertySpec property(String wireName) {
        return spec.property(wireName).orElseThrow(() -> new IllegalArgumentException(
                "Interface " + spec.name() + " declares no property '" + wireName + "'"));
    }

    private <T> CompletableFuture<T> exchange(String member, Message call, Function<Message, T> onReply) {
        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<Message> reply;
        try {
            reply = connection.call(call);
        } catch (RuntimeException e) {
            fail(result, CallException.transport(spec.name(), member, e));
            return result;
        }
        reply.whenComplete((message, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                fail(result, CallException.transport(spec.name(), member, cause));
                return;
            }
            try {
                if (message.type() == MessageType.ERROR) {
                    fail(result, CallException.remoteError(spec.name(), member,
                            message.errorName().orElse("<unnamed>"), message.errorMessage().orElse("")));
                    return;
                }
                result.complete(onReply.apply(message));
            } catch (CallException e) {
                fail(result, e);
            } catch (RuntimeException e) {
                fail(result, CallException.typeMismatch(spec.name(), member,
                        "reply could not be decoded: " + e, e));
            }
        });
        return result;
    }

    private void fail(CompletableFuture<?> result, CallException e) {
        sink.onCallFailed(new CallFailedEvent(Instant.now(), destination, path.value(),
                e.interfaceName(), e.member(), e));
        result.completeExceptionally(e);
    }

    public static final class Builder
    {
        private final BusConnection connection;
        private final InterfaceSpec spec;
        private String destination;
        private ObjectPath path;
        private BusObservabilitySink sink = NullObservabilitySink.INSTANCE;

        private Builder(BusConnection connection, InterfaceSpec spec) {
            this.connection = connection;
            this.spec = spec;
        }

        public Builder destination(String destination) {
            this.destination = destination;
            return this;
        }

        public Builder path(ObjectPath path) {
            this.path = path;
            return this;
        }

        public Builder path(String path) {
            return path(ObjectPath.of(path));
        }

        public Builder observability(BusObservabilitySink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public InterfaceProxy build() {
            return new InterfaceProxy(this);
        }
    }
}
