package com.questrail.busgen.dispatch;

import com.questrail.busgen.bus.BusConnection;
import com.questrail.busgen.bus.Message;
import com.questrail.busgen.bus.MessageHandler;
import com.questrail.busgen.bus.MessageType;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.IntrospectionNode;
import com.questrail.busgen.model.StandardInterfaceSpecs;
import com.questrail.busgen.observability.BusObservabilitySink;
import com.questrail.busgen.observability.DispatchErrorEvent;
import com.questrail.busgen.observability.NullObservabilitySink;
import com.questrail.busgen.signature.TypeSignature;
import com.questrail.busgen.value.ObjectPath;
import com.questrail.busgen.value.Variant;
import com.questrail.busgen.xml.IntrospectionWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ObjectServer
 * =============================================================================
 * Serves interface dispatchers at object paths and answers the standard
 * interfaces for every path it knows.
 *
 * <h2>Standard interfaces</h2>
 * <ul>
 *   <li>{@code org.freedesktop.DBus.Peer}: {@code Ping}, {@code GetMachineId}</li>
 *   <li>{@code org.freedesktop.DBus.Introspectable}: {@code Introspect}, also on
 *       intermediate paths that only have served descendants</li>
 *   <li>{@code org.freedesktop.DBus.Properties}: {@code Get}, {@code Set},
 *       {@code GetAll}, routed to the dispatcher of the named interface</li>
 * </ul>
 *
 * <h2>Routing</h2>
 * A call names an object path and, normally, an interface. A call without an
 * interface goes to the first served interface declaring the member. Unknown
 * paths are answered with {@value MethodErrorException#UNKNOWN_OBJECT},
 * unknown interfaces with {@value MethodErrorException#UNKNOWN_INTERFACE}.
 *
 * <p>Attach the server to a connection with
 * {@link com.questrail.busgen.bus.LocalBusConnection#attach(MessageHandler)} or
 * any transport that delivers method calls to a {@link MessageHandler}.</p>
 */
public final class ObjectServer implements MessageHandler
{
    private static final Logger log = LoggerFactory.getLogger(ObjectServer.class);

    private static final String PEER = StandardInterfaceSpecs.PEER.name();
    private static final String INTROSPECTABLE = StandardInterfaceSpecs.INTROSPECTABLE.name();
    private static final String PROPERTIES = StandardInterfaceSpecs.PROPERTIES.name();

    private final Map<ObjectPath, Map<String, InterfaceDispatcher>> objects = new ConcurrentHashMap<>();
    private final BusObservabilitySink sink;
    private final String machineId;

    public ObjectServer(BusObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.machineId = UUID.randomUUID().toString().replace("-", "");
    }

    public ObjectServer() {
        this(NullObservabilitySink.INSTANCE);
    }

    /**
     * Serves {@code dispatcher} at {@code path}.
     *
     * @throws IllegalStateException if the path already serves that interface
     */
    public ObjectServer serve(ObjectPath path, InterfaceDispatcher dispatcher) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(dispatcher, "dispatcher");
        Map<String, InterfaceDispatcher> ifaces = objects.computeIfAbsent(path, p -> new LinkedHashMap<>());
        synchronized (ifaces) {
            if (ifaces.putIfAbsent(dispatcher.interfaceName(), dispatcher) != null) {
                throw new IllegalStateException("Interface " + dispatcher.interfaceName() + " already served at " + path);
            }
        }
        log.debug("Serving {} at {}", dispatcher.interfaceName(), path);
        return this;
    }

    /**
     * @return {@code true} if the interface was served at the path
     */
    public boolean remove(ObjectPath path, String interfaceName) {
        Map<String, InterfaceDispatcher> ifaces = objects.get(path);
        if (ifaces == null) {
            return false;
        }
        synchronized (ifaces) {
            boolean removed = ifaces.remove(interfaceName) != null;
            if (ifaces.isEmpty()) {
                objects.remove(path, ifaces);
            }
            return removed;
        }
    }

    public Optional<InterfaceDispatcher> dispatcher(ObjectPath path, String interfaceName) {
        Map<String, InterfaceDispatcher> ifaces = objects.get(path);
        if (ifaces == null) {
            return Optional.empty();
        }
        synchronized (ifaces) {
            return Optional.ofNullable(ifaces.get(interfaceName));
        }
    }

    public String machineId() {
        return machineId;
    }

    @Override
    public void handle(Message call, BusConnection connection) {
        if (call.type() != MessageType.METHOD_CALL) {
            return;
        }
        Message reply = reply(call, connection);
        connection.send(reply).whenComplete((ok, error) -> {
            if (error != null) {
                log.warn("Failed to send reply to {}", call, error);
            }
        });
    }

    private Message reply(Message call, BusConnection connection) {
        ObjectPath path = call.path().orElseThrow();
        String member = call.member().orElseThrow();
        String iface = call.interfaceName().orElse(null);
        SignalContext context = new SignalContext(connection, path);
        try {
            if (PEER.equals(iface) || (iface == null && ("Ping".equals(member) || "GetMachineId".equals(member)))) {
                return peer(call, member);
            }
            if (INTROSPECTABLE.equals(iface) || (iface == null && "Introspect".equals(member))) {
                return introspect(call, path);
            }
            List<InterfaceDispatcher> served = served(path);
            if (served.isEmpty()) {
                throw new MethodErrorException(MethodErrorException.UNKNOWN_OBJECT, "Unknown object '" + path + "'");
            }
            if (PROPERTIES.equals(iface)) {
                return properties(call, member, context);
            }
            InterfaceDispatcher target = iface != null
                    ? dispatcher(path, iface).orElseThrow(() -> new MethodErrorException(
                            MethodErrorException.UNKNOWN_INTERFACE,
                            "Unknown interface '" + iface + "' at '" + path + "'"))
                    : served.stream().filter(d -> d.spec().method(member).isPresent()).findFirst()
                            .orElseThrow(() -> new MethodErrorException(MethodErrorException.UNKNOWN_METHOD,
                                    "Unknown method '" + member + "' at '" + path + "'"));
            return target.dispatch(call, context);
        } catch (MethodErrorException e) {
            sink.onDispatchError(new DispatchErrorEvent(Instant.now(), path.value(), iface, member,
                    e.errorName(), e.getMessage(), e.getCause()));
            return Message.error(call, e.errorName(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Handler for {}.{} at {} failed", iface, member, path, e);
            String message = "Handler failed: " + e.getMessage();
            sink.onDispatchError(new DispatchErrorEvent(Instant.now(), path.value(), iface, member,
                    MethodErrorException.FAILED, message, e));
            return Message.error(call, MethodErrorException.FAILED, message);
        }
    }

    private Message peer(Message call, String member) {
        return switch (member) {
            case "Ping" -> Message.methodReturn(call, TypeSignature.EMPTY, List.of());
            case "GetMachineId" -> Message.methodReturn(call, TypeSignature.parse("s"), List.of(machineId));
            default -> throw new MethodErrorException(MethodErrorException.UNKNOWN_METHOD,
                    "Unknown method '" + member + "' on interface " + PEER);
        };
    }

    private Message introspect(Message call, ObjectPath path) {
        List<InterfaceDispatcher> served = served(path);
        List<IntrospectionNode> children = new ArrayList<>();
        for (String child : childNames(path)) {
            children.add(IntrospectionNode.child(child));
        }
        if (served.isEmpty() && children.isEmpty() && !path.isRoot()) {
            throw new MethodErrorException(MethodErrorException.UNKNOWN_OBJECT, "Unknown object '" + path + "'");
        }
        List<InterfaceSpec> interfaces = new ArrayList<>();
        if (!served.isEmpty()) {
            interfaces.add(StandardInterfaceSpecs.PEER);
            interfaces.add(StandardInterfaceSpecs.INTROSPECTABLE);
            interfaces.add(StandardInterfaceSpecs.PROPERTIES);
            served.forEach(d -> interfaces.add(d.spec()));
        }
        String xml = IntrospectionWriter.writeNode(IntrospectionNode.root(interfaces, children));
        return Message.methodReturn(call, TypeSignature.parse("s"), List.of(xml));
    }

    private Message properties(Message call, String member, SignalContext context) {
        List<Object> args = call.body();
        TypeSignature expected = StandardInterfaceSpecs.PROPERTIES.method(member)
                .orElseThrow(() -> new MethodErrorException(MethodErrorException.UNKNOWN_METHOD,
                        "Unknown method '" + member + "' on interface " + PROPERTIES))
                .inputSignature();
        if (!call.signature().equals(expected)) {
            throw new MethodErrorException(MethodErrorException.INVALID_ARGS,
                    "Method " + member + " expects '" + expected + "', got '" + call.signature() + "'");
        }
        InterfaceDispatcher d = dispatcher(context.path(), (String) args.get(0))
                .orElseThrow(() -> new MethodErrorException(MethodErrorException.UNKNOWN_INTERFACE,
                        "Unknown interface '" + args.get(0) + "' at '" + context.path() + "'"));
        switch (member) {
            case "Get" -> {
                Variant value = d.getProperty((String) args.get(1));
                return Message.methodReturn(call, TypeSignature.parse("v"), List.of(value));
            }
            case "GetAll" -> {
                return Message.methodReturn(call, TypeSignature.parse("a{sv}"), List.of(d.getAllProperties()));
            }
            default -> {
                String property = (String) args.get(1);
                Variant value = (Variant) args.get(2);
                TypeSignature declared = d.spec().property(property).map(p -> p.type()).orElse(null);
                if (declared != null && !declared.equals(value.signature())) {
                    throw new MethodErrorException(MethodErrorException.INVALID_ARGS,
                            "Property " + property + " has type '" + declared + "', got '" + value.signature() + "'");
                }
                d.setProperty(context, property, value.value());
                return Message.methodReturn(call, TypeSignature.EMPTY, List.of());
            }
        }
    }

    private List<InterfaceDispatcher> served(ObjectPath path) {
        Map<String, InterfaceDispatcher> ifaces = objects.get(path);
        if (ifaces == null) {
            return List.of();
        }
        synchronized (ifaces) {
            return List.copyOf(ifaces.values());
        }
    }

    /** Names of the direct children of {@code path} that lead to served objects. */
    private List<String> childNames(ObjectPath path) {
        TreeSet<String> names = new TreeSet<>();
        String prefix = path.isRoot() ? "/" : path.value() + "/";
        for (ObjectPath p : objects.keySet()) {
            if (p.value().startsWith(prefix) && p.value().length() > prefix.length()) {
                String rest = p.value().substring(prefix.length());
                int slash = rest.indexOf('/');
                names.add(slash < 0 ? rest : rest.substring(0, slash));
            }
        }
        return List.copyOf(names);
    }
}
