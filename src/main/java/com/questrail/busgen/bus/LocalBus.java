package com.questrail.busgen.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * LocalBus
 * =============================================================================
 * In-process message bus connecting {@link LocalBusConnection}s.
 *
 * <p>Routing follows the bus daemon's rules without a daemon:</p>
 * <ul>
 *   <li>method calls go to the connection owning the destination name (unique
 *       or well-known); an unknown destination gets a
 *       {@code org.freedesktop.DBus.Error.ServiceUnknown} reply</li>
 *   <li>replies go to the connection named by their destination</li>
 *   <li>signals with a destination go to that connection only; broadcast
 *       signals go to every connection</li>
 * </ul>
 *
 * <p>Deliveries run on the supplied {@link Executor}; each connection
 * serializes its own deliveries. Pass {@code Runnable::run} for fully
 * synchronous delivery in tests.</p>
 */
public final class LocalBus
{
    private static final Logger log = LoggerFactory.getLogger(LocalBus.class);

    public static final String SERVICE_UNKNOWN = "org.freedesktop.DBus.Error.ServiceUnknown";

    private final Executor executor;
    private final AtomicInteger nextId = new AtomicInteger(1);
    private final List<LocalBusConnection> connections = new CopyOnWriteArrayList<>();
    private final Map<String, LocalBusConnection> names = new ConcurrentHashMap<>();

    public LocalBus(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public LocalBusConnection connect() {
        LocalBusConnection c = new LocalBusConnection(this, ":1." + nextId.getAndIncrement(), executor);
        connections.add(c);
        names.put(c.uniqueName(), c);
        return c;
    }

    /**
     * @return {@code false} if another connection already owns {@code name}
     */
    boolean requestName(String name, LocalBusConnection owner) {
        return names.putIfAbsent(name, owner) == null || names.get(name) == owner;
    }

    void disconnect(LocalBusConnection connection) {
        connections.remove(connection);
        names.values().removeIf(c -> c == connection);
    }

    Optional<LocalBusConnection> lookup(String name) {
        return Optional.ofNullable(names.get(name));
    }

    void route(Message message, LocalBusConnection from) {
        switch (message.type()) {
            case METHOD_CALL -> {
                Optional<LocalBusConnection> target = message.destination().flatMap(this::lookup);
                if (target.isPresent()) {
                    target.get().deliverCall(message);
                } else {
                    log.debug("No owner for destination {}; replying {}", message.destination().orElse("<none>"),
                            SERVICE_UNKNOWN);
                    Message error = Message.error(message, SERVICE_UNKNOWN,
                            "The name " + message.destination().orElse("<none>") + " was not provided by any connection");
                    from.deliverReply(error);
                }
            }
            case METHOD_RETURN, ERROR -> message.destination().flatMap(this::lookup)
                    .ifPresentOrElse(c -> c.deliverReply(message),
                            () -> log.debug("Dropping reply without a live destination: {}", message));
            case SIGNAL -> {
                if (message.destination().isPresent()) {
                    lookup(message.destination().get()).ifPresent(c -> c.deliverSignal(message));
                } else {
                    for (LocalBusConnection c : connections) {
                        c.deliverSignal(message);
                    }
                }
            }
        }
    }
}
