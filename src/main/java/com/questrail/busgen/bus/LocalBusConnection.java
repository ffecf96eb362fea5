package com.questrail.busgen.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * LocalBusConnection
 * -----------------------------------------------------------------------------
 * One endpoint of a {@link LocalBus}.
 *
 * <p>Pending calls are kept in a map keyed by serial, so replies complete the
 * matching future regardless of arrival order. Closing the connection fails
 * every pending call and drops all subscriptions.</p>
 */
public final class LocalBusConnection implements BusConnection, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(LocalBusConnection.class);

    private final LocalBus bus;
    private final String uniqueName;
    private final Executor executor;
    private final AtomicLong nextSerial = new AtomicLong(1);
    private final Map<Long, CompletableFuture<Message>> pending = new ConcurrentHashMap<>();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Queue<Runnable> deliveries = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile MessageHandler handler;

    LocalBusConnection(LocalBus bus, String uniqueName, Executor executor) {
        this.bus = bus;
        this.uniqueName = uniqueName;
        this.executor = executor;
    }

    @Override
    public String uniqueName() {
        return uniqueName;
    }

    /**
     * Install the handler receiving method calls addressed to this connection.
     */
    public void attach(MessageHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Claim a well-known name so that calls addressed to it reach this connection.
     *
     * @return {@code false} if the name is owned by another connection
     */
    public boolean requestName(String name) {
        return bus.requestName(Objects.requireNonNull(name, "name"), this);
    }

    @Override
    public CompletableFuture<Void> send(Message message) {
        Objects.requireNonNull(message, "message");
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Connection " + uniqueName + " is closed"));
        }
        bus.route(stamp(message), this);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Message> call(Message methodCall) {
        Objects.requireNonNull(methodCall, "methodCall");
        if (methodCall.type() != MessageType.METHOD_CALL) {
            throw new IllegalArgumentException("Not a method call: " + methodCall);
        }
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Connection " + uniqueName + " is closed"));
        }
        Message stamped = stamp(methodCall);
        CompletableFuture<Message> reply = new CompletableFuture<>();
        pending.put(stamped.serial(), reply);
        bus.route(stamped, this);
        return reply;
    }

    @Override
    public Cancellable subscribe(MatchRule rule, MessageListener listener) {
        Subscription s = new Subscription(Objects.requireNonNull(rule, "rule"),
                Objects.requireNonNull(listener, "listener"));
        subscriptions.add(s);
        return s;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        bus.disconnect(this);
        subscriptions.clear();
        IllegalStateException cause = new IllegalStateException("Connection " + uniqueName + " closed");
        pending.values().forEach(f -> f.completeExceptionally(cause));
        pending.clear();
    }

    public boolean isClosed() {
        return closed.get();
    }

    private Message stamp(Message message) {
        return message.toBuilder().serial(nextSerial.getAndIncrement()).sender(uniqueName).build();
    }

    void deliverCall(Message call) {
        enqueue(() -> {
            MessageHandler h = handler;
            if (h == null) {
                log.debug("{} has no handler; rejecting {}", uniqueName, call);
                send(Message.error(call, "org.freedesktop.DBus.Error.UnknownObject",
                        "No object handler on " + uniqueName));
                return;
            }
            h.handle(call, this);
        });
    }

    void deliverReply(Message reply) {
        long serial = reply.replySerial().orElseThrow();
        enqueue(() -> {
            CompletableFuture<Message> f = pending.remove(serial);
            if (f == null) {
                log.debug("{} dropping reply to unknown serial {}", uniqueName, serial);
                return;
            }
            f.complete(reply);
        });
    }

    void deliverSignal(Message signal) {
        enqueue(() -> {
            for (Subscription s : subscriptions) {
                if (s.rule.matches(signal)) {
                    s.listener.onMessage(signal);
                }
            }
        });
    }

    private void enqueue(Runnable delivery) {
        if (closed.get()) {
            return;
        }
        deliveries.add(delivery);
        executor.execute(this::drain);
    }

    private void drain() {
        // one drainer at a time keeps deliveries ordered per connection
        while (draining.compareAndSet(false, true)) {
            try {
                Runnable next;
                while ((next = deliveries.poll()) != null) {
                    try {
                        next.run();
                    } catch (RuntimeException e) {
                        log.warn("{} delivery failed", uniqueName, e);
                    }
                }
            } finally {
                draining.set(false);
            }
            if (deliveries.isEmpty()) {
                return;
            }
        }
    }

    private final class Subscription implements Cancellable
    {
        private final MatchRule rule;
        private final MessageListener listener;

        Subscription(MatchRule rule, MessageListener listener) {
            this.rule = rule;
            this.listener = listener;
        }

        @Override
        public boolean cancel() {
            return subscriptions.remove(this);
        }
    }
}
