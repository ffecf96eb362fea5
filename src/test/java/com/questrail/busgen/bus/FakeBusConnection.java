package com.questrail.busgen.bus;

import com.questrail.busgen.signature.TypeSignature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FakeBusConnection
 * -----------------------------------------------------------------------------
 * Test-only {@link BusConnection} implementation.
 *
 * <p>Outbound calls stay pending until the test answers them with
 * {@link #reply}, {@link #replyError} or {@link #failCall}; sent messages and
 * calls are recorded. Signals are injected with {@link #injectSignal} and go
 * to every subscription whose rule matches.</p>
 */
public final class FakeBusConnection implements BusConnection
{
    private final String uniqueName;
    private final AtomicLong nextSerial = new AtomicLong(1);
    private final List<Message> sent = new CopyOnWriteArrayList<>();
    private final List<Message> calls = new CopyOnWriteArrayList<>();
    private final Map<Long, CompletableFuture<Message>> pending = new ConcurrentHashMap<>();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile RuntimeException sendFailure;

    public FakeBusConnection(String uniqueName) {
        this.uniqueName = Objects.requireNonNull(uniqueName, "uniqueName");
    }

    public FakeBusConnection() {
        this(":1.99");
    }

    @Override
    public String uniqueName() {
        return uniqueName;
    }

    @Override
    public CompletableFuture<Void> send(Message message) {
        Objects.requireNonNull(message, "message");
        if (sendFailure != null) {
            return CompletableFuture.failedFuture(sendFailure);
        }
        sent.add(stamp(message));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Message> call(Message methodCall) {
        Objects.requireNonNull(methodCall, "methodCall");
        if (sendFailure != null) {
            return CompletableFuture.failedFuture(sendFailure);
        }
        Message stamped = stamp(methodCall);
        CompletableFuture<Message> reply = new CompletableFuture<>();
        pending.put(stamped.serial(), reply);
        calls.add(stamped);
        return reply;
    }

    @Override
    public Cancellable subscribe(MatchRule rule, MessageListener listener) {
        Subscription s = new Subscription(rule, listener);
        subscriptions.add(s);
        return () -> subscriptions.remove(s);
    }

    private Message stamp(Message message) {
        return message.toBuilder().serial(nextSerial.getAndIncrement()).sender(uniqueName).build();
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void reply(Message call, String signature, Object... body) {
        complete(call, Message.methodReturn(call, TypeSignature.parse(signature),
                List.of(body)));
    }

    public void replyError(Message call, String errorName, String description) {
        complete(call, Message.error(call, errorName, description));
    }

    /** Completes a pending call with an arbitrary reply, {@code null} included. */
    public void replyWith(Message call, Message reply) {
        complete(call, reply);
    }

    public void failCall(Message call, Throwable cause) {
        CompletableFuture<Message> f = pending.remove(call.serial());
        if (f == null) {
            throw new IllegalStateException("No pending call with serial " + call.serial());
        }
        f.completeExceptionally(cause);
    }

    /** Makes every following send and call fail with {@code failure}; {@code null} restores. */
    public void failSends(RuntimeException failure) {
        this.sendFailure = failure;
    }

    public void injectSignal(Message signal) {
        Message delivered = signal.sender().isPresent() ? signal : signal.withSender(":1.7");
        for (Subscription s : subscriptions) {
            if (s.rule().matches(delivered)) {
                s.listener().onMessage(delivered);
            }
        }
    }

    public List<Message> sent() {
        return Collections.unmodifiableList(sent);
    }

    public List<Message> calls() {
        return Collections.unmodifiableList(calls);
    }

    public Message lastCall() {
        if (calls.isEmpty()) {
            throw new IllegalStateException("No calls made");
        }
        return calls.get(calls.size() - 1);
    }

    public List<MatchRule> subscriptions() {
        List<MatchRule> rules = new ArrayList<>();
        for (Subscription s : subscriptions) {
            rules.add(s.rule());
        }
        return rules;
    }

    public void clear() {
        sent.clear();
        calls.clear();
    }

    private void complete(Message call, Message reply) {
        CompletableFuture<Message> f = pending.remove(call.serial());
        if (f == null) {
            throw new IllegalStateException("No pending call with serial " + call.serial());
        }
        f.complete(reply);
    }

    private record Subscription(MatchRule rule, MessageListener listener) {}
}
