package com.questrail.busgen.signal;

import com.questrail.busgen.bus.BusConnection;
import com.questrail.busgen.bus.Cancellable;
import com.questrail.busgen.bus.Message;
import com.questrail.busgen.observability.BusObservabilitySink;
import com.questrail.busgen.observability.NullObservabilitySink;
import com.questrail.busgen.observability.SignalDecodeFailedEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * SignalSubscription
 * =============================================================================
 * Lazy, restartable, cancelable sequence of signals matching one
 * {@link SignalMatcher}.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   UNSUBSCRIBED --subscribe()--&gt; SUBSCRIBED --cancel()--&gt; UNSUBSCRIBED
 * </pre>
 * Nothing is registered with the connection until {@link #subscribe()}.
 * {@link #cancel()} drops the registration and every buffered signal; a later
 * {@link #subscribe()} starts over with an empty buffer.
 *
 * <h2>Per inbound message</h2>
 * <ul>
 *   <li>not matched: ignored, nothing is buffered</li>
 *   <li>matched: buffered as a {@link MatchedSignal}, still undecoded</li>
 *   <li>decoded / decode failed: decided when the consumer asks; a failure is
 *       reported to the observability sink and the subscription stays alive</li>
 * </ul>
 *
 * <p>The buffer is unbounded.</p>
 */
public final class SignalSubscription implements Cancellable, AutoCloseable
{
    public enum State { UNSUBSCRIBED, SUBSCRIBED }

    private final BusConnection connection;
    private final SignalMatcher matcher;
    private final BusObservabilitySink sink;
    private final BlockingQueue<MatchedSignal> buffer = new LinkedBlockingQueue<>();
    private Cancellable registration;

    public SignalSubscription(BusConnection connection, SignalMatcher matcher, BusObservabilitySink sink) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public SignalSubscription(BusConnection connection, SignalMatcher matcher) {
        this(connection, matcher, NullObservabilitySink.INSTANCE);
    }

    public synchronized State state() {
        return registration == null ? State.UNSUBSCRIBED : State.SUBSCRIBED;
    }

    public SignalMatcher matcher() {
        return matcher;
    }

    /**
     * Registers with the connection. Has no effect when already subscribed.
     *
     * @return this subscription
     */
    public synchronized SignalSubscription subscribe() {
        if (registration == null) {
            registration = connection.subscribe(matcher.toMatchRule(), this::onMessage);
        }
        return this;
    }

    /**
     * Next buffered signal, if one has arrived.
     */
    public Optional<MatchedSignal> poll() {
        return Optional.ofNullable(buffer.poll());
    }

    public Optional<MatchedSignal> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(buffer.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    /**
     * Waits for the next signal.
     */
    public MatchedSignal take() throws InterruptedException {
        return buffer.take();
    }

    /** Number of buffered, not yet consumed signals. */
    public int pending() {
        return buffer.size();
    }

    @Override
    public synchronized boolean cancel() {
        if (registration == null) {
            return false;
        }
        registration.cancel();
        registration = null;
        buffer.clear();
        return true;
    }

    @Override
    public void close() {
        cancel();
    }

    private void onMessage(Message message) {
        Optional<MatchedSignal> matched = matcher.match(message, this::reportDecodeFailure);
        if (matched.isEmpty()) {
            return;
        }
        // cancel() clears the buffer under the same lock
        synchronized (this) {
            if (registration != null) {
                buffer.add(matched.get());
            }
        }
    }

    private void reportDecodeFailure(SignalDecodeException e) {
        sink.onSignalDecodeFailed(new SignalDecodeFailedEvent(
                Instant.now(),
                e.interfaceName(),
                e.member(),
                e.expected().toText(),
                e.actual().toText()));
    }
}
