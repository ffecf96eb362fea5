package com.questrail.busgen.signal;

import com.questrail.busgen.bus.MatchRule;
import com.questrail.busgen.bus.Message;
import com.questrail.busgen.bus.MessageType;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.SignalSpec;
import com.questrail.busgen.value.ObjectPath;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * SignalMatcher
 * =============================================================================
 * Structural matcher for one declared signal.
 *
 * <p>Matching compares the message type, interface name, member name and, when
 * bound, the object path and sender against the signal's identity. It never
 * looks at the body and never fails; decoding is deferred to
 * {@link MatchedSignal}.</p>
 */
public final class SignalMatcher
{
    private final String interfaceName;
    private final SignalSpec signal;
    private final ObjectPath path;
    private final String sender;

    private SignalMatcher(String interfaceName, SignalSpec signal, ObjectPath path, String sender) {
        this.interfaceName = interfaceName;
        this.signal = signal;
        this.path = path;
        this.sender = sender;
    }

    /**
     * @throws IllegalArgumentException if the interface declares no such signal
     */
    public static SignalMatcher of(InterfaceSpec iface, String signalWireName) {
        SignalSpec signal = iface.signal(signalWireName).orElseThrow(() -> new IllegalArgumentException(
                "Interface " + iface.name() + " declares no signal '" + signalWireName + "'"));
        return new SignalMatcher(iface.name(), signal, null, null);
    }

    public static SignalMatcher of(String interfaceName, SignalSpec signal) {
        return new SignalMatcher(Objects.requireNonNull(interfaceName, "interfaceName"),
                Objects.requireNonNull(signal, "signal"), null, null);
    }

    /** Same matcher restricted to signals emitted from {@code path}. */
    public SignalMatcher atPath(ObjectPath path) {
        return new SignalMatcher(interfaceName, signal, Objects.requireNonNull(path, "path"), sender);
    }

    /** Same matcher restricted to signals sent by {@code sender}. */
    public SignalMatcher fromSender(String sender) {
        return new SignalMatcher(interfaceName, signal, path, Objects.requireNonNull(sender, "sender"));
    }

    public String interfaceName() {
        return interfaceName;
    }

    public SignalSpec signal() {
        return signal;
    }

    public Optional<ObjectPath> path() {
        return Optional.ofNullable(path);
    }

    public boolean matches(Message message) {
        return message.type() == MessageType.SIGNAL
                && message.interfaceName().map(interfaceName::equals).orElse(false)
                && message.member().map(signal.wireName()::equals).orElse(false)
                && (path == null || message.path().map(path::equals).orElse(false))
                && (sender == null || message.sender().map(sender::equals).orElse(false));
    }

    public Optional<MatchedSignal> match(Message message) {
        return match(message, e -> { });
    }

    /**
     * @param onDecodeFailure notified once if decoding the matched message fails
     */
    public Optional<MatchedSignal> match(Message message, Consumer<SignalDecodeException> onDecodeFailure) {
        if (!matches(message)) {
            return Optional.empty();
        }
        return Optional.of(new MatchedSignal(interfaceName, signal, message, onDecodeFailure));
    }

    public MatchRule toMatchRule() {
        return MatchRule.builder()
                .type(MessageType.SIGNAL)
                .sender(sender)
                .interfaceName(interfaceName)
                .member(signal.wireName())
                .path(path)
                .build();
    }
}
