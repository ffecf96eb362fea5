package com.questrail.busgen.bus;

import com.questrail.busgen.value.ObjectPath;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * MatchRule
 * -----------------------------------------------------------------------------
 * Filter selecting inbound messages by type, sender, interface, member and
 * object path. Unset fields match anything.
 *
 * <p>{@link #toString()} renders the rule in the bus daemon's match-rule syntax,
 * e.g. {@code type='signal',interface='org.example.Foo',member='Changed'}.</p>
 */
public record MatchRule(
        Optional<MessageType> type,
        Optional<String> sender,
        Optional<String> interfaceName,
        Optional<String> member,
        Optional<ObjectPath> path
) {
    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(Message message) {
        return type.map(t -> t == message.type()).orElse(true)
                && sender.map(s -> message.sender().map(s::equals).orElse(false)).orElse(true)
                && interfaceName.map(i -> message.interfaceName().map(i::equals).orElse(false)).orElse(true)
                && member.map(m -> message.member().map(m::equals).orElse(false)).orElse(true)
                && path.map(p -> message.path().map(p::equals).orElse(false)).orElse(true);
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        type.ifPresent(t -> parts.add("type='" + t.matchName() + "'"));
        sender.ifPresent(s -> parts.add("sender='" + s + "'"));
        interfaceName.ifPresent(i -> parts.add("interface='" + i + "'"));
        member.ifPresent(m -> parts.add("member='" + m + "'"));
        path.ifPresent(p -> parts.add("path='" + p + "'"));
        return String.join(",", parts);
    }

    public static final class Builder
    {
        private MessageType type;
        private String sender;
        private String interfaceName;
        private String member;
        private ObjectPath path;

        private Builder() {}

        public Builder type(MessageType type) {
            this.type = type;
            return this;
        }

        public Builder sender(String sender) {
            this.sender = sender;
            return this;
        }

        public Builder interfaceName(String interfaceName) {
            this.interfaceName = interfaceName;
            return this;
        }

        public Builder member(String member) {
            this.member = member;
            return this;
        }

        public Builder path(ObjectPath path) {
            this.path = path;
            return this;
        }

        public MatchRule build() {
            return new MatchRule(Optional.ofNullable(type), Optional.ofNullable(sender),
                    Optional.ofNullable(interfaceName), Optional.ofNullable(member), Optional.ofNullable(path));
        }
    }
}
