package com.questrail.busgen.bus;

import com.questrail.busgen.signature.TypeSignature;
import com.questrail.busgen.value.ObjectPath;
import com.questrail.busgen.value.ValueShapes;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Message
 * -----------------------------------------------------------------------------
 * One bus message: header fields plus a typed body.
 *
 * <p>The body is carried as native values (see
 * {@link com.questrail.busgen.value.ValueShapes}) together with its wire
 * signature; marshalling to bytes is the transport's concern. A message is
 * immutable; the transport assigns the serial and the sender on send.</p>
 *
 * <h2>Required header fields</h2>
 * <ul>
 *   <li>method call: path and member</li>
 *   <li>method return: reply serial</li>
 *   <li>error: reply serial and error name</li>
 *   <li>signal: path, interface and member</li>
 * </ul>
 */
public final class Message
{
    private final MessageType type;
    private final long serial;
    private final Long replySerial;
    private final String sender;
    private final String destination;
    private final ObjectPath path;
    private final String interfaceName;
    private final String member;
    private final String errorName;
    private final TypeSignature signature;
    private final List<Object> body;

    private Message(Builder b) {
        this.type = Objects.requireNonNull(b.type, "type");
        this.serial = b.serial;
        this.replySerial = b.replySerial;
        this.sender = b.sender;
        this.destination = b.destination;
        this.path = b.path;
        this.interfaceName = b.interfaceName;
        this.member = b.member;
        this.errorName = b.errorName;
        this.signature = b.signature;
        this.body = List.copyOf(b.body);

        switch (type) {
            case METHOD_CALL -> require(path != null && member != null, "method call requires path and member");
            case METHOD_RETURN -> require(replySerial != null, "method return requires a reply serial");
            case ERROR -> require(replySerial != null && errorName != null, "error requires reply serial and error name");
            case SIGNAL -> require(path != null && interfaceName != null && member != null,
                    "signal requires path, interface and member");
        }
        if (!ValueShapes.conforms(signature, body)) {
            throw new IllegalArgumentException("Body does not conform to signature '" + signature + "'");
        }
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    public static Builder builder(MessageType type) {
        return new Builder(type);
    }

    public static Builder methodCall(ObjectPath path, String interfaceName, String member) {
        return builder(MessageType.METHOD_CALL).path(path).interfaceName(interfaceName).member(member);
    }

    public static Builder signal(ObjectPath path, String interfaceName, String member) {
        return builder(MessageType.SIGNAL).path(path).interfaceName(interfaceName).member(member);
    }

    /**
     * Reply to {@code call} carrying {@code body}; addressed back to the caller.
     */
    public static Message methodReturn(Message call, TypeSignature signature, List<?> body) {
        return builder(MessageType.METHOD_RETURN)
                .replySerial(call.serial())
                .destination(call.sender)
                .body(signature, body)
                .build();
    }

    /**
     * Error reply to {@code call}; the body is the human-readable description.
     */
    public static Message error(Message call, String errorName, String description) {
        return builder(MessageType.ERROR)
                .replySerial(call.serial())
                .destination(call.sender)
                .errorName(errorName)
                .body(TypeSignature.parse("s"), List.of(description))
                .build();
    }

    public MessageType type() {
        return type;
    }

    /** Transport-assigned serial; {@code 0} until the message is sent. */
    public long serial() {
        return serial;
    }

    public Optional<Long> replySerial() {
        return Optional.ofNullable(replySerial);
    }

    public Optional<String> sender() {
        return Optional.ofNullable(sender);
    }

    public Optional<String> destination() {
        return Optional.ofNullable(destination);
    }

    public Optional<ObjectPath> path() {
        return Optional.ofNullable(path);
    }

    public Optional<String> interfaceName() {
        return Optional.ofNullable(interfaceName);
    }

    public Optional<String> member() {
        return Optional.ofNullable(member);
    }

    public Optional<String> errorName() {
        return Optional.ofNullable(errorName);
    }

    public TypeSignature signature() {
        return signature;
    }

    public List<Object> body() {
        return body;
    }

    /** First string of an error body, if any. */
    public Optional<String> errorMessage() {
        if (type == MessageType.ERROR && !body.isEmpty() && body.get(0) instanceof String s) {
            return Optional.of(s);
        }
        return Optional.empty();
    }

    public Message withSerial(long serial) {
        return toBuilder().serial(serial).build();
    }

    public Message withSender(String sender) {
        return toBuilder().sender(sender).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(type);
        b.serial = serial;
        b.replySerial = replySerial;
        b.sender = sender;
        b.destination = destination;
        b.path = path;
        b.interfaceName = interfaceName;
        b.member = member;
        b.errorName = errorName;
        b.signature = signature;
        b.body = body;
        return b;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Message{").append(type).append(" serial=").append(serial);
        if (replySerial != null) sb.append(" replySerial=").append(replySerial);
        if (sender != null) sb.append(" sender=").append(sender);
        if (destination != null) sb.append(" destination=").append(destination);
        if (path != null) sb.append(" path=").append(path);
        if (interfaceName != null) sb.append(" interface=").append(interfaceName);
        if (member != null) sb.append(" member=").append(member);
        if (errorName != null) sb.append(" error=").append(errorName);
        return sb.append(" signature='").append(signature).append("'}").toString();
    }

    public static final class Builder
    {
        private final MessageType type;
        private long serial;
        private Long replySerial;
        private String sender;
        private String destination;
        private ObjectPath path;
        private String interfaceName;
        private String member;
        private String errorName;
        private TypeSignature signature = TypeSignature.EMPTY;
        private List<?> body = List.of();

        private Builder(MessageType type) {
            this.type = type;
        }

        public Builder serial(long serial) {
            this.serial = serial;
            return this;
        }

        public Builder replySerial(long replySerial) {
            this.replySerial = replySerial;
            return this;
        }

        public Builder sender(String sender) {
            this.sender = sender;
            return this;
        }

        public Builder destination(String destination) {
            this.destination = destination;
            return this;
        }

        public Builder path(ObjectPath path) {
            this.path = path;
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

        public Builder errorName(String errorName) {
            this.errorName = errorName;
            return this;
        }

        public Builder body(TypeSignature signature, List<?> body) {
            this.signature = Objects.requireNonNull(signature, "signature");
            this.body = Objects.requireNonNull(body, "body");
            return this;
        }

        public Builder body(String signature, Object... values) {
            return body(TypeSignature.parse(signature), List.of(values));
        }

        public Message build() {
            return new Message(this);
        }
    }
}
