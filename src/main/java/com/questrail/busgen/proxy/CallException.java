package com.questrail.busgen.proxy;

import java.util.Optional;

/**
 * CallException
 * -----------------------------------------------------------------------------
 * Failure of a proxy call, delivered through the call's future.
 *
 * <ul>
 *   <li>{@link Kind#REMOTE_ERROR}: the peer answered with an error reply;
 *       {@link #errorName()} carries its D-Bus error name</li>
 *   <li>{@link Kind#TYPE_MISMATCH}: the reply body does not have the declared
 *       output signature</li>
 *   <li>{@link Kind#TRANSPORT}: the message could not be delivered or the
 *       connection failed before a reply arrived</li>
 * </ul>
 */
public final class CallException extends RuntimeException
{
    public enum Kind { REMOTE_ERROR, TYPE_MISMATCH, TRANSPORT }

    private final Kind kind;
    private final String interfaceName;
    private final String member;
    private final String errorName;

    private CallException(Kind kind, String interfaceName, String member, String errorName,
                          String message, Throwable cause) {
        super(interfaceName + "." + member + ": " + message, cause);
        this.kind = kind;
        this.interfaceName = interfaceName;
        this.member = member;
        this.errorName = errorName;
    }

    public static CallException remoteError(String interfaceName, String member, String errorName, String message) {
        return new CallException(Kind.REMOTE_ERROR, interfaceName, member, errorName,
                errorName + (message.isEmpty() ? "" : ": " + message), null);
    }

    public static CallException typeMismatch(String interfaceName, String member, String message) {
        return new CallException(Kind.TYPE_MISMATCH, interfaceName, member, null, message, null);
    }

    public static CallException typeMismatch(String interfaceName, String member, String message, Throwable cause) {
        return new CallException(Kind.TYPE_MISMATCH, interfaceName, member, null, message, cause);
    }

    public static CallException transport(String interfaceName, String member, Throwable cause) {
        return new CallException(Kind.TRANSPORT, interfaceName, member, null,
                "transport failure: " + cause.getMessage(), cause);
    }

    public Kind kind() {
        return kind;
    }

    public String interfaceName() {
        return interfaceName;
    }

    public String member() {
        return member;
    }

    /** D-Bus error name of a {@link Kind#REMOTE_ERROR}. */
    public Optional<String> errorName() {
        return Optional.ofNullable(errorName);
    }
}
