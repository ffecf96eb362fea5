package com.questrail.busgen.model;

import java.util.Optional;

/**
 * Indicates that an interface description is invalid: duplicate wire names,
 * conflicting property accessor types, signal arguments with an output
 * direction, invalid identifiers and similar construction-time defects.
 *
 * <p>The failure is fatal to the construction of one interface only; callers
 * processing several interfaces may continue with the siblings.</p>
 */
public final class ModelValidationException extends RuntimeException
{
    private final String interfaceName;
    private final String member;
    private final String reason;

    public ModelValidationException(String interfaceName, String member, String message) {
        super(format(interfaceName, member, message));
        this.interfaceName = interfaceName;
        this.member = member;
        this.reason = message;
    }

    public static ModelValidationException forMember(String member, String message) {
        return new ModelValidationException(null, member, message);
    }

    public static ModelValidationException forInterface(String interfaceName, String message) {
        return new ModelValidationException(interfaceName, null, message);
    }

    public Optional<String> interfaceName() {
        return Optional.ofNullable(interfaceName);
    }

    public Optional<String> member() {
        return Optional.ofNullable(member);
    }

    /** The failure description without the interface and member prefix. */
    public String reason() {
        return reason;
    }

    /**
     * Same failure attributed to {@code interfaceName}; used when a member
     * built on its own is added to an interface.
     */
    public ModelValidationException withInterface(String interfaceName) {
        ModelValidationException e = new ModelValidationException(interfaceName, member, reason);
        e.initCause(this);
        return e;
    }

    private static String format(String interfaceName, String member, String message) {
        StringBuilder sb = new StringBuilder();
        if (interfaceName != null) {
            sb.append("Interface '").append(interfaceName).append("': ");
        }
        if (member != null) {
            sb.append("Member '").append(member).append("': ");
        }
        return sb.append(message).toString();
    }
}
