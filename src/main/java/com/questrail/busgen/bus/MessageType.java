package com.questrail.busgen.bus;

public enum MessageType
{
    METHOD_CALL("method_call"),
    METHOD_RETURN("method_return"),
    ERROR("error"),
    SIGNAL("signal");

    private final String matchName;

    MessageType(String matchName) {
        this.matchName = matchName;
    }

    /** Name used for this type in match rules, e.g. {@code signal}. */
    public String matchName() {
        return matchName;
    }
}
