package com.questrail.busgen.signal;

import com.questrail.busgen.signature.TypeSignature;

/**
 * A message matched a signal's identity but its body does not have the
 * declared argument signature. Typically a misbehaving or incompatible sender.
 */
public final class SignalDecodeException extends RuntimeException
{
    private final String interfaceName;
    private final String member;
    private final TypeSignature expected;
    private final TypeSignature actual;

    public SignalDecodeException(String interfaceName, String member, TypeSignature expected, TypeSignature actual) {
        super("Signal " + interfaceName + "." + member + " declares body '" + expected
                + "' but the message carries '" + actual + "'");
        this.interfaceName = interfaceName;
        this.member = member;
        this.expected = expected;
        this.actual = actual;
    }

    public String interfaceName() {
        return interfaceName;
    }

    public String member() {
        return member;
    }

    public TypeSignature expected() {
        return expected;
    }

    public TypeSignature actual() {
        return actual;
    }
}
