package com.questrail.busgen.signal;

import com.questrail.busgen.bus.Message;
import com.questrail.busgen.model.SignalSpec;
import com.questrail.busgen.signature.TypeSignature;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * MatchedSignal
 * -----------------------------------------------------------------------------
 * A message whose identity matched a declared signal, with its arguments not
 * yet decoded.
 *
 * <p>Decoding happens on the first call to {@link #decode()} or {@link #args()}
 * and the outcome is kept. It compares the message's body signature with the
 * signal's declared one; a mismatch is a {@link DecodeResult.DecodeFailed}.</p>
 */
public final class MatchedSignal
{
    private final String interfaceName;
    private final SignalSpec signal;
    private final Message message;
    private final Consumer<SignalDecodeException> onFailure;
    private DecodeResult result;

    MatchedSignal(String interfaceName, SignalSpec signal, Message message, Consumer<SignalDecodeException> onFailure) {
        this.interfaceName = interfaceName;
        this.signal = signal;
        this.message = Objects.requireNonNull(message, "message");
        this.onFailure = onFailure;
    }

    public Message message() {
        return message;
    }

    public SignalSpec signal() {
        return signal;
    }

    public synchronized DecodeResult decode() {
        if (result == null) {
            TypeSignature declared = signal.signature();
            if (declared.equals(message.signature())) {
                result = new DecodeResult.Decoded(new SignalArgs(signal, message.body()));
            } else {
                SignalDecodeException e = new SignalDecodeException(interfaceName, signal.wireName(),
                        declared, message.signature());
                result = new DecodeResult.DecodeFailed(e);
                onFailure.accept(e);
            }
        }
        return result;
    }

    /**
     * @throws SignalDecodeException if the body does not have the declared shape
     */
    public SignalArgs args() {
        DecodeResult r = decode();
        if (r instanceof DecodeResult.Decoded d) {
            return d.args();
        }
        throw ((DecodeResult.DecodeFailed) r).error();
    }
}
