package com.questrail.busgen.signal;

import java.util.Objects;

/**
 * Outcome of decoding a matched signal. A message that did not match produces
 * no result at all, so "not our signal" and "our signal, bad payload" stay
 * distinguishable.
 */
public sealed interface DecodeResult
        permits DecodeResult.Decoded, DecodeResult.DecodeFailed
{
    record Decoded(SignalArgs args) implements DecodeResult {
        public Decoded {
            Objects.requireNonNull(args, "args");
        }
    }

    record DecodeFailed(SignalDecodeException error) implements DecodeResult {
        public DecodeFailed {
            Objects.requireNonNull(error, "error");
        }
    }
}
