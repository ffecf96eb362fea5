package com.questrail.busgen.observability;

import java.time.Instant;

/**
 * A signal matched a subscription by identity but its body could not be
 * decoded against the declared argument signature.
 */
public record SignalDecodeFailedEvent(
    Instant timestamp,
    String interfaceName,
    String member,
    String expectedSignature,
    String actualSignature
) {
}
