package com.questrail.busgen.observability;

import java.time.Instant;

/**
 * An inbound method call answered with an error reply.
 */
public record DispatchErrorEvent(
    Instant timestamp,
    String path,
    String interfaceName,
    String member,
    String errorName,
    String message,
    Throwable cause
) {
}
