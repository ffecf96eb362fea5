package com.questrail.busgen.observability;

import java.time.Instant;

/**
 * A proxy call that completed with a failure: an error reply, a reply of the
 * wrong shape, or a transport failure.
 */
public record CallFailedEvent(
    Instant timestamp,
    String destination,
    String path,
    String interfaceName,
    String member,
    Throwable cause
) {
}
