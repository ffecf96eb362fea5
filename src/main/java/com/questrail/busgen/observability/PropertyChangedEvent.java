package com.questrail.busgen.observability;

import com.questrail.busgen.model.ChangeNotify;

import java.time.Instant;

/**
 * A property was set through a dispatcher. {@code notification} is the policy
 * that decided what, if anything, was emitted.
 */
public record PropertyChangedEvent(
    Instant timestamp,
    String path,
    String interfaceName,
    String property,
    ChangeNotify notification
) {
}
