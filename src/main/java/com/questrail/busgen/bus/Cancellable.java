package com.questrail.busgen.bus;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a subscription.
 */
public interface Cancellable
{
    /**
     * Stop delivery.
     *
     * @return {@code true} if this call cancelled the subscription; {@code false}
     *         if it was already cancelled.
     */
    boolean cancel();
}
