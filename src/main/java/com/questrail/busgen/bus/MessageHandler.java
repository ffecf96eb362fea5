package com.questrail.busgen.bus;

/**
 * MessageHandler
 * -----------------------------------------------------------------------------
 * Server-side port: receives the method calls addressed to a connection.
 *
 * <p>The handler answers through {@code connection}, normally with exactly one
 * {@link Message#methodReturn} or {@link Message#error} reply per call.</p>
 */
@FunctionalInterface
public interface MessageHandler
{
    void handle(Message call, BusConnection connection);
}
