package com.questrail.busgen.bus;

import java.util.concurrent.CompletableFuture;

/**
 * BusConnection
 * -----------------------------------------------------------------------------
 * The transport capability that proxies and dispatchers are handed. They never
 * create, own or close it.
 *
 * <p>All operations are asynchronous. Replies are correlated to calls by serial,
 * not by order: replies to concurrent calls may complete in any order.</p>
 *
 * <p>Implementations may be backed by a socket transport, by a subprocess
 * bridge, or by the in-process {@link LocalBus}.</p>
 */
public interface BusConnection
{
    /** Unique name of this connection on the bus, e.g. {@code :1.42}. */
    String uniqueName();

    /**
     * Send a message without awaiting a reply. The transport assigns the serial
     * and the sender.
     *
     * @return completes once the message is handed to the bus; completes
     *         exceptionally on transport failure
     */
    CompletableFuture<Void> send(Message message);

    /**
     * Send a method call and await its reply.
     *
     * @return completes with the {@link MessageType#METHOD_RETURN} or
     *         {@link MessageType#ERROR} reply; completes exceptionally on
     *         transport failure
     */
    CompletableFuture<Message> call(Message methodCall);

    /**
     * Deliver inbound messages selected by {@code rule} to {@code listener}
     * until the returned handle is cancelled.
     */
    Cancellable subscribe(MatchRule rule, MessageListener listener);
}
