package com.questrail.busgen.bus;

/**
 * Callback for messages selected by a {@link MatchRule}.
 *
 * <p>A connection delivers callbacks for one subscription serially, in arrival
 * order. Listeners must not block.</p>
 */
@FunctionalInterface
public interface MessageListener
{
    void onMessage(Message message);
}
