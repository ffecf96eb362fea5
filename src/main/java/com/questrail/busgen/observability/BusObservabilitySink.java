package com.questrail.busgen.observability;

/**
 * Receives runtime events from proxies, signal subscriptions and dispatchers.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface BusObservabilitySink {
    /**
     * Called when a proxy call fails.
     * @param event the failed call
     */
    void onCallFailed(CallFailedEvent event);

    /**
     * Called when a matched signal carries a body of the wrong shape.
     * @param event the decode failure
     */
    void onSignalDecodeFailed(SignalDecodeFailedEvent event);

    /**
     * Called when a dispatcher answers a call with an error reply.
     * @param event the dispatch error
     */
    void onDispatchError(DispatchErrorEvent event);

    /**
     * Called when a dispatcher property setter stored a new value.
     * @param event the property change
     */
    void onPropertyChanged(PropertyChangedEvent event);
}
