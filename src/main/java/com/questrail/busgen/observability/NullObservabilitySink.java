package com.questrail.busgen.observability;

/**
 * No-op implementation of BusObservabilitySink.
 */
public final class NullObservabilitySink implements BusObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCallFailed(CallFailedEvent event) {}

    @Override
    public void onSignalDecodeFailed(SignalDecodeFailedEvent event) {}

    @Override
    public void onDispatchError(DispatchErrorEvent event) {}

    @Override
    public void onPropertyChanged(PropertyChangedEvent event) {}
}
