package com.questrail.busgen.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BusObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBusObservabilitySink implements BusObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBusObservabilitySink.class);

    @Override
    public void onCallFailed(CallFailedEvent event) {
        log.warn("Call {}.{} on {} {} failed: {}",
            event.interfaceName(),
            event.member(),
            event.destination(),
            event.path(),
            event.cause().getMessage());
    }

    @Override
    public void onSignalDecodeFailed(SignalDecodeFailedEvent event) {
        log.warn("Signal {}.{} carried '{}' where '{}' was declared",
            event.interfaceName(),
            event.member(),
            event.actualSignature(),
            event.expectedSignature());
    }

    @Override
    public void onDispatchError(DispatchErrorEvent event) {
        if (event.cause() != null) {
            log.error("Dispatch of {}.{} at {} failed with {}: {}",
                event.interfaceName(), event.member(), event.path(), event.errorName(), event.message(), event.cause());
        } else {
            log.info("Dispatch of {}.{} at {} rejected with {}: {}",
                event.interfaceName(), event.member(), event.path(), event.errorName(), event.message());
        }
    }

    @Override
    public void onPropertyChanged(PropertyChangedEvent event) {
        log.debug("Property {}.{} at {} changed (notify={})",
            event.interfaceName(), event.property(), event.path(), event.notification());
    }
}
