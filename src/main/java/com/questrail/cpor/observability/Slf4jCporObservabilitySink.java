package com.questrail.cpor.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CporObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCporObservabilitySink implements CporObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCporObservabilitySink.class);

    @Override
    public void onKeyEvent(KeyLifecycleEvent event) {
        log.info("CPOR key {}: {} ({} storage)",
            event.action() == KeyLifecycleEvent.Action.GENERATED ? "generated" : "deleted",
            event.keyId(),
            event.storage());
    }

    @Override
    public void onStorageFallback(KeyStorageFallbackEvent event) {
        log.warn("CPOR key {}: {} storage not available, falling back to {} storage",
            event.keyId(),
            event.requested(),
            event.actual());
    }

    @Override
    public void onFrameRejected(FrameRejectedEvent event) {
        log.warn("CPOR frame dropped ({} bytes): {}", event.frameLength(), event.reason(), event.cause());
    }
}
