package com.questrail.cpor.observability;

/**
 * Receives observability events from the CPOR core.
 * Implementations can provide logging, metrics, or auditing.
 */
public interface CporObservabilitySink {
    /**
     * Called when a key is generated or deleted.
     * @param event the lifecycle event
     */
    void onKeyEvent(KeyLifecycleEvent event);

    /**
     * Called when hardware-backed storage was requested but software storage
     * was used instead.
     * @param event the fallback details
     */
    void onStorageFallback(KeyStorageFallbackEvent event);

    /**
     * Called when an inbound frame is dropped as undecodable or invalid.
     * @param event the rejection details
     */
    void onFrameRejected(FrameRejectedEvent event);
}
