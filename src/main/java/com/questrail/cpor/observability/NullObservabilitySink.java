package com.questrail.cpor.observability;

/**
 * No-op implementation of CporObservabilitySink.
 */
public final class NullObservabilitySink implements CporObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onKeyEvent(KeyLifecycleEvent event) {}

    @Override
    public void onStorageFallback(KeyStorageFallbackEvent event) {}

    @Override
    public void onFrameRejected(FrameRejectedEvent event) {}
}
