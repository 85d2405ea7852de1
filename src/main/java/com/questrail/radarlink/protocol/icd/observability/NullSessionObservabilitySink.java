package com.questrail.radarlink.protocol.icd.observability;

/**
 * No-op implementation of SessionObservabilitySink.
 */
public final class NullSessionObservabilitySink implements SessionObservabilitySink {
    public static final NullSessionObservabilitySink INSTANCE = new NullSessionObservabilitySink();

    private NullSessionObservabilitySink() {}

    @Override
    public void onStateTransition(SessionTransitionEvent event) {}

    @Override
    public void onDecodeFailure(DecodeFailureEvent event) {}

    @Override
    public void onHeaderWarning(HeaderWarningEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(SessionErrorEvent event) {}
}
