package com.questrail.radarlink.protocol.icd.observability;

/**
 * Receives observability events from a radar link session.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface SessionObservabilitySink {
    /**
     * Called after every processed session event, whether or not the phase changed.
     */
    void onStateTransition(SessionTransitionEvent event);

    /**
     * Called when a framed message could not be decoded or the stream lost
     * framing. Such failures never stop the session.
     */
    void onDecodeFailure(DecodeFailureEvent event);

    /**
     * Called when a message decoded with length warnings.
     */
    void onHeaderWarning(HeaderWarningEvent event);

    /**
     * Called when the channel comes up or goes down.
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an unexpected exception escapes event processing.
     */
    void onError(SessionErrorEvent event);
}
