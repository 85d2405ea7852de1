package com.questrail.radarlink.protocol.icd.observability;

import com.questrail.radarlink.protocol.icd.model.DecodeErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SessionObservabilitySink that emits logs via SLF4J.
 *
 * <p>Phase changes and channel lifecycle log at INFO, individual reducer steps
 * at DEBUG. Framing desync and length mismatches log at WARN.</p>
 */
public final class Slf4jSessionObservabilitySink implements SessionObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSessionObservabilitySink.class);

    @Override
    public void onStateTransition(SessionTransitionEvent event) {
        if (event.isPhaseChange()) {
            log.info("Radar link phase: {} -> {} (status reports: {})",
                event.oldState().phase(),
                event.newState().phase(),
                event.newState().statusCount());
        }
        if (log.isDebugEnabled() && !event.resultingIntents().isEmpty()) {
            log.debug("Radar link {} -> {}",
                event.triggeringEvent().getClass().getSimpleName(),
                event.resultingIntents());
        }
    }

    @Override
    public void onDecodeFailure(DecodeFailureEvent event) {
        if (event.error().kind() == DecodeErrorKind.FRAMING_DESYNC) {
            log.warn("Radar link framing desync: {}", event.error().reason());
        } else {
            log.info("Radar link decode failure: {}", event.error());
        }
    }

    @Override
    public void onHeaderWarning(HeaderWarningEvent event) {
        log.warn("Radar link length mismatch on {} (declared {} bytes): {}",
            event.message().body().getClass().getSimpleName(),
            event.message().header().messageLength(),
            event.message().warnings());
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event.cause() != null) {
            log.warn("Radar link transport {}: {}", event.kind(), event.description(), event.cause());
        } else {
            log.info("Radar link transport {}: {}", event.kind(), event.description());
        }
    }

    @Override
    public void onError(SessionErrorEvent event) {
        log.error("Radar link error: {}", event.message(), event.cause());
    }
}
