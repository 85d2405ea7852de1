package com.questrail.radarlink.protocol.icd.internal.state;

import com.questrail.radarlink.protocol.icd.config.ProtocolRevision;
import com.questrail.radarlink.protocol.icd.config.SessionPolicy;
import com.questrail.radarlink.protocol.icd.internal.events.ChannelEvent;
import com.questrail.radarlink.protocol.icd.internal.events.MessageEvent;
import com.questrail.radarlink.protocol.icd.internal.events.SessionEvent;
import com.questrail.radarlink.protocol.icd.internal.events.TimerEvent;
import com.questrail.radarlink.protocol.icd.model.DecodeError;
import com.questrail.radarlink.protocol.icd.model.DecodeErrorKind;
import com.questrail.radarlink.protocol.icd.model.MessageHeader;
import com.questrail.radarlink.protocol.icd.model.MessageKind;
import com.questrail.radarlink.protocol.icd.model.RadarMessage;
import com.questrail.radarlink.protocol.icd.model.SensorPosition;
import com.questrail.radarlink.protocol.icd.model.SingleTargetExtended;
import com.questrail.radarlink.protocol.icd.model.SingleTargetReport;
import com.questrail.radarlink.protocol.icd.model.SystemMotion;
import com.questrail.radarlink.protocol.icd.model.SystemStatus;
import com.questrail.radarlink.protocol.icd.model.TargetReport;

import java.time.Instant;
import java.util.Objects;

/**
 * SessionReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for the C2 side of a radar link.
 *
 * <p>Given a prior {@link LinkSessionState} and a single {@link SessionEvent},
 * the reducer computes a new state and the {@link SessionIntents} the caller
 * must carry out. It performs no I/O and arms no timers.</p>
 *
 * <h2>Status handling</h2>
 * Every status report, including one whose payload was too short to decode,
 * increments the status counter. Then, in order:
 * <ol>
 *   <li>every {@code acknowledgeEvery}-th report is acknowledged with its own
 *       header sequence number;</li>
 *   <li>a decoded operational radar state moves the session to
 *       {@link LinkPhase#OPERATE}; a decoded standby state confirms a pending
 *       standby request;</li>
 *   <li>the counter thresholds request standby, then operate.</li>
 * </ol>
 */
public final class SessionReducer
{
    /**
     * Result of applying an event to a session state.
     *
     * @param newState the updated session state
     * @param intents  actions to be executed by the caller
     */
    public record Result(LinkSessionState newState, SessionIntents intents) {}

    private final SessionPolicy policy;
    private final ProtocolRevision revision;

    public SessionReducer(SessionPolicy policy, ProtocolRevision revision) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.revision = Objects.requireNonNull(revision, "revision");
    }

    /**
     * Applies a single event to the current session state.
     *
     * @param state the current state (must not be {@code null})
     * @param event the event to apply (must not be {@code null})
     * @return the resulting state and intents
     */
    public Result apply(LinkSessionState state, SessionEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof ChannelEvent.ChannelUp e) {
            return onChannelUp(state, e);
        }

        // Nothing but a channel-up moves a disconnected session.
        if (state.phase() == LinkPhase.DISCONNECTED) {
            return unchanged(state);
        }

        if (event instanceof ChannelEvent.ChannelDown e) {
            return onChannelDown(state, e);
        }
        if (event instanceof TimerEvent.HeartbeatDue) {
            return new Result(state, SessionIntents.sendKeepAlive());
        }
        if (event instanceof MessageEvent.MessageReceived e) {
            return onMessageReceived(state, e);
        }
        if (event instanceof MessageEvent.DecodeFailed e) {
            return onDecodeFailed(state, e);
        }

        return unchanged(state);
    }

    // ---------------------------------------------------------------------
    // Event handlers
    // ---------------------------------------------------------------------

    private Result onChannelUp(LinkSessionState state, ChannelEvent.ChannelUp e) {
        LinkSessionState newState = state.reset(LinkPhase.CONNECTED, e.timestamp());
        return new Result(newState, SessionIntents.startHeartbeat().and(SessionIntents.sendKeepAlive()));
    }

    private Result onChannelDown(LinkSessionState state, ChannelEvent.ChannelDown e) {
        LinkSessionState newState = state.reset(LinkPhase.DISCONNECTED, e.timestamp());
        return new Result(newState, SessionIntents.stopHeartbeat());
    }

    private Result onMessageReceived(LinkSessionState state, MessageEvent.MessageReceived e) {
        RadarMessage body = e.message().body();

        if (body instanceof SystemStatus status) {
            return onStatus(state, e.message().header(), status, e.timestamp());
        }
        if (isDataMessage(body)) {
            return new Result(state.withDataMessageCount(state.dataMessageCount() + 1), SessionIntents.none());
        }
        // Keep-alives and acknowledgements from the radar, generic payloads.
        return unchanged(state);
    }

    private Result onDecodeFailed(LinkSessionState state, MessageEvent.DecodeFailed e) {
        DecodeError error = e.error();
        if (error.kind() == DecodeErrorKind.INSUFFICIENT_PAYLOAD
                && error.messageKind().filter(k -> k == MessageKind.SYSTEM_STATUS).isPresent()
                && error.header().isPresent()) {
            return onStatus(state, error.header().get(), null, e.timestamp());
        }
        return unchanged(state);
    }

    /**
     * @param status decoded report, or {@code null} when the payload was too short
     */
    private Result onStatus(LinkSessionState state, MessageHeader header, SystemStatus status, Instant now) {
        long count = state.statusCount() + 1;
        LinkSessionState next = state.withStatusCount(count);
        if (status != null) {
            next = next.withLastStatus(status);
        }

        SessionIntents.Builder intents = SessionIntents.builder();

        if (count % policy.acknowledgeEvery() == 0) {
            intents.acknowledge(header.sequenceNumber());
        }

        if (status != null) {
            long radarState = status.radarState();
            if (revision.isOperationalStatus(radarState)) {
                next = next.withPhase(LinkPhase.OPERATE, now);
            } else if (radarState == revision.standbyStatusCode()
                    && next.phase() == LinkPhase.STANDBY_REQUESTED) {
                next = next.withPhase(LinkPhase.STANDBY, now);
            }
        }

        LinkPhase phase = next.phase();
        if (phase == LinkPhase.CONNECTED && count >= policy.standbyThreshold()) {
            next = next.withPhase(LinkPhase.STANDBY_REQUESTED, now);
            intents.add(SessionIntents.Kind.REQUEST_STANDBY);
        } else if ((phase == LinkPhase.STANDBY_REQUESTED || phase == LinkPhase.STANDBY)
                && count >= policy.operateThreshold()) {
            next = next.withPhase(LinkPhase.OPERATE_REQUESTED, now);
            intents.add(SessionIntents.Kind.REQUEST_OPERATE);
        }

        return new Result(next, intents.build());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static boolean isDataMessage(RadarMessage body) {
        return body instanceof TargetReport
                || body instanceof SingleTargetReport
                || body instanceof SingleTargetExtended
                || body instanceof SensorPosition
                || body instanceof SystemMotion;
    }

    private static Result unchanged(LinkSessionState state) {
        return new Result(state, SessionIntents.none());
    }
}
