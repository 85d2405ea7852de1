package com.questrail.radarlink.protocol.icd.transport.tcp;

import com.questrail.radarlink.protocol.icd.config.ControlParameters;
import com.questrail.radarlink.protocol.icd.config.ProtocolRevision;
import com.questrail.radarlink.protocol.icd.internal.exec.SessionIntentExecutor;
import com.questrail.radarlink.protocol.icd.internal.state.SessionIntents;
import com.questrail.radarlink.protocol.icd.model.Acknowledge;
import com.questrail.radarlink.protocol.icd.model.KeepAlive;
import com.questrail.radarlink.protocol.icd.model.SystemControl;

import java.util.Objects;

/**
 * TcpSessionIntentExecutor
 * =============================================================================
 * Turns session intents into outbound messages on the TCP channel.
 *
 * <pre>
 *   SessionReducer
 *      ↓ emits
 *   SessionIntents
 *      ↓ consumed by
 *   TcpSessionIntentExecutor   (this class)
 *      ↓
 *   StreamTransportAdapter.send(RadarMessage)
 * </pre>
 *
 * <p>Within one intent set, messages go out in a fixed order: keep-alive,
 * acknowledgement, then any control request. The radar sees the
 * acknowledgement of a status report before the control it triggered.</p>
 *
 * <p>Heartbeat start and stop are timer concerns handled by
 * {@link com.questrail.radarlink.protocol.icd.internal.exec.TimedSessionIntentExecutor};
 * this class ignores them.</p>
 */
public final class TcpSessionIntentExecutor implements SessionIntentExecutor
{
    private final StreamTransportAdapter transport;
    private final ProtocolRevision revision;
    private final ControlParameters controlParameters;

    public TcpSessionIntentExecutor(StreamTransportAdapter transport,
                                    ProtocolRevision revision,
                                    ControlParameters controlParameters)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.revision = Objects.requireNonNull(revision, "revision");
        this.controlParameters = Objects.requireNonNull(controlParameters, "controlParameters");
    }

    @Override
    public void execute(SessionIntents intents)
    {
        Objects.requireNonNull(intents, "intents");

        if (intents.isEmpty()) {
            return;
        }

        if (intents.contains(SessionIntents.Kind.SEND_KEEP_ALIVE)) {
            transport.send(KeepAlive.empty());
        }

        if (intents.contains(SessionIntents.Kind.SEND_ACKNOWLEDGE)) {
            long seq = intents.acknowledgeSequence()
                    .orElseThrow(() -> new IllegalStateException("SEND_ACKNOWLEDGE without a sequence number"));
            transport.send(new Acknowledge(seq));
        }

        if (intents.contains(SessionIntents.Kind.REQUEST_STANDBY)) {
            transport.send(control(revision.standbyControlCode()));
        }

        if (intents.contains(SessionIntents.Kind.REQUEST_OPERATE)) {
            transport.send(control(revision.operateControlCode()));
        }
    }

    private SystemControl control(long radarStateCode)
    {
        return new SystemControl(
                radarStateCode,
                controlParameters.missionCategory(),
                controlParameters.sensorControls(),
                controlParameters.radarControls(),
                controlParameters.frequencyIndex());
    }
}
