package com.questrail.radarlink.protocol.icd.config;

import com.questrail.radarlink.protocol.icd.codec.impl.HeaderFieldOrder;
import com.questrail.radarlink.protocol.icd.model.RadarStatusState;

import java.util.Objects;
import java.util.Set;

/**
 * ProtocolRevision
 * -----------------------------------------------------------------------------
 * Bundle of the wire and code-space choices that differ between radar builds.
 *
 * <ul>
 *   <li><b>headerOrder</b>: field order of the 20-byte header.</li>
 *   <li><b>controlLayout</b>: layout of the system control payload.</li>
 *   <li><b>standbyControlCode / operateControlCode</b>: radar state values the
 *       C2 writes into a system control request.</li>
 *   <li><b>operationalStatusCodes</b>: radar state values in a status report
 *       that mean the radar is operating.</li>
 *   <li><b>standbyStatusCode</b>: radar state value in a status report that
 *       confirms standby.</li>
 * </ul>
 *
 * <p>Control codes and status codes are separate code spaces: the radar
 * acknowledges an OPERATE control (4) by reporting OPERATIONAL (2).</p>
 */
public record ProtocolRevision(
        String name,
        HeaderFieldOrder headerOrder,
        SystemControlLayout controlLayout,
        long standbyControlCode,
        long operateControlCode,
        Set<Long> operationalStatusCodes,
        long standbyStatusCode
) {
    public static final long STANDBY_CONTROL_CODE = 2;
    public static final long OPERATE_CONTROL_CODE = 4;

    public ProtocolRevision {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be non-blank");
        }
        Objects.requireNonNull(headerOrder, "headerOrder");
        Objects.requireNonNull(controlLayout, "controlLayout");
        operationalStatusCodes = Set.copyOf(Objects.requireNonNull(operationalStatusCodes, "operationalStatusCodes"));
        if (operationalStatusCodes.isEmpty()) {
            throw new IllegalArgumentException("operationalStatusCodes must not be empty");
        }
        if (standbyControlCode == operateControlCode) {
            throw new IllegalArgumentException("standby and operate control codes must differ");
        }
    }

    /**
     * The revision deployed radar controllers speak: source-first header,
     * 40-byte control payload.
     */
    public static ProtocolRevision icd() {
        return new ProtocolRevision(
                "ICD-2135M-004",
                HeaderFieldOrder.SOURCE_FIRST,
                SystemControlLayout.ICD_40,
                STANDBY_CONTROL_CODE,
                OPERATE_CONTROL_CODE,
                Set.of(RadarStatusState.OPERATIONAL.code()),
                RadarStatusState.STANDBY.code());
    }

    /**
     * The later engineering revision: source-last header, 44-byte control payload.
     */
    public static ProtocolRevision engineering() {
        return new ProtocolRevision(
                "ICD-2135M-004-ENG",
                HeaderFieldOrder.SOURCE_LAST,
                SystemControlLayout.WIDE_44,
                STANDBY_CONTROL_CODE,
                OPERATE_CONTROL_CODE,
                Set.of(RadarStatusState.OPERATIONAL.code()),
                RadarStatusState.STANDBY.code());
    }

    public boolean isOperationalStatus(long radarState) {
        return operationalStatusCodes.contains(radarState);
    }
}
