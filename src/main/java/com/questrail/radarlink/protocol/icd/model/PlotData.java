package com.questrail.radarlink.protocol.icd.model;

import java.util.Objects;

/**
 * The 176-byte plot (raw detection) record that follows {@link TargetData}
 * in a single-target-extended message.
 *
 * <pre>
 *   0   time          u64
 *   8   id            u32
 *   12  reserved      u32
 *   16  polarPosition 3 x f64 (elevation, azimuth, range)
 *   40  doppler       f64
 *   48  snr           f64
 *   56  polarSigma    3 x f64
 *   80  dopplerSigma  f64
 *   88  reserved      88 bytes
 * </pre>
 */
public record PlotData(
        long time,
        long id,
        Vector3 polarPosition,
        double doppler,
        double snr,
        Vector3 polarSigma,
        double dopplerSigma
) {
    /** Encoded size of the record. */
    public static final int SIZE = 176;

    public PlotData {
        MessageHeader.requireU32(id, "id");
        Objects.requireNonNull(polarPosition, "polarPosition");
        Objects.requireNonNull(polarSigma, "polarSigma");
    }
}
