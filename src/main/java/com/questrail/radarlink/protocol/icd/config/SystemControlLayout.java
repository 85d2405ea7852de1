package com.questrail.radarlink.protocol.icd.config;

import java.util.Arrays;

/**
 * SystemControlLayout
 * -----------------------------------------------------------------------------
 * Byte offsets and total size of the system control payload.
 *
 * <p>Radar builds disagree on this layout, so it is configuration data rather
 * than code. Every field is a little-endian u32 at the given offset; bytes not
 * covered by a field are spare and encoded as zero.</p>
 *
 * <ul>
 *   <li>{@link #ICD_40}: 40 bytes, frequency index at 16, 20 spare bytes.</li>
 *   <li>{@link #WIDE_44}: 44 bytes, frequency index at 20.</li>
 * </ul>
 */
public record SystemControlLayout(
        String name,
        int radarStateOffset,
        int missionCategoryOffset,
        int sensorControlsOffset,
        int radarControlsOffset,
        int frequencyIndexOffset,
        int payloadSize
) {
    private static final int FIELD_SIZE = 4;

    public static final SystemControlLayout ICD_40 =
            new SystemControlLayout("ICD-40", 0, 4, 8, 12, 16, 40);

    public static final SystemControlLayout WIDE_44 =
            new SystemControlLayout("WIDE-44", 0, 4, 8, 12, 20, 44);

    public SystemControlLayout {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be non-blank");
        }

        int[] offsets = {
                radarStateOffset, missionCategoryOffset, sensorControlsOffset,
                radarControlsOffset, frequencyIndexOffset
        };
        for (int offset : offsets) {
            if (offset < 0 || offset + FIELD_SIZE > payloadSize) {
                throw new IllegalArgumentException(
                        "Field offset " + offset + " does not fit in " + payloadSize + "-byte payload");
            }
        }

        int[] sorted = offsets.clone();
        Arrays.sort(sorted);
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i] - sorted[i - 1] < FIELD_SIZE) {
                throw new IllegalArgumentException("Control fields overlap at offset " + sorted[i]);
            }
        }
    }
}
