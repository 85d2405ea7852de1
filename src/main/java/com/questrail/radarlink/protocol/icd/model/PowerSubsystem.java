package com.questrail.radarlink.protocol.icd.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Bits of the status power bitmask.
 */
public enum PowerSubsystem
{
    MAIN_POWER(0x01),
    BACKUP_POWER(0x02),
    TRANSMITTER(0x04),
    RECEIVER(0x08),
    ANTENNA_DRIVE(0x10),
    PROCESSING_UNIT(0x20);

    private final int mask;

    PowerSubsystem(int mask) {
        this.mask = mask;
    }

    public int mask() {
        return mask;
    }

    /**
     * Subsystems whose bit is set in {@code powerStatus}. Unknown bits are ignored.
     */
    public static Set<PowerSubsystem> fromBitmask(long powerStatus) {
        EnumSet<PowerSubsystem> on = EnumSet.noneOf(PowerSubsystem.class);
        for (PowerSubsystem p : values()) {
            if ((powerStatus & p.mask) != 0) {
                on.add(p);
            }
        }
        return on;
    }
}
