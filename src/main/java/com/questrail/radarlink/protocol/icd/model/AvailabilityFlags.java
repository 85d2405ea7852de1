package com.questrail.radarlink.protocol.icd.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Availability flag byte of extended target data.
 *
 * <p>
 * Every optional triple in the target record is always physically present on
 * the wire. A clear bit only means the sender did not fill that triple in;
 * it never changes where the following fields sit.
 * </p>
 */
public record AvailabilityFlags(int bits)
{
    public enum Field {
        CARTESIAN_LOCATION(0),
        CARTESIAN_VELOCITY(1),
        POLAR_LOCATION(2),
        POLAR_VELOCITY(3),
        GEO_LOCATION(4),
        ABSOLUTE_VELOCITY(5),
        CARTESIAN_VARIANCE(6);

        private final int bit;

        Field(int bit) {
            this.bit = bit;
        }

        public int mask() {
            return 1 << bit;
        }
    }

    public static final AvailabilityFlags NONE = new AvailabilityFlags(0);

    public AvailabilityFlags {
        if (bits < 0 || bits > 0xFF) {
            throw new IllegalArgumentException("flags must fit in one byte: " + bits);
        }
    }

    public static AvailabilityFlags of(Field... fields) {
        int bits = 0;
        for (Field f : fields) {
            bits |= f.mask();
        }
        return new AvailabilityFlags(bits);
    }

    public boolean isSet(Field field) {
        return (bits & field.mask()) != 0;
    }

    public Set<Field> fields() {
        EnumSet<Field> set = EnumSet.noneOf(Field.class);
        for (Field f : Field.values()) {
            if (isSet(f)) {
                set.add(f);
            }
        }
        return set;
    }
}
