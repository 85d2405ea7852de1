package com.questrail.radarlink.protocol.icd.model;

/**
 * Three IEEE-754 doubles as they appear in extended target, plot and motion
 * payloads. The meaning of each axis depends on the field that holds it.
 */
public record Vector3(double x, double y, double z)
{
    public static final Vector3 ZERO = new Vector3(0.0, 0.0, 0.0);

    /** Encoded size of one triple. */
    public static final int SIZE = 24;

    /**
     * Componentwise radians to degrees.
     */
    public Vector3 toDegrees() {
        return new Vector3(Math.toDegrees(x), Math.toDegrees(y), Math.toDegrees(z));
    }
}
