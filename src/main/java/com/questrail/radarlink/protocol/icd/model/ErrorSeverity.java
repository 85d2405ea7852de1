package com.questrail.radarlink.protocol.icd.model;

/**
 * Severity band of a status error code.
 *
 * <ul>
 *   <li>{@code 0}: no error</li>
 *   <li>{@code 1..99}: warning</li>
 *   <li>{@code 100..199}: error</li>
 *   <li>anything higher: critical</li>
 * </ul>
 */
public enum ErrorSeverity
{
    NONE,
    WARNING,
    ERROR,
    CRITICAL;

    public static ErrorSeverity classify(long errorCode) {
        if (errorCode == 0) {
            return NONE;
        }
        if (errorCode < 100) {
            return WARNING;
        }
        if (errorCode < 200) {
            return ERROR;
        }
        return CRITICAL;
    }
}
