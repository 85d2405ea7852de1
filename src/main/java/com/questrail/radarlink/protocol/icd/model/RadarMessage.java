package com.questrail.radarlink.protocol.icd.model;

/**
 * Canonical semantic representation of an ICD message body.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code RadarMessage} is the decoded payload of one message on the C2 /
 * radar-controller link. The session state machine, listeners and tests reason
 * about these values only; byte order, field offsets and the header layout are
 * resolved strictly below this level.
 * </p>
 *
 * <p>
 * The set of variants is closed. Identifiers that the catalog does not map to a
 * structured decoder arrive as {@link GenericMessage}, so decoding an unknown
 * message type never fails.
 * </p>
 *
 * <p>
 * Header information (source, sequence number, time tag) is deliberately not
 * part of the body; it travels alongside in {@link DecodedMessage}.
 * </p>
 */
public sealed interface RadarMessage
        permits KeepAlive, SystemControl, SystemStatus, Acknowledge,
                TargetReport, SingleTargetReport, SingleTargetExtended,
                SystemMotion, SensorPosition, GenericMessage
{
}
