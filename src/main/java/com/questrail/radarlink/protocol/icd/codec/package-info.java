/**
 * ICD Codec Boundary
 * =============================================================================
 *
 * <p>This package defines the <strong>codec interfaces</strong> of the C2 /
 * radar-controller link: the boundary between whole wire messages and their
 * semantic form.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte stream (TCP)
 *        → MessageFramer           (one complete message per emission)
 *            → RadarMessageDecoder (header, registry dispatch, payload decode)
 *                → DecodeResult    (DecodedMessage | DecodeError)
 *                    → session events
 *
 *   RadarMessage + MessageStamp
 *        → RadarMessageEncoder
 *            → byte[] (header + payload)
 * </pre>
 *
 * <h2>Error Model</h2>
 * <p>Nothing in this layer throws for malformed input. Short messages, short
 * payloads and stream desynchronisation are reported as
 * {@link com.questrail.radarlink.protocol.icd.model.DecodeError} values, and an
 * identifier without a structured decoder produces a
 * {@link com.questrail.radarlink.protocol.icd.model.GenericMessage}.</p>
 *
 * <h2>Configuration-Dependent Behavior</h2>
 * <p>Two aspects of the wire format vary between radar builds and are
 * therefore injected rather than hard-coded: the header field order and the
 * system control payload layout. Both are selected through the protocol
 * revision.</p>
 */
package com.questrail.radarlink.protocol.icd.codec;
