/**
 * ICD Codec Implementation
 * =============================================================================
 *
 * <p>Concrete header codec, message decoder and encoder, and the stream
 * framer.</p>
 *
 * <pre>
 *   byte[] chunk
 *        → MessageFramer.feed          (length-delimited reassembly, desync skip)
 *        → MessageHeaderCodec.decode   (field order per HeaderFieldOrder)
 *        → MessageRegistry lookup      (catalog id → kind → payload codec)
 *        → PayloadCodec.decode
 *        → DecodedMessage
 * </pre>
 *
 * <p>All multi-byte fields are little-endian. Unsigned 32-bit fields are
 * widened to {@code long} on decode and range-checked on construction of the
 * model values.</p>
 */
package com.questrail.radarlink.protocol.icd.codec.impl;
