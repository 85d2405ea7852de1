package com.questrail.radarlink.protocol.icd.codec.impl;

import com.questrail.radarlink.protocol.icd.internal.codec.LittleEndianBuffers;
import com.questrail.radarlink.protocol.icd.model.DecodeError;
import com.questrail.radarlink.protocol.icd.model.MessageHeader;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * MessageFramer
 * -----------------------------------------------------------------------------
 * Reassembles complete messages from an arbitrarily chunked byte stream.
 *
 * <p>The stream carries back-to-back messages, each starting with a 20-byte
 * header whose length field gives the full message size. The framer:</p>
 * <ol>
 *   <li>Buffers input until a header is available</li>
 *   <li>Reads the declared length (using the configured field order)</li>
 *   <li>Waits for that many bytes, emits them, and continues with the rest</li>
 * </ol>
 *
 * <h2>Desynchronisation</h2>
 * A declared length below 20 or above the configured maximum cannot belong to
 * a real message. The framer then discards exactly one byte, reports a
 * {@code FRAMING_DESYNC} error to its listener, and tries again at the next
 * offset. Nothing is ever thrown.
 *
 * <h2>Threading</h2>
 * Not thread-safe. One framer belongs to one stream and is fed from that
 * stream's single inbound thread.
 */
public final class MessageFramer
{
    /** Default upper bound on a plausible message length. */
    public static final int DEFAULT_MAX_MESSAGE_LENGTH = 65_536;

    private final MessageHeaderCodec headerCodec;
    private final int maxMessageLength;
    private final Consumer<DecodeError> desyncListener;

    private byte[] buffer = new byte[1024];
    private int start;
    private int end;
    private long desyncCount;

    public MessageFramer(MessageHeaderCodec headerCodec,
                         int maxMessageLength,
                         Consumer<DecodeError> desyncListener)
    {
        this.headerCodec = Objects.requireNonNull(headerCodec, "headerCodec");
        if (maxMessageLength < MessageHeader.SIZE) {
            throw new IllegalArgumentException("maxMessageLength must be >= " + MessageHeader.SIZE);
        }
        this.maxMessageLength = maxMessageLength;
        this.desyncListener = Objects.requireNonNull(desyncListener, "desyncListener");
    }

    public MessageFramer(MessageHeaderCodec headerCodec) {
        this(headerCodec, DEFAULT_MAX_MESSAGE_LENGTH, error -> { });
    }

    /**
     * Appends {@code chunk} to the stream and returns every message it completes,
     * in stream order.
     */
    public List<byte[]> feed(byte[] chunk)
    {
        Objects.requireNonNull(chunk, "chunk");
        append(chunk);

        List<byte[]> messages = new ArrayList<>();
        ByteBuffer view = LittleEndianBuffers.reader(buffer);

        while (end - start >= MessageHeader.SIZE) {
            long declared = headerCodec.peekMessageLength(view, start);

            if (declared < MessageHeader.SIZE || declared > maxMessageLength) {
                byte[] discarded = { buffer[start] };
                start++;
                desyncCount++;
                desyncListener.accept(DecodeError.framingDesync(declared, discarded));
                continue;
            }

            if (end - start < declared) {
                break;
            }

            int length = (int) declared;
            messages.add(Arrays.copyOfRange(buffer, start, start + length));
            start += length;
        }

        compact();
        return messages;
    }

    /**
     * Discards any partially received message. Called when the stream is lost
     * or the session is cancelled.
     */
    public void reset() {
        start = 0;
        end = 0;
    }

    /** Bytes held while waiting for the rest of a message. */
    public int bufferedBytes() {
        return end - start;
    }

    /** Number of bytes discarded for desynchronisation since construction. */
    public long desyncCount() {
        return desyncCount;
    }

    private void append(byte[] chunk) {
        if (end + chunk.length > buffer.length) {
            compact();
            if (end + chunk.length > buffer.length) {
                buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, end + chunk.length));
            }
        }
        System.arraycopy(chunk, 0, buffer, end, chunk.length);
        end += chunk.length;
    }

    private void compact() {
        if (start == 0) {
            return;
        }
        int remaining = end - start;
        System.arraycopy(buffer, start, buffer, 0, remaining);
        start = 0;
        end = remaining;
    }
}
