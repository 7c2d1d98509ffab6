package com.questrail.wirecalc.protocol.codec.impl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * EnvelopeFraming
 * -----------------------------------------------------------------------------
 * Length-prefix framing for envelopes on a byte stream.
 *
 * <p>Each envelope is written as a base-128 varint length (at most five bytes)
 * followed by that many body bytes, the layout protobuf uses for delimited
 * streams.</p>
 *
 * <p>{@link #split(byte[], int, int, int)} works on the bytes buffered so far.
 * A trailing envelope that has only partly arrived is left as residual for
 * the caller to keep and complete with the next read. Framing is lost only
 * when a prefix is malformed (no terminating byte within five bytes) or
 * declares an envelope larger than the caller can buffer; everything from
 * that point on is residual and cannot be resynchronised from.</p>
 */
public final class EnvelopeFraming
{
    static final int MAX_PREFIX_BYTES = 5;

    /**
     * Result of splitting a chunk of bytes.
     *
     * @param bodies        complete envelope bodies, in stream order
     * @param residualBytes trailing bytes that did not form a complete envelope
     * @param framingLost   {@code true} if the residual can never complete
     */
    public record Frames(List<byte[]> bodies, int residualBytes, boolean framingLost)
    {
        public Frames {
            bodies = List.copyOf(bodies);
            if (residualBytes < 0) {
                throw new IllegalArgumentException("residualBytes must be non-negative");
            }
        }
    }

    private EnvelopeFraming() {}

    /**
     * Prepends the length prefix to an envelope body.
     */
    public static byte[] frame(byte[] body)
    {
        Objects.requireNonNull(body, "body");

        byte[] prefix = new byte[MAX_PREFIX_BYTES];
        int n = 0;
        int v = body.length;
        while ((v & ~0x7F) != 0) {
            prefix[n++] = (byte) ((v & 0x7F) | 0x80);
            v >>>= 7;
        }
        prefix[n++] = (byte) v;

        byte[] framed = Arrays.copyOf(prefix, n + body.length);
        System.arraycopy(body, 0, framed, n, body.length);
        return framed;
    }

    /**
     * Splits {@code buffer[offset, offset + length)} into complete envelope bodies.
     *
     * @param maxEnvelopeBytes largest envelope (prefix plus body) the caller
     *                         can hold; a longer one marks framing as lost
     */
    public static Frames split(byte[] buffer, int offset, int length, int maxEnvelopeBytes)
    {
        Objects.requireNonNull(buffer, "buffer");
        Objects.checkFromIndexSize(offset, length, buffer.length);
        if (maxEnvelopeBytes < 1) {
            throw new IllegalArgumentException("maxEnvelopeBytes must be positive");
        }

        final int end = offset + length;
        final List<byte[]> bodies = new ArrayList<>();

        int pos = offset;
        while (pos < end) {
            final int envelopeStart = pos;

            long bodyLength = 0;
            int prefixBytes = 0;
            boolean prefixComplete = false;
            while (prefixBytes < MAX_PREFIX_BYTES && pos < end) {
                final byte b = buffer[pos++];
                bodyLength |= (long) (b & 0x7F) << (7 * prefixBytes++);
                if ((b & 0x80) == 0) {
                    prefixComplete = true;
                    break;
                }
            }

            final int residual = end - envelopeStart;
            if (!prefixComplete) {
                final boolean lost = prefixBytes == MAX_PREFIX_BYTES || residual >= maxEnvelopeBytes;
                return new Frames(bodies, residual, lost);
            }
            if (prefixBytes + bodyLength > maxEnvelopeBytes) {
                return new Frames(bodies, residual, true);
            }
            if (bodyLength > end - pos) {
                return new Frames(bodies, residual, false);
            }

            bodies.add(Arrays.copyOfRange(buffer, pos, pos + (int) bodyLength));
            pos += (int) bodyLength;
        }

        return new Frames(bodies, 0, false);
    }
}
