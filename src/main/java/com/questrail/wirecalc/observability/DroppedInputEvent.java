package com.questrail.wirecalc.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing inbound bytes discarded without a response.
 *
 * @param byteCount number of bytes discarded
 * @param detail    decoder message or other diagnostic; may be {@code null}
 */
public record DroppedInputEvent(
    Instant timestamp,
    SocketAddress remote,
    Reason reason,
    int byteCount,
    String detail
) {
    public enum Reason {
        /** Bytes already buffered on the socket after framing was lost. */
        STALE_BYTES_DRAINED,
        /** An envelope with a malformed length prefix, or one larger than the read buffer. */
        FRAMING_LOST,
        /** A complete envelope the decoder rejected. */
        UNDECODABLE,
        /** A decoded request that earns no response. */
        UNSUPPORTED_VARIANT
    }
}
