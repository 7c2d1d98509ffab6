package com.questrail.wirecalc.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing the start or end of one connection context.
 *
 * @param cause why the context ended; {@code null} for {@link Kind#OPENED}
 *              and for a stop requested through the running flag
 */
public record ConnectionEvent(
    Instant timestamp,
    SocketAddress remote,
    Kind kind,
    Throwable cause
) {
    public enum Kind {
        OPENED,
        CLOSED
    }
}
