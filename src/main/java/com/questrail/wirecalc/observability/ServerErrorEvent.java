package com.questrail.wirecalc.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing an error or anomaly in the server.
 *
 * @param remote the affected peer; {@code null} for accept-loop errors
 */
public record ServerErrorEvent(
    Instant timestamp,
    SocketAddress remote,
    String message,
    Throwable cause
) {
}
