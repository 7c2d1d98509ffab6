package com.questrail.wirecalc.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a change in the accept loop's lifecycle.
 */
public record ServerLifecycleEvent(
    Instant timestamp,
    SocketAddress localAddress,
    Phase phase
) {
    public enum Phase {
        /** The accept loop has started. */
        STARTED,
        /** The running flag has been cleared. */
        STOPPING,
        /** The accept loop has exited and the listening socket is closed. */
        STOPPED
    }
}
