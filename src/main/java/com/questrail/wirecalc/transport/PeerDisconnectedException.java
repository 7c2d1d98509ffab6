package com.questrail.wirecalc.transport;

import java.io.IOException;
import java.net.SocketAddress;

/**
 * Signals that the peer closed its side of the connection.
 *
 * <p>This is the normal way a connection context ends. It is an
 * {@link IOException} so that it terminates the connection loop through the
 * same path as any other socket failure.</p>
 */
public final class PeerDisconnectedException extends IOException
{
    private final transient SocketAddress remote;

    public PeerDisconnectedException(SocketAddress remote) {
        super("Peer " + remote + " closed the connection");
        this.remote = remote;
    }

    public SocketAddress remote() {
        return remote;
    }
}
