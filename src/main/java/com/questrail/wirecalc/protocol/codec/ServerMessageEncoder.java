package com.questrail.wirecalc.protocol.codec;

import com.questrail.wirecalc.protocol.model.ServerMessage;

/**
 * ServerMessageEncoder
 * -----------------------------------------------------------------------------
 * Server-side outbound boundary between a {@link ServerMessage} and an
 * envelope body.
 *
 * <p>Length prefixing is applied by the caller, not by the encoder.</p>
 */
@FunctionalInterface
public interface ServerMessageEncoder
{
    /**
     * @param message response to encode
     * @return envelope body, without length prefix
     */
    byte[] encode(ServerMessage message);
}
