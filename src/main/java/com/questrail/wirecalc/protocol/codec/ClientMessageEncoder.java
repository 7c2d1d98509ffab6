package com.questrail.wirecalc.protocol.codec;

import com.questrail.wirecalc.protocol.model.ClientMessage;

/**
 * Client-side outbound boundary: {@link ClientMessage} to envelope body.
 */
@FunctionalInterface
public interface ClientMessageEncoder
{
    /**
     * @param message request to encode
     * @return envelope body, without length prefix
     */
    byte[] encode(ClientMessage message);
}
