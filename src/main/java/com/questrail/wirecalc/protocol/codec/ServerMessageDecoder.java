package com.questrail.wirecalc.protocol.codec;

import com.questrail.wirecalc.protocol.model.ServerMessage;

import java.util.Optional;

/**
 * Client-side inbound boundary: envelope body to {@link ServerMessage}.
 */
@FunctionalInterface
public interface ServerMessageDecoder
{
    /**
     * @param body envelope body, without length prefix
     * @return the decoded response, or empty if the body selects no known variant
     * @throws WireDecodeException if the body is malformed
     */
    Optional<ServerMessage> decode(byte[] body);
}
