package com.questrail.wirecalc.protocol.codec;

import com.questrail.wirecalc.protocol.model.ClientMessage;

/**
 * ClientMessageDecoder
 * -----------------------------------------------------------------------------
 * Server-side inbound boundary between an envelope body and a
 * {@link ClientMessage}.
 *
 * <p>The decoder receives exactly one envelope body with its length prefix
 * already removed. It must not buffer across calls.</p>
 */
@FunctionalInterface
public interface ClientMessageDecoder
{
    /**
     * Decode one envelope body.
     *
     * @param body envelope body, without length prefix
     * @return the decoded message; {@link com.questrail.wirecalc.protocol.model.UnrecognizedRequest}
     *         when the body is well-formed but selects no known variant
     * @throws WireDecodeException if the body is malformed
     */
    ClientMessage decode(byte[] body);
}
