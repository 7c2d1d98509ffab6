package com.questrail.wirecalc.observability;

import com.questrail.wirecalc.protocol.model.ClientMessage;
import com.questrail.wirecalc.protocol.model.ServerMessage;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing one answered request.
 */
public record ExchangeEvent(
    Instant timestamp,
    SocketAddress remote,
    ClientMessage request,
    ServerMessage response
) {
}
