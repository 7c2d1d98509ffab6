package com.questrail.wirecalc.protocol.model;

/**
 * Semantic representation of a response sent to a client.
 *
 * <p>
 * Responses are constructed by the dispatcher, serialized once by the
 * connection handler and then discarded.
 * </p>
 */
public sealed interface ServerMessage
        permits AddResponse, EchoResponse {
}
