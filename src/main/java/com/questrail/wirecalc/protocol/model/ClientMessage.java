package com.questrail.wirecalc.protocol.model;

/**
 * Semantic representation of a request received from a client.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code ClientMessage} is the decoded form of one request envelope. It is the
 * only form of request the dispatcher is permitted to reason about; byte
 * layout, framing and field numbers are resolved by the codec layer before an
 * instance exists.
 * </p>
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link AddRequest}: add two 32-bit integers</li>
 *   <li>{@link EchoRequest}: return the carried text unchanged</li>
 *   <li>{@link UnrecognizedRequest}: the envelope decoded cleanly but carried
 *       no variant this server knows</li>
 * </ul>
 *
 * <p>Instances are immutable and are owned by the connection that decoded
 * them for the duration of one dispatch.</p>
 */
public sealed interface ClientMessage
        permits AddRequest, EchoRequest, UnrecognizedRequest {
}
