package com.questrail.wirecalc.protocol.model;

import java.util.Objects;

/**
 * Request to echo a piece of text back to the sender.
 *
 * <p>
 * Valid server responses:
 * </p>
 * <ul>
 *   <li>{@link EchoResponse}</li>
 * </ul>
 */
public record EchoRequest(
        String content
) implements ClientMessage
{
    public EchoRequest {
        Objects.requireNonNull(content, "content");
    }
}
