package com.questrail.wirecalc.protocol.model;

import java.util.Objects;

/**
 * Text returned for an {@link EchoRequest}.
 */
public record EchoResponse(
        String content
) implements ServerMessage
{
    public EchoResponse {
        Objects.requireNonNull(content, "content");
    }
}
