package com.questrail.wirecalc.protocol.model;

/**
 * Result of an {@link AddRequest}.
 */
public record AddResponse(
        int result
) implements ServerMessage
{
}
