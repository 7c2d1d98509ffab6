package com.questrail.wirecalc.protocol.model;

/**
 * An envelope that decoded without error but selected no known variant.
 *
 * <p>This happens when a client sends an empty envelope or one whose only
 * fields are unknown to this server (for example a newer client). It is a
 * legal message, not a decode failure; the dispatcher answers it with no
 * response.</p>
 */
public record UnrecognizedRequest() implements ClientMessage
{
    public static final UnrecognizedRequest INSTANCE = new UnrecognizedRequest();
}
