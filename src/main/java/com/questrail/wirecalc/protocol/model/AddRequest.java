package com.questrail.wirecalc.protocol.model;

/**
 * Request to add two integers.
 *
 * <p>
 * Valid server responses:
 * </p>
 * <ul>
 *   <li>{@link AddResponse}</li>
 * </ul>
 */
public record AddRequest(
        int a,
        int b
) implements ClientMessage
{
}
