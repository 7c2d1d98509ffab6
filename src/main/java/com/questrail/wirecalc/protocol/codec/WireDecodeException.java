package com.questrail.wirecalc.protocol.codec;

/**
 * Indicates that an envelope body could not be translated into a semantic
 * message.
 *
 * This typically reflects:
 * <ul>
 *   <li>Truncated or over-long varints</li>
 *   <li>A length-delimited field running past the end of the body</li>
 *   <li>A known field carried with the wrong wire type</li>
 *   <li>Text that is not valid UTF-8</li>
 * </ul>
 *
 * <p>Decode failures are never fatal to a connection. The handler drops the
 * envelope and keeps reading.</p>
 */
public final class WireDecodeException extends RuntimeException
{
    public WireDecodeException(String message) {
        super(message);
    }

    public WireDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
