/**
 * WireCalc Transport
 * =============================================================================
 *
 * <p>Per-connection socket handling. A {@link com.questrail.wirecalc.transport.ConnectionHandler}
 * turns bytes on one blocking {@link java.nio.channels.SocketChannel} into
 * dispatched requests and written responses.</p>
 *
 * <h2>Architectural constraints</h2>
 * Classes in this package:
 * <ul>
 *   <li>Perform socket I/O and framing only</li>
 *   <li>Delegate message decoding and encoding to the codec ports</li>
 *   <li>Delegate request semantics to the dispatcher</li>
 *   <li>Do not spawn threads or read the server's running flag</li>
 * </ul>
 */
package com.questrail.wirecalc.transport;
