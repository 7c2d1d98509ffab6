/**
 * WireCalc Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> between raw
 * envelope bytes and the semantic message model in
 * {@code com.questrail.wirecalc.protocol.model}.</p>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec sits <strong>below</strong> request dispatch and
 * <strong>above</strong> socket I/O:</p>
 *
 * <pre>
 *   bytes read from socket
 *        → EnvelopeFraming        (length prefix removed)
 *            → ClientMessageDecoder
 *                → ClientMessage
 *                    → RequestDispatcher
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Decoders see exactly one envelope body per call.</li>
 *   <li>Decode failures surface as {@link com.questrail.wirecalc.protocol.codec.WireDecodeException}
 *       and are classified by the caller as dropped input.</li>
 *   <li>The body layout is protobuf wire format; the concrete field numbering
 *       lives in {@code codec.impl} only.</li>
 * </ul>
 */
package com.questrail.wirecalc.protocol.codec;
