package com.questrail.wirecalc.protocol.dispatch;

import com.questrail.wirecalc.protocol.model.AddRequest;
import com.questrail.wirecalc.protocol.model.AddResponse;
import com.questrail.wirecalc.protocol.model.ClientMessage;
import com.questrail.wirecalc.protocol.model.EchoRequest;
import com.questrail.wirecalc.protocol.model.EchoResponse;
import com.questrail.wirecalc.protocol.model.ServerMessage;

import java.util.Objects;
import java.util.Optional;

/**
 * DefaultRequestDispatcher
 * =============================================================================
 * The WireCalc message catalog.
 *
 * <table>
 *   <caption>Request to response mapping</caption>
 *   <tr><th>Request</th><th>Response</th></tr>
 *   <tr><td>{@link AddRequest}</td><td>{@link AddResponse} with {@code a + b}</td></tr>
 *   <tr><td>{@link EchoRequest}</td><td>{@link EchoResponse} with the same content</td></tr>
 *   <tr><td>anything else</td><td>none</td></tr>
 * </table>
 *
 * <h2>Overflow</h2>
 * Addition is 32-bit two's complement and wraps on overflow, exactly like Java
 * {@code int} addition: {@code Integer.MAX_VALUE + 1} yields
 * {@code Integer.MIN_VALUE}. Request and result share the wire type
 * {@code int32}, so every result is representable and no request is rejected.
 */
public final class DefaultRequestDispatcher implements RequestDispatcher
{
    public static final DefaultRequestDispatcher INSTANCE = new DefaultRequestDispatcher();

    @Override
    public Optional<ServerMessage> dispatch(ClientMessage request)
    {
        Objects.requireNonNull(request, "request");

        if (request instanceof AddRequest add) {
            return Optional.of(new AddResponse(add.a() + add.b()));
        }
        if (request instanceof EchoRequest echo) {
            return Optional.of(new EchoResponse(echo.content()));
        }
        return Optional.empty();
    }
}
