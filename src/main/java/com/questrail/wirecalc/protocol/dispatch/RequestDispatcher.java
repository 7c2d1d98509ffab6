package com.questrail.wirecalc.protocol.dispatch;

import com.questrail.wirecalc.protocol.model.ClientMessage;
import com.questrail.wirecalc.protocol.model.ServerMessage;

import java.util.Optional;

/**
 * RequestDispatcher
 * -----------------------------------------------------------------------------
 * Maps a decoded request to the response it earns.
 *
 * <p>Implementations must be pure: no I/O, no shared mutable state. They are
 * called concurrently from every connection thread.</p>
 *
 * <p>Dispatch is total. A request that earns no response yields
 * {@link Optional#empty()}; it never throws for an unknown variant.</p>
 */
@FunctionalInterface
public interface RequestDispatcher
{
    Optional<ServerMessage> dispatch(ClientMessage request);
}
