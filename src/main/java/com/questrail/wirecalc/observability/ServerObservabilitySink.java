package com.questrail.wirecalc.observability;

/**
 * Main interface for receiving WireCalc server observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive concurrently from the acceptor thread and from every
 * connection thread. Implementations must be thread-safe and must not throw.</p>
 */
public interface ServerObservabilitySink {
    /**
     * Called when the server starts or stops accepting connections.
     * @param event the lifecycle event
     */
    void onServerEvent(ServerLifecycleEvent event);

    /**
     * Called when a connection is accepted or its context ends.
     * @param event the connection event
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called after a request has been answered.
     * @param event the exchange
     */
    void onExchange(ExchangeEvent event);

    /**
     * Called when inbound bytes are discarded without a response.
     * @param event the dropped input
     */
    void onInputDropped(DroppedInputEvent event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(ServerErrorEvent event);
}
