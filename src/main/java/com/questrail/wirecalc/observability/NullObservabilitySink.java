package com.questrail.wirecalc.observability;

/**
 * No-op implementation of ServerObservabilitySink.
 */
public final class NullObservabilitySink implements ServerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onServerEvent(ServerLifecycleEvent event) {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onExchange(ExchangeEvent event) {}

    @Override
    public void onInputDropped(DroppedInputEvent event) {}

    @Override
    public void onError(ServerErrorEvent event) {}
}
