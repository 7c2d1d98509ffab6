package com.questrail.wirecalc.observability;

import com.questrail.wirecalc.transport.PeerDisconnectedException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Production implementation of ServerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jServerObservabilitySink implements ServerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jServerObservabilitySink.class);

    @Override
    public void onServerEvent(ServerLifecycleEvent event) {
        switch (event.phase()) {
            case STARTED -> log.info("Server is running on {}", event.localAddress());
            case STOPPING -> log.info("Shutdown signal sent.");
            case STOPPED -> log.info("Server stopped.");
        }
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        Level level = levelOf(event);
        if (event.kind() == ConnectionEvent.Kind.OPENED) {
            log.atLevel(level).log("New client connected: {}", event.remote());
        }
        else if (level == Level.INFO) {
            log.atLevel(level).log("Client at {} disconnected", event.remote());
        }
        else {
            log.atLevel(level).log("Client at {} disconnected: {}", event.remote(), event.cause().toString());
        }
    }

    @Override
    public void onExchange(ExchangeEvent event) {
        log.debug("{} {} -> {}", event.remote(), event.request(), event.response());
    }

    @Override
    public void onInputDropped(DroppedInputEvent event) {
        Level level = levelOf(event);
        if (event.reason() == DroppedInputEvent.Reason.UNDECODABLE) {
            log.atLevel(level).log("Failed to decode message from {} ({} bytes): {}",
                event.remote(), event.byteCount(), event.detail());
        }
        else {
            log.atLevel(level).log("Dropped input from {}: {} ({} bytes)",
                event.remote(), event.reason(), event.byteCount());
        }
    }

    @Override
    public void onError(ServerErrorEvent event) {
        if (event.remote() != null) {
            log.error("Error handling client {}: {}", event.remote(), event.message(), event.cause());
        }
        else {
            log.error("{}", event.message(), event.cause());
        }
    }

    /**
     * Orderly disconnects are routine; anything else that ends a connection is a warning.
     */
    static Level levelOf(ConnectionEvent event) {
        if (event.kind() == ConnectionEvent.Kind.OPENED
                || event.cause() == null
                || event.cause() instanceof PeerDisconnectedException) {
            return Level.INFO;
        }
        return Level.WARN;
    }

    /**
     * A peer sending undecodable envelopes is worth a warning; framing and
     * dispatch drops are expected noise.
     */
    static Level levelOf(DroppedInputEvent event) {
        return event.reason() == DroppedInputEvent.Reason.UNDECODABLE ? Level.WARN : Level.DEBUG;
    }
}
