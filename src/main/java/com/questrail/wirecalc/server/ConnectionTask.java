package com.questrail.wirecalc.server;

import com.questrail.wirecalc.observability.ConnectionEvent;
import com.questrail.wirecalc.observability.ServerErrorEvent;
import com.questrail.wirecalc.observability.ServerObservabilitySink;
import com.questrail.wirecalc.transport.ConnectionHandler;

import java.io.IOException;
import java.nio.channels.SocketChannel;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ConnectionTask
 * -----------------------------------------------------------------------------
 * Body of one connection thread.
 *
 * <p>Invokes {@link ConnectionHandler#handle()} while the shared running flag
 * is set. Every failure is absorbed here: it is reported to the sink, the
 * channel is closed and the thread ends. Nothing reaches the accept loop or
 * any other connection.</p>
 */
final class ConnectionTask implements Runnable
{
    private final SocketChannel channel;
    private final ConnectionHandler handler;
    private final AtomicBoolean running;
    private final ServerObservabilitySink sink;

    ConnectionTask(SocketChannel channel,
                   ConnectionHandler handler,
                   AtomicBoolean running,
                   ServerObservabilitySink sink)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.running = Objects.requireNonNull(running, "running");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void run()
    {
        Throwable cause = null;
        try {
            while (running.get()) {
                handler.handle();
            }
        } catch (IOException e) {
            cause = e;
        } catch (RuntimeException e) {
            cause = e;
            sink.onError(new ServerErrorEvent(Instant.now(), handler.remote(), "Error handling client", e));
        } finally {
            closeQuietly();
            sink.onConnectionEvent(new ConnectionEvent(
                    Instant.now(), handler.remote(), ConnectionEvent.Kind.CLOSED, cause));
        }
    }

    private void closeQuietly()
    {
        try {
            channel.close();
        } catch (IOException e) {
            sink.onError(new ServerErrorEvent(Instant.now(), handler.remote(), "Failed to close connection", e));
        }
    }
}
