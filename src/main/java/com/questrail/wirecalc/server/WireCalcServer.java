package com.questrail.wirecalc.server;

import com.questrail.wirecalc.config.ServerConfig;
import com.questrail.wirecalc.observability.ConnectionEvent;
import com.questrail.wirecalc.observability.NullObservabilitySink;
import com.questrail.wirecalc.observability.ServerErrorEvent;
import com.questrail.wirecalc.observability.ServerLifecycleEvent;
import com.questrail.wirecalc.observability.ServerObservabilitySink;
import com.questrail.wirecalc.protocol.codec.ClientMessageDecoder;
import com.questrail.wirecalc.protocol.codec.ServerMessageEncoder;
import com.questrail.wirecalc.protocol.codec.impl.ProtoClientMessageCodec;
import com.questrail.wirecalc.protocol.codec.impl.ProtoServerMessageCodec;
import com.questrail.wirecalc.protocol.dispatch.DefaultRequestDispatcher;
import com.questrail.wirecalc.protocol.dispatch.RequestDispatcher;
import com.questrail.wirecalc.transport.ConnectionHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * WireCalcServer
 * =============================================================================
 * Owns the listening socket and the accept loop.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>{@link #run()} accepts on the calling thread ({@link #start()} uses a
 *       dedicated {@code wirecalc-acceptor} thread).</li>
 *   <li>Every accepted connection gets its own daemon thread running a
 *       {@link ConnectionHandler} loop. The accept loop never waits on a
 *       connection and never observes its outcome.</li>
 *   <li>The only state shared between threads is the running flag, an
 *       {@link AtomicBoolean} set at bind time and cleared once by
 *       {@link #stop()}.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   WireCalcServer.builder()...bind()   binds the socket (IOException is fatal)
 *   server.run() / server.start()       accept loop
 *   server.stop()                       clears the running flag
 * </pre>
 */
public final class WireCalcServer
{
    private static final Logger log = LoggerFactory.getLogger(WireCalcServer.class);

    private final ServerSocketChannel serverChannel;
    private final InetSocketAddress localAddress;
    private final ServerConfig config;
    private final ClientMessageDecoder decoder;
    private final RequestDispatcher dispatcher;
    private final ServerMessageEncoder encoder;
    private final ServerObservabilitySink sink;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicInteger connectionCounter = new AtomicInteger();
    private final CountDownLatch stopped = new CountDownLatch(1);

    private WireCalcServer(ServerSocketChannel serverChannel,
                           ServerConfig config,
                           ClientMessageDecoder decoder,
                           RequestDispatcher dispatcher,
                           ServerMessageEncoder encoder,
                           ServerObservabilitySink sink) throws IOException
    {
        this.serverChannel = serverChannel;
        this.localAddress = (InetSocketAddress) serverChannel.getLocalAddress();
        this.config = config;
        this.decoder = decoder;
        this.dispatcher = dispatcher;
        this.encoder = encoder;
        this.sink = sink;
    }

    /**
     * Runs the accept loop on the calling thread until {@link #stop()} is
     * called, then closes the listening socket.
     *
     * <p>Accept failures are reported and the loop continues. Returns
     * immediately if the server has already been stopped.</p>
     */
    public void run()
    {
        sink.onServerEvent(new ServerLifecycleEvent(Instant.now(), localAddress, ServerLifecycleEvent.Phase.STARTED));
        try {
            while (running.get()) {
                final SocketChannel channel;
                try {
                    channel = serverChannel.accept();
                } catch (ClosedChannelException e) {
                    break;
                } catch (IOException e) {
                    sink.onError(new ServerErrorEvent(Instant.now(), null, "Error accepting connection", e));
                    if (!pause()) {
                        break;
                    }
                    continue;
                }

                if (channel == null) {
                    if (!pause()) {
                        break;
                    }
                    continue;
                }

                spawn(channel);
            }
        } finally {
            try {
                serverChannel.close();
            } catch (IOException e) {
                sink.onError(new ServerErrorEvent(Instant.now(), null, "Failed to close listening socket", e));
            }
            stopped.countDown();
            sink.onServerEvent(new ServerLifecycleEvent(Instant.now(), localAddress, ServerLifecycleEvent.Phase.STOPPED));
        }
    }

    /**
     * Runs {@link #run()} on a new {@code wirecalc-acceptor} thread.
     *
     * @return the acceptor thread
     */
    public Thread start()
    {
        Thread acceptor = new Thread(this::run, "wirecalc-acceptor");
        acceptor.start();
        return acceptor;
    }

    /**
     * Clears the running flag.
     *
     * <p>The accept loop notices within one accept poll interval. Connection
     * threads notice before their next cycle; a connection blocked in a read
     * or write keeps its thread until that call returns, typically when the
     * client disconnects. Blocking socket calls are not interrupted.</p>
     */
    public void stop()
    {
        if (running.compareAndSet(true, false)) {
            sink.onServerEvent(new ServerLifecycleEvent(Instant.now(), localAddress, ServerLifecycleEvent.Phase.STOPPING));
        }
        else {
            log.warn("Server was already stopped or not running.");
        }
    }

    /**
     * Waits until the accept loop has exited and the listening socket is closed.
     *
     * @return {@code true} if the loop exited within the timeout
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException
    {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRunning()
    {
        return running.get();
    }

    public InetSocketAddress localAddress()
    {
        return localAddress;
    }

    private void spawn(SocketChannel channel)
    {
        final ConnectionHandler handler;
        try {
            channel.configureBlocking(true);
            handler = new ConnectionHandler(channel, config.readBufferSize(), decoder, dispatcher, encoder, sink);
        } catch (IOException | RuntimeException e) {
            sink.onError(new ServerErrorEvent(Instant.now(), null, "Failed to set up connection", e));
            try {
                channel.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            return;
        }

        sink.onConnectionEvent(new ConnectionEvent(Instant.now(), handler.remote(), ConnectionEvent.Kind.OPENED, null));

        Thread thread = new Thread(
                new ConnectionTask(channel, handler, running, sink),
                "wirecalc-connection-" + connectionCounter.incrementAndGet());
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * @return {@code false} if the acceptor was interrupted
     */
    private boolean pause()
    {
        try {
            Thread.sleep(config.acceptPollInterval().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ServerConfig config = ServerConfig.defaults();
        private ClientMessageDecoder decoder = new ProtoClientMessageCodec();
        private RequestDispatcher dispatcher = DefaultRequestDispatcher.INSTANCE;
        private ServerMessageEncoder encoder = new ProtoServerMessageCodec();
        private ServerObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(ServerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withDecoder(ClientMessageDecoder decoder) {
            this.decoder = decoder;
            return this;
        }

        public Builder withDispatcher(RequestDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder withEncoder(ServerMessageEncoder encoder) {
            this.encoder = encoder;
            return this;
        }

        public Builder withObservabilitySink(ServerObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Binds the listening socket.
         *
         * @throws IOException if the address cannot be bound
         */
        public WireCalcServer bind() throws IOException {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(decoder, "decoder");
            Objects.requireNonNull(dispatcher, "dispatcher");
            Objects.requireNonNull(encoder, "encoder");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            ServerSocketChannel channel = ServerSocketChannel.open();
            try {
                channel.bind(config.bindAddress(), config.backlog());
                channel.configureBlocking(false);
                return new WireCalcServer(channel, config, decoder, dispatcher, encoder, observabilitySink);
            } catch (IOException | RuntimeException e) {
                try {
                    channel.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
                throw e;
            }
        }
    }
}
