package com.questrail.wirecalc.transport;

import com.questrail.wirecalc.observability.DroppedInputEvent;
import com.questrail.wirecalc.observability.ExchangeEvent;
import com.questrail.wirecalc.observability.ServerObservabilitySink;
import com.questrail.wirecalc.protocol.codec.ClientMessageDecoder;
import com.questrail.wirecalc.protocol.codec.ServerMessageEncoder;
import com.questrail.wirecalc.protocol.codec.WireDecodeException;
import com.questrail.wirecalc.protocol.codec.impl.EnvelopeFraming;
import com.questrail.wirecalc.protocol.dispatch.RequestDispatcher;
import com.questrail.wirecalc.protocol.model.ClientMessage;
import com.questrail.wirecalc.protocol.model.ServerMessage;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * ConnectionHandler
 * =============================================================================
 * Owns one accepted socket and runs one request/response cycle per call to
 * {@link #handle()}.
 *
 * <h2>Cycle</h2>
 * <pre>
 *   drain     if framing was lost on the previous read, non-blocking reads
 *             discard whatever is already buffered on the socket
 *   read      one blocking read, appended to any partial envelope kept
 *             from the previous cycle
 *   decode    split into envelopes, decode each into a ClientMessage
 *   dispatch  RequestDispatcher maps each request to an optional response
 *   respond   encode, frame and write each response in full
 * </pre>
 *
 * <h2>Partial envelopes</h2>
 * An envelope that has only partly arrived stays at the front of the read
 * buffer and is completed by later reads, so a request split across TCP
 * segments, or straddling the end of a pipelined burst, is still answered.
 *
 * <h2>Drain policy</h2>
 * Bytes are stale only when the stream has lost envelope alignment: a length
 * prefix was malformed, or declared an envelope larger than the read buffer.
 * The bytes already read are dropped, and the next cycle discards whatever
 * the peer has buffered since before reading again. An aligned stream is
 * never drained; buffered bytes are the peer's next request.
 *
 * <h2>Failure semantics</h2>
 * <ul>
 *   <li>Undecodable envelopes, unsupported requests and unframeable bytes
 *       are dropped without a response. The connection stays open.</li>
 *   <li>End of stream throws {@link PeerDisconnectedException}.</li>
 *   <li>Any other socket failure propagates as {@link IOException}.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Not thread-safe. An instance belongs to exactly one connection thread and
 * touches no state outside its socket and buffers.
 */
public final class ConnectionHandler
{
    private final SocketChannel channel;
    private final SocketAddress remote;
    private final ClientMessageDecoder decoder;
    private final RequestDispatcher dispatcher;
    private final ServerMessageEncoder encoder;
    private final ServerObservabilitySink sink;

    private final ByteBuffer readBuffer;
    private final ByteBuffer scratch;

    // Bytes of an envelope that can never complete, dropped at the next drain.
    private int unframedBytes;

    public ConnectionHandler(SocketChannel channel,
                             int readBufferSize,
                             ClientMessageDecoder decoder,
                             RequestDispatcher dispatcher,
                             ServerMessageEncoder encoder,
                             ServerObservabilitySink sink)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.sink = Objects.requireNonNull(sink, "sink");

        if (readBufferSize < 1) {
            throw new IllegalArgumentException("readBufferSize must be positive");
        }
        this.readBuffer = ByteBuffer.allocate(readBufferSize);
        this.scratch = ByteBuffer.allocate(readBufferSize);
        this.remote = channel.socket().getRemoteSocketAddress();
    }

    public SocketAddress remote()
    {
        return remote;
    }

    /**
     * Runs one drain/read/decode/dispatch/respond cycle.
     *
     * @throws PeerDisconnectedException if the peer closed the connection
     * @throws IOException               if reading or writing the socket fails
     */
    public void handle() throws IOException
    {
        if (unframedBytes > 0) {
            drain();
        }

        final int read = channel.read(readBuffer);
        if (read <= 0) {
            throw new PeerDisconnectedException(remote);
        }

        readBuffer.flip();
        final EnvelopeFraming.Frames frames =
                EnvelopeFraming.split(readBuffer.array(), 0, readBuffer.limit(), readBuffer.capacity());
        for (byte[] body : frames.bodies()) {
            process(body);
        }

        if (frames.framingLost()) {
            unframedBytes = frames.residualBytes();
            readBuffer.clear();
        }
        else {
            readBuffer.position(readBuffer.limit() - frames.residualBytes());
            readBuffer.compact();
        }
    }

    /**
     * Discards the unframeable bytes left by the previous read together with
     * whatever the peer has already sent after them.
     *
     * <p>Never suspends: the channel is non-blocking for the duration and the
     * loop ends on the first read that returns nothing (or end of stream,
     * which the following blocking read reports). Events are reported only
     * once the socket is back in blocking mode.</p>
     */
    private void drain() throws IOException
    {
        final int unframeable = unframedBytes;
        unframedBytes = 0;
        int discarded = 0;

        channel.configureBlocking(false);
        try {
            int n;
            do {
                scratch.clear();
                n = channel.read(scratch);
                if (n > 0) {
                    discarded += n;
                }
            } while (n > 0);
        } finally {
            channel.configureBlocking(true);
        }

        dropped(DroppedInputEvent.Reason.FRAMING_LOST, unframeable, null);
        if (discarded > 0) {
            dropped(DroppedInputEvent.Reason.STALE_BYTES_DRAINED, discarded, null);
        }
    }

    private void process(byte[] body) throws IOException
    {
        final ClientMessage request;
        try {
            request = decoder.decode(body);
        } catch (WireDecodeException e) {
            dropped(DroppedInputEvent.Reason.UNDECODABLE, body.length, e.getMessage());
            return;
        }

        final Optional<ServerMessage> response = dispatcher.dispatch(request);
        if (response.isEmpty()) {
            dropped(DroppedInputEvent.Reason.UNSUPPORTED_VARIANT, body.length,
                    request.getClass().getSimpleName());
            return;
        }

        write(EnvelopeFraming.frame(encoder.encode(response.get())));
        sink.onExchange(new ExchangeEvent(Instant.now(), remote, request, response.get()));
    }

    private void write(byte[] payload) throws IOException
    {
        final ByteBuffer out = ByteBuffer.wrap(payload);
        while (out.hasRemaining()) {
            channel.write(out);
        }
    }

    private void dropped(DroppedInputEvent.Reason reason, int byteCount, String detail)
    {
        sink.onInputDropped(new DroppedInputEvent(Instant.now(), remote, reason, byteCount, detail));
    }
}
