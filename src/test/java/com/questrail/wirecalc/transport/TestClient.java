package com.questrail.wirecalc.transport;

import com.questrail.wirecalc.protocol.codec.impl.EnvelopeFraming;
import com.questrail.wirecalc.protocol.codec.impl.ProtoClientMessageCodec;
import com.questrail.wirecalc.protocol.codec.impl.ProtoServerMessageCodec;
import com.questrail.wirecalc.protocol.model.ClientMessage;
import com.questrail.wirecalc.protocol.model.ServerMessage;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * TestClient
 * -----------------------------------------------------------------------------
 * Test-only blocking client speaking the WireCalc envelope protocol.
 *
 * <p>Reads honour a five second socket timeout so a missing response fails the
 * test instead of hanging it.</p>
 */
public final class TestClient implements AutoCloseable {

    private static final int READ_TIMEOUT_MILLIS = 5000;

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final ProtoClientMessageCodec requests = new ProtoClientMessageCodec();
    private final ProtoServerMessageCodec responses = new ProtoServerMessageCodec();

    private TestClient(Socket socket) throws IOException {
        this.socket = socket;
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
    }

    public static TestClient connect(InetSocketAddress address) throws IOException {
        Socket socket = new Socket();
        socket.setTcpNoDelay(true);
        socket.connect(address, READ_TIMEOUT_MILLIS);
        socket.setSoTimeout(READ_TIMEOUT_MILLIS);
        return new TestClient(socket);
    }

    /**
     * Frames every message and sends them all in a single write.
     */
    public void send(ClientMessage... messages) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        for (ClientMessage message : messages) {
            buffer.writeBytes(EnvelopeFraming.frame(requests.encode(message)));
        }
        sendRaw(buffer.toByteArray());
    }

    public void sendRaw(byte[] bytes) throws IOException {
        out.write(bytes);
        out.flush();
    }

    public ServerMessage receive() throws IOException {
        return responses.decode(readFrame())
                .orElseThrow(() -> new AssertionError("Response carried no known variant"));
    }

    /**
     * @return {@code true} if no byte arrives within {@code window}
     */
    public boolean receivesNothingWithin(Duration window) throws IOException {
        socket.setSoTimeout((int) window.toMillis());
        try {
            // Either a byte or end of stream: something happened.
            in.read();
            return false;
        } catch (SocketTimeoutException e) {
            return true;
        } finally {
            socket.setSoTimeout(READ_TIMEOUT_MILLIS);
        }
    }

    /**
     * @return {@code true} if the server has closed the connection
     */
    public boolean isClosedByPeer() throws IOException {
        return in.read() == -1;
    }

    public SocketAddress localAddress() {
        return socket.getLocalSocketAddress();
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    private byte[] readFrame() throws IOException {
        int length = 0;
        for (int shift = 0; ; shift += 7) {
            int b = in.read();
            if (b == -1) {
                throw new EOFException("Connection closed while reading length prefix");
            }
            length |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                break;
            }
        }

        byte[] body = in.readNBytes(length);
        if (body.length != length) {
            throw new EOFException("Connection closed after " + body.length + " of " + length + " bytes");
        }
        return body;
    }
}
