package com.questrail.wirecalc.protocol.codec.impl;

import com.questrail.wirecalc.protocol.codec.ServerMessageDecoder;
import com.questrail.wirecalc.protocol.codec.ServerMessageEncoder;
import com.questrail.wirecalc.protocol.model.AddResponse;
import com.questrail.wirecalc.protocol.model.EchoResponse;
import com.questrail.wirecalc.protocol.model.ServerMessage;

import java.util.Objects;
import java.util.Optional;

/**
 * ProtoServerMessageCodec
 * -----------------------------------------------------------------------------
 * Protobuf wire-format codec for the {@code ServerMessage} envelope.
 *
 * <p>The server only encodes; decoding exists for clients and tests and
 * follows the same rules as {@link ProtoClientMessageCodec}.</p>
 */
public final class ProtoServerMessageCodec implements ServerMessageEncoder, ServerMessageDecoder
{
    @Override
    public byte[] encode(ServerMessage message)
    {
        Objects.requireNonNull(message, "message");

        final WireWriter envelope = new WireWriter();

        if (message instanceof AddResponse m) {
            envelope.writeMessage(WireSchema.ENVELOPE_ADD, new WireWriter()
                    .writeInt32(WireSchema.ADD_RESPONSE_RESULT, m.result()));
        }
        else if (message instanceof EchoResponse m) {
            envelope.writeMessage(WireSchema.ENVELOPE_ECHO_MESSAGE, new WireWriter()
                    .writeString(WireSchema.ECHO_CONTENT, m.content()));
        }
        else {
            // Sealed interface should make this unreachable.
            throw new IllegalArgumentException("Unsupported server message type: " + message.getClass());
        }

        return envelope.toByteArray();
    }

    @Override
    public Optional<ServerMessage> decode(byte[] body)
    {
        Objects.requireNonNull(body, "body");

        final WireReader reader = new WireReader(body);
        ServerMessage message = null;

        while (!reader.isAtEnd()) {
            final int tag = reader.readTag();
            switch (WireSchema.fieldNumber(tag)) {
                case WireSchema.ENVELOPE_ECHO_MESSAGE -> {
                    WireReader.requireWireType(tag, WireSchema.WIRETYPE_LENGTH_DELIMITED);
                    message = new EchoResponse(decodeEchoContent(reader.readLengthDelimited()));
                }
                case WireSchema.ENVELOPE_ADD -> {
                    WireReader.requireWireType(tag, WireSchema.WIRETYPE_LENGTH_DELIMITED);
                    message = new AddResponse(decodeAddResult(reader.readLengthDelimited()));
                }
                default -> reader.skipField(WireSchema.wireType(tag));
            }
        }

        return Optional.ofNullable(message);
    }

    private static int decodeAddResult(byte[] bytes)
    {
        final WireReader reader = new WireReader(bytes);
        int result = 0;
        while (!reader.isAtEnd()) {
            final int tag = reader.readTag();
            if (WireSchema.fieldNumber(tag) == WireSchema.ADD_RESPONSE_RESULT) {
                WireReader.requireWireType(tag, WireSchema.WIRETYPE_VARINT);
                result = reader.readInt32();
            } else {
                reader.skipField(WireSchema.wireType(tag));
            }
        }
        return result;
    }

    private static String decodeEchoContent(byte[] bytes)
    {
        final WireReader reader = new WireReader(bytes);
        String content = "";
        while (!reader.isAtEnd()) {
            final int tag = reader.readTag();
            if (WireSchema.fieldNumber(tag) == WireSchema.ECHO_CONTENT) {
                WireReader.requireWireType(tag, WireSchema.WIRETYPE_LENGTH_DELIMITED);
                content = reader.readString();
            } else {
                reader.skipField(WireSchema.wireType(tag));
            }
        }
        return content;
    }
}
