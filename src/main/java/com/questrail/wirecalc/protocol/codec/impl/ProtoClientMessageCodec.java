package com.questrail.wirecalc.protocol.codec.impl;

import com.questrail.wirecalc.protocol.codec.ClientMessageDecoder;
import com.questrail.wirecalc.protocol.codec.ClientMessageEncoder;
import com.questrail.wirecalc.protocol.codec.WireDecodeException;
import com.questrail.wirecalc.protocol.model.AddRequest;
import com.questrail.wirecalc.protocol.model.ClientMessage;
import com.questrail.wirecalc.protocol.model.EchoRequest;
import com.questrail.wirecalc.protocol.model.UnrecognizedRequest;

import java.util.Objects;

/**
 * ProtoClientMessageCodec
 * -----------------------------------------------------------------------------
 * Protobuf wire-format codec for the {@code ClientMessage} envelope.
 *
 * <h2>Decoding rules</h2>
 * <ul>
 *   <li>Unknown fields are skipped.</li>
 *   <li>If the oneof appears more than once, the last member wins.</li>
 *   <li>A body with no known member decodes to {@link UnrecognizedRequest}.</li>
 *   <li>A known member with the wrong wire type is a {@link WireDecodeException}.</li>
 * </ul>
 */
public final class ProtoClientMessageCodec implements ClientMessageDecoder, ClientMessageEncoder
{
    @Override
    public ClientMessage decode(byte[] body)
    {
        Objects.requireNonNull(body, "body");

        final WireReader reader = new WireReader(body);
        ClientMessage message = UnrecognizedRequest.INSTANCE;

        while (!reader.isAtEnd()) {
            final int tag = reader.readTag();
            switch (WireSchema.fieldNumber(tag)) {
                case WireSchema.ENVELOPE_ECHO_MESSAGE -> {
                    WireReader.requireWireType(tag, WireSchema.WIRETYPE_LENGTH_DELIMITED);
                    message = decodeEcho(reader.readLengthDelimited());
                }
                case WireSchema.ENVELOPE_ADD -> {
                    WireReader.requireWireType(tag, WireSchema.WIRETYPE_LENGTH_DELIMITED);
                    message = decodeAdd(reader.readLengthDelimited());
                }
                default -> reader.skipField(WireSchema.wireType(tag));
            }
        }

        return message;
    }

    @Override
    public byte[] encode(ClientMessage message)
    {
        Objects.requireNonNull(message, "message");

        final WireWriter envelope = new WireWriter();

        if (message instanceof AddRequest m) {
            envelope.writeMessage(WireSchema.ENVELOPE_ADD, new WireWriter()
                    .writeInt32(WireSchema.ADD_REQUEST_A, m.a())
                    .writeInt32(WireSchema.ADD_REQUEST_B, m.b()));
        }
        else if (message instanceof EchoRequest m) {
            envelope.writeMessage(WireSchema.ENVELOPE_ECHO_MESSAGE, new WireWriter()
                    .writeString(WireSchema.ECHO_CONTENT, m.content()));
        }
        // UnrecognizedRequest encodes as an empty envelope.

        return envelope.toByteArray();
    }

    private static AddRequest decodeAdd(byte[] bytes)
    {
        final WireReader reader = new WireReader(bytes);
        int a = 0;
        int b = 0;

        while (!reader.isAtEnd()) {
            final int tag = reader.readTag();
            switch (WireSchema.fieldNumber(tag)) {
                case WireSchema.ADD_REQUEST_A -> {
                    WireReader.requireWireType(tag, WireSchema.WIRETYPE_VARINT);
                    a = reader.readInt32();
                }
                case WireSchema.ADD_REQUEST_B -> {
                    WireReader.requireWireType(tag, WireSchema.WIRETYPE_VARINT);
                    b = reader.readInt32();
                }
                default -> reader.skipField(WireSchema.wireType(tag));
            }
        }

        return new AddRequest(a, b);
    }

    private static EchoRequest decodeEcho(byte[] bytes)
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

        return new EchoRequest(content);
    }
}
