package com.questrail.wirecalc.protocol.codec.impl;

import com.questrail.wirecalc.protocol.codec.WireDecodeException;
import com.questrail.wirecalc.protocol.model.AddRequest;
import com.questrail.wirecalc.protocol.model.ClientMessage;
import com.questrail.wirecalc.protocol.model.EchoRequest;
import com.questrail.wirecalc.protocol.model.UnrecognizedRequest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProtoClientMessageCodecTest
 * -----------------------------------------------------------------------------
 * Byte layouts below are what a protobuf library produces for the
 * {@code ClientMessage} schema documented on {@link WireSchema}.
 */
final class ProtoClientMessageCodecTest
{
    private final ProtoClientMessageCodec codec = new ProtoClientMessageCodec();

    @Test
    void decodeAddRequest()
    {
        // add_request (field 2, LEN 4) { a = 2, b = 3 }
        byte[] body = bytes(0x12, 0x04, 0x08, 0x02, 0x10, 0x03);

        assertEquals(new AddRequest(2, 3), codec.decode(body));
    }

    @Test
    void encodeAddRequestMatchesProtobufLayout()
    {
        assertArrayEquals(bytes(0x12, 0x04, 0x08, 0x02, 0x10, 0x03),
                codec.encode(new AddRequest(2, 3)));
    }

    @Test
    void negativeOperandUsesTenByteVarint()
    {
        byte[] body = codec.encode(new AddRequest(-1, 1));

        // 0x12, len, 0x08, ten bytes of -1, 0x10, 0x01
        assertEquals(2 + 1 + 10 + 2, body.length);
        assertEquals(13, body[1]);
        assertEquals(new AddRequest(-1, 1), codec.decode(body));
    }

    @Test
    void zeroOperandsAreOmittedButMessageIsPresent()
    {
        byte[] body = codec.encode(new AddRequest(0, 0));

        assertArrayEquals(bytes(0x12, 0x00), body);
        assertEquals(new AddRequest(0, 0), codec.decode(body));
    }

    @Test
    void decodeEchoMessage()
    {
        // echo_message (field 1, LEN 4) { content = "hi" }
        byte[] body = bytes(0x0A, 0x04, 0x0A, 0x02, 'h', 'i');

        assertEquals(new EchoRequest("hi"), codec.decode(body));
    }

    @Test
    void emptyBodyIsUnrecognized()
    {
        assertEquals(UnrecognizedRequest.INSTANCE, codec.decode(new byte[0]));
    }

    @Test
    void unknownFieldsAreSkipped()
    {
        // field 7 varint 150, then add_request { a = 1 }, then field 9 fixed32
        byte[] body = bytes(
                0x38, 0x96, 0x01,
                0x12, 0x02, 0x08, 0x01,
                0x4D, 0x01, 0x02, 0x03, 0x04);

        assertEquals(new AddRequest(1, 0), codec.decode(body));
    }

    @Test
    void onlyUnknownFieldsIsUnrecognized()
    {
        // field 3, LEN 1
        ClientMessage decoded = codec.decode(bytes(0x1A, 0x01, 0x00));
        assertTrue(decoded instanceof UnrecognizedRequest);
    }

    @Test
    void lastOneofMemberWins()
    {
        byte[] body = bytes(
                0x0A, 0x03, 0x0A, 0x01, 'x',
                0x12, 0x02, 0x08, 0x05);

        assertEquals(new AddRequest(5, 0), codec.decode(body));
    }

    @Test
    void truncatedVarintIsRejected()
    {
        assertThrows(WireDecodeException.class, () -> codec.decode(bytes(0x12, 0x02, 0x08, 0x96)));
    }

    @Test
    void lengthPastEndIsRejected()
    {
        assertThrows(WireDecodeException.class, () -> codec.decode(bytes(0x12, 0x09, 0x08, 0x01)));
    }

    @Test
    void wrongWireTypeForKnownFieldIsRejected()
    {
        // add_request declared as varint
        assertThrows(WireDecodeException.class, () -> codec.decode(bytes(0x10, 0x01)));
    }

    @Test
    void fieldNumberZeroIsRejected()
    {
        assertThrows(WireDecodeException.class, () -> codec.decode(bytes(0x00, 0x01)));
    }

    @Test
    void groupWireTypeIsRejected()
    {
        assertThrows(WireDecodeException.class, () -> codec.decode(bytes(0x1B)));
    }

    @Test
    void invalidUtf8IsRejected()
    {
        byte[] body = bytes(0x0A, 0x03, 0x0A, 0x01, 0xFF);

        assertThrows(WireDecodeException.class, () -> codec.decode(body));
    }

    @Test
    void arbitraryBytesAreRejected()
    {
        assertThrows(WireDecodeException.class,
                () -> codec.decode(bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF)));
    }

    static byte[] bytes(int... values)
    {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }
}
