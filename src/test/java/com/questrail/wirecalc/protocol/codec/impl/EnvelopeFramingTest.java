package com.questrail.wirecalc.protocol.codec.impl;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.questrail.wirecalc.protocol.codec.impl.ProtoClientMessageCodecTest.bytes;
import static org.junit.jupiter.api.Assertions.*;

final class EnvelopeFramingTest
{
    @Test
    void frameUsesSingleBytePrefixForShortBodies()
    {
        assertArrayEquals(bytes(0x02, 0xAA, 0xBB), EnvelopeFraming.frame(bytes(0xAA, 0xBB)));
    }

    @Test
    void frameUsesVarintPrefixForLongBodies()
    {
        byte[] framed = EnvelopeFraming.frame(new byte[300]);

        // 300 = 0b10_0101100 -> 0xAC 0x02
        assertEquals(302, framed.length);
        assertEquals((byte) 0xAC, framed[0]);
        assertEquals((byte) 0x02, framed[1]);
    }

    @Test
    void splitReturnsEveryCompleteEnvelopeInOrder()
    {
        byte[] chunk = bytes(0x01, 0x0A, 0x00, 0x02, 0x0B, 0x0C);

        EnvelopeFraming.Frames frames = EnvelopeFraming.split(chunk, 0, chunk.length, 64);

        assertEquals(3, frames.bodies().size());
        assertArrayEquals(bytes(0x0A), frames.bodies().get(0));
        assertArrayEquals(new byte[0], frames.bodies().get(1));
        assertArrayEquals(bytes(0x0B, 0x0C), frames.bodies().get(2));
        assertEquals(0, frames.residualBytes());
    }

    @Test
    void splitKeepsTruncatedBodyForNextRead()
    {
        byte[] chunk = bytes(0x01, 0x0A, 0x05, 0x01, 0x02);

        EnvelopeFraming.Frames frames = EnvelopeFraming.split(chunk, 0, chunk.length, 64);

        assertEquals(1, frames.bodies().size());
        assertEquals(3, frames.residualBytes());
        assertFalse(frames.framingLost());
    }

    @Test
    void splitKeepsBarePrefixForNextRead()
    {
        byte[] chunk = bytes(0x01, 0x0A, 0x04);

        EnvelopeFraming.Frames frames = EnvelopeFraming.split(chunk, 0, chunk.length, 64);

        assertEquals(1, frames.bodies().size());
        assertEquals(1, frames.residualBytes());
        assertFalse(frames.framingLost());
    }

    @Test
    void splitKeepsUnterminatedShortPrefixForNextRead()
    {
        // 0xAC 0x02 would declare 300 bytes; only the first prefix byte arrived.
        byte[] chunk = bytes(0xAC);

        EnvelopeFraming.Frames frames = EnvelopeFraming.split(chunk, 0, chunk.length, 512);

        assertEquals(1, frames.residualBytes());
        assertFalse(frames.framingLost());
    }

    @Test
    void splitLosesFramingWhenEnvelopeExceedsLimit()
    {
        // 2-byte prefix plus 300-byte body against a 256-byte limit.
        byte[] chunk = bytes(0x00, 0xAC, 0x02, 0x01);

        EnvelopeFraming.Frames frames = EnvelopeFraming.split(chunk, 0, chunk.length, 256);

        assertEquals(1, frames.bodies().size());
        assertEquals(3, frames.residualBytes());
        assertTrue(frames.framingLost());
    }

    @Test
    void splitAcceptsEnvelopeExactlyAtLimit()
    {
        byte[] chunk = bytes(0x03, 0x01, 0x02, 0x03);

        EnvelopeFraming.Frames frames = EnvelopeFraming.split(chunk, 0, chunk.length, 4);

        assertEquals(1, frames.bodies().size());
        assertEquals(0, frames.residualBytes());
        assertFalse(frames.framingLost());
    }

    @Test
    void splitLosesFramingOnOverlongPrefix()
    {
        byte[] chunk = bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0x01);

        EnvelopeFraming.Frames frames = EnvelopeFraming.split(chunk, 0, chunk.length, 64);

        assertTrue(frames.bodies().isEmpty());
        assertEquals(6, frames.residualBytes());
        assertTrue(frames.framingLost());
    }

    @Test
    void splitHonoursOffsetAndLength()
    {
        byte[] buffer = new byte[16];
        Arrays.fill(buffer, (byte) 0x7F);
        buffer[4] = 0x01;
        buffer[5] = 0x42;

        EnvelopeFraming.Frames frames = EnvelopeFraming.split(buffer, 4, 2, 64);

        assertEquals(1, frames.bodies().size());
        assertArrayEquals(bytes(0x42), frames.bodies().get(0));
    }
}
