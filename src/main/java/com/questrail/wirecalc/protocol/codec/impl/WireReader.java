package com.questrail.wirecalc.protocol.codec.impl;

import com.questrail.wirecalc.protocol.codec.WireDecodeException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * WireReader
 * -----------------------------------------------------------------------------
 * Cursor over one protobuf-encoded message body.
 *
 * <p>Every structural fault is reported as {@link WireDecodeException}. The
 * reader never reads past the body it was given.</p>
 */
final class WireReader
{
    private static final int MAX_VARINT_BYTES = 10;

    private final byte[] buffer;
    private final int limit;
    private int position;

    WireReader(byte[] buffer)
    {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.limit = buffer.length;
        this.position = 0;
    }

    boolean isAtEnd()
    {
        return position >= limit;
    }

    /**
     * Reads a field tag and validates its field number and wire type.
     */
    int readTag()
    {
        final long raw = readVarint64();
        if (raw < 0 || raw > 0xFFFFFFFFL) {
            throw new WireDecodeException("Field tag out of range");
        }

        final int tag = (int) raw;
        final int field = WireSchema.fieldNumber(tag);
        if (field < 1 || field > WireSchema.MAX_FIELD_NUMBER) {
            throw new WireDecodeException("Invalid field number: " + field);
        }
        return tag;
    }

    long readVarint64()
    {
        long result = 0;
        for (int i = 0; i < MAX_VARINT_BYTES; i++) {
            if (position >= limit) {
                throw new WireDecodeException("Truncated varint");
            }
            final byte b = buffer[position++];
            result |= (long) (b & 0x7F) << (7 * i);
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new WireDecodeException("Varint longer than " + MAX_VARINT_BYTES + " bytes");
    }

    /**
     * int32 fields are sign-extended to 64 bits on the wire; truncation
     * recovers the original value.
     */
    int readInt32()
    {
        return (int) readVarint64();
    }

    byte[] readLengthDelimited()
    {
        final long length = readVarint64();
        if (length < 0 || length > limit - position) {
            throw new WireDecodeException(
                    "Length-delimited field of " + length + " bytes exceeds remaining "
                            + (limit - position));
        }
        final int start = position;
        position += (int) length;
        return Arrays.copyOfRange(buffer, start, position);
    }

    String readString()
    {
        final byte[] bytes = readLengthDelimited();
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new WireDecodeException("String field is not valid UTF-8", e);
        }
    }

    /**
     * Skips the value of an unknown field.
     *
     * <p>Groups (wire types 3 and 4) are deprecated and not accepted.</p>
     */
    void skipField(int wireType)
    {
        switch (wireType) {
            case WireSchema.WIRETYPE_VARINT -> readVarint64();
            case WireSchema.WIRETYPE_FIXED64 -> skipBytes(8);
            case WireSchema.WIRETYPE_LENGTH_DELIMITED -> readLengthDelimited();
            case WireSchema.WIRETYPE_FIXED32 -> skipBytes(4);
            default -> throw new WireDecodeException("Unsupported wire type: " + wireType);
        }
    }

    /**
     * Asserts that a known field arrived with the wire type it is declared with.
     */
    static void requireWireType(int tag, int expected)
    {
        final int actual = WireSchema.wireType(tag);
        if (actual != expected) {
            throw new WireDecodeException(
                    "Field " + WireSchema.fieldNumber(tag) + " has wire type " + actual
                            + ", expected " + expected);
        }
    }

    private void skipBytes(int count)
    {
        if (count > limit - position) {
            throw new WireDecodeException("Truncated fixed-width field");
        }
        position += count;
    }
}
