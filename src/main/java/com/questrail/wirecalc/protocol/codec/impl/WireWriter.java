package com.questrail.wirecalc.protocol.codec.impl;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * WireWriter
 * -----------------------------------------------------------------------------
 * Builds one protobuf-encoded message body.
 *
 * <p>Scalar fields holding their default value (zero, empty string) are
 * omitted, as proto3 does. Embedded messages are always written, so a oneof
 * member set to an all-default message is still present on the wire.</p>
 */
final class WireWriter
{
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    WireWriter writeInt32(int fieldNumber, int value)
    {
        if (value != 0) {
            writeVarint64(WireSchema.tag(fieldNumber, WireSchema.WIRETYPE_VARINT));
            // Negative int32 values are sign-extended: always 10 bytes.
            writeVarint64(value);
        }
        return this;
    }

    WireWriter writeString(int fieldNumber, String value)
    {
        Objects.requireNonNull(value, "value");
        if (!value.isEmpty()) {
            writeLengthDelimited(fieldNumber, value.getBytes(StandardCharsets.UTF_8));
        }
        return this;
    }

    WireWriter writeMessage(int fieldNumber, WireWriter message)
    {
        writeLengthDelimited(fieldNumber, message.toByteArray());
        return this;
    }

    byte[] toByteArray()
    {
        return out.toByteArray();
    }

    private void writeLengthDelimited(int fieldNumber, byte[] bytes)
    {
        writeVarint64(WireSchema.tag(fieldNumber, WireSchema.WIRETYPE_LENGTH_DELIMITED));
        writeVarint64(bytes.length);
        out.write(bytes, 0, bytes.length);
    }

    private void writeVarint64(long value)
    {
        long v = value;
        while ((v & ~0x7FL) != 0) {
            out.write((int) ((v & 0x7F) | 0x80));
            v >>>= 7;
        }
        out.write((int) v);
    }
}
