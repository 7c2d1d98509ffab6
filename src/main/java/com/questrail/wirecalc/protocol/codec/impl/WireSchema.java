package com.questrail.wirecalc.protocol.codec.impl;

/**
 * WireSchema
 * -----------------------------------------------------------------------------
 * Field numbers and wire types of the WireCalc envelope.
 *
 * <p>The body layout is protobuf wire format and is compatible with:</p>
 *
 * <pre>
 *   message EchoMessage   { string content = 1; }
 *   message AddRequest    { int32 a = 1; int32 b = 2; }
 *   message AddResponse   { int32 result = 1; }
 *
 *   message ClientMessage {
 *     oneof message { EchoMessage echo_message = 1; AddRequest add_request = 2; }
 *   }
 *   message ServerMessage {
 *     oneof message { EchoMessage echo_message = 1; AddResponse add_response = 2; }
 *   }
 * </pre>
 */
final class WireSchema
{
    static final int WIRETYPE_VARINT = 0;
    static final int WIRETYPE_FIXED64 = 1;
    static final int WIRETYPE_LENGTH_DELIMITED = 2;
    static final int WIRETYPE_FIXED32 = 5;

    static final int MAX_FIELD_NUMBER = (1 << 29) - 1;

    // Envelope (ClientMessage / ServerMessage) oneof members
    static final int ENVELOPE_ECHO_MESSAGE = 1;
    static final int ENVELOPE_ADD = 2;

    // EchoMessage
    static final int ECHO_CONTENT = 1;

    // AddRequest
    static final int ADD_REQUEST_A = 1;
    static final int ADD_REQUEST_B = 2;

    // AddResponse
    static final int ADD_RESPONSE_RESULT = 1;

    private WireSchema() {}

    static int tag(int fieldNumber, int wireType)
    {
        return (fieldNumber << 3) | wireType;
    }

    static int fieldNumber(int tag)
    {
        return tag >>> 3;
    }

    static int wireType(int tag)
    {
        return tag & 0x7;
    }
}
