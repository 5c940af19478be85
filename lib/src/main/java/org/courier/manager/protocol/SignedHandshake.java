package org.courier.manager.protocol;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;

import java.io.IOException;

/**
 * Envelope carrying a serialized {@link HandshakeRecord} and the Ed25519 signature over exactly those bytes.
 */
public record SignedHandshake(byte[] signed, byte[] signature) {

    private static final int SIGNED_TAG = 1 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
    private static final int SIGNATURE_TAG = 2 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;

    public byte[] serialize() {
        final var bytes = new byte[CodedOutputStream.computeByteArraySize(1, signed)
                + CodedOutputStream.computeByteArraySize(2, signature)];
        final var out = CodedOutputStream.newInstance(bytes);
        try {
            out.writeByteArray(1, signed);
            out.writeByteArray(2, signature);
            out.checkNoSpaceLeft();
        } catch (IOException e) {
            throw new AssertionError("Writing to a sized array failed", e);
        }
        return bytes;
    }

    public static SignedHandshake parse(byte[] bytes) throws InvalidProtocolBufferException {
        final var in = CodedInputStream.newInstance(bytes);
        byte[] signed = null;
        byte[] signature = null;
        try {
            var done = false;
            while (!done) {
                final var tag = in.readTag();
                switch (tag) {
                    case 0 -> done = true;
                    case SIGNED_TAG -> signed = in.readByteArray();
                    case SIGNATURE_TAG -> signature = in.readByteArray();
                    default -> done = !in.skipField(tag);
                }
            }
        } catch (InvalidProtocolBufferException e) {
            throw e;
        } catch (IOException e) {
            throw new InvalidProtocolBufferException(e);
        }
        if (signed == null || signature == null) {
            throw new InvalidProtocolBufferException("Signed key exchange is missing required fields");
        }
        return new SignedHandshake(signed, signature);
    }
}
