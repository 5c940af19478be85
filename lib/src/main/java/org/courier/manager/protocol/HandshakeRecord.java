package org.courier.manager.protocol;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Signed payload of a key exchange: everything a peer needs to send messages to us.
 *
 * @param publicKey      Ed25519 key the payload is signed with
 * @param identityPublic X25519 identity public key
 * @param server         address of our home server, UTF-8 encoded
 * @param dh             first ratchet public value
 * @param group          delivery group the member key belongs to
 * @param groupKey       member key issued to the peer
 * @param generation     revocation generation of our delivery group, unsigned
 */
public record HandshakeRecord(
        byte[] publicKey,
        byte[] identityPublic,
        byte[] server,
        byte[] dh,
        byte[] group,
        byte[] groupKey,
        int generation
) {

    private static final int PUBLIC_KEY_TAG = 1 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
    private static final int IDENTITY_PUBLIC_TAG = 2 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
    private static final int SERVER_TAG = 3 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
    private static final int DH_TAG = 4 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
    private static final int GROUP_TAG = 5 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
    private static final int GROUP_KEY_TAG = 6 << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
    private static final int GENERATION_TAG = 7 << 3 | WireFormat.WIRETYPE_VARINT;

    public HandshakeRecord(
            byte[] publicKey,
            byte[] identityPublic,
            String server,
            byte[] dh,
            byte[] group,
            byte[] groupKey,
            int generation
    ) {
        this(publicKey, identityPublic, server.getBytes(StandardCharsets.UTF_8), dh, group, groupKey, generation);
    }

    public byte[] serialize() {
        final var size = CodedOutputStream.computeByteArraySize(1, publicKey)
                + CodedOutputStream.computeByteArraySize(2, identityPublic)
                + CodedOutputStream.computeByteArraySize(3, server)
                + CodedOutputStream.computeByteArraySize(4, dh)
                + CodedOutputStream.computeByteArraySize(5, group)
                + CodedOutputStream.computeByteArraySize(6, groupKey)
                + CodedOutputStream.computeUInt32Size(7, generation);
        final var bytes = new byte[size];
        final var out = CodedOutputStream.newInstance(bytes);
        try {
            out.writeByteArray(1, publicKey);
            out.writeByteArray(2, identityPublic);
            out.writeByteArray(3, server);
            out.writeByteArray(4, dh);
            out.writeByteArray(5, group);
            out.writeByteArray(6, groupKey);
            out.writeUInt32(7, generation);
            out.checkNoSpaceLeft();
        } catch (IOException e) {
            throw new AssertionError("Writing to a sized array failed", e);
        }
        return bytes;
    }

    public static HandshakeRecord parse(byte[] bytes) throws InvalidProtocolBufferException {
        final var in = CodedInputStream.newInstance(bytes);
        byte[] publicKey = null;
        byte[] identityPublic = null;
        byte[] server = null;
        byte[] dh = null;
        byte[] group = null;
        byte[] groupKey = null;
        Integer generation = null;
        try {
            var done = false;
            while (!done) {
                final var tag = in.readTag();
                switch (tag) {
                    case 0 -> done = true;
                    case PUBLIC_KEY_TAG -> publicKey = in.readByteArray();
                    case IDENTITY_PUBLIC_TAG -> identityPublic = in.readByteArray();
                    case SERVER_TAG -> server = in.readByteArray();
                    case DH_TAG -> dh = in.readByteArray();
                    case GROUP_TAG -> group = in.readByteArray();
                    case GROUP_KEY_TAG -> groupKey = in.readByteArray();
                    case GENERATION_TAG -> generation = in.readUInt32();
                    default -> done = !in.skipField(tag);
                }
            }
        } catch (InvalidProtocolBufferException e) {
            throw e;
        } catch (IOException e) {
            throw new InvalidProtocolBufferException(e);
        }
        if (publicKey == null
                || identityPublic == null
                || server == null
                || dh == null
                || group == null
                || groupKey == null
                || generation == null) {
            throw new InvalidProtocolBufferException("Key exchange is missing required fields");
        }
        return new HandshakeRecord(publicKey, identityPublic, server, dh, group, groupKey, generation);
    }
}
