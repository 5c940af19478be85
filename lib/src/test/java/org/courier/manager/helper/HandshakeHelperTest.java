package org.courier.manager.helper;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;

import org.courier.manager.Settings;
import org.courier.manager.api.HandshakeException;
import org.courier.manager.api.HandshakeException.Reason;
import org.courier.manager.config.ScryptParameters;
import org.courier.manager.network.OfflineNetworkGateway;
import org.courier.manager.protocol.HandshakeRecord;
import org.courier.manager.protocol.SignedHandshake;
import org.courier.manager.storage.contacts.Contact;
import org.courier.manager.util.KeyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandshakeHelperTest {

    private Context alice;
    private Context bob;

    @BeforeEach
    void setUp() {
        alice = SessionFixtures.newContext(new OfflineNetworkGateway(), Clock.systemUTC());
        bob = SessionFixtures.newContext(new OfflineNetworkGateway(), Clock.systemUTC());
    }

    @Test
    void appliedHandshakeActivatesContact() throws Exception {
        final var bobInAlice = SessionFixtures.addPendingContact(alice, "bob");
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");
        final var ownHandshake = HandshakeRecord.parse(SignedHandshake.parse(aliceInBob.getHandshake()).signed());

        bob.getHandshakeHelper().applyHandshake(aliceInBob, bobInAlice.getHandshake());

        assertFalse(aliceInBob.isPending());
        assertNull(aliceInBob.getHandshake());
        final var identity = alice.getState().getIdentity();
        assertArrayEquals(identity.getSigningPublicKey(), aliceInBob.getSigningPublicKey());
        assertArrayEquals(identity.getIdentityPublicKey(), aliceInBob.getIdentityPublicKey());
        assertEquals(identity.getServer(), aliceInBob.getServer());
        assertArrayEquals(KeyUtils.getDhPublicKey(bobInAlice.getLocalDh().previous()),
                aliceInBob.getPeerDh().current());
        assertArrayEquals(bobInAlice.getIssuedCredential().memberKey(),
                aliceInBob.getReceivedCredential().memberKey());
        assertNotNull(aliceInBob.getLocalDh().current());
        assertArrayEquals(ownHandshake.dh(), KeyUtils.getDhPublicKey(aliceInBob.getLocalDh().previous()));
    }

    @Test
    void eachContactGetsFreshMemberKey() {
        final var first = SessionFixtures.addPendingContact(alice, "bob");
        final var second = SessionFixtures.addPendingContact(alice, "carol");

        assertArrayEquals(first.getIssuedCredential().group(), second.getIssuedCredential().group());
        assertFalse(Arrays.equals(first.getIssuedCredential().memberKey(), second.getIssuedCredential().memberKey()));
        assertFalse(Arrays.equals(first.getLocalDh().previous(), second.getLocalDh().previous()));
    }

    static Stream<Arguments> tamperedPayloads() {
        return Stream.of(Arguments.of("public key", (UnaryOperator<HandshakeRecord>) r -> with(r, 0, flip(r.publicKey()))),
                Arguments.of("identity", (UnaryOperator<HandshakeRecord>) r -> with(r, 1, flip(r.identityPublic()))),
                Arguments.of("server", (UnaryOperator<HandshakeRecord>) r -> new HandshakeRecord(r.publicKey(),
                        r.identityPublic(),
                        new String(r.server(), StandardCharsets.UTF_8).replace("127.0.0.1", "127.0.0.2"),
                        r.dh(),
                        r.group(),
                        r.groupKey(),
                        r.generation())),
                Arguments.of("dh", (UnaryOperator<HandshakeRecord>) r -> with(r, 3, flip(r.dh()))),
                Arguments.of("group key", (UnaryOperator<HandshakeRecord>) r -> with(r, 5, flip(r.groupKey()))),
                Arguments.of("generation", (UnaryOperator<HandshakeRecord>) r -> new HandshakeRecord(r.publicKey(),
                        r.identityPublic(),
                        r.server(),
                        r.dh(),
                        r.group(),
                        r.groupKey(),
                        r.generation() + 1)));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("tamperedPayloads")
    void tamperedPayloadFailsSignatureCheck(String field, UnaryOperator<HandshakeRecord> tamper) throws Exception {
        final var bobInAlice = SessionFixtures.addPendingContact(alice, "bob");
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");
        final var signed = SignedHandshake.parse(bobInAlice.getHandshake());
        final var tampered = tamper.apply(HandshakeRecord.parse(signed.signed())).serialize();

        final var handshake = new SignedHandshake(tampered, signed.signature()).serialize();

        assertRejected(Reason.INVALID_SIGNATURE, aliceInBob, handshake);
    }

    @Test
    void everyTamperedPayloadByteFailsSignatureCheck() throws IOException {
        final var bobInAlice = SessionFixtures.addPendingContact(alice, "bob");
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");
        final var signed = SignedHandshake.parse(bobInAlice.getHandshake());
        final var payload = signed.signed();

        for (final var field : fieldContents(payload)) {
            for (var i = field[0]; i < field[1]; i++) {
                for (final var value : new byte[]{(byte) (payload[i] ^ 0x01), (byte) 0xff}) {
                    if (value == payload[i]) {
                        continue;
                    }
                    final var tampered = payload.clone();
                    tampered[i] = value;
                    final var handshake = new SignedHandshake(tampered, signed.signature()).serialize();

                    final var e = assertThrows(HandshakeException.class,
                            () -> bob.getHandshakeHelper().parseHandshake(handshake));
                    assertEquals(Reason.INVALID_SIGNATURE, e.getReason(), "byte " + i + " set to " + value);
                }
            }
        }
        assertTrue(aliceInBob.isPending());
    }

    @Test
    void undecodableServerRejectedAsAddress() throws InvalidProtocolBufferException {
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");
        final var r = validRecord();
        final var server = r.server().clone();
        server[server.length - 1] = (byte) 0xff;

        final var record = new HandshakeRecord(r.publicKey(),
                r.identityPublic(),
                server,
                r.dh(),
                r.group(),
                r.groupKey(),
                r.generation());

        assertRejected(Reason.INVALID_ADDRESS, aliceInBob, resign(record));
    }

    @Test
    void malformedHandshakeRejected() {
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");

        assertRejected(Reason.MALFORMED_HANDSHAKE, aliceInBob, new byte[0]);
        assertRejected(Reason.MALFORMED_HANDSHAKE, aliceInBob, new byte[]{0x0a, 0x05, 0x01});
        assertRejected(Reason.MALFORMED_HANDSHAKE,
                aliceInBob,
                new SignedHandshake(new byte[]{1, 2, 3}, new byte[64]).serialize());
    }

    @Test
    void shortSignatureRejected() throws InvalidProtocolBufferException {
        final var bobInAlice = SessionFixtures.addPendingContact(alice, "bob");
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");
        final var signed = SignedHandshake.parse(bobInAlice.getHandshake());

        final var handshake = new SignedHandshake(signed.signed(), Arrays.copyOf(signed.signature(), 63));

        assertRejected(Reason.MALFORMED_HANDSHAKE, aliceInBob, handshake.serialize());
    }

    @Test
    void shortPublicKeyRejected() throws InvalidProtocolBufferException {
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");
        final var record = validRecord();

        assertRejected(Reason.INVALID_PUBLIC_KEY,
                aliceInBob,
                resign(with(record, 0, Arrays.copyOf(record.publicKey(), 31))));
    }

    @Test
    void invalidServerRejected() throws InvalidProtocolBufferException {
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");
        final var r = validRecord();

        final var record = new HandshakeRecord(r.publicKey(),
                r.identityPublic(),
                "https://example.com",
                r.dh(),
                r.group(),
                r.groupKey(),
                r.generation());

        assertRejected(Reason.INVALID_ADDRESS, aliceInBob, resign(record));
    }

    @Test
    void testingServerRejectedOutsideTesting() throws InvalidProtocolBufferException {
        final var strictBob = SessionFixtures.newContext(new Settings(false, ScryptParameters.DEFAULT),
                new OfflineNetworkGateway(),
                Clock.systemUTC());
        final var aliceInBob = SessionFixtures.addPendingContact(strictBob, "alice");

        final var e = assertThrows(HandshakeException.class,
                () -> strictBob.getHandshakeHelper().applyHandshake(aliceInBob, resign(validRecord())));
        assertEquals(Reason.INVALID_ADDRESS, e.getReason());
    }

    @Test
    void foreignMemberKeyRejected() throws InvalidProtocolBufferException {
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");
        final var otherGroup = SessionFixtures.addPendingContact(bob, "carol").getIssuedCredential();

        assertRejected(Reason.INVALID_GROUP_CREDENTIAL,
                aliceInBob,
                resign(with(validRecord(), 5, otherGroup.memberKey())));
    }

    @Test
    void shortIdentityKeyRejected() throws InvalidProtocolBufferException {
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");

        assertRejected(Reason.INVALID_PUBLIC_KEY, aliceInBob, resign(with(validRecord(), 1, new byte[16])));
    }

    @Test
    void shortDhValueRejected() throws InvalidProtocolBufferException {
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");

        assertRejected(Reason.INVALID_DH_VALUE, aliceInBob, resign(with(validRecord(), 3, new byte[31])));
    }

    private void assertRejected(Reason reason, Contact contact, byte[] handshake) {
        final var e = assertThrows(HandshakeException.class,
                () -> bob.getHandshakeHelper().applyHandshake(contact, handshake));
        assertEquals(reason, e.getReason());
        assertTrue(contact.isPending());
        assertNull(contact.getSigningPublicKey());
        assertNull(contact.getPeerDh().current());
        assertNull(contact.getLocalDh().current());
    }

    private HandshakeRecord validRecord() throws InvalidProtocolBufferException {
        final var bobInAlice = SessionFixtures.addPendingContact(alice, "bob-" + System.nanoTime());
        return HandshakeRecord.parse(SignedHandshake.parse(bobInAlice.getHandshake()).signed());
    }

    private byte[] resign(HandshakeRecord record) {
        final var payload = record.serialize();
        final var signature = KeyUtils.sign(alice.getState().getIdentity().getSigningKey(), payload);
        return new SignedHandshake(payload, signature).serialize();
    }

    private static HandshakeRecord with(HandshakeRecord r, int field, byte[] value) {
        return new HandshakeRecord(field == 0 ? value : r.publicKey(),
                field == 1 ? value : r.identityPublic(),
                r.server(),
                field == 3 ? value : r.dh(),
                field == 4 ? value : r.group(),
                field == 5 ? value : r.groupKey(),
                r.generation());
    }

    /**
     * Offsets of the contents of every length-delimited field, start inclusive and end exclusive.
     */
    private static List<int[]> fieldContents(byte[] payload) throws IOException {
        final var fields = new ArrayList<int[]>();
        final var in = CodedInputStream.newInstance(payload);
        var tag = in.readTag();
        while (tag != 0) {
            if (WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                final var length = in.readRawVarint32();
                final var start = in.getTotalBytesRead();
                fields.add(new int[]{start, start + length});
                in.skipRawBytes(length);
            } else {
                in.skipField(tag);
            }
            tag = in.readTag();
        }
        return fields;
    }

    private static byte[] flip(byte[] bytes) {
        final var copy = bytes.clone();
        copy[copy.length / 2] ^= 0x01;
        return copy;
    }
}
