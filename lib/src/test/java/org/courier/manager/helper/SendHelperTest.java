package org.courier.manager.helper;

import org.courier.manager.TestClock;
import org.courier.manager.api.Attachment;
import org.courier.manager.api.MessageStatus;
import org.courier.manager.api.MessageTooLargeException;
import org.courier.manager.config.ServiceConfig;
import org.courier.manager.network.OfflineNetworkGateway;
import org.courier.manager.protocol.MessageRecord;
import org.courier.manager.storage.Storage;
import org.courier.manager.storage.contacts.Contact;
import org.courier.manager.storage.messages.InboundMessage;
import org.courier.manager.storage.messages.OutboundMessage;
import org.courier.manager.util.KeyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SendHelperTest {

    private final TestClock clock = new TestClock(Instant.parse("2024-03-01T12:00:00Z"));

    private Context alice;
    private Context bob;
    private Contact bobInAlice;

    @BeforeEach
    void setUp() throws Exception {
        alice = SessionFixtures.newContext(new OfflineNetworkGateway(), clock);
        bob = SessionFixtures.newContext(new OfflineNetworkGateway(), clock);
        bobInAlice = SessionFixtures.connect(alice, "bob", bob, "alice")[0];
    }

    @Test
    void composedMessageIsQueued() throws MessageTooLargeException {
        final var message = alice.getSendHelper().sendMessage(bobInAlice, "hello", List.of(), null);

        assertEquals(MessageStatus.QUEUED, message.getStatus());
        assertEquals(clock.millis(), message.getCreatedTimestamp());
        assertEquals(bobInAlice.getServer(), message.getServer());
        assertEquals(List.of(message), alice.getState().getQueue().getMessages());
        assertEquals(List.of(message), alice.getState().getOutbox());
        assertEquals(message.getId(), message.getRecord().id());
        assertArrayEquals(KeyUtils.getDhPublicKey(bobInAlice.getLocalDh().current()), message.getRecord().myNextDh());
        assertArrayEquals(bobInAlice.getPeerDh().current(), message.getDeliveryKeys().peerDhPublicKey());
    }

    @Test
    void emptyBodyReplacedWithSpace() throws MessageTooLargeException {
        final var message = alice.getSendHelper().sendMessage(bobInAlice, "", List.of(), null);

        assertArrayEquals(" ".getBytes(StandardCharsets.UTF_8), message.getRecord().body());
        assertFalse(message.getRecord().isAcknowledgement());
    }

    @Test
    void messageAtSizeLimitAccepted() throws MessageTooLargeException {
        final var body = bodyOfSize(ServiceConfig.MAX_SERIALIZED_MESSAGE);

        final var message = alice.getSendHelper().sendMessage(bobInAlice, body, List.of(), null);

        assertEquals(ServiceConfig.MAX_SERIALIZED_MESSAGE, message.getRecord().serialize().length);
    }

    @Test
    void messageAboveSizeLimitRejected() {
        final var body = bodyOfSize(ServiceConfig.MAX_SERIALIZED_MESSAGE + 1);

        final var e = assertThrows(MessageTooLargeException.class,
                () -> alice.getSendHelper().sendMessage(bobInAlice, body, List.of(), null));

        assertEquals(ServiceConfig.MAX_SERIALIZED_MESSAGE + 1, e.getSize());
        assertTrue(alice.getState().getOutbox().isEmpty());
        assertEquals(0, alice.getState().getQueue().size());
    }

    @Test
    void estimateMatchesComposedSize() throws MessageTooLargeException {
        final var attachments = List.of(new Attachment("photo.jpg", new byte[1000]));
        final var usage = alice.getSendHelper().estimateUsage("see attached", false, attachments);

        final var message = alice.getSendHelper().sendMessage(bobInAlice, "see attached", attachments, null);

        assertEquals(message.getRecord().getSerializedSize(), usage.size());
        assertEquals(ServiceConfig.MAX_SERIALIZED_MESSAGE, usage.maximum());
        assertFalse(usage.isOverflowing());
    }

    @Test
    void estimateReportsOverflow() {
        final var usage = alice.getSendHelper()
                .estimateUsage("x", true, List.of(new Attachment("big.bin", new byte[20000])));

        assertTrue(usage.isOverflowing());
    }

    @Test
    void replyAcknowledgesOriginal() throws MessageTooLargeException {
        final var original = received("question?");

        final var reply = alice.getSendHelper().sendMessage(bobInAlice, "answer", List.of(), original);

        assertEquals(Optional.of(original.getRecord().id()), reply.getRecord().inReplyTo());
        assertTrue(original.isAcknowledged());
    }

    @Test
    void acknowledgementHasEmptyBody() {
        final var original = received("ping");

        final var ack = alice.getSendHelper().sendAcknowledgement(original);

        assertTrue(ack.getRecord().isAcknowledgement());
        assertEquals(Optional.of(original.getRecord().id()), ack.getRecord().inReplyTo());
        assertArrayEquals(KeyUtils.getDhPublicKey(bobInAlice.getLocalDh().current()), ack.getRecord().myNextDh());
        assertTrue(original.isAcknowledged());
        assertEquals(1, alice.getState().getQueue().size());
    }

    @Test
    void sentConfirmationStampsMessageOnce() throws MessageTooLargeException {
        final var message = alice.getSendHelper().sendMessage(bobInAlice, "hello", List.of(), null);
        clock.advance(Duration.ofMinutes(1));

        assertEquals(Optional.of(message), alice.getSendHelper().markSent(message.getId()));
        assertEquals(MessageStatus.SENT, message.getStatus());
        assertEquals(clock.millis(), message.getSentTimestamp());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(alice.getSendHelper().markSent(message.getId()).isEmpty());
        assertEquals(clock.millis() - 60_000, message.getSentTimestamp());
    }

    @Test
    void sentConfirmationForUnknownMessageIgnored() {
        assertTrue(alice.getSendHelper().markSent(12345L).isEmpty());
    }

    @Test
    void composingToPendingContactIsDefect() {
        final var pending = SessionFixtures.addPendingContact(alice, "carol");

        assertThrows(IllegalStateException.class,
                () -> alice.getSendHelper().sendMessage(pending, "hi", List.of(), null));
    }

    @Test
    void requeueSkipsMessagesAwaitingKeyExchange() throws Exception {
        final var unsent = alice.getSendHelper().sendMessage(bobInAlice, "still queued", List.of(), null);
        final var sent = alice.getSendHelper().sendMessage(bobInAlice, "delivered", List.of(), null);
        alice.getSendHelper().markSent(sent.getId());
        final var carol = SessionFixtures.addPendingContact(alice, "carol");
        final var r = unsent.getRecord();
        final var id = alice.getState().createId(new SecureRandom());
        final var record = new MessageRecord(id,
                r.time(),
                r.body(),
                r.bodyEncoding(),
                r.inReplyTo(),
                r.myNextDh(),
                r.files());
        alice.getState()
                .addOutboundMessage(new OutboundMessage(id,
                        carol.getId(),
                        bobInAlice.getServer(),
                        clock.millis(),
                        0,
                        0,
                        record));

        final var restored = new Context(Storage.deserialize(Storage.serialize(alice.getState())),
                alice.getDependencies());
        restored.getSendHelper().requeueUnsentMessages();

        final var queued = restored.getState().getQueue().getMessages();
        assertEquals(List.of(unsent.getId()), queued.stream().map(OutboundMessage::getId).toList());
        assertEquals(MessageStatus.QUEUED, restored.getState().getOutboundMessage(id).orElseThrow().getStatus());
    }

    private InboundMessage received(String body) {
        try {
            final var aliceInBob = bob.getState().getContactByName("alice").orElseThrow();
            final var outbound = bob.getSendHelper().sendMessage(aliceInBob, body, List.of(), null);
            final var inbound = InboundMessage.decoded(alice.getState().createId(new SecureRandom()),
                    bobInAlice.getId(),
                    clock.millis(),
                    outbound.getRecord());
            alice.getState().addInboundMessage(inbound);
            return inbound;
        } catch (MessageTooLargeException e) {
            throw new AssertionError(e);
        }
    }

    /**
     * Builds a body whose message serializes to exactly the given size. Bodies between 128 and 16383 bytes share
     * the same length prefix width.
     */
    private String bodyOfSize(int size) {
        final var reference = "a".repeat(200);
        final var referenceSize = alice.getSendHelper().estimateUsage(reference, false, List.of()).size();
        return "a".repeat(200 + size - referenceSize);
    }
}
