package org.courier.manager.helper;

import org.courier.manager.TestClock;
import org.courier.manager.api.MessageStatus;
import org.courier.manager.config.ServiceConfig;
import org.courier.manager.network.FetchedMessage;
import org.courier.manager.network.LoopbackNetwork;
import org.courier.manager.protocol.MessageRecord;
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
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IncomingMessageHandlerTest {

    private final TestClock clock = new TestClock(Instant.parse("2024-03-01T12:00:00Z"));
    private final LoopbackNetwork network = new LoopbackNetwork();
    private final SecureRandom random = new SecureRandom();

    private Context alice;
    private Context bob;

    @BeforeEach
    void setUp() {
        alice = SessionFixtures.newContext(network.newEndpoint(), clock);
        bob = SessionFixtures.newContext(network.newEndpoint(), clock);
    }

    @Test
    void messageFromActiveContactIsOpened() throws Exception {
        final var contacts = SessionFixtures.connect(alice, "bob", bob, "alice");
        final var sent = send(alice, contacts[0], "hello");

        final var result = bob.getIncomingMessageHandler()
                .handleFetchedMessages(List.of(new FetchedMessage(contacts[1].getId(), seal(sent))));

        assertEquals(1, result.getReceived().size());
        final var inbound = bob.getState().getInbox().get(0);
        assertFalse(inbound.isSealed());
        assertEquals("hello", new String(inbound.getRecord().body(), StandardCharsets.UTF_8));
        assertEquals(contacts[1].getId(), inbound.getFrom());
        assertEquals(clock.millis(), inbound.getReceivedTimestamp());
    }

    @Test
    void messageFromUnknownSenderDropped() throws Exception {
        final var contacts = SessionFixtures.connect(alice, "bob", bob, "alice");
        final var sent = send(alice, contacts[0], "hello");

        final var result = bob.getIncomingMessageHandler()
                .handleFetchedMessages(List.of(new FetchedMessage(contacts[1].getId() + 1, seal(sent))));

        assertTrue(result.isEmpty());
        assertTrue(bob.getState().getInbox().isEmpty());
    }

    @Test
    void messageFromPendingContactStaysSealedUntilHandshake() throws Exception {
        final var bobInAlice = SessionFixtures.addPendingContact(alice, "bob");
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");
        final var aliceHandshake = bobInAlice.getHandshake();
        alice.getHandshakeHelper().applyHandshake(bobInAlice, aliceInBob.getHandshake());
        final var sent = send(alice, bobInAlice, "early bird");

        bob.getIncomingMessageHandler()
                .handleFetchedMessages(List.of(new FetchedMessage(aliceInBob.getId(), seal(sent))));
        final var inbound = bob.getState().getInbox().get(0);
        assertTrue(inbound.isSealed());

        final var opened = bob.getHandshakeHelper().applyHandshake(aliceInBob, aliceHandshake);

        assertEquals(List.of(inbound), opened.getReceived());
        assertFalse(inbound.isSealed());
        assertEquals("early bird", new String(inbound.getRecord().body(), StandardCharsets.UTF_8));
    }

    @Test
    void unreadableSealedMessageRemovedOnHandshake() throws Exception {
        final var bobInAlice = SessionFixtures.addPendingContact(alice, "bob");
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");

        bob.getIncomingMessageHandler()
                .handleFetchedMessages(List.of(new FetchedMessage(aliceInBob.getId(), new byte[40])));
        assertEquals(1, bob.getState().getInbox().size());

        bob.getHandshakeHelper().applyHandshake(aliceInBob, bobInAlice.getHandshake());

        assertTrue(bob.getState().getInbox().isEmpty());
    }

    @Test
    void sealedAcknowledgementDiscardedOnHandshake() throws Exception {
        final var bobInAlice = SessionFixtures.addPendingContact(alice, "bob");
        final var aliceInBob = SessionFixtures.addPendingContact(bob, "alice");
        final var aliceHandshake = bobInAlice.getHandshake();
        alice.getHandshakeHelper().applyHandshake(bobInAlice, aliceInBob.getHandshake());

        // restored outbox entry of bob's that alice already received
        final var question = new MessageRecord(bob.getState().createId(random),
                clock.millis() / 1000,
                "ping".getBytes(StandardCharsets.UTF_8),
                MessageRecord.BodyEncoding.RAW,
                Optional.empty(),
                new byte[ServiceConfig.KEY_LENGTH],
                List.of());
        final var original = new OutboundMessage(question.id(),
                aliceInBob.getId(),
                "pondserver://bob@127.0.0.1:16333",
                clock.millis(),
                0,
                0,
                question);
        bob.getState().addOutboundMessage(original);
        final var received = InboundMessage.decoded(alice.getState().createId(random),
                bobInAlice.getId(),
                clock.millis(),
                question);
        alice.getState().addInboundMessage(received);
        final var ack = alice.getSendHelper().sendAcknowledgement(received);

        bob.getIncomingMessageHandler()
                .handleFetchedMessages(List.of(new FetchedMessage(aliceInBob.getId(), seal(ack))));
        assertTrue(bob.getState().getInbox().get(0).isSealed());
        clock.advance(Duration.ofMinutes(5));

        final var opened = bob.getHandshakeHelper().applyHandshake(aliceInBob, aliceHandshake);

        assertTrue(opened.getReceived().isEmpty());
        assertEquals(List.of(original), opened.getAcknowledged());
        assertTrue(bob.getState().getInbox().isEmpty());
        assertEquals(MessageStatus.ACKNOWLEDGED, original.getStatus());
        assertEquals(clock.millis(), original.getAcknowledgedTimestamp());
    }

    @Test
    void acknowledgementUpdatesOutboxWithoutInboxEntry() throws Exception {
        final var contacts = SessionFixtures.connect(alice, "bob", bob, "alice");
        final var sent = send(alice, contacts[0], "hello");
        bob.getIncomingMessageHandler()
                .handleFetchedMessages(List.of(new FetchedMessage(contacts[1].getId(), seal(sent))));
        final var ack = bob.getSendHelper().sendAcknowledgement(bob.getState().getInbox().get(0));
        clock.advance(Duration.ofMinutes(5));

        final var result = alice.getIncomingMessageHandler()
                .handleFetchedMessages(List.of(new FetchedMessage(contacts[0].getId(), seal(ack))));

        assertEquals(List.of(sent), result.getAcknowledged());
        assertEquals(MessageStatus.ACKNOWLEDGED, sent.getStatus());
        assertEquals(clock.millis(), sent.getAcknowledgedTimestamp());
        assertEquals(clock.millis(), sent.getSentTimestamp());
        assertTrue(alice.getState().getInbox().isEmpty());
    }

    @Test
    void ratchetAdvancesOnBothSides() throws Exception {
        final var contacts = SessionFixtures.connect(alice, "bob", bob, "alice");
        final var bobInAlice = contacts[0];
        final var aliceInBob = contacts[1];
        final var aliceCurrent = bobInAlice.getLocalDh().current();

        final var first = send(alice, bobInAlice, "one");
        bob.getIncomingMessageHandler()
                .handleFetchedMessages(List.of(new FetchedMessage(aliceInBob.getId(), seal(first))));
        assertArrayEquals(KeyUtils.getDhPublicKey(aliceCurrent), aliceInBob.getPeerDh().current());

        final var reply = send(bob, aliceInBob, "two");
        alice.getIncomingMessageHandler()
                .handleFetchedMessages(List.of(new FetchedMessage(bobInAlice.getId(), seal(reply))));

        assertArrayEquals(aliceCurrent, bobInAlice.getLocalDh().previous());
        assertFalse(Arrays.equals(aliceCurrent, bobInAlice.getLocalDh().current()));
        assertEquals(1, alice.getState().getInbox().size());
    }

    @Test
    void expiredMessagesErased() throws Exception {
        final var contacts = SessionFixtures.connect(alice, "bob", bob, "alice");
        bob.getIncomingMessageHandler()
                .handleFetchedMessages(List.of(new FetchedMessage(contacts[1].getId(),
                        seal(send(alice, contacts[0], "old")))));
        clock.advance(Duration.ofDays(1));
        bob.getIncomingMessageHandler()
                .handleFetchedMessages(List.of(new FetchedMessage(contacts[1].getId(),
                        seal(send(alice, contacts[0], "new")))));

        clock.advance(ServiceConfig.MESSAGE_LIFETIME.minus(Duration.ofHours(1)));
        final var expired = bob.getIncomingMessageHandler().removeExpiredMessages();

        assertEquals(1, expired.size());
        assertEquals("old", new String(expired.get(0).getRecord().body(), StandardCharsets.UTF_8));
        assertEquals(1, bob.getState().getInbox().size());
    }

    private static OutboundMessage send(Context context, Contact to, String body) throws Exception {
        return context.getSendHelper().sendMessage(to, body, List.of(), null);
    }

    private static byte[] seal(OutboundMessage message) {
        return LoopbackNetwork.seal(message.getDeliveryKeys().peerDhPublicKey(), message.getRecord());
    }
}
