package org.courier.manager.storage;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.InvalidProtocolBufferException;

import org.courier.manager.api.CorruptStateException;
import org.courier.manager.groups.MemberCredential;
import org.courier.manager.protocol.MessageRecord;
import org.courier.manager.storage.contacts.Contact;
import org.courier.manager.storage.contacts.DhRatchet;
import org.courier.manager.storage.messages.InboundMessage;
import org.courier.manager.storage.messages.OutboundMessage;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.courier.manager.storage.Utils.decode;
import static org.courier.manager.storage.Utils.encode;

/**
 * Serialized form of the {@link SessionState}. Binary values are Base64 encoded, message records are kept in
 * their wire format.
 */
public record Storage(
        int version,
        IdentityData identity,
        List<ContactData> contacts,
        List<InboundData> inbox,
        List<OutboundData> outbox
) {

    public static final int CURRENT_STORAGE_VERSION = 1;

    private static final ObjectMapper jsonProcessor = Utils.createStorageObjectMapper();

    public record IdentityData(
            String server,
            String signingKey,
            String identityPrivateKey,
            String groupPrivateKey,
            long generation
    ) {}

    public record ContactData(
            long id,
            String name,
            boolean pending,
            String handshake,
            String issuedGroup,
            String issuedMemberKey,
            String receivedGroup,
            String receivedMemberKey,
            long generation,
            String server,
            String signingPublicKey,
            String identityPublicKey,
            String lastDhPrivateKey,
            String currentDhPrivateKey,
            String peerLastDhPublicKey,
            String peerCurrentDhPublicKey
    ) {}

    public record InboundData(
            long id,
            long from,
            long receivedTimestamp,
            boolean read,
            boolean acknowledged,
            String sealed,
            String message
    ) {}

    public record OutboundData(
            long id,
            long to,
            String server,
            long createdTimestamp,
            long sentTimestamp,
            long acknowledgedTimestamp,
            String message
    ) {}

    public static byte[] serialize(SessionState state) {
        final var storage = from(state);
        try (var output = new ByteArrayOutputStream()) {
            jsonProcessor.writeValue(output, storage);
            return output.toByteArray();
        } catch (IOException e) {
            throw new AssertionError("Failed to serialize session state", e);
        }
    }

    public static SessionState deserialize(byte[] bytes) throws CorruptStateException {
        final Storage storage;
        try {
            storage = jsonProcessor.readValue(bytes, Storage.class);
        } catch (JacksonException e) {
            throw new CorruptStateException("State file contents are not valid: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CorruptStateException("Failed to read state file contents", e);
        }
        if (storage.version() > CURRENT_STORAGE_VERSION) {
            throw new CorruptStateException("State file version " + storage.version() + " is not supported");
        }
        final SessionState state;
        try {
            state = storage.toSessionState();
        } catch (IllegalArgumentException | IllegalStateException | NullPointerException |
                 IndexOutOfBoundsException | InvalidProtocolBufferException e) {
            throw new CorruptStateException("State file contents are not valid: " + e.getMessage(), e);
        }
        checkConsistency(state);
        return state;
    }

    /**
     * Ids are non-zero and unique across contacts and messages, every message belongs to a known contact.
     */
    private static void checkConsistency(SessionState state) throws CorruptStateException {
        final var ids = new HashSet<Long>();
        for (final var contact : state.getContacts()) {
            checkId(ids, contact.getId());
        }
        for (final var message : state.getInbox()) {
            checkId(ids, message.getId());
            if (state.getContact(message.getFrom()).isEmpty()) {
                throw new CorruptStateException("Inbox message "
                        + Long.toUnsignedString(message.getId(), 16)
                        + " is from unknown contact "
                        + Long.toUnsignedString(message.getFrom(), 16));
            }
        }
        for (final var message : state.getOutbox()) {
            checkId(ids, message.getId());
            if (state.getContact(message.getTo()).isEmpty()) {
                throw new CorruptStateException("Outbox message "
                        + Long.toUnsignedString(message.getId(), 16)
                        + " is to unknown contact "
                        + Long.toUnsignedString(message.getTo(), 16));
            }
        }
    }

    private static void checkId(Set<Long> ids, long id) throws CorruptStateException {
        if (id == 0) {
            throw new CorruptStateException("State file contains a zero id");
        }
        if (!ids.add(id)) {
            throw new CorruptStateException("State file contains duplicate id " + Long.toUnsignedString(id, 16));
        }
    }

    private static Storage from(SessionState state) {
        final var identity = state.getIdentity();
        return new Storage(CURRENT_STORAGE_VERSION,
                new IdentityData(identity.getServer(),
                        encode(identity.getSigningKey()),
                        encode(identity.getIdentityPrivateKey()),
                        encode(identity.getGroupPrivateKey()),
                        Integer.toUnsignedLong(identity.getGeneration())),
                state.getContacts().stream().map(Storage::from).toList(),
                state.getInbox()
                        .stream()
                        .map(m -> new InboundData(m.getId(),
                                m.getFrom(),
                                m.getReceivedTimestamp(),
                                m.isRead(),
                                m.isAcknowledged(),
                                encode(m.getSealed()),
                                m.isSealed() ? null : encode(m.getRecord().serialize())))
                        .toList(),
                state.getOutbox()
                        .stream()
                        .map(m -> new OutboundData(m.getId(),
                                m.getTo(),
                                m.getServer(),
                                m.getCreatedTimestamp(),
                                m.getSentTimestamp(),
                                m.getAcknowledgedTimestamp(),
                                encode(m.getRecord().serialize())))
                        .toList());
    }

    private static ContactData from(Contact contact) {
        final var issued = contact.getIssuedCredential();
        final var received = contact.getReceivedCredential();
        return new ContactData(contact.getId(),
                contact.getName(),
                contact.isPending(),
                encode(contact.getHandshake()),
                issued == null ? null : encode(issued.group()),
                issued == null ? null : encode(issued.memberKey()),
                received == null ? null : encode(received.group()),
                received == null ? null : encode(received.memberKey()),
                Integer.toUnsignedLong(contact.getGeneration()),
                contact.getServer(),
                encode(contact.getSigningPublicKey()),
                encode(contact.getIdentityPublicKey()),
                encode(contact.getLocalDh().previous()),
                encode(contact.getLocalDh().current()),
                encode(contact.getPeerDh().previous()),
                encode(contact.getPeerDh().current()));
    }

    private SessionState toSessionState() throws InvalidProtocolBufferException {
        if (identity == null) {
            throw new IllegalArgumentException("identity missing");
        }
        final var state = new SessionState(new Identity(identity.server(),
                decode(identity.signingKey()),
                decode(identity.identityPrivateKey()),
                decode(identity.groupPrivateKey()),
                (int) identity.generation()));
        if (contacts != null) {
            for (final var c : contacts) {
                state.addContact(new Contact(c.id(),
                        c.name(),
                        c.pending(),
                        decode(c.handshake()),
                        credential(c.issuedGroup(), c.issuedMemberKey()),
                        credential(c.receivedGroup(), c.receivedMemberKey()),
                        (int) c.generation(),
                        c.server(),
                        decode(c.signingPublicKey()),
                        decode(c.identityPublicKey()),
                        new DhRatchet(decode(c.lastDhPrivateKey()), decode(c.currentDhPrivateKey())),
                        new DhRatchet(decode(c.peerLastDhPublicKey()), decode(c.peerCurrentDhPublicKey()))));
            }
        }
        if (inbox != null) {
            for (final var m : inbox) {
                final var record = m.message() == null ? null : MessageRecord.parse(decode(m.message()));
                state.addInboundMessage(new InboundMessage(m.id(),
                        m.from(),
                        m.receivedTimestamp(),
                        m.read(),
                        m.acknowledged(),
                        decode(m.sealed()),
                        record));
            }
        }
        if (outbox != null) {
            for (final var m : outbox) {
                state.addOutboundMessage(new OutboundMessage(m.id(),
                        m.to(),
                        m.server(),
                        m.createdTimestamp(),
                        m.sentTimestamp(),
                        m.acknowledgedTimestamp(),
                        MessageRecord.parse(decode(m.message()))));
            }
        }
        return state;
    }

    private static MemberCredential credential(String group, String memberKey) {
        if (group == null || memberKey == null) {
            return null;
        }
        return new MemberCredential(decode(group), decode(memberKey));
    }
}
