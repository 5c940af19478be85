package org.courier.manager.storage;

import org.courier.manager.storage.contacts.Contact;
import org.courier.manager.storage.messages.InboundMessage;
import org.courier.manager.storage.messages.MessageQueue;
import org.courier.manager.storage.messages.OutboundMessage;
import org.courier.manager.util.KeyUtils;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the client knows. Owned by the session thread, only the queue is shared with the network.
 */
public class SessionState {

    private final Identity identity;
    private final Map<Long, Contact> contacts = new LinkedHashMap<>();
    private final List<InboundMessage> inbox = new ArrayList<>();
    private final List<OutboundMessage> outbox = new ArrayList<>();
    private final MessageQueue queue = new MessageQueue();

    public SessionState(final Identity identity) {
        this.identity = identity;
    }

    public Identity getIdentity() {
        return identity;
    }

    public MessageQueue getQueue() {
        return queue;
    }

    public Collection<Contact> getContacts() {
        return Collections.unmodifiableCollection(contacts.values());
    }

    public Optional<Contact> getContact(long id) {
        return Optional.ofNullable(contacts.get(id));
    }

    public Optional<Contact> getContactByName(String name) {
        return contacts.values().stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    public void addContact(Contact contact) {
        if (contacts.putIfAbsent(contact.getId(), contact) != null) {
            throw new IllegalStateException("Duplicate contact id " + Long.toUnsignedString(contact.getId(), 16));
        }
    }

    public List<InboundMessage> getInbox() {
        return Collections.unmodifiableList(inbox);
    }

    public Optional<InboundMessage> getInboundMessage(long id) {
        return inbox.stream().filter(m -> m.getId() == id).findFirst();
    }

    public List<InboundMessage> getSealedMessages(long contactId) {
        return inbox.stream().filter(m -> m.getFrom() == contactId && m.isSealed()).toList();
    }

    public void addInboundMessage(InboundMessage message) {
        inbox.add(message);
    }

    public void removeInboundMessage(InboundMessage message) {
        inbox.remove(message);
    }

    /**
     * Erases inbox entries whose lifetime has ended.
     *
     * @return the removed messages
     */
    public List<InboundMessage> removeExpiredInboundMessages(long now) {
        final var expired = inbox.stream().filter(m -> m.isExpired(now)).toList();
        inbox.removeAll(expired);
        return expired;
    }

    public List<OutboundMessage> getOutbox() {
        return Collections.unmodifiableList(outbox);
    }

    public Optional<OutboundMessage> getOutboundMessage(long id) {
        return outbox.stream().filter(m -> m.getId() == id).findFirst();
    }

    public void addOutboundMessage(OutboundMessage message) {
        outbox.add(message);
    }

    /**
     * Draws an identifier that no contact or message uses yet.
     */
    public long createId(SecureRandom random) {
        while (true) {
            final var id = KeyUtils.createId(random);
            if (!isIdInUse(id)) {
                return id;
            }
        }
    }

    private boolean isIdInUse(long id) {
        return contacts.containsKey(id)
                || inbox.stream().anyMatch(m -> m.getId() == id)
                || outbox.stream().anyMatch(m -> m.getId() == id);
    }
}
