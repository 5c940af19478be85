package org.courier.manager.helper;

import org.courier.manager.config.ServiceConfig;
import org.courier.manager.network.FetchedMessage;
import org.courier.manager.network.UnsealedMessage;
import org.courier.manager.protocol.MessageRecord;
import org.courier.manager.storage.contacts.Contact;
import org.courier.manager.storage.messages.InboundMessage;
import org.courier.manager.storage.messages.OutboundMessage;
import org.courier.manager.util.KeyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public class IncomingMessageHandler {

    private final static Logger logger = LoggerFactory.getLogger(IncomingMessageHandler.class);

    private final Context context;

    public IncomingMessageHandler(final Context context) {
        this.context = context;
    }

    /**
     * Stores fetched messages in the inbox. Messages from pending contacts are kept sealed, messages from active
     * contacts are opened. Acknowledgements update the outbox instead of being stored.
     */
    public IncomingMessages handleFetchedMessages(List<FetchedMessage> messages) {
        final var result = new IncomingMessages();
        for (final var fetched : messages) {
            final var contact = context.getState().getContact(fetched.from());
            if (contact.isEmpty()) {
                logger.warn("Dropping message from unknown contact {}", Long.toUnsignedString(fetched.from(), 16));
                continue;
            }

            if (contact.get().isPending()) {
                final var message = InboundMessage.sealed(newId(), fetched.from(), context.now(), fetched.sealed());
                context.getState().addInboundMessage(message);
                result.received.add(message);
                logger.debug("Stored sealed message from pending contact {}", contact.get().getName());
                continue;
            }

            final var unsealed = unseal(contact.get(), fetched.sealed());
            if (unsealed.isEmpty()) {
                continue;
            }
            final var record = unsealed.get();
            result.acknowledged.addAll(handleReply(contact.get(), record));
            if (record.isAcknowledgement()) {
                continue;
            }
            final var message = InboundMessage.decoded(newId(), fetched.from(), context.now(), record);
            context.getState().addInboundMessage(message);
            result.received.add(message);
        }
        return result;
    }

    /**
     * Opens the sealed messages of a contact whose key exchange just completed. Messages that can't be opened and
     * acknowledgements are removed from the inbox.
     */
    public IncomingMessages unsealPendingMessages(Contact contact) {
        final var result = new IncomingMessages();
        final var state = context.getState();
        for (final var message : state.getSealedMessages(contact.getId())) {
            final var record = unseal(contact, message.getSealed());
            if (record.isEmpty()) {
                state.removeInboundMessage(message);
                continue;
            }
            result.acknowledged.addAll(handleReply(contact, record.get()));
            if (record.get().isAcknowledgement()) {
                state.removeInboundMessage(message);
                continue;
            }
            message.unseal(record.get());
            result.received.add(message);
        }
        if (!result.received.isEmpty()) {
            logger.info("Opened {} messages from {}", result.received.size(), contact.getName());
        }
        return result;
    }

    public List<InboundMessage> removeExpiredMessages() {
        final var expired = context.getState().removeExpiredInboundMessages(context.now());
        if (!expired.isEmpty()) {
            logger.debug("Erased {} expired messages", expired.size());
        }
        return expired;
    }

    private Optional<MessageRecord> unseal(Contact contact, byte[] sealed) {
        final Optional<UnsealedMessage> unsealed = context.getDependencies()
                .getNetworkGateway()
                .unseal(contact, sealed);
        if (unsealed.isEmpty()) {
            logger.warn("Failed to open message from {}", contact.getName());
            return Optional.empty();
        }
        advanceRatchet(contact, unsealed.get());
        return Optional.of(unsealed.get().record());
    }

    /**
     * The peer advertises its newest ratchet value in every message. Once the peer has used our current value we
     * move on to a fresh one.
     */
    private void advanceRatchet(Contact contact, UnsealedMessage unsealed) {
        final var nextDh = unsealed.record().myNextDh();
        if (nextDh != null
                && nextDh.length == ServiceConfig.KEY_LENGTH
                && !Arrays.equals(nextDh, contact.getPeerDh().current())) {
            contact.advancePeerDh(nextDh);
        }
        if (unsealed.sealedToCurrentKey()) {
            contact.rotateLocalDh(KeyUtils.createDhPrivateKey(context.getDependencies().getSecureRandom()));
        }
    }

    private List<OutboundMessage> handleReply(Contact contact, MessageRecord record) {
        if (record.inReplyTo().isEmpty()) {
            if (record.isAcknowledgement()) {
                logger.warn("Ignoring empty message from {}", contact.getName());
            }
            return List.of();
        }
        final var replyTo = record.inReplyTo().get();
        final var original = context.getState().getOutboundMessage(replyTo);
        if (original.isEmpty() || original.get().getTo() != contact.getId()) {
            logger.debug("Reply from {} refers to unknown message {}",
                    contact.getName(),
                    Long.toUnsignedString(replyTo, 16));
            return List.of();
        }
        if (!original.get().markAcknowledged(context.now())) {
            return List.of();
        }
        return List.of(original.get());
    }

    private long newId() {
        return context.getState().createId(context.getDependencies().getSecureRandom());
    }

    public static class IncomingMessages {

        private final List<InboundMessage> received = new ArrayList<>();
        private final List<OutboundMessage> acknowledged = new ArrayList<>();

        public List<InboundMessage> getReceived() {
            return received;
        }

        public List<OutboundMessage> getAcknowledged() {
            return acknowledged;
        }

        public boolean isEmpty() {
            return received.isEmpty() && acknowledged.isEmpty();
        }
    }
}
