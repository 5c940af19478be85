package org.courier.manager.helper;

import org.courier.manager.api.Attachment;
import org.courier.manager.api.MessageTooLargeException;
import org.courier.manager.api.MessageUsage;
import org.courier.manager.config.ServiceConfig;
import org.courier.manager.protocol.MessageRecord;
import org.courier.manager.protocol.MessageRecord.BodyEncoding;
import org.courier.manager.storage.contacts.Contact;
import org.courier.manager.storage.messages.DeliveryKeys;
import org.courier.manager.storage.messages.InboundMessage;
import org.courier.manager.storage.messages.OutboundMessage;
import org.courier.manager.util.KeyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

public class SendHelper {

    private final static Logger logger = LoggerFactory.getLogger(SendHelper.class);

    private static final byte[] PLACEHOLDER_BODY = " ".getBytes(StandardCharsets.UTF_8);

    private final Context context;

    public SendHelper(final Context context) {
        this.context = context;
    }

    /**
     * Reports how large a message with the given contents would be once composed.
     */
    public MessageUsage estimateUsage(String body, boolean isReply, List<Attachment> attachments) {
        final var record = buildRecord(0,
                context.now(),
                toBody(body),
                isReply ? Optional.of(0L) : Optional.empty(),
                new byte[ServiceConfig.KEY_LENGTH],
                attachments);
        return new MessageUsage(record.getSerializedSize(), ServiceConfig.MAX_SERIALIZED_MESSAGE);
    }

    /**
     * Composes a message to an active contact and queues it for transmission.
     *
     * @param inReplyTo the received message this one answers, it is marked as acknowledged
     */
    public OutboundMessage sendMessage(
            Contact to, String body, List<Attachment> attachments, InboundMessage inReplyTo
    ) throws MessageTooLargeException {
        final var replyId = inReplyTo == null ? Optional.<Long>empty() : Optional.of(inReplyTo.getRecord().id());
        final var record = composeRecord(to, toBody(body), replyId, attachments);

        final var message = enqueue(to, record);
        if (inReplyTo != null) {
            inReplyTo.markAcknowledged();
        }
        return message;
    }

    /**
     * Queues an empty message telling the sender that the given message was received.
     */
    public OutboundMessage sendAcknowledgement(InboundMessage message) {
        final var contact = context.getState()
                .getContact(message.getFrom())
                .orElseThrow(() -> new IllegalStateException("Sender of inbound message is not a contact"));
        final MessageRecord record;
        try {
            record = composeRecord(contact, new byte[0], Optional.of(message.getRecord().id()), List.of());
        } catch (MessageTooLargeException e) {
            throw new AssertionError("Acknowledgement exceeds the message size limit", e);
        }
        final var outbound = enqueue(contact, record);
        message.markAcknowledged();
        return outbound;
    }

    /**
     * Puts unsent outbox messages of a freshly loaded state back into the queue.
     */
    public void requeueUnsentMessages() {
        final var state = context.getState();
        for (final var message : state.getOutbox()) {
            if (message.getSentTimestamp() != 0) {
                continue;
            }
            final var contact = state.getContact(message.getTo());
            if (contact.isEmpty()) {
                logger.warn("Not sending queued message {} to unknown contact {}",
                        Long.toUnsignedString(message.getId(), 16),
                        Long.toUnsignedString(message.getTo(), 16));
                continue;
            }
            if (contact.get().isPending()) {
                logger.warn("Not sending queued message {}, key exchange with {} is not complete",
                        Long.toUnsignedString(message.getId(), 16),
                        contact.get().getName());
                continue;
            }
            message.setDeliveryKeys(getDeliveryKeys(contact.get()));
            state.getQueue().enqueue(message);
        }
        logger.debug("Requeued {} unsent messages", state.getQueue().size());
    }

    /**
     * Records that the network delivered a queued message.
     *
     * @return the message, empty if the id is unknown or the message was already sent
     */
    public Optional<OutboundMessage> markSent(long messageId) {
        final var message = context.getState().getOutboundMessage(messageId);
        if (message.isEmpty()) {
            logger.warn("Sent confirmation for unknown message {}", Long.toUnsignedString(messageId, 16));
            return Optional.empty();
        }
        if (!message.get().markSent(context.now())) {
            return Optional.empty();
        }
        return message;
    }

    private MessageRecord composeRecord(
            Contact to, byte[] body, Optional<Long> inReplyTo, List<Attachment> attachments
    ) throws MessageTooLargeException {
        if (to.isPending()) {
            throw new IllegalStateException("Can't compose a message to pending contact " + to.getName());
        }
        final var id = context.getState().createId(context.getDependencies().getSecureRandom());
        final var record = buildRecord(id,
                context.now(),
                body,
                inReplyTo,
                KeyUtils.getDhPublicKey(to.getLocalDh().current()),
                attachments);

        final var size = record.getSerializedSize();
        if (size > ServiceConfig.MAX_SERIALIZED_MESSAGE) {
            throw new MessageTooLargeException(size, ServiceConfig.MAX_SERIALIZED_MESSAGE);
        }
        return record;
    }

    private OutboundMessage enqueue(Contact to, MessageRecord record) {
        final var message = new OutboundMessage(record.id(), to.getId(), to.getServer(), context.now(), 0, 0, record);
        message.setDeliveryKeys(getDeliveryKeys(to));

        context.getState().addOutboundMessage(message);
        context.getState().getQueue().enqueue(message);
        logger.debug("Queued message {} to {}", Long.toUnsignedString(message.getId(), 16), to.getName());
        return message;
    }

    private static DeliveryKeys getDeliveryKeys(Contact contact) {
        return new DeliveryKeys(contact.getServer(),
                contact.getIdentityPublicKey(),
                contact.getPeerDh().current(),
                contact.getLocalDh().previous(),
                contact.getReceivedCredential(),
                contact.getGeneration());
    }

    private static MessageRecord buildRecord(
            long id,
            long timestamp,
            byte[] body,
            Optional<Long> inReplyTo,
            byte[] myNextDh,
            List<Attachment> attachments
    ) {
        return new MessageRecord(id,
                TimeUnit.MILLISECONDS.toSeconds(timestamp),
                body,
                BodyEncoding.RAW,
                inReplyTo,
                myNextDh,
                attachments);
    }

    /**
     * Empty bodies are reserved for acknowledgements.
     */
    private static byte[] toBody(String body) {
        if (body == null || body.isEmpty()) {
            return PLACEHOLDER_BODY;
        }
        return body.getBytes(StandardCharsets.UTF_8);
    }
}
