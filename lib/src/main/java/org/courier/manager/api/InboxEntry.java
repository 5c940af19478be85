package org.courier.manager.api;

import org.courier.manager.protocol.MessageRecord;
import org.courier.manager.storage.messages.InboundMessage;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * A received message. Messages from contacts whose key exchange is not complete stay sealed and carry no content.
 */
public record InboxEntry(
        long id,
        long from,
        String fromName,
        long receivedTimestamp,
        long eraseTimestamp,
        boolean read,
        boolean acknowledged,
        Optional<Content> content
) {

    public boolean isSealed() {
        return content.isEmpty();
    }

    /**
     * @param body empty if the body encoding is not supported
     */
    public record Content(
            long messageId,
            long sentTimestamp,
            Optional<String> body,
            Optional<Long> inReplyTo,
            List<Attachment> attachments
    ) {

        static Content from(MessageRecord record) {
            final var body = record.bodyEncoding() == MessageRecord.BodyEncoding.RAW
                    ? Optional.of(new String(record.body(), StandardCharsets.UTF_8))
                    : Optional.<String>empty();
            return new Content(record.id(),
                    TimeUnit.SECONDS.toMillis(record.time()),
                    body,
                    record.inReplyTo(),
                    record.files());
        }
    }

    public static InboxEntry from(InboundMessage message, String fromName) {
        return new InboxEntry(message.getId(),
                message.getFrom(),
                fromName,
                message.getReceivedTimestamp(),
                message.getEraseTimestamp(),
                message.isRead(),
                message.isAcknowledged(),
                message.isSealed() ? Optional.empty() : Optional.of(Content.from(message.getRecord())));
    }
}
