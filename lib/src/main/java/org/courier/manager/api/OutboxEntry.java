package org.courier.manager.api;

import org.courier.manager.storage.messages.OutboundMessage;

import java.nio.charset.StandardCharsets;

public record OutboxEntry(
        long id,
        long to,
        String toName,
        long createdTimestamp,
        long sentTimestamp,
        long acknowledgedTimestamp,
        MessageStatus status,
        String body,
        boolean isAcknowledgement,
        int attachmentCount
) {

    public static OutboxEntry from(OutboundMessage message, String toName) {
        final var record = message.getRecord();
        return new OutboxEntry(message.getId(),
                message.getTo(),
                toName,
                message.getCreatedTimestamp(),
                message.getSentTimestamp(),
                message.getAcknowledgedTimestamp(),
                message.getStatus(),
                new String(record.body(), StandardCharsets.UTF_8),
                record.isAcknowledgement(),
                record.files().size());
    }
}
