package org.courier.json;

import org.courier.manager.api.MessageStatus;
import org.courier.manager.api.OutboxEntry;
import org.courier.util.Util;

public record JsonOutboxMessage(
        String id,
        String to,
        MessageStatus status,
        long createdTimestamp,
        long sentTimestamp,
        long acknowledgedTimestamp,
        boolean acknowledgement,
        String body,
        int attachmentCount
) {

    public static JsonOutboxMessage from(OutboxEntry message) {
        return new JsonOutboxMessage(Util.formatId(message.id()),
                message.toName(),
                message.status(),
                message.createdTimestamp(),
                message.sentTimestamp(),
                message.acknowledgedTimestamp(),
                message.isAcknowledgement(),
                message.body(),
                message.attachmentCount());
    }
}
