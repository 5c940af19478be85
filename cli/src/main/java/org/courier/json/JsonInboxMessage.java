package org.courier.json;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.courier.manager.api.Attachment;
import org.courier.manager.api.InboxEntry;
import org.courier.util.Util;

import java.util.List;

public record JsonInboxMessage(
        String id,
        String from,
        long receivedTimestamp,
        long eraseTimestamp,
        boolean read,
        boolean acknowledged,
        boolean sealed,
        @JsonInclude(JsonInclude.Include.NON_NULL) Long sentTimestamp,
        @JsonInclude(JsonInclude.Include.NON_NULL) String body,
        @JsonInclude(JsonInclude.Include.NON_NULL) String inReplyTo,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> attachments
) {

    public static JsonInboxMessage from(InboxEntry message) {
        final var content = message.content();
        return new JsonInboxMessage(Util.formatId(message.id()),
                message.fromName(),
                message.receivedTimestamp(),
                message.eraseTimestamp(),
                message.read(),
                message.acknowledged(),
                message.isSealed(),
                content.map(InboxEntry.Content::sentTimestamp).orElse(null),
                content.flatMap(InboxEntry.Content::body).orElse(null),
                content.flatMap(InboxEntry.Content::inReplyTo).map(Util::formatId).orElse(null),
                content.map(c -> c.attachments().stream().map(Attachment::filename).toList()).orElse(List.of()));
    }
}
