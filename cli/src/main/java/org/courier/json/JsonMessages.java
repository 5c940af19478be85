package org.courier.json;

import java.util.List;

public record JsonMessages(List<JsonInboxMessage> inbox, List<JsonOutboxMessage> outbox) {}
