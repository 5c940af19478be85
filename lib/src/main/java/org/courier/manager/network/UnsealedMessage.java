package org.courier.manager.network;

import org.courier.manager.protocol.MessageRecord;

/**
 * @param sealedToCurrentKey whether the sender used our current ratchet value rather than the previous one
 */
public record UnsealedMessage(MessageRecord record, boolean sealedToCurrentKey) {}
