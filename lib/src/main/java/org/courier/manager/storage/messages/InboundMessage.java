package org.courier.manager.storage.messages;

import org.courier.manager.config.ServiceConfig;
import org.courier.manager.protocol.MessageRecord;

/**
 * A fetched message. Until the sender's key exchange has been applied only the sealed bytes are kept.
 */
public class InboundMessage {

    private final long id;
    private final long from;
    private final long receivedTimestamp;
    private boolean read;
    private boolean acknowledged;
    private byte[] sealed;
    private MessageRecord record;

    public InboundMessage(
            final long id,
            final long from,
            final long receivedTimestamp,
            final boolean read,
            final boolean acknowledged,
            final byte[] sealed,
            final MessageRecord record
    ) {
        if ((sealed == null) == (record == null)) {
            throw new IllegalArgumentException("Inbound message must be either sealed or decoded");
        }
        this.id = id;
        this.from = from;
        this.receivedTimestamp = receivedTimestamp;
        this.read = read;
        this.acknowledged = acknowledged;
        this.sealed = sealed;
        this.record = record;
    }

    public static InboundMessage sealed(long id, long from, long receivedTimestamp, byte[] sealed) {
        return new InboundMessage(id, from, receivedTimestamp, false, false, sealed, null);
    }

    public static InboundMessage decoded(long id, long from, long receivedTimestamp, MessageRecord record) {
        return new InboundMessage(id, from, receivedTimestamp, false, false, null, record);
    }

    public long getId() {
        return id;
    }

    public long getFrom() {
        return from;
    }

    public long getReceivedTimestamp() {
        return receivedTimestamp;
    }

    public long getEraseTimestamp() {
        return receivedTimestamp + ServiceConfig.MESSAGE_LIFETIME.toMillis();
    }

    public boolean isExpired(long now) {
        return now >= getEraseTimestamp();
    }

    public boolean isRead() {
        return read;
    }

    public boolean isAcknowledged() {
        return acknowledged;
    }

    public boolean isSealed() {
        return sealed != null;
    }

    public byte[] getSealed() {
        return sealed;
    }

    public MessageRecord getRecord() {
        return record;
    }

    public void markRead() {
        read = true;
    }

    public void markAcknowledged() {
        acknowledged = true;
    }

    /**
     * Replaces the sealed bytes with the opened record. Happens at most once.
     */
    public void unseal(MessageRecord record) {
        if (sealed == null) {
            throw new IllegalStateException("Message " + Long.toUnsignedString(id, 16) + " is not sealed");
        }
        this.record = record;
        this.sealed = null;
    }
}
