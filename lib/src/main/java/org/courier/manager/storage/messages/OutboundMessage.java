package org.courier.manager.storage.messages;

import org.courier.manager.api.MessageStatus;
import org.courier.manager.protocol.MessageRecord;

/**
 * A message we composed. Timestamps are milliseconds since the epoch, zero while the event has not happened.
 */
public class OutboundMessage {

    private final long id;
    private final long to;
    private final String server;
    private final long createdTimestamp;
    private long sentTimestamp;
    private long acknowledgedTimestamp;
    private final MessageRecord record;
    private DeliveryKeys deliveryKeys;

    public OutboundMessage(
            final long id,
            final long to,
            final String server,
            final long createdTimestamp,
            final long sentTimestamp,
            final long acknowledgedTimestamp,
            final MessageRecord record
    ) {
        this.id = id;
        this.to = to;
        this.server = server;
        this.createdTimestamp = createdTimestamp;
        this.sentTimestamp = sentTimestamp;
        this.acknowledgedTimestamp = acknowledgedTimestamp;
        this.record = record;
    }

    public long getId() {
        return id;
    }

    public long getTo() {
        return to;
    }

    public String getServer() {
        return server;
    }

    public long getCreatedTimestamp() {
        return createdTimestamp;
    }

    public long getSentTimestamp() {
        return sentTimestamp;
    }

    public long getAcknowledgedTimestamp() {
        return acknowledgedTimestamp;
    }

    public MessageRecord getRecord() {
        return record;
    }

    public DeliveryKeys getDeliveryKeys() {
        return deliveryKeys;
    }

    public void setDeliveryKeys(final DeliveryKeys deliveryKeys) {
        this.deliveryKeys = deliveryKeys;
    }

    public MessageStatus getStatus() {
        if (acknowledgedTimestamp != 0) {
            return MessageStatus.ACKNOWLEDGED;
        } else if (sentTimestamp != 0) {
            return MessageStatus.SENT;
        } else {
            return MessageStatus.QUEUED;
        }
    }

    /**
     * @return false if the message was already marked as sent
     */
    public boolean markSent(long timestamp) {
        if (sentTimestamp != 0) {
            return false;
        }
        sentTimestamp = timestamp;
        return true;
    }

    /**
     * An acknowledgement implies delivery, so an unsent message is stamped as sent as well.
     *
     * @return false if the message was already acknowledged
     */
    public boolean markAcknowledged(long timestamp) {
        if (acknowledgedTimestamp != 0) {
            return false;
        }
        markSent(timestamp);
        acknowledgedTimestamp = timestamp;
        return true;
    }
}
