package org.courier.manager.api;

/**
 * Delivery state of an outbound message. Only ever moves forward.
 */
public enum MessageStatus {
    QUEUED,
    SENT,
    ACKNOWLEDGED,
}
