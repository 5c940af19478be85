package org.courier.manager.api;

public class MessageNotFoundException extends Exception {

    public MessageNotFoundException(long messageId) {
        super("Message not found: " + Long.toUnsignedString(messageId, 16));
    }
}
