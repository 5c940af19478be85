package org.courier.manager.api;

public class MessageTooLargeException extends Exception {

    private final int size;
    private final int maximum;

    public MessageTooLargeException(int size, int maximum) {
        super("Message too large: " + size + " of " + maximum + " bytes");
        this.size = size;
        this.maximum = maximum;
    }

    public int getSize() {
        return size;
    }

    public int getMaximum() {
        return maximum;
    }
}
