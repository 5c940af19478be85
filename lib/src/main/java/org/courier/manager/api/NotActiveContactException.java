package org.courier.manager.api;

public class NotActiveContactException extends Exception {

    public NotActiveContactException(String name) {
        super("Key exchange with " + name + " has not been completed yet");
    }
}
