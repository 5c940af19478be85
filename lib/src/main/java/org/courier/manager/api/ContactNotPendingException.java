package org.courier.manager.api;

public class ContactNotPendingException extends Exception {

    public ContactNotPendingException(String name) {
        super("Key exchange with " + name + " has already been completed");
    }
}
