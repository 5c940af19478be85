package org.courier.manager.api;

public class ContactNotFoundException extends Exception {

    public ContactNotFoundException(String message) {
        super(message);
    }

    public ContactNotFoundException(long contactId) {
        super("Contact not found: " + Long.toUnsignedString(contactId, 16));
    }
}
