package org.courier.manager.api;

public class IncorrectPassphraseException extends Exception {

    public IncorrectPassphraseException() {
        super("Incorrect passphrase");
    }
}
