package org.courier.manager.api;

public class InvalidServerAddressException extends Exception {

    public InvalidServerAddressException(String message) {
        super(message);
    }
}
