package org.courier.manager.groups;

public class InvalidGroupException extends Exception {

    public InvalidGroupException(String message) {
        super(message);
    }

    public InvalidGroupException(String message, Throwable cause) {
        super(message, cause);
    }
}
