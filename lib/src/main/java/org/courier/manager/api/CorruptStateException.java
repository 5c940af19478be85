package org.courier.manager.api;

import java.io.IOException;

/**
 * The state file was decrypted but its contents could not be read back.
 */
public class CorruptStateException extends IOException {

    public CorruptStateException(String message) {
        super(message);
    }

    public CorruptStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
