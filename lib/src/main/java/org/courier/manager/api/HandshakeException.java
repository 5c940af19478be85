package org.courier.manager.api;

/**
 * A key exchange message from a peer was rejected. No contact state was changed.
 */
public class HandshakeException extends Exception {

    public enum Reason {
        MALFORMED_HANDSHAKE,
        INVALID_PUBLIC_KEY,
        INVALID_SIGNATURE,
        INVALID_ADDRESS,
        INVALID_GROUP_CREDENTIAL,
        INVALID_DH_VALUE,
    }

    private final Reason reason;

    public HandshakeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public HandshakeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
