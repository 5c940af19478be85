package org.courier.manager.storage.contacts;

/**
 * The two most recent values of one side of a contact's Diffie-Hellman ratchet.
 * Keeping the previous value lets messages sealed before the latest rotation still be opened.
 */
public record DhRatchet(byte[] previous, byte[] current) {

    public static final DhRatchet EMPTY = new DhRatchet(null, null);

    public DhRatchet advance(byte[] next) {
        return new DhRatchet(current, next);
    }
}
