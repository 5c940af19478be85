package org.courier.manager.config;

/**
 * Cost parameters used to derive the state file key from a passphrase.
 */
public record ScryptParameters(int n, int r, int p) {

    public static final ScryptParameters DEFAULT = new ScryptParameters(32768, 16, 1);
}
