package org.courier.manager;

import org.courier.manager.config.ScryptParameters;

/**
 * @param testing accept non-onion server addresses with explicit ports
 * @param scrypt  key derivation cost for passphrase protected state files
 */
public record Settings(boolean testing, ScryptParameters scrypt) {

    public static final Settings DEFAULT = new Settings(false, ScryptParameters.DEFAULT);
}
