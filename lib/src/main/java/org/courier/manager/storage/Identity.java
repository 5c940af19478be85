package org.courier.manager.storage;

import org.courier.manager.util.KeyUtils;

import java.security.SecureRandom;

/**
 * Long term key material of the local account.
 */
public class Identity {

    private final String server;
    private final byte[] signingKey;
    private final byte[] signingPublicKey;
    private final byte[] identityPrivateKey;
    private final byte[] identityPublicKey;
    private final byte[] groupPrivateKey;
    private final int generation;

    public Identity(
            final String server,
            final byte[] signingKey,
            final byte[] identityPrivateKey,
            final byte[] groupPrivateKey,
            final int generation
    ) {
        this.server = server;
        this.signingKey = signingKey;
        this.signingPublicKey = KeyUtils.getSigningPublicKey(signingKey);
        this.identityPrivateKey = identityPrivateKey;
        this.identityPublicKey = KeyUtils.getDhPublicKey(identityPrivateKey);
        this.groupPrivateKey = groupPrivateKey;
        this.generation = generation;
    }

    public static Identity generate(String server, byte[] groupPrivateKey, SecureRandom random) {
        return new Identity(server,
                KeyUtils.createSigningKey(random),
                KeyUtils.createDhPrivateKey(random),
                groupPrivateKey,
                0);
    }

    public String getServer() {
        return server;
    }

    public byte[] getSigningKey() {
        return signingKey;
    }

    public byte[] getSigningPublicKey() {
        return signingPublicKey;
    }

    public byte[] getIdentityPrivateKey() {
        return identityPrivateKey;
    }

    public byte[] getIdentityPublicKey() {
        return identityPublicKey;
    }

    public byte[] getGroupPrivateKey() {
        return groupPrivateKey;
    }

    public int getGeneration() {
        return generation;
    }
}
