package org.courier.manager.storage.contacts;

import org.courier.manager.groups.MemberCredential;

/**
 * Validated contents of a peer's key exchange.
 *
 * @param credential member key the peer issued to us for delivering to their server
 */
public record PeerIdentity(
        byte[] signingPublicKey,
        byte[] identityPublicKey,
        String server,
        byte[] dhPublicKey,
        MemberCredential credential,
        int generation
) {}
