package org.courier.manager.storage.messages;

import org.courier.manager.groups.MemberCredential;

/**
 * Key material needed to seal and deliver one outbound message, captured when the message is queued.
 *
 * @param peerDhPublicKey    ratchet value the message is sealed to
 * @param localDhPrivateKey  our ratchet value used for sealing
 * @param credential         member key authorizing delivery to the recipient's server
 */
public record DeliveryKeys(
        String server,
        byte[] peerIdentityPublicKey,
        byte[] peerDhPublicKey,
        byte[] localDhPrivateKey,
        MemberCredential credential,
        int generation
) {}
