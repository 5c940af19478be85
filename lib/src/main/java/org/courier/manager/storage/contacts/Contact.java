package org.courier.manager.storage.contacts;

import org.courier.manager.groups.MemberCredential;

/**
 * A correspondent. A contact starts out pending, with only our half of the key exchange, and becomes active
 * once the peer's key exchange has been applied.
 */
public class Contact {

    private final long id;
    private final String name;
    private boolean pending;
    private byte[] handshake;
    private MemberCredential issuedCredential;
    private MemberCredential receivedCredential;
    private int generation;
    private String server;
    private byte[] signingPublicKey;
    private byte[] identityPublicKey;
    private DhRatchet localDh;
    private DhRatchet peerDh;

    public Contact(
            final long id,
            final String name,
            final boolean pending,
            final byte[] handshake,
            final MemberCredential issuedCredential,
            final MemberCredential receivedCredential,
            final int generation,
            final String server,
            final byte[] signingPublicKey,
            final byte[] identityPublicKey,
            final DhRatchet localDh,
            final DhRatchet peerDh
    ) {
        this.id = id;
        this.name = name;
        this.pending = pending;
        this.handshake = handshake;
        this.issuedCredential = issuedCredential;
        this.receivedCredential = receivedCredential;
        this.generation = generation;
        this.server = server;
        this.signingPublicKey = signingPublicKey;
        this.identityPublicKey = identityPublicKey;
        this.localDh = localDh == null ? DhRatchet.EMPTY : localDh;
        this.peerDh = peerDh == null ? DhRatchet.EMPTY : peerDh;
    }

    public static Contact newPending(long id, String name) {
        return new Contact(id, name, true, null, null, null, 0, null, null, null, DhRatchet.EMPTY, DhRatchet.EMPTY);
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isPending() {
        return pending;
    }

    /**
     * Our serialized key exchange for this contact. Kept until the exchange completes.
     */
    public byte[] getHandshake() {
        return handshake;
    }

    public MemberCredential getIssuedCredential() {
        return issuedCredential;
    }

    public MemberCredential getReceivedCredential() {
        return receivedCredential;
    }

    public int getGeneration() {
        return generation;
    }

    public String getServer() {
        return server;
    }

    public byte[] getSigningPublicKey() {
        return signingPublicKey;
    }

    public byte[] getIdentityPublicKey() {
        return identityPublicKey;
    }

    public DhRatchet getLocalDh() {
        return localDh;
    }

    public DhRatchet getPeerDh() {
        return peerDh;
    }

    public void setHandshake(byte[] handshake, byte[] dhPrivateKey, MemberCredential issuedCredential) {
        if (!pending) {
            throw new IllegalStateException("Key exchange of active contact can't be replaced");
        }
        this.handshake = handshake;
        this.issuedCredential = issuedCredential;
        this.localDh = new DhRatchet(dhPrivateKey, null);
    }

    /**
     * Records the peer's identity and makes the contact active.
     *
     * @param nextDhPrivateKey private value whose public half we will advertise in our next message
     */
    public void activate(PeerIdentity peer, byte[] nextDhPrivateKey) {
        if (!pending) {
            throw new IllegalStateException("Contact " + name + " is already active");
        }
        this.signingPublicKey = peer.signingPublicKey();
        this.identityPublicKey = peer.identityPublicKey();
        this.server = peer.server();
        this.receivedCredential = peer.credential();
        this.generation = peer.generation();
        this.peerDh = new DhRatchet(null, peer.dhPublicKey());
        this.localDh = new DhRatchet(localDh.previous(), nextDhPrivateKey);
        this.handshake = null;
        this.pending = false;
    }

    public void rotateLocalDh(byte[] nextDhPrivateKey) {
        localDh = localDh.advance(nextDhPrivateKey);
    }

    public void advancePeerDh(byte[] dhPublicKey) {
        peerDh = peerDh.advance(dhPublicKey);
    }
}
