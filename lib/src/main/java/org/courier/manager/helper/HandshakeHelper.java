package org.courier.manager.helper;

import com.google.protobuf.InvalidProtocolBufferException;

import org.courier.manager.api.HandshakeException;
import org.courier.manager.api.HandshakeException.Reason;
import org.courier.manager.api.InvalidServerAddressException;
import org.courier.manager.groups.InvalidGroupException;
import org.courier.manager.groups.MemberCredential;
import org.courier.manager.protocol.HandshakeRecord;
import org.courier.manager.protocol.ServerAddress;
import org.courier.manager.protocol.SignedHandshake;
import org.courier.manager.storage.contacts.Contact;
import org.courier.manager.storage.contacts.PeerIdentity;
import org.courier.manager.util.KeyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;

import static org.courier.manager.config.ServiceConfig.KEY_LENGTH;
import static org.courier.manager.config.ServiceConfig.SIGNATURE_LENGTH;

public class HandshakeHelper {

    private final static Logger logger = LoggerFactory.getLogger(HandshakeHelper.class);

    private final Context context;

    public HandshakeHelper(final Context context) {
        this.context = context;
    }

    /**
     * Creates our half of the key exchange for a pending contact: a fresh ratchet value and a new member key of
     * our delivery group, signed with our identity key.
     */
    public byte[] generateHandshake(Contact contact) {
        final var random = context.getDependencies().getSecureRandom();
        final var identity = context.getState().getIdentity();

        final var dhPrivateKey = KeyUtils.createDhPrivateKey(random);
        final var credential = context.getDependencies()
                .getGroupSignatureScheme()
                .newMember(identity.getGroupPrivateKey(), random);

        final var payload = new HandshakeRecord(identity.getSigningPublicKey(),
                identity.getIdentityPublicKey(),
                identity.getServer(),
                KeyUtils.getDhPublicKey(dhPrivateKey),
                credential.group(),
                credential.memberKey(),
                identity.getGeneration()).serialize();
        final var signature = KeyUtils.sign(identity.getSigningKey(), payload);
        final var handshake = new SignedHandshake(payload, signature).serialize();

        contact.setHandshake(handshake, dhPrivateKey, credential);
        logger.debug("Generated key exchange for contact {}", contact.getName());
        return handshake;
    }

    /**
     * Validates the peer's key exchange and activates the contact. Messages from the peer that arrived before the
     * exchange completed are opened afterwards.
     * Nothing is changed if validation fails.
     *
     * @return the messages opened after activation
     */
    public IncomingMessageHandler.IncomingMessages applyHandshake(Contact contact, byte[] handshake) throws HandshakeException {
        final var peer = parseHandshake(handshake);

        final var nextDhPrivateKey = KeyUtils.createDhPrivateKey(context.getDependencies().getSecureRandom());
        contact.activate(peer, nextDhPrivateKey);
        logger.info("Key exchange with {} completed", contact.getName());

        return context.getIncomingMessageHandler().unsealPendingMessages(contact);
    }

    /**
     * Checks a peer's key exchange in order and returns its contents.
     */
    public PeerIdentity parseHandshake(byte[] handshake) throws HandshakeException {
        final SignedHandshake signedHandshake;
        try {
            signedHandshake = SignedHandshake.parse(handshake);
        } catch (InvalidProtocolBufferException e) {
            throw new HandshakeException(Reason.MALFORMED_HANDSHAKE, "Failed to parse key exchange", e);
        }
        if (signedHandshake.signature().length != SIGNATURE_LENGTH) {
            throw new HandshakeException(Reason.MALFORMED_HANDSHAKE, "Invalid signature length");
        }

        final HandshakeRecord payload;
        try {
            payload = HandshakeRecord.parse(signedHandshake.signed());
        } catch (InvalidProtocolBufferException e) {
            throw new HandshakeException(Reason.MALFORMED_HANDSHAKE, "Failed to parse signed key exchange", e);
        }
        if (payload.publicKey().length != KEY_LENGTH) {
            throw new HandshakeException(Reason.INVALID_PUBLIC_KEY, "Invalid public key length");
        }
        if (!KeyUtils.verify(payload.publicKey(), signedHandshake.signed(), signedHandshake.signature())) {
            throw new HandshakeException(Reason.INVALID_SIGNATURE, "Invalid signature");
        }

        final String server;
        try {
            server = StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(payload.server())).toString();
        } catch (CharacterCodingException e) {
            throw new HandshakeException(Reason.INVALID_ADDRESS, "Server address is not valid UTF-8", e);
        }
        try {
            ServerAddress.parse(server, context.getDependencies().getSettings().testing());
        } catch (InvalidServerAddressException e) {
            throw new HandshakeException(Reason.INVALID_ADDRESS, "Invalid server: " + e.getMessage(), e);
        }

        final var credential = new MemberCredential(payload.group(), payload.groupKey());
        try {
            context.getDependencies().getGroupSignatureScheme().checkMember(credential);
        } catch (InvalidGroupException e) {
            throw new HandshakeException(Reason.INVALID_GROUP_CREDENTIAL, e.getMessage(), e);
        }

        if (payload.identityPublic().length != KEY_LENGTH) {
            throw new HandshakeException(Reason.INVALID_PUBLIC_KEY, "Invalid identity public key length");
        }
        if (payload.dh().length != KEY_LENGTH) {
            throw new HandshakeException(Reason.INVALID_DH_VALUE, "Invalid DH value length");
        }

        return new PeerIdentity(payload.publicKey(),
                payload.identityPublic(),
                server,
                payload.dh(),
                credential,
                payload.generation());
    }
}
