package org.courier.manager.api;

import org.courier.manager.protocol.Armor;
import org.courier.manager.storage.contacts.Contact;

import java.util.Optional;

/**
 * @param handshake armored key exchange message, present while the contact is pending
 */
public record ContactInfo(
        long id,
        String name,
        boolean pending,
        Optional<String> handshake,
        Optional<String> server,
        Optional<byte[]> signingPublicKey,
        long generation
) {

    public static ContactInfo from(Contact contact) {
        return new ContactInfo(contact.getId(),
                contact.getName(),
                contact.isPending(),
                Optional.ofNullable(contact.getHandshake()).map(Armor::armor),
                Optional.ofNullable(contact.getServer()),
                Optional.ofNullable(contact.getSigningPublicKey()),
                Integer.toUnsignedLong(contact.getGeneration()));
    }
}
