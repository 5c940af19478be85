package org.courier.json;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.courier.manager.api.ContactInfo;
import org.courier.util.Hex;
import org.courier.util.Util;

public record JsonContact(
        String id,
        String name,
        boolean pending,
        @JsonInclude(JsonInclude.Include.NON_NULL) String server,
        @JsonInclude(JsonInclude.Include.NON_NULL) String signingPublicKey,
        @JsonInclude(JsonInclude.Include.NON_NULL) String handshake
) {

    public static JsonContact from(ContactInfo contact) {
        return new JsonContact(Util.formatId(contact.id()),
                contact.name(),
                contact.pending(),
                contact.server().orElse(null),
                contact.signingPublicKey().map(Hex::toStringCondensed).orElse(null),
                contact.handshake().orElse(null));
    }
}
