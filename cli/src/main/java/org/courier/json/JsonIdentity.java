package org.courier.json;

import org.courier.manager.api.IdentityInfo;
import org.courier.util.Hex;

public record JsonIdentity(String server, String signingPublicKey, String identityPublicKey, long generation) {

    public static JsonIdentity from(IdentityInfo identity) {
        return new JsonIdentity(identity.server(),
                Hex.toStringCondensed(identity.signingPublicKey()),
                Hex.toStringCondensed(identity.identityPublicKey()),
                identity.generation());
    }
}
