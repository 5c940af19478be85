package org.courier.manager.protocol;

import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;
import org.courier.manager.api.HandshakeException;
import org.courier.manager.config.ServiceConfig;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

/**
 * Text encoding of key exchange messages, so that they can be pasted into mail or chat.
 */
public class Armor {

    private Armor() {
    }

    public static String armor(byte[] handshake) {
        final var writer = new StringWriter();
        try (var pemWriter = new PemWriter(writer)) {
            pemWriter.writeObject(new PemObject(ServiceConfig.HANDSHAKE_ARMOR_LABEL, handshake));
        } catch (IOException e) {
            throw new AssertionError("Writing to a string failed", e);
        }
        return writer.toString();
    }

    /**
     * Extracts the first armored key exchange block found in the given text.
     */
    public static byte[] dearmor(String text) throws HandshakeException {
        final PemObject pemObject;
        try (var pemReader = new PemReader(new StringReader(text))) {
            pemObject = pemReader.readPemObject();
        } catch (IOException | RuntimeException e) {
            throw new HandshakeException(HandshakeException.Reason.MALFORMED_HANDSHAKE,
                    "No key exchange message found",
                    e);
        }
        if (pemObject == null || !ServiceConfig.HANDSHAKE_ARMOR_LABEL.equals(pemObject.getType())) {
            throw new HandshakeException(HandshakeException.Reason.MALFORMED_HANDSHAKE,
                    "No key exchange message found");
        }
        return pemObject.getContent();
    }
}
