package org.courier.manager.util;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.math.ec.rfc7748.X25519;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.SecureRandom;

import static org.courier.manager.config.ServiceConfig.KEY_LENGTH;
import static org.courier.manager.config.ServiceConfig.SIGNATURE_LENGTH;

public class KeyUtils {

    private KeyUtils() {
    }

    public static byte[] createSigningKey(SecureRandom random) {
        return new Ed25519PrivateKeyParameters(random).getEncoded();
    }

    public static byte[] getSigningPublicKey(byte[] signingKey) {
        return new Ed25519PrivateKeyParameters(signingKey, 0).generatePublicKey().getEncoded();
    }

    public static byte[] sign(byte[] signingKey, byte[] message) {
        final var signer = new Ed25519Signer();
        signer.init(true, new Ed25519PrivateKeyParameters(signingKey, 0));
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    public static boolean verify(byte[] publicKey, byte[] message, byte[] signature) {
        if (publicKey.length != KEY_LENGTH || signature.length != SIGNATURE_LENGTH) {
            return false;
        }
        final Ed25519PublicKeyParameters key;
        try {
            key = new Ed25519PublicKeyParameters(publicKey, 0);
        } catch (IllegalArgumentException e) {
            // Not a point on the curve
            return false;
        }
        final var verifier = new Ed25519Signer();
        verifier.init(false, key);
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(signature);
    }

    /**
     * Draws a new X25519 private scalar. Clamping is applied when the scalar is used.
     */
    public static byte[] createDhPrivateKey(SecureRandom random) {
        return getSecretBytes(random, X25519.SCALAR_SIZE);
    }

    public static byte[] getDhPublicKey(byte[] privateKey) {
        final var publicKey = new byte[X25519.POINT_SIZE];
        X25519.scalarMultBase(privateKey, 0, publicKey, 0);
        return publicKey;
    }

    public static byte[] getSecretBytes(SecureRandom random, int size) {
        final var secret = new byte[size];
        random.nextBytes(secret);
        return secret;
    }

    /**
     * Returns a random non-zero 64 bit identifier.
     */
    public static long createId(SecureRandom random) {
        final var bytes = new byte[8];
        while (true) {
            random.nextBytes(bytes);
            final var id = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).getLong();
            if (id != 0) {
                return id;
            }
        }
    }
}
