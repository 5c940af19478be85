package org.courier.manager.storage;

import org.bouncycastle.crypto.generators.SCrypt;
import org.courier.manager.api.CorruptStateException;
import org.courier.manager.api.IncorrectPassphraseException;
import org.courier.manager.config.ScryptParameters;
import org.courier.manager.util.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import static org.courier.manager.config.ServiceConfig.STATE_KEY_LENGTH;
import static org.courier.manager.config.ServiceConfig.STATE_NONCE_LENGTH;
import static org.courier.manager.config.ServiceConfig.STATE_SALT_LENGTH;

/**
 * Encrypted on-disk form of the session state.
 * <p>
 * Layout: {@code salt || nonce || AES-GCM(state)}. The salt feeds the passphrase key derivation and is
 * authenticated together with the ciphertext. An account without passphrase uses the all-zero key.
 */
public class StateFile {

    private static final Logger logger = LoggerFactory.getLogger(StateFile.class);

    private static final int TAG_LENGTH_BITS = 128;

    private final File file;

    public StateFile(final File file) {
        this.file = file;
    }

    public File getFile() {
        return file;
    }

    public boolean exists() {
        return file.exists();
    }

    public static byte[] zeroKey() {
        return new byte[STATE_KEY_LENGTH];
    }

    public static byte[] createSalt(SecureRandom random) {
        final var salt = new byte[STATE_SALT_LENGTH];
        random.nextBytes(salt);
        return salt;
    }

    public static byte[] deriveKey(String passphrase, byte[] salt, ScryptParameters parameters) {
        if (passphrase == null || passphrase.isEmpty()) {
            return zeroKey();
        }
        logger.debug("Deriving state file key from passphrase");
        return SCrypt.generate(passphrase.getBytes(StandardCharsets.UTF_8),
                salt,
                parameters.n(),
                parameters.r(),
                parameters.p(),
                STATE_KEY_LENGTH);
    }

    public byte[] read() throws IOException {
        final var contents = Files.readAllBytes(file.toPath());
        if (contents.length < STATE_SALT_LENGTH + STATE_NONCE_LENGTH) {
            throw new CorruptStateException("State file is truncated");
        }
        return contents;
    }

    public static byte[] getSalt(byte[] contents) {
        return Arrays.copyOfRange(contents, 0, STATE_SALT_LENGTH);
    }

    public void write(byte[] contents) throws IOException {
        IOUtils.writeAtomically(file, contents);
    }

    public static byte[] encrypt(byte[] plaintext, byte[] key, byte[] salt, SecureRandom random) {
        final var nonce = new byte[STATE_NONCE_LENGTH];
        random.nextBytes(nonce);
        try {
            final var cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE,
                    new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            cipher.updateAAD(salt);
            final var ciphertext = cipher.doFinal(plaintext);

            final var contents = new byte[salt.length + nonce.length + ciphertext.length];
            System.arraycopy(salt, 0, contents, 0, salt.length);
            System.arraycopy(nonce, 0, contents, salt.length, nonce.length);
            System.arraycopy(ciphertext, 0, contents, salt.length + nonce.length, ciphertext.length);
            return contents;
        } catch (GeneralSecurityException e) {
            throw new AssertionError("AES-GCM is not available", e);
        }
    }

    public static byte[] decrypt(
            byte[] contents, byte[] key
    ) throws IncorrectPassphraseException, CorruptStateException {
        if (contents.length < STATE_SALT_LENGTH + STATE_NONCE_LENGTH) {
            throw new CorruptStateException("State file is truncated");
        }
        final var salt = getSalt(contents);
        final var nonce = Arrays.copyOfRange(contents, STATE_SALT_LENGTH, STATE_SALT_LENGTH + STATE_NONCE_LENGTH);
        try {
            final var cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE,
                    new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            cipher.updateAAD(salt);
            return cipher.doFinal(contents,
                    STATE_SALT_LENGTH + STATE_NONCE_LENGTH,
                    contents.length - STATE_SALT_LENGTH - STATE_NONCE_LENGTH);
        } catch (AEADBadTagException e) {
            throw new IncorrectPassphraseException();
        } catch (GeneralSecurityException e) {
            throw new CorruptStateException("Failed to decrypt state file: " + e.getMessage(), e);
        }
    }
}
