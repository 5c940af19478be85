package org.courier.manager.storage;

import org.courier.manager.api.CorruptStateException;
import org.courier.manager.api.IncorrectPassphraseException;
import org.courier.manager.config.ScryptParameters;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.SecureRandom;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateFileTest {

    private static final ScryptParameters CHEAP = new ScryptParameters(1024, 8, 1);

    private final SecureRandom random = new SecureRandom();

    @TempDir
    File tempDir;

    @Test
    void writtenStateReadsBack() throws Exception {
        final var stateFile = new StateFile(new File(tempDir, "state"));
        final var salt = StateFile.createSalt(random);
        final var key = StateFile.deriveKey("correct horse", salt, CHEAP);
        final var plaintext = "{\"version\":1}".getBytes(StandardCharsets.UTF_8);

        stateFile.write(StateFile.encrypt(plaintext, key, salt, random));

        final var contents = stateFile.read();
        assertArrayEquals(salt, StateFile.getSalt(contents));
        assertArrayEquals(plaintext, StateFile.decrypt(contents, key));
        assertFalse(new File(tempDir, "state.tmp").exists());
    }

    @Test
    void emptyPassphraseUsesZeroKey() {
        assertArrayEquals(StateFile.zeroKey(), StateFile.deriveKey("", StateFile.createSalt(random), CHEAP));
        assertArrayEquals(StateFile.zeroKey(), StateFile.deriveKey(null, StateFile.createSalt(random), CHEAP));
    }

    @Test
    void wrongPassphraseRejected() {
        final var salt = StateFile.createSalt(random);
        final var contents = StateFile.encrypt(new byte[10], StateFile.deriveKey("right", salt, CHEAP), salt, random);

        assertThrows(IncorrectPassphraseException.class,
                () -> StateFile.decrypt(contents, StateFile.deriveKey("wrong", salt, CHEAP)));
        assertThrows(IncorrectPassphraseException.class, () -> StateFile.decrypt(contents, StateFile.zeroKey()));
    }

    @Test
    void modifiedSaltRejected() {
        final var salt = StateFile.createSalt(random);
        final var contents = StateFile.encrypt(new byte[10], StateFile.zeroKey(), salt, random);
        contents[0] ^= 1;

        assertThrows(IncorrectPassphraseException.class, () -> StateFile.decrypt(contents, StateFile.zeroKey()));
    }

    @Test
    void truncatedFileIsCorrupt() throws Exception {
        final var file = new File(tempDir, "state");
        Files.write(file.toPath(), new byte[20]);

        assertThrows(CorruptStateException.class, () -> new StateFile(file).read());
        assertThrows(CorruptStateException.class, () -> StateFile.decrypt(new byte[20], StateFile.zeroKey()));
    }

    @Test
    void undecodableContentsAreCorrupt() {
        assertThrows(CorruptStateException.class,
                () -> Storage.deserialize("not json".getBytes(StandardCharsets.UTF_8)));
        assertThrows(CorruptStateException.class,
                () -> Storage.deserialize("{\"version\":1}".getBytes(StandardCharsets.UTF_8)));
        assertThrows(CorruptStateException.class,
                () -> Storage.deserialize("{\"version\":99}".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void overwriteIsAtomic() throws Exception {
        final var stateFile = new StateFile(new File(tempDir, "state"));
        stateFile.write(new byte[]{1});
        stateFile.write(new byte[]{2, 3});

        assertTrue(stateFile.exists());
        assertArrayEquals(new byte[]{2, 3}, Files.readAllBytes(stateFile.getFile().toPath()));
    }
}
