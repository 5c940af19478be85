package org.courier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.courier.commands.exceptions.UserErrorException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    File tempDir;

    @Test
    void accountLifecycle() throws Exception {
        final var alice = new File(tempDir, "alice");
        run(alice, "createAccount");

        final var identity = json(run(alice, "-o", "json", "showIdentity"));
        assertTrue(identity.get("server").asText().startsWith("pondserver://"));
        assertEquals(64, identity.get("signingPublicKey").asText().length());

        final var output = run(alice, "addContact", "bob");
        assertTrue(output.contains("-----BEGIN POND KEY EXCHANGE-----"));

        final var contacts = json(run(alice, "-o", "json", "listContacts"));
        assertEquals(1, contacts.size());
        assertEquals("bob", contacts.get(0).get("name").asText());
        assertTrue(contacts.get(0).get("pending").asBoolean());
    }

    @Test
    void handshakeAndSend() throws Exception {
        final var alice = new File(tempDir, "alice");
        final var bob = new File(tempDir, "bob");
        run(alice, "createAccount");
        run(bob, "createAccount");

        final var aliceHandshake = writeHandshake(json(run(alice, "-o", "json", "addContact", "bob")), "alice.txt");
        final var bobHandshake = writeHandshake(json(run(bob, "-o", "json", "addContact", "alice")), "bob.txt");

        final var activated = json(run(alice,
                "-o",
                "json",
                "completeHandshake",
                "bob",
                "--file",
                bobHandshake.getPath()));
        assertFalse(activated.get("pending").asBoolean());
        run(bob, "completeHandshake", "alice", "--file", aliceHandshake.getPath());

        final var again = assertThrows(UserErrorException.class,
                () -> run(alice, "completeHandshake", "bob", "--file", bobHandshake.getPath()));
        assertTrue(again.getMessage().contains("already complete"));

        final var sent = json(run(alice, "-o", "json", "send", "bob", "-m", "hello"));
        assertEquals("QUEUED", sent.get("status").asText());

        final var messages = json(run(alice, "-o", "json", "listMessages", "--outbox"));
        assertEquals(0, messages.get("inbox").size());
        assertEquals(sent.get("id").asText(), messages.get("outbox").get(0).get("id").asText());

        final var usage = json(run(alice, "-o", "json", "estimateUsage", "-m", "x".repeat(20000)));
        assertTrue(usage.get("overflowing").asBoolean());
    }

    @Test
    void sendToPendingContactIsUserError() throws Exception {
        final var alice = new File(tempDir, "alice");
        run(alice, "createAccount");
        run(alice, "addContact", "bob");

        final var e = assertThrows(UserErrorException.class, () -> run(alice, "send", "bob", "-m", "too early"));
        assertEquals(1, Main.getStatusForError(e));
        assertThrows(UserErrorException.class, () -> run(alice, "addContact", "bob"));
        assertThrows(UserErrorException.class, () -> run(alice, "send", "carol", "-m", "unknown"));
    }

    @Test
    void missingAccountIsUserError() {
        assertThrows(UserErrorException.class, () -> run(new File(tempDir, "nobody"), "listContacts"));
    }

    @Test
    void passphraseFileProtectsState() throws Exception {
        final var alice = new File(tempDir, "alice");
        final var secret = new File(tempDir, "secret.txt");
        final var wrong = new File(tempDir, "wrong.txt");
        Files.writeString(secret.toPath(), "correct horse\n");
        Files.writeString(wrong.toPath(), "battery staple\n");

        run(alice, "--passphrase-file", secret.getPath(), "createAccount");

        assertThrows(UserErrorException.class, () -> run(alice, "--passphrase-file", wrong.getPath(), "listContacts"));
        run(alice, "--passphrase-file", secret.getPath(), "listContacts");
    }

    private File writeHandshake(JsonNode contact, String fileName) throws Exception {
        final var file = new File(tempDir, fileName);
        Files.writeString(file.toPath(), contact.get("handshake").asText(), StandardCharsets.UTF_8);
        return file;
    }

    private JsonNode json(String output) throws Exception {
        return objectMapper.readTree(output);
    }

    private static String run(File config, String... args) throws Exception {
        final var fullArgs = new ArrayList<>(List.of("--config", config.getPath()));
        fullArgs.addAll(List.of(args));
        final var ns = App.buildArgumentParser().parseArgs(fullArgs.toArray(new String[0]));

        final var output = new ByteArrayOutputStream();
        final var originalOut = System.out;
        System.setOut(new PrintStream(output, true, Charset.defaultCharset()));
        try {
            new App(ns).init();
        } finally {
            System.setOut(originalOut);
        }
        return output.toString(Charset.defaultCharset());
    }
}
