package org.courier.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.courier.commands.exceptions.CommandException;
import org.courier.commands.exceptions.IOErrorException;
import org.courier.commands.exceptions.UserErrorException;
import org.courier.json.JsonContact;
import org.courier.manager.Manager;
import org.courier.manager.api.ContactInfo;
import org.courier.manager.api.ContactNotFoundException;
import org.courier.manager.api.ContactNotPendingException;
import org.courier.manager.api.HandshakeException;
import org.courier.output.JsonWriter;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriter;
import org.courier.util.CommandUtil;
import org.courier.util.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class CompleteHandshakeCommand implements JsonOutputCommand {

    private final static Logger logger = LoggerFactory.getLogger(CompleteHandshakeCommand.class);

    @Override
    public String getName() {
        return "completeHandshake";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Apply the key exchange message received from a pending contact.");
        subparser.addArgument("name").help("Local name of the contact.");
        subparser.addArgument("-f", "--file")
                .type(File.class)
                .help("Read the key exchange message from this file instead of stdin.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var contact = CommandUtil.getContact(m, ns.getString("name"));
        final var armored = readHandshake(ns.get("file"));

        final ContactInfo activated;
        try {
            activated = m.completeHandshake(contact.id(), armored);
        } catch (ContactNotFoundException e) {
            throw new UserErrorException("Unknown contact: " + contact.name(), e);
        } catch (ContactNotPendingException e) {
            throw new UserErrorException("Key exchange with " + contact.name() + " is already complete", e);
        } catch (HandshakeException e) {
            throw new UserErrorException("Key exchange message rejected (" + e.getReason() + "): " + e.getMessage(),
                    e);
        }

        if (outputWriter instanceof PlainTextWriter writer) {
            writer.println("Key exchange with {} complete, server: {}",
                    activated.name(),
                    activated.server().orElse(""));
        } else if (outputWriter instanceof JsonWriter writer) {
            writer.write(JsonContact.from(activated));
        }
    }

    private static String readHandshake(final File file) throws IOErrorException {
        try {
            if (file == null) {
                logger.debug("Reading key exchange message from stdin...");
                return IOUtils.readAll(System.in, IOUtils.getConsoleCharset());
            }
            return Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IOErrorException("Failed to read key exchange message: " + e.getMessage(), e);
        }
    }
}
