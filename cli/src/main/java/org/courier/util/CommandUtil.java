package org.courier.util;

import net.sourceforge.argparse4j.inf.Namespace;

import org.courier.commands.exceptions.IOErrorException;
import org.courier.commands.exceptions.UserErrorException;
import org.courier.manager.Manager;
import org.courier.manager.api.Attachment;
import org.courier.manager.api.ContactInfo;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

public class CommandUtil {

    private CommandUtil() {
    }

    public static ContactInfo getContact(final Manager m, final String name) throws UserErrorException {
        if (name == null) {
            throw new UserErrorException("No contact given");
        }
        return m.getContact(name).orElseThrow(() -> new UserErrorException("Unknown contact: " + name));
    }

    public static long getMessageId(final String idString) throws UserErrorException {
        if (idString == null) {
            throw new UserErrorException("No message id given");
        }
        try {
            return Long.parseUnsignedLong(idString, 16);
        } catch (NumberFormatException e) {
            throw new UserErrorException("Invalid message id: " + idString, e);
        }
    }

    /**
     * Message text from {@code --message}, or standard input if {@code --message-from-stdin} is set.
     */
    public static String getMessageText(final Namespace ns) throws UserErrorException {
        final var readMessageFromStdin = Boolean.TRUE.equals(ns.getBoolean("message-from-stdin"));
        if (readMessageFromStdin) {
            try {
                return IOUtils.readAll(System.in, IOUtils.getConsoleCharset());
            } catch (IOException e) {
                throw new UserErrorException("Failed to read message from stdin: " + e.getMessage(), e);
            }
        }
        final var message = ns.getString("message");
        return message == null ? "" : message;
    }

    public static List<Attachment> getAttachments(final Namespace ns) throws IOErrorException {
        final var files = ns.<File>getList("attachment");
        if (files == null) {
            return List.of();
        }
        final var attachments = new ArrayList<Attachment>();
        for (final var file : files) {
            try {
                attachments.add(new Attachment(file.getName(), Files.readAllBytes(file.toPath())));
            } catch (IOException e) {
                throw new IOErrorException("Failed to read attachment " + file + ": " + e.getMessage(), e);
            }
        }
        return attachments;
    }
}
