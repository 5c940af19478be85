package org.courier.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.courier.commands.exceptions.CommandException;
import org.courier.commands.exceptions.UserErrorException;
import org.courier.json.JsonInboxMessage;
import org.courier.manager.Manager;
import org.courier.manager.api.InboxEntry;
import org.courier.manager.api.MessageNotFoundException;
import org.courier.output.JsonWriter;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriter;
import org.courier.util.CommandUtil;
import org.courier.util.DateUtils;
import org.courier.util.Util;

public class ReadMessageCommand implements JsonOutputCommand {

    @Override
    public String getName() {
        return "readMessage";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Show a received message and mark it as read.");
        subparser.addArgument("id").help("Id of the inbox message.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var id = CommandUtil.getMessageId(ns.getString("id"));
        final InboxEntry message;
        try {
            message = m.readMessage(id);
        } catch (MessageNotFoundException e) {
            throw new UserErrorException(e.getMessage(), e);
        }

        if (outputWriter instanceof PlainTextWriter writer) {
            writer.println("From: {}", message.fromName());
            writer.println("Received: {}", DateUtils.formatTimestamp(message.receivedTimestamp()));
            writer.println("Erased: {}", DateUtils.formatTimestamp(message.eraseTimestamp()));
            if (message.content().isEmpty()) {
                writer.println("The key exchange with {} is not complete, the message can't be opened yet.",
                        message.fromName());
                return;
            }
            final var content = message.content().get();
            writer.println("Sent: {}", DateUtils.formatTimestamp(content.sentTimestamp()));
            content.inReplyTo().ifPresent(inReplyTo -> writer.println("In reply to: {}", Util.formatId(inReplyTo)));
            for (final var attachment : content.attachments()) {
                writer.println("Attachment: {} ({} bytes)", attachment.filename(), attachment.contents().length);
            }
            writer.println();
            writer.println("{}", content.body().orElse("<unsupported encoding>"));
        } else if (outputWriter instanceof JsonWriter writer) {
            writer.write(JsonInboxMessage.from(message));
        }
    }
}
