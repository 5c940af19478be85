package org.courier.commands;

import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.courier.commands.exceptions.CommandException;
import org.courier.json.JsonInboxMessage;
import org.courier.json.JsonMessages;
import org.courier.json.JsonOutboxMessage;
import org.courier.manager.Manager;
import org.courier.manager.api.InboxEntry;
import org.courier.manager.api.OutboxEntry;
import org.courier.output.JsonWriter;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriter;
import org.courier.util.DateUtils;
import org.courier.util.Util;

import java.util.List;

public class ListMessagesCommand implements JsonOutputCommand {

    private static final int PREVIEW_LENGTH = 40;

    @Override
    public String getName() {
        return "listMessages";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Show the inbox and the outbox.");
        final var mut = subparser.addMutuallyExclusiveGroup();
        mut.addArgument("--inbox").action(Arguments.storeTrue()).help("Only show received messages.");
        mut.addArgument("--outbox").action(Arguments.storeTrue()).help("Only show sent messages.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var onlyInbox = Boolean.TRUE.equals(ns.getBoolean("inbox"));
        final var onlyOutbox = Boolean.TRUE.equals(ns.getBoolean("outbox"));
        final List<InboxEntry> inbox = onlyOutbox ? List.of() : m.getInbox();
        final List<OutboxEntry> outbox = onlyInbox ? List.of() : m.getOutbox();

        if (outputWriter instanceof PlainTextWriter writer) {
            if (!onlyOutbox) {
                writer.println("Inbox:");
                inbox.forEach(message -> printInboxMessage(writer.indentedWriter(), message));
            }
            if (!onlyInbox) {
                writer.println("Outbox:");
                outbox.forEach(message -> printOutboxMessage(writer.indentedWriter(), message));
            }
        } else if (outputWriter instanceof JsonWriter writer) {
            writer.write(new JsonMessages(inbox.stream().map(JsonInboxMessage::from).toList(),
                    outbox.stream().map(JsonOutboxMessage::from).toList()));
        }
    }

    private static void printInboxMessage(PlainTextWriter writer, InboxEntry message) {
        final var preview = message.content()
                .map(c -> c.body().map(ListMessagesCommand::preview).orElse("<unsupported encoding>"))
                .orElse("<sealed>");
        writer.println("{} From: {} Received: {} {}{} {}",
                Util.formatId(message.id()),
                message.fromName(),
                DateUtils.formatTimestamp(message.receivedTimestamp()),
                message.read() ? "" : "[unread]",
                message.acknowledged() ? "[acked]" : "",
                preview);
    }

    private static void printOutboxMessage(PlainTextWriter writer, OutboxEntry message) {
        writer.println("{} To: {} Status: {} Created: {} {}",
                Util.formatId(message.id()),
                message.toName(),
                message.status(),
                DateUtils.formatTimestamp(message.createdTimestamp()),
                message.isAcknowledgement() ? "<acknowledgement>" : preview(message.body()));
    }

    private static String preview(String body) {
        final var line = body.replace('\n', ' ');
        return line.length() <= PREVIEW_LENGTH ? line : line.substring(0, PREVIEW_LENGTH) + "…";
    }
}
