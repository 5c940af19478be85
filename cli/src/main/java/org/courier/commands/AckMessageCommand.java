package org.courier.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.courier.commands.exceptions.CommandException;
import org.courier.commands.exceptions.UserErrorException;
import org.courier.manager.Manager;
import org.courier.manager.api.MessageNotFoundException;
import org.courier.manager.api.NotActiveContactException;
import org.courier.manager.api.OutboxEntry;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriter;
import org.courier.util.CommandUtil;
import org.courier.util.Util;

import java.util.Optional;

public class AckMessageCommand implements LocalCommand {

    @Override
    public String getName() {
        return "ackMessage";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Tell the sender that a message was received.");
        subparser.addArgument("id").help("Id of the inbox message.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var id = CommandUtil.getMessageId(ns.getString("id"));
        final Optional<OutboxEntry> ack;
        try {
            ack = m.acknowledgeMessage(id);
        } catch (MessageNotFoundException | NotActiveContactException e) {
            throw new UserErrorException(e.getMessage(), e);
        }

        final var writer = (PlainTextWriter) outputWriter;
        if (ack.isPresent()) {
            writer.println("Queued acknowledgement {} to {}", Util.formatId(ack.get().id()), ack.get().toName());
        } else {
            writer.println("Message {} was already acknowledged", Util.formatId(id));
        }
    }
}
