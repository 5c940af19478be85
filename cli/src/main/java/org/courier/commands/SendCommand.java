package org.courier.commands;

import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.courier.commands.exceptions.CommandException;
import org.courier.commands.exceptions.UserErrorException;
import org.courier.json.JsonOutboxMessage;
import org.courier.manager.Manager;
import org.courier.manager.api.ContactNotFoundException;
import org.courier.manager.api.MessageNotFoundException;
import org.courier.manager.api.MessageTooLargeException;
import org.courier.manager.api.NotActiveContactException;
import org.courier.manager.api.OutboxEntry;
import org.courier.output.JsonWriter;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriter;
import org.courier.util.CommandUtil;
import org.courier.util.Util;

import java.io.File;

public class SendCommand implements JsonOutputCommand {

    @Override
    public String getName() {
        return "send";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Queue a message for a contact. It is transmitted by the network transport.");
        subparser.addArgument("recipient").help("Local name of the contact.").nargs("?");
        final var mut = subparser.addMutuallyExclusiveGroup();
        mut.addArgument("-m", "--message").help("Specify the message.");
        mut.addArgument("--message-from-stdin")
                .action(Arguments.storeTrue())
                .help("Read the message from standard input.");
        subparser.addArgument("-a", "--attachment")
                .type(File.class)
                .nargs("*")
                .help("Add one or more files as attachment.");
        subparser.addArgument("--reply-to")
                .help("Reply to the inbox message with this id, acknowledging it. The recipient is its sender.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var recipient = ns.getString("recipient");
        final var replyTo = ns.getString("reply-to");
        final var messageText = CommandUtil.getMessageText(ns);
        final var attachments = CommandUtil.getAttachments(ns);

        final OutboxEntry message;
        try {
            if (replyTo != null) {
                if (recipient != null) {
                    throw new UserErrorException("A reply always goes to the sender, don't specify a recipient");
                }
                message = m.replyToMessage(CommandUtil.getMessageId(replyTo), messageText, attachments);
            } else {
                final var contact = CommandUtil.getContact(m, recipient);
                message = m.sendMessage(contact.id(), messageText, attachments);
            }
        } catch (ContactNotFoundException | MessageNotFoundException | NotActiveContactException |
                 MessageTooLargeException e) {
            throw new UserErrorException(e.getMessage(), e);
        }

        if (outputWriter instanceof PlainTextWriter writer) {
            writer.println("Queued message {} to {}", Util.formatId(message.id()), message.toName());
        } else if (outputWriter instanceof JsonWriter writer) {
            writer.write(JsonOutboxMessage.from(message));
        }
    }
}
