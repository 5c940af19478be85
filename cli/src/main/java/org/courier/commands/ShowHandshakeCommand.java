package org.courier.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.courier.commands.exceptions.CommandException;
import org.courier.commands.exceptions.UserErrorException;
import org.courier.manager.Manager;
import org.courier.manager.api.ContactNotFoundException;
import org.courier.manager.api.ContactNotPendingException;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriter;
import org.courier.util.CommandUtil;

public class ShowHandshakeCommand implements LocalCommand {

    @Override
    public String getName() {
        return "showHandshake";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Print the key exchange message for a pending contact again.");
        subparser.addArgument("name").help("Local name of the contact.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var contact = CommandUtil.getContact(m, ns.getString("name"));
        final String handshake;
        try {
            handshake = m.getHandshake(contact.id());
        } catch (ContactNotFoundException e) {
            throw new UserErrorException("Unknown contact: " + contact.name(), e);
        } catch (ContactNotPendingException e) {
            throw new UserErrorException("Key exchange with " + contact.name() + " is already complete", e);
        }
        final var writer = (PlainTextWriter) outputWriter;
        writer.println("{}", handshake);
    }
}
