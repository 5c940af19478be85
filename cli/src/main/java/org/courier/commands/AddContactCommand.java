package org.courier.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.courier.commands.exceptions.CommandException;
import org.courier.commands.exceptions.UserErrorException;
import org.courier.json.JsonContact;
import org.courier.manager.Manager;
import org.courier.manager.api.ContactAlreadyExistsException;
import org.courier.manager.api.ContactInfo;
import org.courier.output.JsonWriter;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriter;

public class AddContactCommand implements JsonOutputCommand {

    @Override
    public String getName() {
        return "addContact";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Create a pending contact and print the key exchange message to hand to them.");
        subparser.addArgument("name").help("Local name of the new contact.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var name = ns.getString("name");
        if (name == null || name.isBlank()) {
            throw new UserErrorException("Contact name must not be empty");
        }
        final ContactInfo contact;
        try {
            contact = m.addContact(name);
        } catch (ContactAlreadyExistsException e) {
            throw new UserErrorException("A contact named " + name + " already exists", e);
        }
        if (outputWriter instanceof PlainTextWriter writer) {
            writer.println("Added contact {}, give them this key exchange message:", contact.name());
            writer.println("{}", contact.handshake().orElse(""));
        } else if (outputWriter instanceof JsonWriter writer) {
            writer.write(JsonContact.from(contact));
        }
    }
}
