package org.courier.commands;

import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.courier.commands.exceptions.CommandException;
import org.courier.json.JsonContact;
import org.courier.manager.Manager;
import org.courier.output.JsonWriter;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriter;
import org.courier.util.Hex;
import org.courier.util.Util;

public class ListContactsCommand implements JsonOutputCommand {

    @Override
    public String getName() {
        return "listContacts";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Show a list of contacts and the state of their key exchange.");
        subparser.addArgument("--pending")
                .type(Boolean.class)
                .help("Specify if only pending or only active contacts should be shown (default: all contacts)");
        subparser.addArgument("--detailed")
                .action(Arguments.storeTrue())
                .help("List the contacts with more details. If output=json, then this is always set");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var pending = ns.getBoolean("pending");
        final var contacts = m.getContacts()
                .stream()
                .filter(c -> pending == null || c.pending() == pending)
                .toList();
        final var detailed = Boolean.TRUE.equals(ns.getBoolean("detailed"));

        if (outputWriter instanceof PlainTextWriter writer) {
            for (var c : contacts) {
                writer.println("Id: {} Name: {} Pending: {}", Util.formatId(c.id()), c.name(), c.pending());
                if (detailed && !c.pending()) {
                    writer.indentedWriter()
                            .println("Server: {} Signing key: {}",
                                    c.server().orElse(""),
                                    c.signingPublicKey().map(Hex::toStringCondensed).orElse(""));
                }
            }
        } else if (outputWriter instanceof JsonWriter writer) {
            writer.write(contacts.stream().map(JsonContact::from).toList());
        }
    }
}
