package org.courier.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.courier.commands.exceptions.CommandException;
import org.courier.json.JsonIdentity;
import org.courier.manager.Manager;
import org.courier.manager.api.IdentityInfo;
import org.courier.output.JsonWriter;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriter;
import org.courier.util.Hex;

public class ShowIdentityCommand implements JsonOutputCommand {

    @Override
    public String getName() {
        return "showIdentity";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Show the home server and public keys of this account.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var identity = m.getIdentity();
        if (outputWriter instanceof PlainTextWriter writer) {
            printIdentity(writer, identity);
        } else if (outputWriter instanceof JsonWriter writer) {
            writer.write(JsonIdentity.from(identity));
        }
    }

    static void printIdentity(PlainTextWriter writer, IdentityInfo identity) {
        writer.println("Server: {}", identity.server());
        writer.println("Signing key: {}", Hex.toStringCondensed(identity.signingPublicKey()));
        writer.println("Identity key: {}", Hex.toStringCondensed(identity.identityPublicKey()));
        writer.println("Generation: {}", identity.generation());
    }
}
