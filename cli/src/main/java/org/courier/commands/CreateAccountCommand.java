package org.courier.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.courier.OutputType;
import org.courier.commands.exceptions.CommandException;
import org.courier.commands.exceptions.IOErrorException;
import org.courier.commands.exceptions.UserErrorException;
import org.courier.json.JsonIdentity;
import org.courier.manager.AccountFiles;
import org.courier.manager.api.AccountAlreadyExistsException;
import org.courier.manager.api.InvalidServerAddressException;
import org.courier.manager.config.ServiceConfig;
import org.courier.output.JsonWriter;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriter;

import java.io.IOException;
import java.util.List;

public class CreateAccountCommand implements AccountCommand {

    @Override
    public String getName() {
        return "createAccount";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Create a new identity, homed on the given server.");
        subparser.addArgument("--server")
                .help("The home server address (default: the public default server, or the local test server with --testing).");
    }

    @Override
    public List<OutputType> getSupportedOutputTypes() {
        return List.of(OutputType.PLAIN_TEXT, OutputType.JSON);
    }

    @Override
    public void handleCommand(
            final Namespace ns, final AccountFiles accountFiles, final String passphrase, final OutputWriter outputWriter
    ) throws CommandException {
        final var serverArgument = ns.getString("server");
        final var testing = Boolean.TRUE.equals(ns.getBoolean("testing"));
        final var server = serverArgument == null ? ServiceConfig.getDefaultServer(testing) : serverArgument;

        try (var m = accountFiles.createAccount(server, passphrase)) {
            final var identity = m.getIdentity();
            if (outputWriter instanceof PlainTextWriter writer) {
                writer.println("Created account on {}", identity.server());
                ShowIdentityCommand.printIdentity(writer, identity);
            } else if (outputWriter instanceof JsonWriter writer) {
                writer.write(JsonIdentity.from(identity));
            }
        } catch (InvalidServerAddressException e) {
            throw new UserErrorException("Invalid server address: " + e.getMessage(), e);
        } catch (AccountAlreadyExistsException e) {
            throw new UserErrorException(e.getMessage(), e);
        } catch (IOException e) {
            throw new IOErrorException("Failed to create account: " + e.getMessage(), e);
        }
    }
}
