package org.courier.commands;

import net.sourceforge.argparse4j.inf.Namespace;

import org.courier.commands.exceptions.CommandException;
import org.courier.manager.AccountFiles;
import org.courier.output.OutputWriter;

/**
 * A command working on the data directory itself, before an account can be opened.
 */
public interface AccountCommand extends CliCommand {

    void handleCommand(
            Namespace ns, AccountFiles accountFiles, String passphrase, OutputWriter outputWriter
    ) throws CommandException;
}
