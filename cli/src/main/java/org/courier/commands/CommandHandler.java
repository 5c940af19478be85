package org.courier.commands;

import net.sourceforge.argparse4j.inf.Namespace;

import org.courier.commands.exceptions.CommandException;
import org.courier.manager.AccountFiles;
import org.courier.manager.Manager;
import org.courier.output.OutputWriter;

public class CommandHandler {

    final Namespace ns;
    final OutputWriter outputWriter;

    public CommandHandler(final Namespace ns, final OutputWriter outputWriter) {
        this.ns = ns;
        this.outputWriter = outputWriter;
    }

    public void handleAccountCommand(
            final AccountCommand command, final AccountFiles accountFiles, final String passphrase
    ) throws CommandException {
        command.handleCommand(ns, accountFiles, passphrase, outputWriter);
    }

    public void handleLocalCommand(final LocalCommand command, final Manager manager) throws CommandException {
        command.handleCommand(ns, manager, outputWriter);
    }
}
