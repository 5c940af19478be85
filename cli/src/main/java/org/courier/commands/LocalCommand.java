package org.courier.commands;

import net.sourceforge.argparse4j.inf.Namespace;

import org.courier.commands.exceptions.CommandException;
import org.courier.manager.Manager;
import org.courier.output.OutputWriter;

public interface LocalCommand extends CliCommand {

    void handleCommand(Namespace ns, Manager m, OutputWriter outputWriter) throws CommandException;
}
