package org.courier.commands;

import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.courier.commands.exceptions.CommandException;
import org.courier.json.JsonUsage;
import org.courier.manager.Manager;
import org.courier.output.JsonWriter;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriter;
import org.courier.util.CommandUtil;

import java.io.File;

public class EstimateUsageCommand implements JsonOutputCommand {

    @Override
    public String getName() {
        return "estimateUsage";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Show how much of the size limit a message would use.");
        final var mut = subparser.addMutuallyExclusiveGroup();
        mut.addArgument("-m", "--message").help("Specify the message.");
        mut.addArgument("--message-from-stdin")
                .action(Arguments.storeTrue())
                .help("Read the message from standard input.");
        subparser.addArgument("-a", "--attachment")
                .type(File.class)
                .nargs("*")
                .help("Add one or more files as attachment.");
        subparser.addArgument("--reply").action(Arguments.storeTrue()).help("Estimate the size of a reply.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var isReply = Boolean.TRUE.equals(ns.getBoolean("reply"));
        final var usage = m.estimateUsage(CommandUtil.getMessageText(ns), isReply, CommandUtil.getAttachments(ns));

        if (outputWriter instanceof PlainTextWriter writer) {
            writer.println("{}{}", usage.describe(), usage.isOverflowing() ? " (too large)" : "");
        } else if (outputWriter instanceof JsonWriter writer) {
            writer.write(JsonUsage.from(usage));
        }
    }
}
