package org.courier.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.courier.commands.exceptions.CommandException;
import org.courier.commands.exceptions.IOErrorException;
import org.courier.manager.Manager;
import org.courier.manager.api.InboxEntry;
import org.courier.manager.api.OutboxEntry;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

public class FetchCommand implements LocalCommand {

    @Override
    public String getName() {
        return "fetch";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Fetch new messages from the home server now.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var received = new AtomicInteger();
        final var acknowledged = new AtomicInteger();
        final var listener = new Manager.SessionListener() {
            @Override
            public void onMessageReceived(final InboxEntry message) {
                received.incrementAndGet();
            }

            @Override
            public void onMessageAcknowledged(final OutboxEntry message) {
                acknowledged.incrementAndGet();
            }
        };
        m.addSessionListener(listener);
        try {
            m.fetchMessages();
        } catch (IOException e) {
            throw new IOErrorException("Failed to fetch messages: " + e.getMessage(), e);
        } finally {
            m.removeSessionListener(listener);
        }
        final var writer = (PlainTextWriter) outputWriter;
        writer.println("Fetched {} new messages, {} sent messages acknowledged", received.get(), acknowledged.get());
    }
}
