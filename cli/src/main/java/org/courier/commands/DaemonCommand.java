package org.courier.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.courier.OutputType;
import org.courier.Shutdown;
import org.courier.commands.exceptions.CommandException;
import org.courier.json.JsonContact;
import org.courier.json.JsonInboxMessage;
import org.courier.json.JsonOutboxMessage;
import org.courier.json.JsonSessionEvent;
import org.courier.manager.Manager;
import org.courier.manager.api.ContactInfo;
import org.courier.manager.api.InboxEntry;
import org.courier.manager.api.OutboxEntry;
import org.courier.output.JsonWriter;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriter;
import org.courier.util.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class DaemonCommand implements LocalCommand {

    private static final Logger logger = LoggerFactory.getLogger(DaemonCommand.class);

    @Override
    public String getName() {
        return "daemon";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Keep the session open, letting the network transport deliver and fetch messages, and print session events until interrupted.");
    }

    @Override
    public List<OutputType> getSupportedOutputTypes() {
        return List.of(OutputType.PLAIN_TEXT, OutputType.JSON);
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        Shutdown.installHandler();
        logger.info("Starting daemon for account on {}", m.getIdentity().server());

        final var listener = new EventPrinter(outputWriter);
        m.addSessionListener(listener);
        try {
            Shutdown.waitForShutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Interrupted while waiting for shutdown");
        } finally {
            m.removeSessionListener(listener);
        }
    }

    static final class EventPrinter implements Manager.SessionListener {

        private final OutputWriter outputWriter;

        EventPrinter(final OutputWriter outputWriter) {
            this.outputWriter = outputWriter;
        }

        @Override
        public void onMessageReceived(final InboxEntry message) {
            if (outputWriter instanceof PlainTextWriter writer) {
                writer.println("Received message {} from {}{}",
                        Util.formatId(message.id()),
                        message.fromName(),
                        message.isSealed() ? " (sealed until the key exchange completes)" : "");
            } else if (outputWriter instanceof JsonWriter writer) {
                writer.write(new JsonSessionEvent("received", JsonInboxMessage.from(message)));
            }
        }

        @Override
        public void onMessageSent(final OutboxEntry message) {
            if (outputWriter instanceof PlainTextWriter writer) {
                writer.println("Sent message {} to {}", Util.formatId(message.id()), message.toName());
            } else if (outputWriter instanceof JsonWriter writer) {
                writer.write(new JsonSessionEvent("sent", JsonOutboxMessage.from(message)));
            }
        }

        @Override
        public void onMessageAcknowledged(final OutboxEntry message) {
            if (outputWriter instanceof PlainTextWriter writer) {
                writer.println("Message {} to {} was acknowledged", Util.formatId(message.id()), message.toName());
            } else if (outputWriter instanceof JsonWriter writer) {
                writer.write(new JsonSessionEvent("acknowledged", JsonOutboxMessage.from(message)));
            }
        }

        @Override
        public void onContactActivated(final ContactInfo contact) {
            if (outputWriter instanceof PlainTextWriter writer) {
                writer.println("Key exchange with {} complete", contact.name());
            } else if (outputWriter instanceof JsonWriter writer) {
                writer.write(new JsonSessionEvent("contactActivated", JsonContact.from(contact)));
            }
        }

        @Override
        public void onSessionHalted(final Throwable cause) {
            logger.error("Session halted: {}", cause.getMessage());
            if (outputWriter instanceof JsonWriter writer) {
                writer.write(new JsonSessionEvent("halted", cause.getMessage()));
            }
            Shutdown.triggerShutdown();
        }
    }
}
