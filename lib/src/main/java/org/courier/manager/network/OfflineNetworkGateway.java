package org.courier.manager.network;

import org.courier.manager.storage.contacts.Contact;
import org.courier.manager.storage.messages.MessageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Gateway used when no transport is installed. Messages stay queued until a session with a transport runs.
 */
public class OfflineNetworkGateway implements NetworkGateway {

    private static final Logger logger = LoggerFactory.getLogger(OfflineNetworkGateway.class);

    @Override
    public void start(final MessageQueue queue, final NetworkListener listener) {
        logger.debug("No transport available, {} queued messages will not be transmitted", queue.size());
    }

    @Override
    public CompletableFuture<Void> fetchNow() {
        logger.info("No transport available, not fetching messages");
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public Optional<UnsealedMessage> unseal(final Contact sender, final byte[] sealed) {
        logger.warn("No transport available to open messages from {}", sender.getName());
        return Optional.empty();
    }

    @Override
    public void close() {
    }
}
