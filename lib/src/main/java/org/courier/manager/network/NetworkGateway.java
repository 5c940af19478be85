package org.courier.manager.network;

import org.courier.manager.storage.contacts.Contact;
import org.courier.manager.storage.messages.MessageQueue;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Transport between the session and the servers. Transmits queued messages and fetches new ones on its own
 * threads, reporting back through the {@link NetworkListener}. A message is removed from the queue once it has
 * been transmitted.
 */
public interface NetworkGateway extends AutoCloseable {

    void start(MessageQueue queue, NetworkListener listener);

    /**
     * Requests an immediate fetch from our home server.
     */
    CompletableFuture<Void> fetchNow();

    /**
     * Opens a message sealed by the given contact. Called on the session thread.
     *
     * @return empty if the message could not be opened with any of the contact's keys
     */
    Optional<UnsealedMessage> unseal(Contact sender, byte[] sealed);

    @Override
    void close();
}
