package org.courier.manager;

import org.courier.manager.api.Attachment;
import org.courier.manager.api.ContactAlreadyExistsException;
import org.courier.manager.api.ContactInfo;
import org.courier.manager.api.ContactNotFoundException;
import org.courier.manager.api.ContactNotPendingException;
import org.courier.manager.api.HandshakeException;
import org.courier.manager.api.IdentityInfo;
import org.courier.manager.api.InboxEntry;
import org.courier.manager.api.MessageNotFoundException;
import org.courier.manager.api.MessageTooLargeException;
import org.courier.manager.api.MessageUsage;
import org.courier.manager.api.NotActiveContactException;
import org.courier.manager.api.OutboxEntry;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * An open account. All operations are executed in order on the session thread, every change is written to the
 * state file.
 */
public interface Manager extends Closeable {

    IdentityInfo getIdentity();

    /**
     * Creates a pending contact together with our half of the key exchange.
     */
    ContactInfo addContact(String name) throws ContactAlreadyExistsException;

    /**
     * @return the armored key exchange message to hand to the contact
     */
    String getHandshake(long contactId) throws ContactNotFoundException, ContactNotPendingException;

    /**
     * Applies the contact's key exchange, given in armored form. Sealed messages already received from the contact
     * are opened.
     */
    ContactInfo completeHandshake(
            long contactId, String armoredHandshake
    ) throws ContactNotFoundException, ContactNotPendingException, HandshakeException;

    List<ContactInfo> getContacts();

    Optional<ContactInfo> getContact(String name);

    OutboxEntry sendMessage(
            long contactId, String body, List<Attachment> attachments
    ) throws ContactNotFoundException, NotActiveContactException, MessageTooLargeException;

    /**
     * Sends a message to the sender of an inbox message, marking that message as acknowledged.
     */
    OutboxEntry replyToMessage(
            long inboxId, String body, List<Attachment> attachments
    ) throws MessageNotFoundException, NotActiveContactException, MessageTooLargeException;

    MessageUsage estimateUsage(String body, boolean isReply, List<Attachment> attachments);

    List<InboxEntry> getInbox();

    List<OutboxEntry> getOutbox();

    InboxEntry readMessage(long inboxId) throws MessageNotFoundException;

    /**
     * Queues an acknowledgement for an inbox message.
     *
     * @return the queued acknowledgement, empty if the message was already acknowledged
     */
    Optional<OutboxEntry> acknowledgeMessage(long inboxId) throws MessageNotFoundException, NotActiveContactException;

    /**
     * Fetches new messages from the home server and waits until they have been stored.
     */
    void fetchMessages() throws IOException;

    void addSessionListener(SessionListener listener);

    void removeSessionListener(SessionListener listener);

    /**
     * Writes the final state, stops the network and rejects further operations.
     */
    @Override
    void close();

    /**
     * Called on the session thread. Implementations must not block or call back into the manager synchronously.
     */
    interface SessionListener {

        default void onMessageReceived(InboxEntry message) {
        }

        default void onMessageSent(OutboxEntry message) {
        }

        default void onMessageAcknowledged(OutboxEntry message) {
        }

        default void onContactActivated(ContactInfo contact) {
        }

        default void onSessionHalted(Throwable cause) {
        }
    }
}
