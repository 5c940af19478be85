/*
  Copyright (C) 2015-2022 AsamK and contributors

  This program is free software: you can redistribute it and/or modify
  it under the terms of the GNU General Public License as published by
  the Free Software Foundation, either version 3 of the License, or
  (at your option) any later version.

  This program is distributed in the hope that it will be useful,
  but WITHOUT ANY WARRANTY; without even the implied warranty of
  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
  GNU General Public License for more details.

  You should have received a copy of the GNU General Public License
  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.courier.manager.internal;

import org.courier.manager.Manager;
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
import org.courier.manager.helper.Context;
import org.courier.manager.protocol.Armor;
import org.courier.manager.storage.SessionState;
import org.courier.manager.storage.StateWriter;
import org.courier.manager.storage.contacts.Contact;
import org.courier.manager.storage.messages.InboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public class ManagerImpl implements Manager {

    private final static Logger logger = LoggerFactory.getLogger(ManagerImpl.class);

    private final SessionDependencies dependencies;
    private final SessionCoordinator coordinator;
    private final Closeable accountLock;

    private boolean closed;

    public ManagerImpl(
            final SessionState state,
            final StateWriter stateWriter,
            final SessionDependencies dependencies,
            final Closeable accountLock
    ) {
        this.dependencies = dependencies;
        this.accountLock = accountLock;
        final var context = new Context(state, dependencies);
        this.coordinator = new SessionCoordinator(context, stateWriter);
        this.coordinator.start();
        this.coordinator.submit(c -> {
            c.getIncomingMessageHandler().removeExpiredMessages();
            c.getSendHelper().requeueUnsentMessages();
            return null;
        }, true);
    }

    @Override
    public IdentityInfo getIdentity() {
        return await(coordinator.submit(context -> {
            final var identity = context.getState().getIdentity();
            return new IdentityInfo(identity.getServer(),
                    identity.getSigningPublicKey(),
                    identity.getIdentityPublicKey(),
                    Integer.toUnsignedLong(identity.getGeneration()));
        }, false));
    }

    @Override
    public ContactInfo addContact(final String name) throws ContactAlreadyExistsException {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Contact name must not be empty");
        }
        return await(coordinator.submit(context -> {
            final var state = context.getState();
            if (state.getContactByName(name).isPresent()) {
                throw new ContactAlreadyExistsException(name);
            }
            final var contact = Contact.newPending(state.createId(context.getDependencies().getSecureRandom()),
                    name);
            context.getHandshakeHelper().generateHandshake(contact);
            state.addContact(contact);
            logger.info("Added contact {}", name);
            return ContactInfo.from(contact);
        }, true), ContactAlreadyExistsException.class);
    }

    @Override
    public String getHandshake(final long contactId) throws ContactNotFoundException, ContactNotPendingException {
        return await(coordinator.submit(context -> {
            final var contact = getContact(context, contactId);
            if (!contact.isPending()) {
                throw new ContactNotPendingException(contact.getName());
            }
            return Armor.armor(contact.getHandshake());
        }, false), ContactNotFoundException.class, ContactNotPendingException.class);
    }

    @Override
    public ContactInfo completeHandshake(
            final long contactId, final String armoredHandshake
    ) throws ContactNotFoundException, ContactNotPendingException, HandshakeException {
        final var handshake = Armor.dearmor(armoredHandshake);
        return await(coordinator.submit(context -> {
            final var contact = getContact(context, contactId);
            if (!contact.isPending()) {
                throw new ContactNotPendingException(contact.getName());
            }
            final var opened = context.getHandshakeHelper().applyHandshake(contact, handshake);
            coordinator.notifyContactActivated(contact);
            coordinator.notifyIncoming(opened);
            return ContactInfo.from(contact);
        }, true), ContactNotFoundException.class, ContactNotPendingException.class, HandshakeException.class);
    }

    @Override
    public List<ContactInfo> getContacts() {
        return await(coordinator.submit(context -> context.getState()
                .getContacts()
                .stream()
                .map(ContactInfo::from)
                .toList(), false));
    }

    @Override
    public Optional<ContactInfo> getContact(final String name) {
        return await(coordinator.submit(context -> context.getState()
                .getContactByName(name)
                .map(ContactInfo::from), false));
    }

    @Override
    public OutboxEntry sendMessage(
            final long contactId, final String body, final List<Attachment> attachments
    ) throws ContactNotFoundException, NotActiveContactException, MessageTooLargeException {
        return await(coordinator.submit(context -> {
            final var contact = getContact(context, contactId);
            if (contact.isPending()) {
                throw new NotActiveContactException(contact.getName());
            }
            final var message = context.getSendHelper().sendMessage(contact, body, attachments, null);
            return OutboxEntry.from(message, contact.getName());
        }, true), ContactNotFoundException.class, NotActiveContactException.class, MessageTooLargeException.class);
    }

    @Override
    public OutboxEntry replyToMessage(
            final long inboxId, final String body, final List<Attachment> attachments
    ) throws MessageNotFoundException, NotActiveContactException, MessageTooLargeException {
        return await(coordinator.submit(context -> {
            final var inReplyTo = getInboundMessage(context, inboxId);
            final var contact = getSender(context, inReplyTo);
            if (contact.isPending() || inReplyTo.isSealed()) {
                throw new NotActiveContactException(contact.getName());
            }
            final var message = context.getSendHelper().sendMessage(contact, body, attachments, inReplyTo);
            return OutboxEntry.from(message, contact.getName());
        }, true), MessageNotFoundException.class, NotActiveContactException.class, MessageTooLargeException.class);
    }

    @Override
    public MessageUsage estimateUsage(final String body, final boolean isReply, final List<Attachment> attachments) {
        return await(coordinator.submit(context -> context.getSendHelper()
                .estimateUsage(body, isReply, attachments), false));
    }

    @Override
    public List<InboxEntry> getInbox() {
        return await(coordinator.submit(context -> context.getState()
                .getInbox()
                .stream()
                .map(m -> InboxEntry.from(m, getSender(context, m).getName()))
                .toList(), false));
    }

    @Override
    public List<OutboxEntry> getOutbox() {
        return await(coordinator.submit(context -> context.getState()
                .getOutbox()
                .stream()
                .map(m -> OutboxEntry.from(m,
                        context.getState().getContact(m.getTo()).map(Contact::getName).orElse(null)))
                .toList(), false));
    }

    @Override
    public InboxEntry readMessage(final long inboxId) throws MessageNotFoundException {
        return await(coordinator.submit(context -> {
            final var message = getInboundMessage(context, inboxId);
            message.markRead();
            return InboxEntry.from(message, getSender(context, message).getName());
        }, true), MessageNotFoundException.class);
    }

    @Override
    public Optional<OutboxEntry> acknowledgeMessage(
            final long inboxId
    ) throws MessageNotFoundException, NotActiveContactException {
        return await(coordinator.submit(context -> {
            final var message = getInboundMessage(context, inboxId);
            final var contact = getSender(context, message);
            if (contact.isPending() || message.isSealed()) {
                throw new NotActiveContactException(contact.getName());
            }
            if (message.isAcknowledged()) {
                return Optional.<OutboxEntry>empty();
            }
            final var ack = context.getSendHelper().sendAcknowledgement(message);
            return Optional.of(OutboxEntry.from(ack, contact.getName()));
        }, true), MessageNotFoundException.class, NotActiveContactException.class);
    }

    @Override
    public void fetchMessages() throws IOException {
        try {
            dependencies.getNetworkGateway().fetchNow().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof IOException ioException) {
                throw ioException;
            }
            throw new IOException("Failed to fetch messages: " + e.getCause().getMessage(), e.getCause());
        }
        // Fetched messages are queued before the fetch completes, wait until they are handled
        await(coordinator.submit(context -> null, false));
    }

    @Override
    public void addSessionListener(final SessionListener listener) {
        coordinator.addListener(listener);
    }

    @Override
    public void removeSessionListener(final SessionListener listener) {
        coordinator.removeListener(listener);
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        coordinator.shutdown().thenRun(this::releaseAccountLock);
    }

    private void releaseAccountLock() {
        try {
            accountLock.close();
        } catch (IOException e) {
            logger.warn("Failed to release account lock: {}", e.getMessage());
        }
    }

    private static Contact getContact(Context context, long contactId) throws ContactNotFoundException {
        return context.getState().getContact(contactId).orElseThrow(() -> new ContactNotFoundException(contactId));
    }

    private static InboundMessage getInboundMessage(
            Context context, long inboxId
    ) throws MessageNotFoundException {
        return context.getState()
                .getInboundMessage(inboxId)
                .orElseThrow(() -> new MessageNotFoundException(inboxId));
    }

    private static Contact getSender(Context context, InboundMessage message) {
        return context.getState()
                .getContact(message.getFrom())
                .orElseThrow(() -> new IllegalStateException("Inbound message without sender contact"));
    }

    private static <T> T await(CompletableFuture<T> future) {
        return await(future, RuntimeException.class, RuntimeException.class, RuntimeException.class);
    }

    private static <T, E1 extends Exception> T await(
            CompletableFuture<T> future, Class<E1> e1
    ) throws E1 {
        return await(future, e1, e1, e1);
    }

    private static <T, E1 extends Exception, E2 extends Exception> T await(
            CompletableFuture<T> future, Class<E1> e1, Class<E2> e2
    ) throws E1, E2 {
        return await(future, e1, e2, e2);
    }

    private static <T, E1 extends Exception, E2 extends Exception, E3 extends Exception> T await(
            CompletableFuture<T> future, Class<E1> e1, Class<E2> e2, Class<E3> e3
    ) throws E1, E2, E3 {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the session", e);
        } catch (ExecutionException e) {
            final var cause = e.getCause();
            if (e1.isInstance(cause)) {
                throw e1.cast(cause);
            }
            if (e2.isInstance(cause)) {
                throw e2.cast(cause);
            }
            if (e3.isInstance(cause)) {
                throw e3.cast(cause);
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new AssertionError("Unexpected exception from session", cause);
        }
    }
}
