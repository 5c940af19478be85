package org.courier.manager.internal;

import org.courier.manager.Manager;
import org.courier.manager.api.ContactInfo;
import org.courier.manager.api.InboxEntry;
import org.courier.manager.api.OutboxEntry;
import org.courier.manager.config.ServiceConfig;
import org.courier.manager.helper.Context;
import org.courier.manager.helper.IncomingMessageHandler.IncomingMessages;
import org.courier.manager.network.FetchedMessage;
import org.courier.manager.network.NetworkListener;
import org.courier.manager.storage.StateWriter;
import org.courier.manager.storage.Storage;
import org.courier.manager.storage.contacts.Contact;
import org.courier.manager.storage.messages.InboundMessage;
import org.courier.manager.storage.messages.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns the session state. Presentation requests and network notifications are funnelled through one event queue
 * and handled one at a time on the session thread, which also triggers a state write after every change.
 */
public class SessionCoordinator implements NetworkListener {

    private final static Logger logger = LoggerFactory.getLogger(SessionCoordinator.class);

    private final Context context;
    private final StateWriter stateWriter;
    private final BlockingQueue<SessionEvent> events = new LinkedBlockingQueue<>();
    private final List<Manager.SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private final ScheduledExecutorService expiryTimer;
    private final Thread thread;

    private boolean accepting = true;

    public SessionCoordinator(final Context context, final StateWriter stateWriter) {
        this.context = context;
        this.stateWriter = stateWriter;
        this.thread = new Thread(this::run, "session");
        this.expiryTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            final var timerThread = new Thread(r, "session-expiry");
            timerThread.setDaemon(true);
            return timerThread;
        });
    }

    public void start() {
        thread.start();
        context.getDependencies().getNetworkGateway().start(context.getState().getQueue(), this);
        final var period = ServiceConfig.EXPIRY_SWEEP_PERIOD.toMillis();
        expiryTimer.scheduleAtFixedRate(() -> post(new SessionEvent.ExpiryTick()),
                period,
                period,
                TimeUnit.MILLISECONDS);
    }

    public void addListener(Manager.SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(Manager.SessionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Schedules an action on the session thread.
     *
     * @param mutating whether the state has to be written after the action
     */
    public <T> CompletableFuture<T> submit(SessionAction<T> action, boolean mutating) {
        final var result = new CompletableFuture<T>();
        if (!post(new SessionEvent.Action<>(action, mutating, result))) {
            result.completeExceptionally(new IllegalStateException("Session is closed"));
        }
        return result;
    }

    /**
     * Writes the final state and stops the session. Blocks until the state file is closed and the network has
     * been told to stop. Called from the session thread, e.g. by a listener, it returns at once and the session
     * stops after the current event.
     *
     * @return completes once the session has stopped
     */
    public CompletableFuture<Void> shutdown() {
        synchronized (events) {
            if (accepting) {
                accepting = false;
                events.add(new SessionEvent.Shutdown());
            }
        }
        if (Thread.currentThread() != thread) {
            terminated.join();
        }
        return terminated;
    }

    @Override
    public void onMessageSent(final long messageId) {
        post(new SessionEvent.MessageSent(messageId));
    }

    @Override
    public void onMessagesFetched(final List<FetchedMessage> messages, final Runnable acknowledge) {
        if (!post(new SessionEvent.MessagesFetched(List.copyOf(messages), acknowledge))) {
            logger.debug("Session closed, leaving {} fetched messages on the server", messages.size());
        }
    }

    private boolean post(SessionEvent event) {
        synchronized (events) {
            if (!accepting) {
                return false;
            }
            events.add(event);
            return true;
        }
    }

    private void run() {
        logger.debug("Session started");
        try {
            while (true) {
                final var event = events.take();
                if (event instanceof SessionEvent.Shutdown) {
                    handleShutdown();
                    return;
                }
                try {
                    handleEvent(event);
                } catch (RuntimeException | Error e) {
                    halt(e);
                    return;
                }
            }
        } catch (InterruptedException e) {
            logger.warn("Session thread interrupted");
            Thread.currentThread().interrupt();
            halt(e);
        }
    }

    private void handleEvent(SessionEvent event) {
        if (event instanceof SessionEvent.Action<?> action) {
            handleAction(action);
        } else if (event instanceof SessionEvent.MessageSent sent) {
            handleMessageSent(sent.messageId());
        } else if (event instanceof SessionEvent.MessagesFetched fetched) {
            handleMessagesFetched(fetched.messages(), fetched.acknowledge());
        } else if (event instanceof SessionEvent.ExpiryTick) {
            if (!context.getIncomingMessageHandler().removeExpiredMessages().isEmpty()) {
                persist();
            }
        } else {
            throw new AssertionError("Unhandled session event " + event);
        }
    }

    private <T> void handleAction(SessionEvent.Action<T> action) {
        final T result;
        try {
            result = action.action().run(context);
        } catch (RuntimeException | Error e) {
            action.result().completeExceptionally(e);
            throw e;
        } catch (Exception e) {
            action.result().completeExceptionally(e);
            return;
        }
        if (action.mutating()) {
            persist();
        }
        action.result().complete(result);
    }

    private void handleMessageSent(long messageId) {
        final var message = context.getSendHelper().markSent(messageId);
        if (message.isEmpty()) {
            return;
        }
        persist();
        final var entry = toOutboxEntry(message.get());
        listeners.forEach(l -> l.onMessageSent(entry));
    }

    private void handleMessagesFetched(List<FetchedMessage> messages, Runnable acknowledge) {
        logger.debug("Handling {} fetched messages", messages.size());
        final var incoming = context.getIncomingMessageHandler().handleFetchedMessages(messages);
        persist().thenRun(acknowledge).exceptionally(e -> {
            logger.warn("Not acknowledging fetched messages, state could not be written: {}", e.getMessage());
            return null;
        });
        notifyIncoming(incoming);
    }

    /**
     * Tells the listeners about messages opened or received and outbound messages that got acknowledged.
     */
    public void notifyIncoming(IncomingMessages incoming) {
        for (final var message : incoming.getReceived()) {
            final var entry = toInboxEntry(message);
            listeners.forEach(l -> l.onMessageReceived(entry));
        }
        for (final var message : incoming.getAcknowledged()) {
            final var entry = toOutboxEntry(message);
            listeners.forEach(l -> l.onMessageAcknowledged(entry));
        }
    }

    public void notifyContactActivated(Contact contact) {
        final var info = ContactInfo.from(contact);
        listeners.forEach(l -> l.onContactActivated(info));
    }

    private CompletableFuture<Void> persist() {
        return stateWriter.save(Storage.serialize(context.getState()));
    }

    private void handleShutdown() {
        logger.debug("Shutting down session");
        expiryTimer.shutdownNow();
        try {
            persist().join();
        } catch (CompletionException e) {
            logger.error("Failed to write final state: {}", e.getMessage());
        }
        stateWriter.close();
        context.getDependencies().getNetworkGateway().close();
        rejectPendingEvents(new IllegalStateException("Session is closed"));
        terminated.complete(null);
        logger.debug("Session stopped");
    }

    private void halt(Throwable cause) {
        logger.error("Session halted after unexpected error: {}", cause.getMessage(), cause);
        synchronized (events) {
            accepting = false;
        }
        expiryTimer.shutdownNow();
        context.getDependencies().getNetworkGateway().close();
        stateWriter.close();
        rejectPendingEvents(new IllegalStateException("Session halted", cause));
        for (final var listener : listeners) {
            listener.onSessionHalted(cause);
        }
        terminated.complete(null);
    }

    private void rejectPendingEvents(Exception reason) {
        final var pending = new ArrayList<SessionEvent>();
        synchronized (events) {
            events.drainTo(pending);
        }
        for (final var event : pending) {
            if (event instanceof SessionEvent.Action<?> action) {
                action.result().completeExceptionally(reason);
            }
        }
    }

    private InboxEntry toInboxEntry(InboundMessage message) {
        return InboxEntry.from(message, contactName(message.getFrom()));
    }

    private OutboxEntry toOutboxEntry(OutboundMessage message) {
        return OutboxEntry.from(message, contactName(message.getTo()));
    }

    private String contactName(long contactId) {
        return context.getState().getContact(contactId).map(Contact::getName).orElse(null);
    }
}
