package org.courier.manager.helper;

import org.courier.manager.internal.SessionDependencies;
import org.courier.manager.storage.SessionState;

import java.util.function.Supplier;

/**
 * State and helpers of one session. Only used from the session thread.
 */
public class Context {

    private final SessionState state;
    private final SessionDependencies dependencies;

    private HandshakeHelper handshakeHelper;
    private IncomingMessageHandler incomingMessageHandler;
    private SendHelper sendHelper;

    public Context(final SessionState state, final SessionDependencies dependencies) {
        this.state = state;
        this.dependencies = dependencies;
    }

    public SessionState getState() {
        return state;
    }

    public SessionDependencies getDependencies() {
        return dependencies;
    }

    public long now() {
        return dependencies.getClock().millis();
    }

    public HandshakeHelper getHandshakeHelper() {
        return getOrCreate(() -> handshakeHelper, () -> handshakeHelper = new HandshakeHelper(this));
    }

    public IncomingMessageHandler getIncomingMessageHandler() {
        return getOrCreate(() -> incomingMessageHandler,
                () -> incomingMessageHandler = new IncomingMessageHandler(this));
    }

    public SendHelper getSendHelper() {
        return getOrCreate(() -> sendHelper, () -> sendHelper = new SendHelper(this));
    }

    private <T> T getOrCreate(Supplier<T> supplier, Callable creator) {
        var value = supplier.get();
        if (value != null) {
            return value;
        }

        creator.call();
        return supplier.get();
    }

    private interface Callable {

        void call();
    }
}
