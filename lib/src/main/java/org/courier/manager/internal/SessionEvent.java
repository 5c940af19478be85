package org.courier.manager.internal;

import org.courier.manager.network.FetchedMessage;

import java.util.List;
import java.util.concurrent.CompletableFuture;

sealed interface SessionEvent {

    record Action<T>(SessionAction<T> action, boolean mutating, CompletableFuture<T> result) implements SessionEvent {}

    record MessageSent(long messageId) implements SessionEvent {}

    record MessagesFetched(List<FetchedMessage> messages, Runnable acknowledge) implements SessionEvent {}

    record ExpiryTick() implements SessionEvent {}

    record Shutdown() implements SessionEvent {}
}
