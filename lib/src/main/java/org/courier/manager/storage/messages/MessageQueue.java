package org.courier.manager.storage.messages;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;

/**
 * Outbound messages waiting for transmission. Shared between the session and the network.
 */
public class MessageQueue {

    private final Object lock = new Object();
    private final ArrayDeque<OutboundMessage> queue = new ArrayDeque<>();

    public void enqueue(OutboundMessage message) {
        synchronized (lock) {
            queue.addLast(message);
            lock.notifyAll();
        }
    }

    public Optional<OutboundMessage> peek() {
        synchronized (lock) {
            return Optional.ofNullable(queue.peekFirst());
        }
    }

    /**
     * Waits up to the given time for a message to become available.
     */
    public Optional<OutboundMessage> awaitNext(long timeoutMillis) throws InterruptedException {
        final var deadline = System.currentTimeMillis() + timeoutMillis;
        synchronized (lock) {
            while (queue.isEmpty()) {
                final var remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    return Optional.empty();
                }
                lock.wait(remaining);
            }
            return Optional.of(queue.peekFirst());
        }
    }

    public boolean remove(OutboundMessage message) {
        synchronized (lock) {
            return queue.remove(message);
        }
    }

    public List<OutboundMessage> getMessages() {
        synchronized (lock) {
            return List.copyOf(queue);
        }
    }

    public int size() {
        synchronized (lock) {
            return queue.size();
        }
    }
}
