package org.courier.manager.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Writes state snapshots to disk on a dedicated thread.
 * <p>
 * Snapshots submitted while a write is in progress are coalesced, only the newest one is written. Each returned
 * future completes once a snapshot at least as new as the submitted one is durable.
 */
public class StateWriter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StateWriter.class);

    private final StateFile stateFile;
    private final byte[] key;
    private final byte[] salt;
    private final SecureRandom random;
    private final BlockingQueue<Request> requests = new LinkedBlockingQueue<>();
    private final CompletableFuture<Void> done = new CompletableFuture<>();
    private final Thread thread;

    private volatile boolean closed;

    private record Request(byte[] snapshot, CompletableFuture<Void> written) {

        private static final byte[] STOP = new byte[0];

        boolean isStop() {
            return snapshot == STOP;
        }
    }

    public StateWriter(final StateFile stateFile, final byte[] key, final byte[] salt, final SecureRandom random) {
        this.stateFile = stateFile;
        this.key = key;
        this.salt = salt;
        this.random = random;
        this.thread = new Thread(this::run, "state-writer");
        this.thread.setDaemon(false);
        this.thread.start();
    }

    public CompletableFuture<Void> save(byte[] snapshot) {
        final var written = new CompletableFuture<Void>();
        if (closed) {
            written.completeExceptionally(new IllegalStateException("State writer is closed"));
            return written;
        }
        requests.add(new Request(snapshot, written));
        return written;
    }

    /**
     * Writes all pending snapshots and stops the writer thread. Blocks until the thread has finished.
     */
    @Override
    public void close() {
        if (closed) {
            done.join();
            return;
        }
        closed = true;
        requests.add(new Request(Request.STOP, new CompletableFuture<>()));
        done.join();
    }

    private void run() {
        try {
            var stop = false;
            while (!stop) {
                final var batch = new ArrayList<Request>();
                batch.add(requests.take());
                requests.drainTo(batch);

                byte[] latest = null;
                for (final var request : batch) {
                    if (request.isStop()) {
                        stop = true;
                    } else {
                        latest = request.snapshot();
                    }
                }
                if (latest != null) {
                    write(latest, batch);
                }
            }
            logger.debug("State writer stopped");
        } catch (InterruptedException e) {
            logger.warn("State writer interrupted, pending state may be lost");
            Thread.currentThread().interrupt();
        } finally {
            final var closedError = new IllegalStateException("State writer is closed");
            requests.forEach(r -> r.written().completeExceptionally(closedError));
            done.complete(null);
        }
    }

    private void write(byte[] snapshot, ArrayList<Request> batch) {
        try {
            stateFile.write(StateFile.encrypt(snapshot, key, salt, random));
            logger.trace("Wrote state file ({} bytes)", snapshot.length);
            batch.forEach(r -> r.written().complete(null));
        } catch (Exception e) {
            logger.error("Error saving state file: {}", e.getMessage(), e);
            batch.forEach(r -> r.written().completeExceptionally(e));
        }
    }
}
