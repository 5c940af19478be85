package org.courier.manager.network;

import org.bouncycastle.util.encoders.Hex;
import org.courier.manager.protocol.MessageRecord;
import org.courier.manager.storage.contacts.Contact;
import org.courier.manager.storage.messages.MessageQueue;
import org.courier.manager.util.KeyUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory transport connecting the accounts of one test. Nothing happens on its own, tests drive transmission
 * and fetching explicitly.
 * <p>
 * A sealed message is the ratchet value it was sealed to followed by the serialized record.
 */
public class LoopbackNetwork {

    private final Map<String, Endpoint> endpoints = new ConcurrentHashMap<>();

    public Endpoint newEndpoint() {
        return new Endpoint();
    }

    private record Delivery(byte[] senderIdentity, byte[] sealed) {}

    public class Endpoint implements NetworkGateway {

        private final Map<String, Long> contactsByIdentity = new ConcurrentHashMap<>();
        private final List<Delivery> mailbox = new ArrayList<>();
        private byte[] identity;
        private MessageQueue queue;
        private NetworkListener listener;
        private volatile boolean closed;

        /**
         * Makes this endpoint reachable under the given identity public key.
         */
        public void register(byte[] identityPublicKey) {
            this.identity = identityPublicKey;
            endpoints.put(Hex.toHexString(identityPublicKey), this);
        }

        /**
         * Attributes messages from the given identity to the given contact id.
         */
        public void addContact(byte[] peerIdentityPublicKey, long contactId) {
            contactsByIdentity.put(Hex.toHexString(peerIdentityPublicKey), contactId);
        }

        public boolean isClosed() {
            return closed;
        }

        public int getMailboxSize() {
            synchronized (mailbox) {
                return mailbox.size();
            }
        }

        @Override
        public void start(final MessageQueue queue, final NetworkListener listener) {
            this.queue = queue;
            this.listener = listener;
        }

        /**
         * Delivers all queued messages and reports them as sent.
         *
         * @return number of delivered messages
         */
        public int transmitAll() {
            var count = 0;
            while (true) {
                final var next = queue.peek();
                if (next.isEmpty()) {
                    return count;
                }
                final var message = next.get();
                final var keys = message.getDeliveryKeys();
                final var target = endpoints.get(Hex.toHexString(keys.peerIdentityPublicKey()));
                if (target != null) {
                    target.deliver(new Delivery(identity, seal(keys.peerDhPublicKey(), message.getRecord())));
                }
                queue.remove(message);
                listener.onMessageSent(message.getId());
                count++;
            }
        }

        /**
         * Injects a message as if the given sender had delivered it.
         */
        public void deliverFrom(byte[] senderIdentity, byte[] sealed) {
            deliver(new Delivery(senderIdentity, sealed));
        }

        private void deliver(Delivery delivery) {
            synchronized (mailbox) {
                mailbox.add(delivery);
            }
        }

        @Override
        public CompletableFuture<Void> fetchNow() {
            final List<Delivery> fetched;
            synchronized (mailbox) {
                fetched = List.copyOf(mailbox);
            }
            if (!fetched.isEmpty()) {
                final var messages = fetched.stream()
                        .map(d -> new FetchedMessage(contactsByIdentity.getOrDefault(Hex.toHexString(d.senderIdentity()),
                                0L), d.sealed()))
                        .toList();
                listener.onMessagesFetched(messages, () -> {
                    synchronized (mailbox) {
                        mailbox.removeAll(fetched);
                    }
                });
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public Optional<UnsealedMessage> unseal(final Contact sender, final byte[] sealed) {
            if (sealed.length < 32) {
                return Optional.empty();
            }
            final var sealedTo = Arrays.copyOf(sealed, 32);
            final var localDh = sender.getLocalDh();
            final boolean current;
            if (localDh.current() != null && Arrays.equals(sealedTo, KeyUtils.getDhPublicKey(localDh.current()))) {
                current = true;
            } else if (localDh.previous() != null && Arrays.equals(sealedTo,
                    KeyUtils.getDhPublicKey(localDh.previous()))) {
                current = false;
            } else {
                return Optional.empty();
            }
            try {
                final var record = MessageRecord.parse(Arrays.copyOfRange(sealed, 32, sealed.length));
                return Optional.of(new UnsealedMessage(record, current));
            } catch (Exception e) {
                return Optional.empty();
            }
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    public static byte[] seal(byte[] peerDhPublicKey, MessageRecord record) {
        final var serialized = record.serialize();
        final var sealed = new byte[32 + serialized.length];
        System.arraycopy(peerDhPublicKey, 0, sealed, 0, 32);
        System.arraycopy(serialized, 0, sealed, 32, serialized.length);
        return sealed;
    }
}
