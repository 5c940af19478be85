package org.courier.manager.network;

import java.util.List;

/**
 * Callbacks from the network actor into the session. May be invoked from any thread.
 */
public interface NetworkListener {

    void onMessageSent(long messageId);

    /**
     * @param acknowledge removes the messages from the server, must only be run once they are stored locally
     */
    void onMessagesFetched(List<FetchedMessage> messages, Runnable acknowledge);
}
