package org.courier.manager.network;

/**
 * A sealed message retrieved from our home server, attributed to the contact whose member key authorized it.
 */
public record FetchedMessage(long from, byte[] sealed) {}
