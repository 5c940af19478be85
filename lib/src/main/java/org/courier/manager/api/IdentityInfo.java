package org.courier.manager.api;

public record IdentityInfo(String server, byte[] signingPublicKey, byte[] identityPublicKey, long generation) {}
