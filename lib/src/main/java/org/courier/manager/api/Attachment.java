package org.courier.manager.api;

public record Attachment(String filename, byte[] contents) {}
