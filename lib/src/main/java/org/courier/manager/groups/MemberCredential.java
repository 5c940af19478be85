package org.courier.manager.groups;

/**
 * A delivery group descriptor together with one member key of that group, both in serialized form.
 */
public record MemberCredential(byte[] group, byte[] memberKey) {}
