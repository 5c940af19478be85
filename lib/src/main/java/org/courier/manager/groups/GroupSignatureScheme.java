package org.courier.manager.groups;

import java.security.SecureRandom;

/**
 * Anonymous group signature scheme used to authorize deliveries to a home server.
 * <p>
 * Each account owns one delivery group and hands a fresh member key to every contact, so that contacts can
 * deliver messages without the server learning who sent them. Implementations are looked up with
 * {@link java.util.ServiceLoader}.
 */
public interface GroupSignatureScheme {

    /**
     * Creates the private key of a new delivery group.
     */
    byte[] generateGroup(SecureRandom random);

    /**
     * Issues a new member key for the group with the given private key.
     */
    MemberCredential newMember(byte[] groupPrivateKey, SecureRandom random);

    /**
     * Checks that both parts of the credential parse and that the member key belongs to the group.
     *
     * @throws InvalidGroupException if either part is malformed or the key is not a member of the group
     */
    void checkMember(MemberCredential credential) throws InvalidGroupException;
}
