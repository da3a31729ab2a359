package com.keygate.backend.modules.auth.application.port;

/**
 * One-way, salted, deliberately slow password hashing.
 */
public interface CredentialHasher {

    /**
     * @throws CredentialHashingException if the primitive rejects the input
     */
    byte[] hash(String password);

    /**
     * @throws CredentialHashingException if the stored hash is unreadable
     */
    boolean verify(byte[] passHash, String password);
}
