package com.keygate.backend.modules.auth.application.port;

public class CredentialHashingException extends RuntimeException {

    public CredentialHashingException(String message) {
        super(message);
    }

    public CredentialHashingException(String message, Throwable cause) {
        super(message, cause);
    }
}
