package com.keygate.backend.modules.auth.application;

import com.keygate.backend.global.error.ProblemException;

/**
 * Classified failure of an auth operation. The detail is {@code "<operation>: <description>"}
 * and never carries passwords, hashes or token values.
 */
public class AuthException extends ProblemException {

    private final AuthErrorKind kind;
    private final String operation;

    public AuthException(AuthErrorKind kind, String operation) {
        this(kind, operation, null);
    }

    public AuthException(AuthErrorKind kind, String operation, Throwable cause) {
        super(kind.getStatus(), kind.getCode(), operation + ": " + kind.getDescription(), cause);
        this.kind = kind;
        this.operation = operation;
    }

    public AuthErrorKind getKind() {
        return kind;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public String getMessage() {
        return getDetailMessage();
    }
}
