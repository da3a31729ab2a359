package com.keygate.backend.global.common;

public class CallCancelledException extends RuntimeException {

    private final String operation;

    public CallCancelledException(String operation, String message) {
        super(operation + ": " + message);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
