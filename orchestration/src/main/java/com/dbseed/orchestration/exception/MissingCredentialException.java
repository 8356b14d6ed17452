package com.dbseed.orchestration.exception;

public class MissingCredentialException extends RuntimeException {
    public MissingCredentialException() {
    }

    public MissingCredentialException(String message) {
        super(message);
    }

    public MissingCredentialException(String message, Throwable cause) {
        super(message, cause);
    }

    public MissingCredentialException(Throwable cause) {
        super(cause);
    }

    public MissingCredentialException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
