package com.dbseed.orchestration.exception;

public class LockContentionException extends RuntimeException {
    public LockContentionException() {
    }

    public LockContentionException(String message) {
        super(message);
    }

    public LockContentionException(String message, Throwable cause) {
        super(message, cause);
    }

    public LockContentionException(Throwable cause) {
        super(cause);
    }

    public LockContentionException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
