package com.dbseed.orchestration.exception;

public class ConnectionStringUnavailableException extends RuntimeException {
    public ConnectionStringUnavailableException() {
    }

    public ConnectionStringUnavailableException(String message) {
        super(message);
    }

    public ConnectionStringUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConnectionStringUnavailableException(Throwable cause) {
        super(cause);
    }

    public ConnectionStringUnavailableException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
