package com.dbseed.orchestration.exception;

public class RestoreStatementException extends RuntimeException {
    public RestoreStatementException() {
    }

    public RestoreStatementException(String message) {
        super(message);
    }

    public RestoreStatementException(String message, Throwable cause) {
        super(message, cause);
    }

    public RestoreStatementException(Throwable cause) {
        super(cause);
    }

    public RestoreStatementException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
