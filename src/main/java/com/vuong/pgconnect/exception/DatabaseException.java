package com.vuong.pgconnect.exception;

/**
 * Base class of every error raised by the connection and repository layer.
 * Each subclass corresponds to one failure category and carries an {@link ErrorCode}.
 */
public abstract class DatabaseException extends RuntimeException {

    private final ErrorCode errorCode;

    protected DatabaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected DatabaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
