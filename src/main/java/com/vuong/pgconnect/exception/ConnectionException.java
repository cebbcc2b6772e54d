package com.vuong.pgconnect.exception;

/**
 * Failure to open, ping or close the pooled database handle, or use of a handle that is already closed.
 */
public class ConnectionException extends DatabaseException {

    public ConnectionException(String message) {
        super(ErrorCode.CONNECTION_ERROR, message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(ErrorCode.CONNECTION_ERROR, message, cause);
    }

    public ConnectionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
