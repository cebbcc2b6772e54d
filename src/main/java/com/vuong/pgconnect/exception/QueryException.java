package com.vuong.pgconnect.exception;

/**
 * Any other failure reported by the mapper: malformed predicate, constraint violation, type mismatch.
 * The mapper's exception is kept as the cause.
 */
public class QueryException extends DatabaseException {

    public QueryException(String message) {
        super(ErrorCode.QUERY_ERROR, message);
    }

    public QueryException(String message, Throwable cause) {
        super(ErrorCode.QUERY_ERROR, message, cause);
    }

    public QueryException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
