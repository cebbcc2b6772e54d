package com.vuong.pgconnect.exception;

/**
 * A lookup by id or a single-match query matched zero rows.
 */
public class NotFoundException extends DatabaseException {

    public NotFoundException(String message) {
        super(ErrorCode.ENTITY_NOT_FOUND, message);
    }
}
