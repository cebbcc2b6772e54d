package com.vuong.pgconnect.exception;

/**
 * Failure applying schema changes for one or more entity classes.
 */
public class MigrationException extends DatabaseException {

    public MigrationException(String message) {
        super(ErrorCode.MIGRATION_ERROR, message);
    }

    public MigrationException(String message, Throwable cause) {
        super(ErrorCode.MIGRATION_ERROR, message, cause);
    }
}
