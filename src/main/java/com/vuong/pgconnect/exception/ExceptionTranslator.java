package com.vuong.pgconnect.exception;

import org.hibernate.exception.ConstraintViolationException;
import org.hibernate.exception.JDBCConnectionException;

import java.sql.SQLTransientConnectionException;

/**
 * Maps exceptions thrown by Hibernate, HikariCP or the JDBC driver onto the {@link DatabaseException} hierarchy.
 */
public final class ExceptionTranslator {

    private ExceptionTranslator() {
    }

    /**
     * Translates a failure of the named operation.
     * Exceptions that already belong to the hierarchy are returned unchanged.
     * @param operation short description used as message prefix, e.g. "findById Account"
     * @param ex the failure
     * @return the translated exception, never null
     */
    public static DatabaseException translate(String operation, RuntimeException ex) {
        if (ex instanceof DatabaseException databaseException) {
            return databaseException;
        }
        String message = operation + " failed: " + ex.getMessage();
        if (isConnectionFailure(ex)) {
            return new ConnectionException(message, ex);
        }
        if (hasCause(ex, ConstraintViolationException.class)) {
            return new QueryException(ErrorCode.CONSTRAINT_VIOLATION, message, ex);
        }
        return new QueryException(message, ex);
    }

    private static boolean isConnectionFailure(Throwable ex) {
        return hasCause(ex, JDBCConnectionException.class) || hasCause(ex, SQLTransientConnectionException.class);
    }

    private static boolean hasCause(Throwable ex, Class<? extends Throwable> type) {
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
