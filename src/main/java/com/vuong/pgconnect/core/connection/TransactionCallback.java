package com.vuong.pgconnect.core.connection;

/**
 * Callback run by {@link Database#withTransaction(TransactionCallback)}.
 * Returning normally commits; throwing rolls back and the exception reaches the caller unchanged.
 * @param <R> the result type
 */
@FunctionalInterface
public interface TransactionCallback<R> {

    R doInTransaction(TransactionScope tx);
}
