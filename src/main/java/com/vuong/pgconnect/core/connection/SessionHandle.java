package com.vuong.pgconnect.core.connection;

import com.vuong.pgconnect.config.LogLevel;

/**
 * Something repositories can run session work against: the {@link Database} itself, where every call
 * gets its own short transaction, or a {@link TransactionScope}, where every call joins the open transaction.
 */
public interface SessionHandle {

    /**
     * Runs the work in a session with an active transaction.
     * @param work the work
     * @param <R> the result type
     * @return the result of the work
     */
    <R> R execute(SessionWork<R> work);

    /**
     * Makes sure the entity class is known to the mapping used by this handle.
     * @param entityClass the entity class
     */
    void ensureMapped(Class<?> entityClass);

    LogLevel getLogLevel();
}
