package com.vuong.pgconnect.core.connection;

import com.vuong.pgconnect.config.LogLevel;
import com.vuong.pgconnect.core.domain.repository.GenericRepository;
import com.vuong.pgconnect.core.domain.repository.SimpleGenericRepository;
import com.vuong.pgconnect.exception.ErrorCode;
import com.vuong.pgconnect.exception.QueryException;
import org.hibernate.Session;

/**
 * Transactional handle passed to a {@link TransactionCallback}.
 * Repositories obtained here run every operation in the enclosing transaction.
 * The scope is only valid while the callback runs.
 */
public class TransactionScope implements SessionHandle {

    private final Database database;
    private final Session session;
    private volatile boolean finished;

    TransactionScope(Database database, Session session) {
        this.database = database;
        this.session = session;
    }

    /**
     * Creates a repository bound to this transaction.
     * The entity class must already be mapped when the transaction was opened.
     * @param entityClass the entity class
     * @param <T> the entity type
     * @return the repository
     * @throws QueryException if the entity class is not mapped
     */
    public <T> GenericRepository<T> repository(Class<T> entityClass) {
        return new SimpleGenericRepository<>(this, entityClass);
    }

    /**
     * @return the Hibernate session of the transaction, for work the repositories do not cover
     */
    public Session getSession() {
        checkActive();
        return session;
    }

    public Database getDatabase() {
        return database;
    }

    @Override
    public <R> R execute(SessionWork<R> work) {
        checkActive();
        return work.apply(session);
    }

    @Override
    public void ensureMapped(Class<?> entityClass) {
        checkActive();
        try {
            session.getMetamodel().entity(entityClass);
        } catch (IllegalArgumentException e) {
            throw new QueryException(ErrorCode.INVALID_OPERATION, entityClass.getName()
                    + " is not mapped in this transaction; register or migrate it before opening the transaction", e);
        }
    }

    @Override
    public LogLevel getLogLevel() {
        return database.getLogLevel();
    }

    void finish() {
        finished = true;
    }

    private void checkActive() {
        if (finished) {
            throw new QueryException(ErrorCode.INVALID_OPERATION,
                    "transaction scope used after its transaction ended", null);
        }
    }
}
