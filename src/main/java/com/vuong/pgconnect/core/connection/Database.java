package com.vuong.pgconnect.core.connection;

import com.vuong.pgconnect.config.DatabaseConfig;
import com.vuong.pgconnect.config.LogLevel;
import com.vuong.pgconnect.core.domain.repository.GenericRepository;
import com.vuong.pgconnect.core.domain.repository.SimpleGenericRepository;
import com.vuong.pgconnect.exception.ConnectionException;
import com.vuong.pgconnect.exception.ErrorCode;
import com.vuong.pgconnect.exception.ExceptionTranslator;
import com.vuong.pgconnect.exception.MigrationException;
import com.vuong.pgconnect.exception.QueryException;
import com.vuong.pgconnect.util.ConnectionStringSanitizer;
import com.vuong.pgconnect.util.SqlStatementLogger;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.hibernate.Session;
import org.hibernate.SessionFactory;
import org.hibernate.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * A pooled database handle with the Hibernate mapping built on top of it.
 * <p>
 * One instance is meant to be shared by every repository of an application; it adds no locking
 * around queries and relies on the pool for concurrent use. The caller owns the instance and
 * must {@link #close()} it once no repository needs it anymore.
 * <p>
 * Entity classes become known to the mapping through {@link #autoMigrate(Class[])}, {@link #register(Class[])}
 * or by creating a repository. Each registration of new classes replaces the session factory. A replaced
 * factory stays open while sessions opened on it are still running and is closed when the last one ends.
 */
public class Database implements SessionHandle, AutoCloseable {

    /**
     * Maximum lifetime of a pooled connection. Not configurable.
     */
    public static final Duration MAX_CONNECTION_LIFETIME = Duration.ofHours(1);

    static final int PING_TIMEOUT_SECONDS = 5;

    private static final Logger logger = LoggerFactory.getLogger(Database.class);
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final HikariDataSource dataSource;
    private final LogLevel logLevel;
    private final String target;
    private final MappingBuilder mappingBuilder;
    private final AtomicBoolean closed = new AtomicBoolean();

    // guarded by this
    private final List<SessionFactory> retiredFactories = new ArrayList<>();
    private final Map<SessionFactory, Integer> openSessions = new HashMap<>();
    private volatile SessionFactory sessionFactory;
    private volatile Set<Class<?>> mappedClasses = Set.of();

    private Database(HikariDataSource dataSource, LogLevel logLevel, String target) {
        this.dataSource = dataSource;
        this.logLevel = logLevel != null ? logLevel : LogLevel.SILENT;
        this.target = target;
        this.mappingBuilder = new MappingBuilder(dataSource, new SqlStatementLogger(this.logLevel));
    }

    /**
     * Opens a connection pool for the given configuration.
     * The pool applies the configured idle and open connection limits and a fixed one hour
     * connection lifetime, and connects eagerly so that an unreachable database fails here.
     * @param config the connection configuration
     * @return the open database
     * @throws ConnectionException if the pool cannot be created or the first connection fails
     */
    public static Database open(DatabaseConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        String target = ConnectionStringSanitizer.sanitizeForLogging(
                config.getUrl() != null ? config.toJdbcUrl() : config.toConnectionString());

        HikariDataSource dataSource;
        try {
            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setPoolName("pgconnect-" + POOL_SEQUENCE.incrementAndGet());
            hikariConfig.setJdbcUrl(config.toJdbcUrl());
            hikariConfig.setUsername(config.getUser());
            hikariConfig.setPassword(config.getPassword());
            hikariConfig.setMaximumPoolSize(config.getMaxOpenConns());
            hikariConfig.setMinimumIdle(config.getMaxIdleConns());
            hikariConfig.setMaxLifetime(MAX_CONNECTION_LIFETIME.toMillis());
            dataSource = new HikariDataSource(hikariConfig);
        } catch (RuntimeException e) {
            throw new ConnectionException("failed to connect to database " + target + ": " + e.getMessage(), e);
        }

        logger.info("Connected to database {} (pool {}, maxOpenConns={}, maxIdleConns={})",
                target, dataSource.getPoolName(), config.getMaxOpenConns(), config.getMaxIdleConns());
        return new Database(dataSource, config.getLogLevel(), target);
    }

    /**
     * Borrows a connection from the pool and checks that it is alive.
     * @throws ConnectionException if the database is closed, unreachable or the connection is invalid
     */
    public void ping() {
        if (closed.get() || dataSource.isClosed()) {
            throw new ConnectionException(ErrorCode.CONNECTION_CLOSED, "ping failed: database " + target + " is closed");
        }
        boolean valid;
        try (Connection connection = dataSource.getConnection()) {
            valid = connection.isValid(PING_TIMEOUT_SECONDS);
        } catch (SQLException | RuntimeException e) {
            throw new ConnectionException("ping failed: " + e.getMessage(), e);
        }
        if (!valid) {
            throw new ConnectionException("ping failed: connection to " + target + " is not valid");
        }
    }

    /**
     * Releases every pooled connection and every session factory built by this database.
     * Calling it again has no effect.
     * @throws ConnectionException if releasing a resource fails; the remaining resources are still released
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            logger.debug("Database {} already closed", target);
            return;
        }

        RuntimeException failure = null;
        synchronized (this) {
            List<SessionFactory> factories = new ArrayList<>(retiredFactories);
            if (sessionFactory != null) {
                factories.add(sessionFactory);
            }
            for (SessionFactory factory : factories) {
                try {
                    factory.close();
                } catch (RuntimeException e) {
                    failure = addFailure(failure, e);
                }
            }
            retiredFactories.clear();
            openSessions.clear();
            sessionFactory = null;
        }
        try {
            dataSource.close();
        } catch (RuntimeException e) {
            failure = addFailure(failure, e);
        }

        if (failure != null) {
            throw new ConnectionException("failed to close database " + target + ": " + failure.getMessage(), failure);
        }
        logger.info("Closed database {}", target);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Creates missing tables and columns for the given entity classes and adds them to the mapping.
     * Existing tables and columns are never dropped, including columns no entity maps.
     * @param models classes annotated with {@link jakarta.persistence.Entity}
     * @throws MigrationException if a class is not an entity or the schema update fails
     */
    public void autoMigrate(Class<?>... models) {
        ensureOpen();
        Set<Class<?>> requested = requireEntities(models);
        if (requested.isEmpty()) {
            return;
        }

        long start = System.nanoTime();
        synchronized (this) {
            ensureOpen();
            Set<Class<?>> union = new LinkedHashSet<>(mappedClasses);
            union.addAll(requested);
            try {
                installMapping(union, true);
            } catch (RuntimeException e) {
                throw new MigrationException("failed to migrate " + names(requested) + ": " + e.getMessage(), e);
            }
        }
        logger.info("Migrated schema for {} in {} ms", names(requested),
                Duration.ofNanos(System.nanoTime() - start).toMillis());
    }

    /**
     * Adds entity classes to the mapping without touching the schema.
     * @param models classes annotated with {@link jakarta.persistence.Entity}
     * @throws MigrationException if a class is not an entity or cannot be mapped
     */
    public void register(Class<?>... models) {
        ensureOpen();
        Set<Class<?>> requested = requireEntities(models);
        if (sessionFactory != null && mappedClasses.containsAll(requested)) {
            return;
        }

        synchronized (this) {
            ensureOpen();
            if (sessionFactory != null && mappedClasses.containsAll(requested)) {
                return;
            }
            Set<Class<?>> union = new LinkedHashSet<>(mappedClasses);
            union.addAll(requested);
            try {
                installMapping(union, false);
            } catch (RuntimeException e) {
                throw new MigrationException("failed to map " + names(requested) + ": " + e.getMessage(), e);
            }
        }
        logger.debug("Registered entity classes {}", names(requested));
    }

    public boolean isMapped(Class<?> entityClass) {
        return mappedClasses.contains(entityClass);
    }

    /**
     * Runs the callback inside one transaction.
     * The transaction commits when the callback returns and rolls back when it throws; the thrown
     * exception reaches the caller unchanged. A failing rollback is attached to it as suppressed.
     * @param callback the work, receiving a scope whose repositories join the transaction
     * @param <R> the result type
     * @return the callback's result
     * @throws QueryException if the commit fails
     * @throws ConnectionException if the database is closed or no connection can be obtained
     */
    public <R> R withTransaction(TransactionCallback<R> callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        SessionFactory factory = acquireFactory();

        try (Session session = openSession(factory)) {
            Transaction transaction = begin(session);
            TransactionScope scope = new TransactionScope(this, session);
            R result;
            try {
                result = callback.doInTransaction(scope);
            } catch (RuntimeException | Error e) {
                scope.finish();
                rollback(transaction, e);
                logger.debug("Transaction rolled back: {}", e.toString());
                throw e;
            }

            scope.finish();
            try {
                transaction.commit();
            } catch (RuntimeException e) {
                rollback(transaction, e);
                throw ExceptionTranslator.translate("commit transaction", e);
            }
            return result;
        } finally {
            releaseFactory(factory);
        }
    }

    /**
     * Creates a repository for the entity class, registering the class if needed.
     * @param entityClass the entity class
     * @param <T> the entity type
     * @return a repository whose operations each run in their own transaction
     */
    public <T> GenericRepository<T> repository(Class<T> entityClass) {
        return new SimpleGenericRepository<>(this, entityClass);
    }

    @Override
    public <R> R execute(SessionWork<R> work) {
        SessionFactory factory = acquireFactory();
        try (Session session = openSession(factory)) {
            Transaction transaction = begin(session);
            try {
                R result = work.apply(session);
                transaction.commit();
                return result;
            } catch (RuntimeException | Error e) {
                rollback(transaction, e);
                throw e;
            }
        } finally {
            releaseFactory(factory);
        }
    }

    @Override
    public void ensureMapped(Class<?> entityClass) {
        if (!MappingBuilder.isEntity(entityClass)) {
            throw new QueryException(ErrorCode.INVALID_OPERATION,
                    entityClass + " is not annotated with @Entity", null);
        }
        if (!isMapped(entityClass)) {
            register(entityClass);
        }
    }

    @Override
    public LogLevel getLogLevel() {
        return logLevel;
    }

    /**
     * @return the underlying pool, for work the repositories do not cover
     */
    public DataSource getDataSource() {
        return dataSource;
    }

    synchronized int retiredFactoryCount() {
        return retiredFactories.size();
    }

    // the returned factory stays open until releaseFactory is called for it
    private synchronized SessionFactory acquireFactory() {
        ensureOpen();
        if (sessionFactory == null) {
            try {
                installMapping(new LinkedHashSet<>(mappedClasses), false);
            } catch (RuntimeException e) {
                throw ExceptionTranslator.translate("build session factory", e);
            }
        }
        openSessions.merge(sessionFactory, 1, Integer::sum);
        return sessionFactory;
    }

    private synchronized void releaseFactory(SessionFactory factory) {
        Integer remaining = openSessions.computeIfPresent(factory, (f, count) -> count > 1 ? count - 1 : null);
        if (remaining == null && retiredFactories.remove(factory)) {
            closeRetired(factory);
        }
    }

    // caller holds the lock
    private void installMapping(Set<Class<?>> entityClasses, boolean migrate) {
        SessionFactory next = mappingBuilder.build(entityClasses, migrate).buildSessionFactory();
        SessionFactory previous = sessionFactory;
        sessionFactory = next;
        mappedClasses = Set.copyOf(entityClasses);
        if (previous == null) {
            return;
        }
        if (openSessions.containsKey(previous)) {
            retiredFactories.add(previous);
        } else {
            closeRetired(previous);
        }
    }

    private void closeRetired(SessionFactory factory) {
        try {
            factory.close();
            logger.debug("Closed replaced session factory of {}", target);
        } catch (RuntimeException e) {
            logger.warn("Failed to close replaced session factory of {}", target, e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new ConnectionException(ErrorCode.CONNECTION_CLOSED, "database " + target + " is closed");
        }
    }

    private static Session openSession(SessionFactory factory) {
        try {
            return factory.openSession();
        } catch (RuntimeException e) {
            throw ExceptionTranslator.translate("open session", e);
        }
    }

    private static Transaction begin(Session session) {
        try {
            return session.beginTransaction();
        } catch (RuntimeException e) {
            throw ExceptionTranslator.translate("begin transaction", e);
        }
    }

    private static void rollback(Transaction transaction, Throwable original) {
        try {
            if (transaction.isActive()) {
                transaction.rollback();
            }
        } catch (RuntimeException e) {
            logger.warn("Rollback failed after {}: {}", original.toString(), e.getMessage());
            original.addSuppressed(e);
        }
    }

    private static Set<Class<?>> requireEntities(Class<?>... models) {
        Set<Class<?>> classes = new LinkedHashSet<>();
        if (models == null) {
            return classes;
        }
        for (Class<?> model : models) {
            if (!MappingBuilder.isEntity(model)) {
                throw new MigrationException(model + " is not annotated with @Entity");
            }
            classes.add(model);
        }
        return classes;
    }

    private static String names(Set<Class<?>> classes) {
        return classes.stream().map(Class::getSimpleName).collect(Collectors.joining(", ", "[", "]"));
    }

    private static RuntimeException addFailure(RuntimeException failure, RuntimeException e) {
        if (failure == null) {
            return e;
        }
        failure.addSuppressed(e);
        return failure;
    }

    @Override
    public String toString() {
        return "Database[" + target + ", mapped=" + names(mappedClasses) + "]";
    }
}
