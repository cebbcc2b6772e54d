package com.vuong.pgconnect.core.domain.repository;

import com.vuong.pgconnect.core.connection.SessionHandle;
import com.vuong.pgconnect.core.connection.SessionWork;
import com.vuong.pgconnect.core.domain.specification.WhereClause;
import com.vuong.pgconnect.exception.DatabaseException;
import com.vuong.pgconnect.exception.ErrorCode;
import com.vuong.pgconnect.exception.ExceptionTranslator;
import com.vuong.pgconnect.exception.NotFoundException;
import com.vuong.pgconnect.exception.QueryException;
import com.vuong.pgconnect.util.IdConverter;
import com.vuong.pgconnect.util.OperationLogger;
import com.vuong.pgconnect.util.PaginationValidator;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.metamodel.Attribute.PersistentAttributeType;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.SingularAttribute;
import org.hibernate.Session;
import org.hibernate.engine.spi.SessionFactoryImplementor;
import org.hibernate.engine.spi.SharedSessionContractImplementor;
import org.hibernate.persister.entity.EntityPersister;
import org.hibernate.query.MutationQuery;
import org.hibernate.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Default {@link GenericRepository} running each operation as one Hibernate call on a {@link SessionHandle}.
 * The repository keeps no state besides the handle and the entity class and can be created and dropped freely.
 * @param <T> the entity type
 */
public class SimpleGenericRepository<T> implements GenericRepository<T> {

    private static final Logger logger = LoggerFactory.getLogger(SimpleGenericRepository.class);

    private final SessionHandle handle;
    private final Class<T> entityClass;
    private final OperationLogger operationLogger;

    /**
     * Constructs a repository for the entity class, mapping the class on the handle if needed.
     * @param handle the database or transaction the operations run against
     * @param entityClass the entity class
     */
    public SimpleGenericRepository(SessionHandle handle, Class<T> entityClass) {
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
        this.entityClass = Objects.requireNonNull(entityClass, "entityClass must not be null");
        this.operationLogger = new OperationLogger(handle.getLogLevel());
        handle.ensureMapped(entityClass);
    }

    @Override
    public Class<T> getEntityClass() {
        return entityClass;
    }

    @Override
    public void create(T entity) {
        requireEntity(entity);
        run("create", session -> {
            session.persist(entity);
            return null;
        });
    }

    @Override
    public T findById(Object id) {
        return run("findById", session -> {
            Object key = IdConverter.convert(id, idType(session));
            T found = session.find(entityClass, key);
            if (found == null) {
                throw new NotFoundException(entityName(session) + " not found with id: " + id);
            }
            return found;
        });
    }

    @Override
    public List<T> findAll() {
        return run("findAll", session -> session.createQuery("from " + entityName(session), entityClass)
                .getResultList());
    }

    @Override
    public List<T> findWhere(String filter, Object... args) {
        return run("findWhere", session -> {
            WhereClause where = WhereClause.of(filter, args);
            return where.bind(session.createQuery(where.appendTo("from " + entityName(session)), entityClass))
                    .getResultList();
        });
    }

    @Override
    public T findOne(String filter, Object... args) {
        return run("findOne", session -> {
            WhereClause where = WhereClause.of(filter, args);
            String hql = where.appendTo("from " + entityName(session)) + orderByPrimaryKey(session);
            List<T> found = where.bind(session.createQuery(hql, entityClass))
                    .setMaxResults(1)
                    .getResultList();
            if (found.isEmpty()) {
                throw new NotFoundException("No " + entityName(session) + " found matching: " + where);
            }
            return found.get(0);
        });
    }

    @Override
    public T update(T entity) {
        requireEntity(entity);
        return run("update", session -> {
            EntityPersister persister = persister(session);
            SharedSessionContractImplementor implementor = session.unwrap(SharedSessionContractImplementor.class);
            Object id = persister.getIdentifier(entity, implementor);
            // merge would generate a fresh key and drop the given one
            if (id != null && hasGeneratedId(session) && session.find(entityClass, id) == null) {
                insertWithKey(session, persister, entity, id);
                return session.find(entityClass, id);
            }
            T saved = session.merge(entity);
            if (id == null) {
                persister.setIdentifier(entity, persister.getIdentifier(saved, implementor), implementor);
            }
            return saved;
        });
    }

    @Override
    public void delete(T entity) {
        requireEntity(entity);
        run("delete", session -> {
            Object id = session.getEntityManagerFactory().getPersistenceUnitUtil().getIdentifier(entity);
            if (id == null) {
                throw new QueryException(ErrorCode.INVALID_OPERATION,
                        "Cannot delete " + entityName(session) + " without a primary key", null);
            }
            T managed = session.find(entityClass, id);
            if (managed != null) {
                session.remove(managed);
            }
            return null;
        });
    }

    @Override
    public int deleteWhere(String filter, Object... args) {
        if (!StringUtils.hasText(filter)) {
            throw new QueryException(ErrorCode.INVALID_OPERATION,
                    "Refusing to delete every " + entityClass.getSimpleName() + " without a filter", null);
        }
        return run("deleteWhere", session -> {
            WhereClause where = WhereClause.of(filter, args);
            return where.bind(session.createMutationQuery(where.appendTo("delete from " + entityName(session))))
                    .executeUpdate();
        });
    }

    @Override
    public long count() {
        return count(null);
    }

    @Override
    public long count(String filter, Object... args) {
        return run("count", session -> {
            WhereClause where = WhereClause.of(filter, args);
            Long total = where.bind(session.createQuery(
                            where.appendTo("select count(*) from " + entityName(session)), Long.class))
                    .getSingleResult();
            return total != null ? total : 0L;
        });
    }

    @Override
    public List<T> paginate(int page, int pageSize) {
        return paginateWhere(page, pageSize, null);
    }

    @Override
    public List<T> paginateWhere(int page, int pageSize, String filter, Object... args) {
        List<String> problems = PaginationValidator.validate(page, pageSize);
        if (!problems.isEmpty()) {
            logger.warn("Invalid pagination for {}: {}", entityClass.getSimpleName(), String.join(", ", problems));
        }
        return run("paginate", session -> {
            int firstResult = PaginationValidator.firstResult(page, pageSize);
            WhereClause where = WhereClause.of(filter, args);
            Query<T> query = where.bind(session.createQuery(where.appendTo("from " + entityName(session)), entityClass));
            query.setFirstResult(firstResult);
            if (pageSize >= 0) {
                query.setMaxResults(pageSize);
            }
            return query.getResultList();
        });
    }

    private <R> R run(String operation, SessionWork<R> work) {
        String description = operation + " " + entityClass.getSimpleName();
        long start = System.nanoTime();
        try {
            R result = handle.execute(work);
            operationLogger.record(description, start, null);
            return result;
        } catch (RuntimeException e) {
            DatabaseException translated = ExceptionTranslator.translate(description, e);
            operationLogger.record(description, start, translated);
            throw translated;
        }
    }

    private void requireEntity(T entity) {
        if (entity == null) {
            throw new QueryException(ErrorCode.INVALID_OPERATION,
                    entityClass.getSimpleName() + " entity must not be null", null);
        }
    }

    private EntityType<T> entityType(Session session) {
        return session.getMetamodel().entity(entityClass);
    }

    private String entityName(Session session) {
        return entityType(session).getName();
    }

    private Class<?> idType(Session session) {
        EntityType<T> type = entityType(session);
        return type.getIdType() != null ? type.getIdType().getJavaType() : null;
    }

    private String orderByPrimaryKey(Session session) {
        SingularAttribute<? super T, ?> id = idAttribute(session);
        return id != null ? " order by " + id.getName() : "";
    }

    private SingularAttribute<? super T, ?> idAttribute(Session session) {
        EntityType<T> type = entityType(session);
        if (!type.hasSingleIdAttribute()) {
            return null;
        }
        for (SingularAttribute<? super T, ?> attribute : type.getSingularAttributes()) {
            if (attribute.isId()) {
                return attribute;
            }
        }
        return null;
    }

    private boolean hasGeneratedId(Session session) {
        SingularAttribute<? super T, ?> id = idAttribute(session);
        return id != null && id.getJavaMember() instanceof AnnotatedElement member
                && member.isAnnotationPresent(GeneratedValue.class);
    }

    private EntityPersister persister(Session session) {
        return session.getSessionFactory().unwrap(SessionFactoryImplementor.class)
                .getMappingMetamodel()
                .getEntityDescriptor(entityClass);
    }

    // insert ... values with an explicit key, bypassing the id generator
    private void insertWithKey(Session session, EntityPersister persister, T entity, Object id) {
        List<String> names = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        names.add(idAttribute(session).getName());
        values.add(id);
        for (SingularAttribute<? super T, ?> attribute : entityType(session).getSingularAttributes()) {
            if (attribute.isId()) {
                continue;
            }
            PersistentAttributeType type = attribute.getPersistentAttributeType();
            if (type != PersistentAttributeType.BASIC && type != PersistentAttributeType.MANY_TO_ONE) {
                throw new QueryException(ErrorCode.INVALID_OPERATION, "Cannot insert " + entityName(session)
                        + " with id " + id + ": attribute '" + attribute.getName() + "' is " + type, null);
            }
            names.add(attribute.getName());
            values.add(persister.getPropertyValue(entity, attribute.getName()));
        }

        String placeholders = IntStream.rangeClosed(1, values.size())
                .mapToObj(i -> "?" + i)
                .collect(Collectors.joining(", "));
        MutationQuery insert = session.createMutationQuery("insert into " + entityName(session)
                + " (" + String.join(", ", names) + ") values (" + placeholders + ")");
        for (int i = 0; i < values.size(); i++) {
            insert.setParameter(i + 1, values.get(i));
        }
        insert.executeUpdate();
    }
}
