package com.vuong.pgconnect.core.domain.repository;

import java.util.List;

/**
 * Uniform data access operations for one entity type.
 * <p>
 * Every operation is a single call into the mapper. Filter expressions are conditions over the
 * entity's attribute names with positional {@code ?} placeholders, e.g. {@code "status = ?"}.
 * Failures are reported as {@link com.vuong.pgconnect.exception.DatabaseException} subclasses.
 * @param <T> the entity type
 */
public interface GenericRepository<T> {

    /**
     * Returns the entity class managed by this repository.
     * @return the entity class
     */
    Class<T> getEntityClass();

    /**
     * Inserts one record. Generated values such as the primary key are set on the given instance.
     * @param entity the entity to insert
     */
    void create(T entity);

    /**
     * Loads the record with the given primary key.
     * @param id the primary key; numbers and strings are converted to the id type of the entity
     * @return the entity
     * @throws com.vuong.pgconnect.exception.NotFoundException if no record has that key
     */
    T findById(Object id);

    /**
     * Loads every record, unfiltered and in no particular order.
     * @return all entities
     */
    List<T> findAll();

    /**
     * Loads every record matching the filter, in no particular order.
     * @param filter the filter expression
     * @param args the positional arguments
     * @return the matching entities
     */
    List<T> findWhere(String filter, Object... args);

    /**
     * Loads the first record matching the filter, ordered by primary key.
     * @param filter the filter expression
     * @param args the positional arguments
     * @return the first matching entity
     * @throws com.vuong.pgconnect.exception.NotFoundException if nothing matches
     */
    T findOne(String filter, Object... args);

    /**
     * Saves all fields of the record by primary key: inserts when the key does not exist yet,
     * otherwise updates the existing row. A key set by the caller is kept even when the entity's key
     * is generated; without a key a new one is generated and set on the given instance.
     * @param entity the entity to save
     * @return the saved state, including generated values
     */
    T update(T entity);

    /**
     * Deletes the record with the primary key of the given entity. Deleting a missing record is not an error.
     * @param entity the entity to delete; its primary key must be set
     * @throws com.vuong.pgconnect.exception.QueryException if the entity has no primary key
     */
    void delete(T entity);

    /**
     * Deletes every record matching the filter in a single statement.
     * @param filter the filter expression, must not be blank
     * @param args the positional arguments
     * @return the number of deleted records
     */
    int deleteWhere(String filter, Object... args);

    /**
     * Counts every record.
     * @return the number of records
     */
    long count();

    /**
     * Counts the records matching the filter; a null or blank filter counts every record.
     * @param filter the filter expression
     * @param args the positional arguments
     * @return the number of matching records
     */
    long count(String filter, Object... args);

    /**
     * Loads one page of records. The offset is {@code (page - 1) * pageSize}.
     * Invalid values are logged but not corrected: a negative offset reads from the first row and a
     * negative page size reads without a limit.
     * @param page the 1-based page number
     * @param pageSize the maximum number of records
     * @return the records of the page
     * @throws com.vuong.pgconnect.exception.QueryException if the offset exceeds {@link Integer#MAX_VALUE}
     */
    List<T> paginate(int page, int pageSize);

    /**
     * Loads one page of the records matching the filter, with the same offset rule as {@link #paginate(int, int)}.
     * @param page the 1-based page number
     * @param pageSize the maximum number of records
     * @param filter the filter expression
     * @param args the positional arguments
     * @return the records of the page
     */
    List<T> paginateWhere(int page, int pageSize, String filter, Object... args);
}
