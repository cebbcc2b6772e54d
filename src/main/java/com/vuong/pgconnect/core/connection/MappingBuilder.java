package com.vuong.pgconnect.core.connection;

import jakarta.persistence.Entity;
import org.hibernate.SessionFactory;
import org.hibernate.boot.Metadata;
import org.hibernate.boot.MetadataSources;
import org.hibernate.boot.registry.StandardServiceRegistry;
import org.hibernate.boot.registry.StandardServiceRegistryBuilder;
import org.hibernate.cfg.AvailableSettings;
import org.hibernate.resource.jdbc.spi.StatementInspector;

import javax.sql.DataSource;
import java.util.Collection;

/**
 * Builds Hibernate mapping metadata for a set of entity classes on top of an externally owned pool.
 * Every build gets its own service registry, released together with the session factory built from it;
 * the pool itself is never closed by Hibernate.
 * <p>
 * A migrating build runs Hibernate's schema update while the session factory is created. The update
 * only creates tables and adds columns, and any DDL error aborts the build.
 */
class MappingBuilder {

    private final DataSource dataSource;
    private final StatementInspector statementInspector;

    MappingBuilder(DataSource dataSource, StatementInspector statementInspector) {
        this.dataSource = dataSource;
        this.statementInspector = statementInspector;
    }

    static boolean isEntity(Class<?> type) {
        return type != null && type.isAnnotationPresent(Entity.class);
    }

    Mapping build(Collection<Class<?>> entityClasses, boolean migrate) {
        StandardServiceRegistryBuilder registryBuilder = new StandardServiceRegistryBuilder()
                .applySetting(AvailableSettings.DATASOURCE, dataSource)
                .applySetting(AvailableSettings.STATEMENT_INSPECTOR, statementInspector)
                .applySetting(AvailableSettings.SHOW_SQL, false);
        if (migrate) {
            registryBuilder.applySetting(AvailableSettings.HBM2DDL_AUTO, "update")
                    .applySetting(AvailableSettings.HBM2DDL_HALT_ON_ERROR, true);
        }
        StandardServiceRegistry registry = registryBuilder.build();
        try {
            MetadataSources sources = new MetadataSources(registry);
            entityClasses.forEach(sources::addAnnotatedClass);
            return new Mapping(registry, sources.buildMetadata());
        } catch (RuntimeException e) {
            StandardServiceRegistryBuilder.destroy(registry);
            throw e;
        }
    }

    /**
     * Mapping metadata together with the registry it was built with.
     */
    static final class Mapping {

        private final StandardServiceRegistry registry;
        private final Metadata metadata;

        private Mapping(StandardServiceRegistry registry, Metadata metadata) {
            this.registry = registry;
            this.metadata = metadata;
        }

        SessionFactory buildSessionFactory() {
            try {
                return metadata.buildSessionFactory();
            } catch (RuntimeException e) {
                release();
                throw e;
            }
        }

        void release() {
            StandardServiceRegistryBuilder.destroy(registry);
        }
    }
}
