package com.vuong.pgconnect.util;

import com.vuong.pgconnect.config.LogLevel;
import org.hibernate.resource.jdbc.spi.StatementInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hibernate statement hook that logs each SQL statement at INFO when the level is {@link LogLevel#INFO}.
 * The statement itself is never altered.
 */
public class SqlStatementLogger implements StatementInspector {

    private static final Logger logger = LoggerFactory.getLogger(SqlStatementLogger.class);

    private final boolean enabled;

    public SqlStatementLogger(LogLevel level) {
        this.enabled = level != null && level.isEnabled(LogLevel.INFO);
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public String inspect(String sql) {
        if (enabled) {
            logger.info("SQL: {}", sql);
        }
        return sql;
    }
}
