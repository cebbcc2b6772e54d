package com.vuong.pgconnect.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.util.StringUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Connection parameters and pool limits for a {@link com.vuong.pgconnect.core.connection.Database}.
 * Every field has a default usable without customization. Values are not validated here;
 * the pool and the driver decide what they accept.
 * Treat an instance as read-only once it has been handed to {@code Database.open}.
 */
@Getter
@Setter
public class DatabaseConfig {

    private String host = "localhost";

    private String port = "5432";

    private String user = "postgres";

    private String password = "postgres";

    private String databaseName = "postgres";

    private String sslMode = "disable";

    private String timeZone = "UTC";

    /**
     * Connections the pool keeps open while idle.
     */
    private int maxIdleConns = 10;

    /**
     * Upper bound on connections held by the pool.
     */
    private int maxOpenConns = 100;

    private LogLevel logLevel = LogLevel.SILENT;

    /**
     * Explicit JDBC URL. When set it replaces the PostgreSQL URL derived from
     * host, port, database name, SSL mode and time zone.
     */
    private String url;

    /**
     * Returns a configuration holding the documented defaults.
     * @return a new configuration
     */
    public static DatabaseConfig defaultConfig() {
        return new DatabaseConfig();
    }

    /**
     * Builds the key/value connection string understood by libpq based tooling.
     * @return the connection string, password included
     */
    public String toConnectionString() {
        return String.format("host=%s port=%s user=%s password=%s dbname=%s sslmode=%s TimeZone=%s",
                host, port, user, password, databaseName, sslMode, timeZone);
    }

    /**
     * Returns the JDBC URL the pool connects with.
     * @return {@link #getUrl()} if set, otherwise a PostgreSQL URL built from the individual fields
     */
    public String toJdbcUrl() {
        if (StringUtils.hasText(url)) {
            return url;
        }
        String options = URLEncoder.encode("-c TimeZone=" + timeZone, StandardCharsets.UTF_8);
        return "jdbc:postgresql://" + host + ":" + port + "/" + databaseName
                + "?sslmode=" + sslMode
                + "&options=" + options;
    }
}
