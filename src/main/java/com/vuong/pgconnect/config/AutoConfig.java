package com.vuong.pgconnect.config;

import com.vuong.pgconnect.core.connection.Database;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for pg-connect.
 * Binds {@link DatabaseConfig} from the {@code pgconnect} prefix and exposes a {@link Database}
 * that is closed together with the application context.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties
public class AutoConfig {

    /**
     * Creates the configuration bean, starting from the defaults and overridden by {@code pgconnect.*} properties.
     * @return the bound configuration
     */
    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "pgconnect")
    public DatabaseConfig databaseConfig() {
        return DatabaseConfig.defaultConfig();
    }

    /**
     * Opens the shared database handle.
     * @param databaseConfig the bound configuration
     * @return the database
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Database database(DatabaseConfig databaseConfig) {
        return Database.open(databaseConfig);
    }
}
