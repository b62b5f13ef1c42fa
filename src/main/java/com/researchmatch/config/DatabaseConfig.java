package com.researchmatch.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

/**
 * Database configuration for the R2DBC PostgreSQL embedding store.
 */
@Configuration
@ConditionalOnProperty(name = "researchmatch.store.type", havingValue = "r2dbc", matchIfMissing = true)
public class DatabaseConfig {

    @Value("${researchmatch.store.initialize-schema:false}")
    private boolean initializeSchema;

    /**
     * Initialize database schema on startup.
     * Executes schema.sql when researchmatch.store.initialize-schema is set.
     */
    @Bean
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        if (initializeSchema) {
            populator.addScript(new ClassPathResource("schema.sql"));
        }
        initializer.setDatabasePopulator(populator);
        initializer.setEnabled(initializeSchema);

        return initializer;
    }
}
