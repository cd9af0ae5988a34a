package com.tapas.sitestats.stats.config;

import com.tapas.sitestats.stats.domain.RelationalDatabase;
import com.tapas.sitestats.stats.repository.MySqlDialect;
import com.tapas.sitestats.stats.repository.PostgresDialect;
import com.tapas.sitestats.stats.repository.RelationalDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;

/**
 * Configuration for the relational (primary) DataSource holding
 * {@code website_event} and {@code session}.
 */
@Configuration
public class RelationalDataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(RelationalDataSourceConfig.class);

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource")
    public DataSourceProperties primaryDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @Primary
    public DataSource primaryDataSource() {
        return primaryDataSourceProperties()
                .initializeDataSourceBuilder()
                .build();
    }

    @Bean
    public NamedParameterJdbcTemplate relationalJdbcTemplate() {
        return new NamedParameterJdbcTemplate(primaryDataSource());
    }

    @Bean
    public RelationalDialect relationalDialect(AnalyticsProperties properties) {
        RelationalDatabase database = properties.getRelationalDialect();
        log.info("Using relational dialect: {}", database);
        return switch (database) {
            case POSTGRESQL -> new PostgresDialect();
            case MYSQL -> new MySqlDialect();
        };
    }
}
