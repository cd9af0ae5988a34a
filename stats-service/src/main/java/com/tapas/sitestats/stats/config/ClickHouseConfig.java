package com.tapas.sitestats.stats.config;

import com.clickhouse.jdbc.ClickHouseDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Configuration for the ClickHouse DataSource holding raw events and the
 * hourly rollup.
 */
@Configuration
public class ClickHouseConfig {

    private static final Logger log = LoggerFactory.getLogger(ClickHouseConfig.class);

    @Value("${clickhouse.host:clickhouse}")
    private String host;

    @Value("${clickhouse.port:8123}")
    private int port;

    @Value("${clickhouse.database:analytics}")
    private String database;

    @Value("${clickhouse.socket-timeout:300000}")
    private int socketTimeout;

    @Bean
    public DataSource clickHouseDataSource() throws SQLException {
        String url = String.format("jdbc:clickhouse://%s:%d/%s", host, port, database);
        log.info("Creating ClickHouse DataSource with URL: {}", url);
        Properties properties = new Properties();
        properties.setProperty("socket_timeout", String.valueOf(socketTimeout));
        properties.setProperty("compress", "true");
        return new ClickHouseDataSource(url, properties);
    }

    @Bean
    public NamedParameterJdbcTemplate clickHouseJdbcTemplate() throws SQLException {
        return new NamedParameterJdbcTemplate(clickHouseDataSource());
    }
}
