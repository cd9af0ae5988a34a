package com.tapas.sitestats.stats.config;

import com.tapas.sitestats.stats.domain.Backend;
import com.tapas.sitestats.stats.domain.RelationalDatabase;
import com.tapas.sitestats.stats.repository.MySqlDialect;
import com.tapas.sitestats.stats.repository.PostgresDialect;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RelationalDataSourceConfigTest {

    @Test
    void bindsLowercaseSettingsToEnums() {
        var source = new MapConfigurationPropertySource(Map.of(
                "analytics.backend", "columnar",
                "analytics.relational-dialect", "mysql"));

        var properties = new Binder(source).bind("analytics", AnalyticsProperties.class).get();

        assertThat(properties.getBackend()).isEqualTo(Backend.COLUMNAR);
        assertThat(properties.getRelationalDialect()).isEqualTo(RelationalDatabase.MYSQL);
    }

    @Test
    void defaultsToPostgres() {
        var dialect = new RelationalDataSourceConfig().relationalDialect(new AnalyticsProperties());

        assertThat(dialect).isInstanceOf(PostgresDialect.class);
    }

    @Test
    void selectsMySqlDialect() {
        var properties = new AnalyticsProperties();
        properties.setRelationalDialect(RelationalDatabase.MYSQL);

        assertThat(new RelationalDataSourceConfig().relationalDialect(properties))
                .isInstanceOf(MySqlDialect.class);
    }
}
