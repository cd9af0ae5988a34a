package com.tapas.sitestats.stats.config;

import com.tapas.sitestats.stats.domain.Backend;
import com.tapas.sitestats.stats.domain.RelationalDatabase;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties("analytics")
public class AnalyticsProperties {

    private Backend backend = Backend.RELATIONAL;

    private RelationalDatabase relationalDialect = RelationalDatabase.POSTGRESQL;
}
