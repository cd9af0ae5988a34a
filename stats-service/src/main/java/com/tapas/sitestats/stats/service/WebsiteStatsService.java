package com.tapas.sitestats.stats.service;

import com.tapas.sitestats.stats.config.AnalyticsProperties;
import com.tapas.sitestats.stats.domain.Backend;
import com.tapas.sitestats.stats.domain.QueryFilters;
import com.tapas.sitestats.stats.dto.WebsiteStats;
import com.tapas.sitestats.stats.repository.ClickHouseStatsRepository;
import com.tapas.sitestats.stats.repository.RelationalStatsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class WebsiteStatsService {

    private static final Logger log = LoggerFactory.getLogger(WebsiteStatsService.class);

    private final Backend backend;
    private final RelationalStatsRepository relationalRepo;
    private final ClickHouseStatsRepository clickHouseRepo;

    public WebsiteStatsService(
            AnalyticsProperties properties,
            RelationalStatsRepository relationalRepo,
            ClickHouseStatsRepository clickHouseRepo) {
        this.backend = properties.getBackend();
        this.relationalRepo = relationalRepo;
        this.clickHouseRepo = clickHouseRepo;
        log.info("Website stats backend: {}", backend);
    }

    /**
     * Aggregate stats for one website. Always a single row; only the relational
     * backend fills in conversions. Errors from the backend propagate unchanged.
     */
    public List<WebsiteStats> getWebsiteStats(UUID websiteId, QueryFilters filters) {
        log.debug("Website stats for {} on {}", websiteId, backend);
        return switch (backend) {
            case RELATIONAL -> relationalRepo.getWebsiteStats(websiteId, filters);
            case COLUMNAR -> clickHouseRepo.getWebsiteStats(websiteId, filters);
        };
    }
}
