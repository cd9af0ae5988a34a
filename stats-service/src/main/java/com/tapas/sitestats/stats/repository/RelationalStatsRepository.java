package com.tapas.sitestats.stats.repository;

import com.tapas.sitestats.stats.domain.EventType;
import com.tapas.sitestats.stats.domain.QueryFilters;
import com.tapas.sitestats.stats.dto.WebsiteStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Website stats computed on the relational store (PostgreSQL or MySQL).
 * <p>
 * Pageview metrics are grouped per visit. Conversions are a single scalar
 * counted over every filtered event named {@code alert_submit}, whatever its
 * event type, and attached to the aggregate row as-is.
 */
@Repository
public class RelationalStatsRepository {

    private static final Logger logger = LoggerFactory.getLogger(RelationalStatsRepository.class);

    static final String CONVERSION_EVENT = "alert_submit";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final RelationalFilterParser filterParser;
    private final RelationalDialect dialect;

    public RelationalStatsRepository(
            @Qualifier("relationalJdbcTemplate") NamedParameterJdbcTemplate jdbcTemplate,
            RelationalFilterParser filterParser,
            RelationalDialect dialect) {
        this.jdbcTemplate = jdbcTemplate;
        this.filterParser = filterParser;
        this.dialect = dialect;
    }

    public List<WebsiteStats> getWebsiteStats(UUID websiteId, QueryFilters filters) {
        var parsed = filterParser.parseFilters(websiteId, filters.withEventType(EventType.PAGE_VIEW));

        String sql = String.format("""
                WITH filtered_events AS (
                    SELECT website_event.* FROM website_event
                    %s
                    WHERE website_event.website_id = :websiteId
                      AND website_event.created_at BETWEEN :startDate AND :endDate
                      %s
                ),
                metrics AS (
                    SELECT
                        filtered_events.session_id AS session_id,
                        filtered_events.visit_id AS visit_id,
                        COUNT(*) AS c,
                        MIN(filtered_events.created_at) AS min_time,
                        MAX(filtered_events.created_at) AS max_time
                    FROM filtered_events
                    WHERE filtered_events.event_type = :eventType
                    GROUP BY filtered_events.session_id, filtered_events.visit_id
                ),
                conversions AS (
                    SELECT COUNT(DISTINCT filtered_events.event_id) AS conversions
                    FROM filtered_events
                    WHERE filtered_events.event_name = '%s'
                )
                SELECT
                    SUM(metrics.c) AS pageviews,
                    COUNT(DISTINCT metrics.session_id) AS visitors,
                    COUNT(DISTINCT metrics.visit_id) AS visits,
                    SUM(CASE WHEN metrics.c = 1 THEN 1 ELSE 0 END) AS bounces,
                    SUM(%s) AS totaltime,
                    (SELECT conversions.conversions FROM conversions) AS conversions
                FROM metrics
                """,
                parsed.joinSession(),
                parsed.filterQuery(),
                CONVERSION_EVENT,
                dialect.timestampDiff("metrics.min_time", "metrics.max_time"));

        logger.debug("Querying relational stats for website {}", websiteId);

        // SUM over zero groups is NULL; getLong maps it to 0
        return jdbcTemplate.query(sql, new MapSqlParameterSource(parsed.params()),
                (rs, rowNum) -> new WebsiteStats(
                        rs.getLong("pageviews"),
                        rs.getLong("visitors"),
                        rs.getLong("visits"),
                        rs.getLong("bounces"),
                        rs.getLong("totaltime"),
                        rs.getLong("conversions")));
    }
}
