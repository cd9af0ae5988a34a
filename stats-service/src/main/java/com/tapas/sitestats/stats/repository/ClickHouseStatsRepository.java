package com.tapas.sitestats.stats.repository;

import com.tapas.sitestats.stats.domain.EventType;
import com.tapas.sitestats.stats.domain.QueryFilters;
import com.tapas.sitestats.stats.dto.WebsiteStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Website stats computed on ClickHouse.
 * <p>
 * Reads the hourly rollup unless a filter targets a column that only raw
 * {@code website_event} rows carry. Distinct visitors and visits are
 * approximate ({@code uniq}). No conversions are computed here.
 */
@Repository
public class ClickHouseStatsRepository {

    private static final Logger logger = LoggerFactory.getLogger(ClickHouseStatsRepository.class);

    static final String HOURLY_TABLE = "website_event_stats_hourly";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ClickHouseFilterParser filterParser;
    private final String database;

    public ClickHouseStatsRepository(
            @Qualifier("clickHouseJdbcTemplate") NamedParameterJdbcTemplate jdbcTemplate,
            ClickHouseFilterParser filterParser,
            @Value("${clickhouse.database:analytics}") String database) {
        this.jdbcTemplate = jdbcTemplate;
        this.filterParser = filterParser;
        this.database = database;
    }

    public List<WebsiteStats> getWebsiteStats(UUID websiteId, QueryFilters filters) {
        var parsed = filterParser.parseFilters(websiteId, filters.withEventType(EventType.PAGE_VIEW));

        String sql;
        if (filters.hasEventColumn()) {
            sql = String.format("""
                    select
                        sum(t.c) as "pageviews",
                        uniq(t.session_id) as "visitors",
                        uniq(t.visit_id) as "visits",
                        sum(if(t.c = 1, 1, 0)) as "bounces",
                        sum(max_time - min_time) as "totaltime"
                    from (
                        select
                            session_id,
                            visit_id,
                            count(*) c,
                            min(created_at) min_time,
                            max(created_at) max_time
                        from website_event
                        where website_id = :websiteId
                          and created_at between :startDate and :endDate
                          and event_type = :eventType
                          %s
                        group by session_id, visit_id
                    ) as t
                    """, parsed.filterQuery());
        } else {
            sql = String.format("""
                    select
                        sum(t.c) as "pageviews",
                        uniq(t.session_id) as "visitors",
                        uniq(t.visit_id) as "visits",
                        sumIf(1, t.c = 1) as "bounces",
                        sum(max_time - min_time) as "totaltime"
                    from (
                        select
                            session_id,
                            visit_id,
                            sum(views) c,
                            min(min_time) min_time,
                            max(max_time) max_time
                        from %s.%s "website_event"
                        where website_id = :websiteId
                          and created_at between :startDate and :endDate
                          and event_type = :eventType
                          %s
                        group by session_id, visit_id
                    ) as t
                    """, database, HOURLY_TABLE, parsed.filterQuery());
        }

        logger.debug("Querying ClickHouse stats for website {} from {}", websiteId,
                filters.hasEventColumn() ? "raw events" : "hourly rollup");

        return jdbcTemplate.query(sql, new MapSqlParameterSource(parsed.params()),
                (rs, rowNum) -> new WebsiteStats(
                        rs.getLong("pageviews"),
                        rs.getLong("visitors"),
                        rs.getLong("visits"),
                        rs.getLong("bounces"),
                        rs.getLong("totaltime"),
                        null));
    }
}
