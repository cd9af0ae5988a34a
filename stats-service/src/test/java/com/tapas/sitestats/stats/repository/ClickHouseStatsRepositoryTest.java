package com.tapas.sitestats.stats.repository;

import com.tapas.sitestats.stats.domain.EventType;
import com.tapas.sitestats.stats.domain.FilterColumn;
import com.tapas.sitestats.stats.domain.FilterValue;
import com.tapas.sitestats.stats.domain.QueryFilters;
import com.tapas.sitestats.stats.dto.WebsiteStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClickHouseStatsRepositoryTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-03-08T00:00:00Z");
    private static final UUID WEBSITE = UUID.fromString("6f1c2b0e-4a5d-4c3b-9f6e-2d7a8b9c0d1e");

    private NamedParameterJdbcTemplate jdbcTemplate;
    private ClickHouseStatsRepository repository;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        jdbcTemplate = mock(NamedParameterJdbcTemplate.class);
        when(jdbcTemplate.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(List.of(new WebsiteStats(10, 4, 5, 2, 300, null)));
        repository = new ClickHouseStatsRepository(jdbcTemplate, new ClickHouseFilterParser(), "analytics");
    }

    @Test
    void noFilters_readsHourlyRollup() {
        var result = repository.getWebsiteStats(WEBSITE, QueryFilters.between(START, END));

        String sql = capturedSql();
        assertThat(sql).contains("from analytics.website_event_stats_hourly \"website_event\"");
        assertThat(sql).contains("sum(views) c");
        assertThat(sql).doesNotContain("from website_event\n");
        assertThat(result).singleElement()
                .satisfies(stats -> assertThat(stats.conversions()).isNull());
    }

    @Test
    void sessionFilterOnly_staysOnHourlyRollup() {
        var filters = QueryFilters.between(START, END)
                .with(FilterColumn.COUNTRY, FilterValue.eq("DE"));

        repository.getWebsiteStats(WEBSITE, filters);

        String sql = capturedSql();
        assertThat(sql).contains("website_event_stats_hourly");
        assertThat(sql).contains("and country = :country");
    }

    @Test
    void eventColumnFilter_readsRawEvents() {
        var filters = QueryFilters.between(START, END)
                .with(FilterColumn.COUNTRY, FilterValue.eq("DE"))
                .with(FilterColumn.URL, FilterValue.parse("c./Docs"));

        repository.getWebsiteStats(WEBSITE, filters);

        var sqlCaptor = ArgumentCaptor.forClass(String.class);
        var paramsCaptor = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate).query(sqlCaptor.capture(), paramsCaptor.capture(), any(RowMapper.class));

        String sql = sqlCaptor.getValue();
        assertThat(sql).doesNotContain("website_event_stats_hourly");
        assertThat(sql).contains("from website_event");
        assertThat(sql).contains("count(*) c");
        assertThat(sql).contains("and lower(url_path) like :url");
        assertThat(paramsCaptor.getValue().getValue("url")).isEqualTo("%/docs%");
    }

    @Test
    void eventTypeIsForcedToPageview() {
        var filters = QueryFilters.between(START, END).withEventType(EventType.CUSTOM_EVENT);

        repository.getWebsiteStats(WEBSITE, filters);

        var paramsCaptor = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate).query(anyString(), paramsCaptor.capture(), any(RowMapper.class));
        var params = paramsCaptor.getValue();
        assertThat(params.getValue("eventType")).isEqualTo(EventType.PAGE_VIEW.value());
        assertThat(params.getValue("websiteId")).isEqualTo(WEBSITE);
    }

    @SuppressWarnings("unchecked")
    private String capturedSql() {
        var sqlCaptor = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).query(sqlCaptor.capture(), any(SqlParameterSource.class), any(RowMapper.class));
        return sqlCaptor.getValue();
    }
}
