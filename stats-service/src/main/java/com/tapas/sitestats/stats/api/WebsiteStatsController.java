package com.tapas.sitestats.stats.api;

import com.tapas.sitestats.stats.domain.FilterColumn;
import com.tapas.sitestats.stats.domain.FilterValue;
import com.tapas.sitestats.stats.domain.QueryFilters;
import com.tapas.sitestats.stats.dto.WebsiteStats;
import com.tapas.sitestats.stats.service.WebsiteStatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api")
public class WebsiteStatsController {

    private final WebsiteStatsService service;

    public WebsiteStatsController(WebsiteStatsService service) {
        this.service = service;
    }

    @Operation(
            summary = "Website stats",
            description = "Pageviews, visitors, visits, bounces and total time for a website in [startAt, endAt]. "
                    + "Dimension filters are passed as query parameters named after the filter key, "
                    + "optionally prefixed with an operator (eq, neq, c, dnc), e.g. url=c./blog.",
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Successful response",
                            content = @Content(
                                    mediaType = "application/json",
                                    schema = @Schema(implementation = WebsiteStats.class),
                                    examples = @ExampleObject(
                                            name = "websiteStatsExample",
                                            value = "[{\n  \"pageviews\": 1250,\n  \"visitors\": 410,\n  \"visits\": 530,\n  \"bounces\": 220,\n  \"totaltime\": 48210,\n  \"conversions\": 12\n}]"
                                    )
                            )
                    )
            }
    )
    @GetMapping("/websites/{websiteId}/stats")
    public List<WebsiteStats> websiteStats(
            @Parameter(description = "Website identifier")
            @PathVariable UUID websiteId,
            @Parameter(description = "Range start, epoch milliseconds (inclusive)", example = "1704067200000")
            @RequestParam long startAt,
            @Parameter(description = "Range end, epoch milliseconds (inclusive)", example = "1704153599999")
            @RequestParam long endAt,
            @Parameter(hidden = true)
            @RequestParam Map<String, String> params
    ) {
        var dimensions = new EnumMap<FilterColumn, FilterValue>(FilterColumn.class);
        params.forEach((key, raw) -> FilterColumn.fromKey(key)
                .ifPresent(column -> dimensions.put(column, FilterValue.parse(raw))));

        var filters = new QueryFilters(
                Instant.ofEpochMilli(startAt),
                Instant.ofEpochMilli(endAt),
                null,
                dimensions);

        return service.getWebsiteStats(websiteId, filters);
    }
}
