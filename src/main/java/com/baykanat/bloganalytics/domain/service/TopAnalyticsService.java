package com.baykanat.bloganalytics.domain.service;

import com.baykanat.bloganalytics.config.AppProperties;
import com.baykanat.bloganalytics.domain.model.AnalyticsDimension;
import com.baykanat.bloganalytics.domain.model.TimeRange;
import com.baykanat.bloganalytics.domain.model.TopEntry;
import com.baykanat.bloganalytics.domain.time.RequestDates;
import com.baykanat.bloganalytics.infrastructure.persistence.ViewAnalyticsJdbcRepository;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.FilterFieldRegistry;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.SqlFragment;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/** Blog, country ya da user bazında en çok görüntülenen N değer. */
@Slf4j
@Service
@RequiredArgsConstructor
public class TopAnalyticsService {

    private static final List<AnalyticsDimension> DIMENSIONS =
            List.of(AnalyticsDimension.BLOG, AnalyticsDimension.COUNTRY, AnalyticsDimension.USER);

    private final ViewAnalyticsJdbcRepository viewAnalyticsRepository;
    private final AnalyticsFilters analyticsFilters;
    private final AppProperties appProperties;

    /** Girdiler (dimension, tarih, filtre) storage'a gitmeden doğrulanır. */
    public List<TopEntry> top(String dimension, JsonNode filters, String start, String end, Integer limit) {
        AnalyticsDimension resolved = AnalyticsDimension.fromToken(dimension, DIMENSIONS);
        TimeRange range = RequestDates.range(start, end);
        SqlFragment filter = analyticsFilters.toSql(filters, FilterFieldRegistry.VIEW_EVENTS);
        int effectiveLimit = resolveLimit(limit);

        log.debug("Top {}: range={}, limit={}, filter={}", resolved.getToken(), range, effectiveLimit, filter);
        return viewAnalyticsRepository.findTop(resolved, filter, range, effectiveLimit);
    }

    int resolveLimit(Integer requested) {
        AppProperties.AnalyticsProperties analytics = appProperties.getAnalytics();
        if (requested == null || requested < 1) {
            return analytics.getDefaultTopLimit();
        }
        return Math.min(requested, analytics.getMaxTopLimit());
    }
}
