package com.baykanat.bloganalytics.domain.service;

import com.baykanat.bloganalytics.domain.model.AnalyticsDimension;
import com.baykanat.bloganalytics.domain.model.BreakdownEntry;
import com.baykanat.bloganalytics.domain.model.Granularity;
import com.baykanat.bloganalytics.domain.model.TimeRange;
import com.baykanat.bloganalytics.domain.time.GranularityAdvisor;
import com.baykanat.bloganalytics.domain.time.RequestDates;
import com.baykanat.bloganalytics.infrastructure.persistence.ViewAnalyticsJdbcRepository;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.FilterFieldRegistry;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.SqlFragment;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/** Country ya da user × periyot kırılımı; granularity verilmezse tarih aralığından seçilir. */
@Slf4j
@Service
@RequiredArgsConstructor
public class BreakdownAnalyticsService {

    private static final List<AnalyticsDimension> DIMENSIONS =
            List.of(AnalyticsDimension.COUNTRY, AnalyticsDimension.USER);

    private final ViewAnalyticsJdbcRepository viewAnalyticsRepository;
    private final AnalyticsFilters analyticsFilters;

    public List<BreakdownEntry> breakdown(String dimension, JsonNode filters, String start, String end,
                                          String granularity) {
        AnalyticsDimension resolved = AnalyticsDimension.fromToken(dimension, DIMENSIONS);
        TimeRange range = RequestDates.range(start, end);
        Granularity period = granularity == null || granularity.isBlank()
                ? GranularityAdvisor.select(range.getStart(), range.getEnd())
                : Granularity.aggregatable(granularity);
        SqlFragment filter = analyticsFilters.toSql(filters, FilterFieldRegistry.VIEW_EVENTS);

        log.debug("Breakdown {}: range={}, granularity={}", resolved.getToken(), range, period.getToken());
        return viewAnalyticsRepository.findBreakdown(resolved, period, filter, range);
    }
}
