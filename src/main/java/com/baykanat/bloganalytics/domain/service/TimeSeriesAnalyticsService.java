package com.baykanat.bloganalytics.domain.service;

import com.baykanat.bloganalytics.domain.model.Granularity;
import com.baykanat.bloganalytics.domain.model.TimeRange;
import com.baykanat.bloganalytics.domain.model.TimeSeriesPoint;
import com.baykanat.bloganalytics.domain.time.RequestDates;
import com.baykanat.bloganalytics.infrastructure.persistence.ViewAnalyticsJdbcRepository;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.FilterFieldRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/** Ham view'lardan periyot başına view ve farklı blog sayısı. */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimeSeriesAnalyticsService {

    private final ViewAnalyticsJdbcRepository viewAnalyticsRepository;
    private final AnalyticsFilters analyticsFilters;

    public List<TimeSeriesPoint> timeSeries(String granularity, JsonNode filters, String start, String end) {
        Granularity resolved = granularity == null || granularity.isBlank()
                ? Granularity.DAY
                : Granularity.aggregatable(granularity);
        TimeRange range = RequestDates.range(start, end);

        log.debug("Time series: granularity={}, range={}", resolved.getToken(), range);
        return viewAnalyticsRepository.findTimeSeries(resolved,
                analyticsFilters.toSql(filters, FilterFieldRegistry.VIEW_EVENTS), range);
    }
}
