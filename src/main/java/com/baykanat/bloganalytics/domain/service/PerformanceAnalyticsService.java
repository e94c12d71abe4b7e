package com.baykanat.bloganalytics.domain.service;

import com.baykanat.bloganalytics.domain.filter.FieldPath;
import com.baykanat.bloganalytics.domain.filter.FilterOperator;
import com.baykanat.bloganalytics.domain.filter.FilterPredicate;
import com.baykanat.bloganalytics.domain.model.BucketTotal;
import com.baykanat.bloganalytics.domain.model.Granularity;
import com.baykanat.bloganalytics.domain.model.PerformancePoint;
import com.baykanat.bloganalytics.domain.model.TimeRange;
import com.baykanat.bloganalytics.domain.time.GrowthCalculator;
import com.baykanat.bloganalytics.domain.time.RequestDates;
import com.baykanat.bloganalytics.domain.time.TimeBuckets;
import com.baykanat.bloganalytics.infrastructure.persistence.CreationRollupJdbcRepository;
import com.baykanat.bloganalytics.infrastructure.persistence.EventSourceJdbcRepository;
import com.baykanat.bloganalytics.infrastructure.persistence.ViewRollupJdbcRepository;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.FilterFieldRegistry;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.SqlFragment;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Rollup tablolarından periyot başına view ve blog oluşturma serisi, önceki periyoda göre büyüme yüzdesiyle.
 * Filtre yoksa toplam satırları, varsa filtreye uyan dimension satırları okunur. Creation rollup'larında
 * blog dimension'ı olmadığından blog alanı içeren filtrelerde creation serisi ham blogs tablosundan sayılır.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceAnalyticsService {

    private static final String DEFAULT_PERIOD = "month";

    private final ViewRollupJdbcRepository viewRollupRepository;
    private final CreationRollupJdbcRepository creationRollupRepository;
    private final EventSourceJdbcRepository eventSourceRepository;
    private final AnalyticsFilters analyticsFilters;

    /**
     * @param periodSize day, week, month veya year; null ise month
     * @param authorId   verilirse author.id eşitliği filtreye AND ile eklenir
     */
    public List<PerformancePoint> performance(String periodSize, JsonNode filters, Long authorId,
                                              String start, String end) {
        Granularity granularity = Granularity.comparePeriod(
                periodSize == null || periodSize.isBlank() ? DEFAULT_PERIOD : periodSize);
        TimeRange range = RequestDates.range(start, end);

        Optional<FilterPredicate> predicate = withAuthor(analyticsFilters.compile(filters), authorId);
        SqlFragment viewFilter = analyticsFilters.toSql(predicate, FilterFieldRegistry.VIEW_ROLLUPS);
        boolean creationsFromRollups = predicate.map(FilterFieldRegistry.CREATION_ROLLUPS::covers).orElse(true);
        SqlFragment creationFilter = analyticsFilters.toSql(predicate,
                creationsFromRollups ? FilterFieldRegistry.CREATION_ROLLUPS : FilterFieldRegistry.BLOGS);

        Instant from = range.startInclusive() == null ? null : TimeBuckets.bucketStart(range.startInclusive(), granularity);
        Instant to = range.endExclusive();
        log.debug("Performance: period={}, from={}, to={}, filtered={}", granularity.getToken(), from, to,
                predicate.isPresent());

        List<BucketTotal> views = viewRollupRepository.sumViewsByBucket(granularity, from, to, viewFilter);
        List<BucketTotal> creations;
        if (creationsFromRollups) {
            creations = creationRollupRepository.sumBlogsByBucket(granularity, from, to, creationFilter);
        } else {
            log.debug("Filter references blog fields, counting creations from blogs");
            creations = eventSourceRepository.countCreationsByBucket(granularity, from, to, creationFilter);
        }
        return buildSeries(granularity, views, creations);
    }

    /**
     * İki seriyi bucket üzerinden birleştirir; ilk ve son bucket arasındaki boş periyotlar 0 ile doldurulur,
     * böylece büyüme her zaman takvimdeki bir önceki periyoda göre hesaplanır.
     */
    List<PerformancePoint> buildSeries(Granularity granularity, List<BucketTotal> views, List<BucketTotal> creations) {
        Map<Instant, Long> viewsByBucket = toMap(views);
        Map<Instant, Long> creationsByBucket = toMap(creations);
        TreeSet<Instant> buckets = new TreeSet<>(viewsByBucket.keySet());
        buckets.addAll(creationsByBucket.keySet());
        if (buckets.isEmpty()) {
            return Collections.emptyList();
        }

        List<PerformancePoint> points = new ArrayList<>();
        Long previous = null;
        Instant last = buckets.last();
        for (Instant bucket = buckets.first(); !bucket.isAfter(last); bucket = TimeBuckets.nextBucket(bucket, granularity)) {
            long current = viewsByBucket.getOrDefault(bucket, 0L);
            points.add(PerformancePoint.builder()
                    .periodStart(bucket)
                    .period(TimeBuckets.formatPeriod(bucket, granularity))
                    .blogsCreated(creationsByBucket.getOrDefault(bucket, 0L))
                    .views(current)
                    .growth(GrowthCalculator.round(GrowthCalculator.growth(previous, current)))
                    .build());
            previous = current;
        }
        return points;
    }

    private static Optional<FilterPredicate> withAuthor(Optional<FilterPredicate> predicate, Long authorId) {
        if (authorId == null) {
            return predicate;
        }
        FilterPredicate author = new FilterPredicate.Comparison(FilterOperator.EQ, FieldPath.parse("author.id"), authorId);
        return Optional.of(predicate
                .<FilterPredicate>map(p -> new FilterPredicate.And(List.of(p, author)))
                .orElse(author));
    }

    private static Map<Instant, Long> toMap(List<BucketTotal> totals) {
        Map<Instant, Long> byBucket = new TreeMap<>();
        for (BucketTotal total : totals) {
            byBucket.merge(total.getTimeBucket(), total.getTotal(), Long::sum);
        }
        return byBucket;
    }
}
