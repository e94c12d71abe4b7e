package com.baykanat.bloganalytics.domain.service;

import com.baykanat.bloganalytics.domain.exception.UnsupportedGranularityException;
import com.baykanat.bloganalytics.domain.model.CreationRollup;
import com.baykanat.bloganalytics.domain.model.Granularity;
import com.baykanat.bloganalytics.domain.model.PeriodBounds;
import com.baykanat.bloganalytics.domain.model.ViewFact;
import com.baykanat.bloganalytics.domain.model.ViewRollup;
import com.baykanat.bloganalytics.domain.time.TimeBuckets;
import com.baykanat.bloganalytics.infrastructure.persistence.CreationRollupJdbcRepository;
import com.baykanat.bloganalytics.infrastructure.persistence.EventSourceJdbcRepository;
import com.baykanat.bloganalytics.infrastructure.persistence.ViewRollupJdbcRepository;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ham event'leri (veya bir alt granularity'nin rollup'larını) bucket × dimension bazında toplayıp rollup
 * tablolarına upsert eder. Aynı pencere için tekrar çalıştırmak aynı saklı durumu üretir.
 *
 * <p>Daha ince rollup'lardan türetilen satırlarda unique_blogs_viewed ve unique_users alt bucket'ların
 * toplamıdır (yaklaşık değer): iki alt bucket'ta görünen aynı kullanıcı iki kez sayılır. Ham event'ten
 * hesaplanan satırlar ve backfill kesin sayım verir.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationService {

    public static final String ALL_GRANULARITIES = "all";

    private static final List<Granularity> AGGREGATION_ORDER =
            List.of(Granularity.HOUR, Granularity.DAY, Granularity.WEEK, Granularity.MONTH, Granularity.YEAR);

    private final EventSourceJdbcRepository eventSourceRepository;
    private final ViewRollupJdbcRepository viewRollupRepository;
    private final CreationRollupJdbcRepository creationRollupRepository;
    private final Clock clock;

    /** Scheduler giriş noktası: bir önceki tam periyodun view rollup'larını yazar. */
    @Transactional
    public int aggregateViews(String granularity) {
        return aggregateViews(Granularity.aggregatable(granularity));
    }

    @Transactional
    public int aggregateViews(Granularity granularity) {
        requireAggregatable(granularity);
        PeriodBounds window = TimeBuckets.previousPeriodBounds(clock.instant(), granularity);
        log.info("Aggregating {} views for [{}, {})", granularity.getToken(), window.getStart(), window.getEnd());

        List<ViewRollup> rollups = viewRollupsFromFinerSource(granularity, window);
        int written = viewRollupRepository.upsertAll(rollups);
        log.info("Aggregated {} views: {} rollup rows written", granularity.getToken(), written);
        return written;
    }

    /** Scheduler giriş noktası: bir önceki tam periyodun creation rollup'larını yazar. */
    @Transactional
    public int aggregateCreations(String granularity) {
        return aggregateCreations(Granularity.aggregatable(granularity));
    }

    @Transactional
    public int aggregateCreations(Granularity granularity) {
        requireAggregatable(granularity);
        PeriodBounds window = TimeBuckets.previousPeriodBounds(clock.instant(), granularity);
        log.info("Aggregating {} creations for [{}, {})", granularity.getToken(), window.getStart(), window.getEnd());

        List<CreationRollup> rollups = creationRollupsFromFinerSource(granularity, window);
        int written = creationRollupRepository.upsertAll(rollups);
        log.info("Aggregated {} creations: {} rollup rows written", granularity.getToken(), written);
        return written;
    }

    /**
     * [bucketStart(start), end) aralığındaki her bucket'ı ham event'lerden yeniden hesaplar (view ve creation).
     * start yoksa en eski event, end yoksa şimdiki an kullanılır; end dahil edici bir tarihtir.
     *
     * @param granularity tek bir granularity ya da "all"
     * @param clear       true ise penceredeki mevcut rollup'lar önce silinir
     * @return yazılan toplam satır sayısı
     */
    @Transactional
    public int backfill(String granularity, LocalDate start, LocalDate end, boolean clear) {
        List<Granularity> targets = granularity == null || ALL_GRANULARITIES.equals(granularity.trim().toLowerCase(Locale.ROOT))
                ? AGGREGATION_ORDER
                : List.of(Granularity.aggregatable(granularity));

        Instant to = end == null ? clock.instant() : end.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant from;
        if (start != null) {
            from = start.atStartOfDay(ZoneOffset.UTC).toInstant();
        } else {
            from = eventSourceRepository.findEarliestEventTime().orElse(null);
            if (from == null) {
                log.info("Backfill skipped: no views or blogs found");
                return 0;
            }
        }
        if (!from.isBefore(to)) {
            log.info("Backfill skipped: empty range [{}, {})", from, to);
            return 0;
        }

        int total = 0;
        for (Granularity target : targets) {
            total += backfill(target, from, to, clear);
        }
        log.info("Backfill finished: granularities={}, range=[{}, {}), rows written={}", targets, from, to, total);
        return total;
    }

    private int backfill(Granularity granularity, Instant from, Instant to, boolean clear) {
        PeriodBounds window = PeriodBounds.builder()
                .start(TimeBuckets.bucketStart(from, granularity))
                .end(to)
                .build();
        if (clear) {
            viewRollupRepository.deleteInWindow(granularity, window);
            creationRollupRepository.deleteInWindow(granularity, window);
        }

        int written = 0;
        Instant bucket = window.getStart();
        while (bucket.isBefore(window.getEnd())) {
            Instant next = TimeBuckets.nextBucket(bucket, granularity);
            PeriodBounds slice = PeriodBounds.builder()
                    .start(bucket)
                    .end(next.isBefore(window.getEnd()) ? next : window.getEnd())
                    .build();
            written += viewRollupRepository.upsertAll(viewRollupsFromRaw(granularity, slice));
            written += creationRollupRepository.upsertAll(creationRollupsFromRaw(granularity, slice));
            bucket = next;
        }
        log.info("Backfilled {} rollups for [{}, {}): {} rows", granularity.getToken(),
                window.getStart(), window.getEnd(), written);
        return written;
    }

    /**
     * Alt granularity'nin her bucket'ı ayrı değerlendirilir: toplam satırı olan bucket'lar rollup'tan,
     * eksik olanlar ham event'lerden alt granularity'de hesaplanıp birlikte toplanır.
     */
    private List<ViewRollup> viewRollupsFromFinerSource(Granularity granularity, PeriodBounds window) {
        Granularity finer = granularity.finerSource();
        if (finer == Granularity.RAW) {
            return viewRollupsFromRaw(granularity, window);
        }
        List<ViewRollup> finerRows = viewRollupRepository.findInWindow(finer, window);
        Set<Instant> covered = finerRows.stream()
                .filter(ViewRollup::isTotal)
                .map(ViewRollup::getTimeBucket)
                .collect(Collectors.toSet());
        if (covered.isEmpty()) {
            log.warn("No {} view rollups in [{}, {}), falling back to raw views for {}",
                    finer.getToken(), window.getStart(), window.getEnd(), granularity.getToken());
            return viewRollupsFromRaw(granularity, window);
        }

        List<ViewRollup> rows = new ArrayList<>();
        for (ViewRollup row : finerRows) {
            if (covered.contains(row.getTimeBucket())) {
                rows.add(row);
            }
        }
        for (PeriodBounds gap : uncoveredSlices(window, finer, covered)) {
            log.warn("Missing {} view rollups in [{}, {}), reading raw views for {}",
                    finer.getToken(), gap.getStart(), gap.getEnd(), granularity.getToken());
            rows.addAll(viewRollupsFromRaw(finer, gap));
        }
        return viewRollupsFromRollups(granularity, rows);
    }

    private List<CreationRollup> creationRollupsFromFinerSource(Granularity granularity, PeriodBounds window) {
        Granularity finer = granularity.finerSource();
        if (finer == Granularity.RAW) {
            return creationRollupsFromRaw(granularity, window);
        }
        List<CreationRollup> finerRows = creationRollupRepository.findInWindow(finer, window);
        Set<Instant> covered = finerRows.stream()
                .filter(CreationRollup::isTotal)
                .map(CreationRollup::getTimeBucket)
                .collect(Collectors.toSet());
        if (covered.isEmpty()) {
            log.warn("No {} creation rollups in [{}, {}), falling back to raw blogs for {}",
                    finer.getToken(), window.getStart(), window.getEnd(), granularity.getToken());
            return creationRollupsFromRaw(granularity, window);
        }

        List<CreationRollup> rows = new ArrayList<>();
        for (CreationRollup row : finerRows) {
            if (covered.contains(row.getTimeBucket())) {
                rows.add(row);
            }
        }
        for (PeriodBounds gap : uncoveredSlices(window, finer, covered)) {
            log.warn("Missing {} creation rollups in [{}, {}), reading raw blogs for {}",
                    finer.getToken(), gap.getStart(), gap.getEnd(), granularity.getToken());
            rows.addAll(creationRollupsFromRaw(finer, gap));
        }
        return creationRollupsFromRollups(granularity, rows);
    }

    /** Pencerede toplam satırı olmayan ardışık alt bucket'lar, tek dilim olarak birleştirilmiş. */
    static List<PeriodBounds> uncoveredSlices(PeriodBounds window, Granularity finer, Set<Instant> covered) {
        List<PeriodBounds> slices = new ArrayList<>();
        Instant gapStart = null;
        for (Instant bucket = window.getStart(); bucket.isBefore(window.getEnd());
             bucket = TimeBuckets.nextBucket(bucket, finer)) {
            if (covered.contains(bucket)) {
                if (gapStart != null) {
                    slices.add(PeriodBounds.builder().start(gapStart).end(bucket).build());
                    gapStart = null;
                }
            } else if (gapStart == null) {
                gapStart = bucket;
            }
        }
        if (gapStart != null) {
            slices.add(PeriodBounds.builder().start(gapStart).end(window.getEnd()).build());
        }
        return slices;
    }

    List<ViewRollup> viewRollupsFromRaw(Granularity granularity, PeriodBounds window) {
        Map<DimensionKey, ViewAccumulator> buckets = new LinkedHashMap<>();
        eventSourceRepository.streamViewFacts(window, fact -> {
            Instant bucket = TimeBuckets.bucketStart(fact.getViewedAt(), granularity);
            buckets.computeIfAbsent(new DimensionKey(bucket, fact.getBlogId(), fact.getCountryId(), fact.getAuthorId()),
                    key -> new ViewAccumulator()).add(fact);
            buckets.computeIfAbsent(DimensionKey.total(bucket), key -> new ViewAccumulator()).add(fact);
        });

        List<ViewRollup> rollups = new ArrayList<>(buckets.size());
        buckets.forEach((key, acc) -> rollups.add(ViewRollup.builder()
                .granularity(granularity)
                .timeBucket(key.bucket)
                .blogId(key.blogId)
                .countryId(key.countryId)
                .authorId(key.authorId)
                .viewCount(acc.views)
                .uniqueBlogsViewed(acc.blogs.size())
                .uniqueUsers(acc.users.size())
                .build()));
        return rollups;
    }

    List<ViewRollup> viewRollupsFromRollups(Granularity granularity, List<ViewRollup> finerRows) {
        Map<DimensionKey, ViewRollup> buckets = new LinkedHashMap<>();
        for (ViewRollup row : finerRows) {
            Instant bucket = TimeBuckets.bucketStart(row.getTimeBucket(), granularity);
            DimensionKey key = new DimensionKey(bucket, row.getBlogId(), row.getCountryId(), row.getAuthorId());
            buckets.merge(key, row.toBuilder().granularity(granularity).timeBucket(bucket).build(),
                    (sum, next) -> sum.toBuilder()
                            .viewCount(sum.getViewCount() + next.getViewCount())
                            .uniqueBlogsViewed(sum.getUniqueBlogsViewed() + next.getUniqueBlogsViewed())
                            .uniqueUsers(sum.getUniqueUsers() + next.getUniqueUsers())
                            .build());
        }
        return new ArrayList<>(buckets.values());
    }

    List<CreationRollup> creationRollupsFromRaw(Granularity granularity, PeriodBounds window) {
        Map<DimensionKey, Long> counts = new LinkedHashMap<>();
        eventSourceRepository.streamCreationFacts(window, fact -> {
            Instant bucket = TimeBuckets.bucketStart(fact.getCreatedAt(), granularity);
            counts.merge(new DimensionKey(bucket, null, fact.getCountryId(), fact.getAuthorId()), 1L, Long::sum);
            counts.merge(DimensionKey.total(bucket), 1L, Long::sum);
        });
        return toCreationRollups(granularity, counts);
    }

    List<CreationRollup> creationRollupsFromRollups(Granularity granularity, List<CreationRollup> finerRows) {
        Map<DimensionKey, Long> counts = new LinkedHashMap<>();
        for (CreationRollup row : finerRows) {
            Instant bucket = TimeBuckets.bucketStart(row.getTimeBucket(), granularity);
            counts.merge(new DimensionKey(bucket, null, row.getCountryId(), row.getAuthorId()),
                    row.getBlogCount(), Long::sum);
        }
        return toCreationRollups(granularity, counts);
    }

    private static List<CreationRollup> toCreationRollups(Granularity granularity, Map<DimensionKey, Long> counts) {
        List<CreationRollup> rollups = new ArrayList<>(counts.size());
        counts.forEach((key, count) -> rollups.add(CreationRollup.builder()
                .granularity(granularity)
                .timeBucket(key.bucket)
                .countryId(key.countryId)
                .authorId(key.authorId)
                .blogCount(count)
                .build()));
        return rollups;
    }

    private static void requireAggregatable(Granularity granularity) {
        if (granularity == null || !granularity.isAggregatable()) {
            throw new UnsupportedGranularityException(String.valueOf(granularity));
        }
    }

    /** Rollup anahtarı; tüm dimension'lar null ise bucket toplamı. */
    @EqualsAndHashCode
    private static final class DimensionKey {
        private final Instant bucket;
        private final Long blogId;
        private final Long countryId;
        private final Long authorId;

        private DimensionKey(Instant bucket, Long blogId, Long countryId, Long authorId) {
            this.bucket = bucket;
            this.blogId = blogId;
            this.countryId = countryId;
            this.authorId = authorId;
        }

        static DimensionKey total(Instant bucket) {
            return new DimensionKey(bucket, null, null, null);
        }
    }

    private static final class ViewAccumulator {
        private long views;
        private final Set<Long> blogs = new HashSet<>();
        private final Set<Long> users = new HashSet<>();

        void add(ViewFact fact) {
            views++;
            blogs.add(fact.getBlogId());
            if (fact.getUserId() != null) {
                users.add(fact.getUserId());
            }
        }
    }
}
