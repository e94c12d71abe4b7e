package com.baykanat.bloganalytics.domain.service;

import com.baykanat.bloganalytics.domain.exception.InvalidFilterException;
import com.baykanat.bloganalytics.domain.exception.UnsupportedGranularityException;
import com.baykanat.bloganalytics.domain.filter.FilterCompiler;
import com.baykanat.bloganalytics.domain.model.BucketTotal;
import com.baykanat.bloganalytics.domain.model.Granularity;
import com.baykanat.bloganalytics.domain.model.PerformancePoint;
import com.baykanat.bloganalytics.infrastructure.persistence.CreationRollupJdbcRepository;
import com.baykanat.bloganalytics.infrastructure.persistence.EventSourceJdbcRepository;
import com.baykanat.bloganalytics.infrastructure.persistence.ViewRollupJdbcRepository;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.SqlFragment;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PerformanceAnalyticsService: series join, gap filling, growth rules and filter routing.
 */
@ExtendWith(MockitoExtension.class)
class PerformanceAnalyticsServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ViewRollupJdbcRepository viewRollupRepository;

    @Mock
    private CreationRollupJdbcRepository creationRollupRepository;

    @Mock
    private EventSourceJdbcRepository eventSourceRepository;

    private PerformanceAnalyticsService service;

    @BeforeEach
    void setUp() {
        service = new PerformanceAnalyticsService(viewRollupRepository, creationRollupRepository,
                eventSourceRepository, new AnalyticsFilters(new FilterCompiler()));
    }

    private static BucketTotal total(String bucket, long value) {
        return new BucketTotal(Instant.parse(bucket), value);
    }

    @Test
    @DisplayName("Without filters the totals rows are read and growth follows the edge-case rules")
    void monthlySeriesWithGrowth() {
        when(viewRollupRepository.sumViewsByBucket(eq(Granularity.MONTH), isNull(), isNull(), isNull()))
                .thenReturn(List.of(
                        total("2025-01-01T00:00:00Z", 0),
                        total("2025-02-01T00:00:00Z", 50),
                        total("2025-03-01T00:00:00Z", 100),
                        total("2025-04-01T00:00:00Z", 150),
                        total("2025-05-01T00:00:00Z", 75)));
        when(creationRollupRepository.sumBlogsByBucket(eq(Granularity.MONTH), isNull(), isNull(), isNull()))
                .thenReturn(List.of(total("2025-02-01T00:00:00Z", 4)));

        List<PerformancePoint> points = service.performance(null, null, null, null, null);

        assertThat(points).extracting(PerformancePoint::getPeriod)
                .containsExactly("2025-01", "2025-02", "2025-03", "2025-04", "2025-05");
        assertThat(points).extracting(PerformancePoint::getViews).containsExactly(0L, 50L, 100L, 150L, 75L);
        assertThat(points).extracting(PerformancePoint::getBlogsCreated).containsExactly(0L, 4L, 0L, 0L, 0L);
        assertThat(points).extracting(PerformancePoint::getGrowth)
                .containsExactly(null, 100.0, 100.0, 50.0, -50.0);
    }

    @Test
    @DisplayName("Missing periods between observed buckets are filled with zero views")
    void fillsGaps() {
        List<PerformancePoint> points = service.buildSeries(Granularity.DAY,
                List.of(total("2025-03-01T00:00:00Z", 10), total("2025-03-04T00:00:00Z", 20)),
                List.of(total("2025-03-02T00:00:00Z", 1)));

        assertThat(points).extracting(PerformancePoint::getPeriod)
                .containsExactly("2025-03-01", "2025-03-02", "2025-03-03", "2025-03-04");
        assertThat(points).extracting(PerformancePoint::getGrowth)
                .containsExactly(null, -100.0, null, 100.0);
    }

    @Test
    @DisplayName("Empty rollups give an empty list, never null")
    void emptySeries() {
        assertThat(service.buildSeries(Granularity.WEEK, List.of(), List.of())).isEmpty();
    }

    @Test
    @DisplayName("Filters and author_id are rendered against the rollup tables and start snaps to its bucket")
    void filtersRouteToDimensionRows() throws Exception {
        when(viewRollupRepository.sumViewsByBucket(any(), any(), any(), any())).thenReturn(List.of());
        when(creationRollupRepository.sumBlogsByBucket(any(), any(), any(), any())).thenReturn(List.of());

        service.performance("week",
                objectMapper.readTree("{\"eq\": {\"field\": \"country.code\", \"value\": \"US\"}}"),
                7L, "2025-03-13", "2025-03-31");

        ArgumentCaptor<SqlFragment> viewFilter = ArgumentCaptor.forClass(SqlFragment.class);
        verify(viewRollupRepository).sumViewsByBucket(eq(Granularity.WEEK),
                eq(Instant.parse("2025-03-10T00:00:00Z")), eq(Instant.parse("2025-04-01T00:00:00Z")),
                viewFilter.capture());
        assertThat(viewFilter.getValue().getSql()).isEqualTo("(c.code = ? AND r.author_id = ?)");
        assertThat(viewFilter.getValue().getParams()).containsExactly("US", 7L);
        verifyNoInteractions(eventSourceRepository);
    }

    @Test
    @DisplayName("A blog.id filter narrows views on rollups and counts creations from the blogs table")
    void blogFilterCountsCreationsFromBlogs() throws Exception {
        when(viewRollupRepository.sumViewsByBucket(any(), any(), any(), any())).thenReturn(List.of(
                total("2025-01-01T00:00:00Z", 10),
                total("2025-02-01T00:00:00Z", 15)));
        when(eventSourceRepository.countCreationsByBucket(any(), any(), any(), any())).thenReturn(List.of(
                total("2025-01-01T00:00:00Z", 1)));

        List<PerformancePoint> points = service.performance("month",
                objectMapper.readTree("{\"eq\": {\"field\": \"blog.id\", \"value\": 1}}"), null, null, null);

        assertThat(points).extracting(PerformancePoint::getBlogsCreated).containsExactly(1L, 0L);
        assertThat(points).extracting(PerformancePoint::getGrowth).containsExactly(null, 50.0);

        ArgumentCaptor<SqlFragment> viewFilter = ArgumentCaptor.forClass(SqlFragment.class);
        verify(viewRollupRepository).sumViewsByBucket(eq(Granularity.MONTH), isNull(), isNull(), viewFilter.capture());
        assertThat(viewFilter.getValue().getSql()).isEqualTo("r.blog_id = ?");

        ArgumentCaptor<SqlFragment> creationFilter = ArgumentCaptor.forClass(SqlFragment.class);
        verify(eventSourceRepository).countCreationsByBucket(eq(Granularity.MONTH), isNull(), isNull(),
                creationFilter.capture());
        assertThat(creationFilter.getValue().getSql()).isEqualTo("b.id = ?");
        assertThat(creationFilter.getValue().getParams()).containsExactly(1L);
        verifyNoInteractions(creationRollupRepository);
    }

    @Test
    @DisplayName("hour and unknown period sizes are rejected; fields missing on rollups are invalid filters")
    void rejectsInvalidInput() throws Exception {
        assertThatThrownBy(() -> service.performance("hour", null, null, null, null))
                .isInstanceOf(UnsupportedGranularityException.class);
        assertThatThrownBy(() -> service.performance("quarter", null, null, null, null))
                .isInstanceOf(UnsupportedGranularityException.class);
        assertThatThrownBy(() -> service.performance("month",
                objectMapper.readTree("{\"eq\": {\"field\": \"viewed_at\", \"value\": \"2025-01-01\"}}"),
                null, null, null))
                .isInstanceOf(InvalidFilterException.class);
        verifyNoInteractions(viewRollupRepository, creationRollupRepository, eventSourceRepository);
    }
}
