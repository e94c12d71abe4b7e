package com.baykanat.bloganalytics.integration;

import com.baykanat.bloganalytics.domain.model.CreationRollup;
import com.baykanat.bloganalytics.domain.model.Granularity;
import com.baykanat.bloganalytics.domain.model.PerformancePoint;
import com.baykanat.bloganalytics.domain.model.PeriodBounds;
import com.baykanat.bloganalytics.domain.model.TopEntry;
import com.baykanat.bloganalytics.domain.model.ViewRollup;
import com.baykanat.bloganalytics.domain.service.AggregationService;
import com.baykanat.bloganalytics.domain.service.PerformanceAnalyticsService;
import com.baykanat.bloganalytics.domain.service.TopAnalyticsService;
import com.baykanat.bloganalytics.infrastructure.persistence.CreationRollupJdbcRepository;
import com.baykanat.bloganalytics.infrastructure.persistence.ViewRollupJdbcRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test against a real PostgreSQL (via Testcontainers).
 *
 * <p>This test validates:
 * <ul>
 *   <li>Top-N ranking over raw views, end to end</li>
 *   <li>Filter trees lowered to SQL return only matching rows</li>
 *   <li>Aggregation is idempotent at the table level (ON CONFLICT on NULLS NOT DISTINCT keys)</li>
 *   <li>The all-null totals row equals the sum of the dimension rows</li>
 *   <li>Performance reads the rollups written by backfill</li>
 *   <li>Single-row upserts keep one totals row per bucket</li>
 * </ul>
 *
 * <p>The clock is fixed so that "previous period" windows are deterministic.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class BlogAnalyticsIntegrationTest {

    private static final Instant NOW = Instant.parse("2025-03-13T14:37:00Z");

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("blog_analytics_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TopAnalyticsService topAnalyticsService;

    @Autowired
    private PerformanceAnalyticsService performanceAnalyticsService;

    @Autowired
    private AggregationService aggregationService;

    @Autowired
    private ViewRollupJdbcRepository viewRollupRepository;

    @Autowired
    private CreationRollupJdbcRepository creationRollupRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private long usCountry;
    private long trCountry;
    private long deCountry;
    private long blogA;
    private long blogB;
    private long blogC;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE blog_view_rollups, blog_creation_rollups, blog_views, blogs, authors, users, "
                + "countries RESTART IDENTITY CASCADE");

        usCountry = insertCountry("US", "United States");
        trCountry = insertCountry("TR", "Turkey");
        deCountry = insertCountry("DE", null);
        long alice = insertAuthor("alice");
        long bob = insertAuthor("bob");
        blogA = insertBlog("Blog A", alice, usCountry, "2025-02-20T10:00:00Z");
        blogB = insertBlog("Blog B", bob, trCountry, "2025-03-02T10:00:00Z");
        blogC = insertBlog("Blog C", bob, deCountry, "2025-03-05T10:00:00Z");
    }

    @Test
    @DisplayName("Top blogs: 5-view blog first, 2-view blog second, z equals raw view counts")
    void topBlogsEndToEnd() {
        insertViews(blogA, 5, "2025-03-10T09:00:00Z");
        insertViews(blogB, 2, "2025-03-11T09:00:00Z");

        List<TopEntry> top = topAnalyticsService.top("blog", null, null, null, 10);

        assertThat(top).hasSize(2);
        assertThat(top.get(0).getLabel()).isEqualTo("Blog A");
        assertThat(top.get(0).getSecondaryMetric()).isEqualTo(blogA);
        assertThat(top.get(0).getTotalViews()).isEqualTo(5);
        assertThat(top.get(1).getLabel()).isEqualTo("Blog B");
        assertThat(top.get(1).getTotalViews()).isEqualTo(2);
    }

    @Test
    @DisplayName("Country top falls back to the code when the name is missing")
    void topCountriesLabelFallback() {
        insertViews(blogC, 3, "2025-03-10T09:00:00Z");
        insertViews(blogA, 1, "2025-03-10T09:00:00Z");

        List<TopEntry> top = topAnalyticsService.top("country", null, "2025-03-01", "2025-03-31", null);

        assertThat(top).extracting(TopEntry::getLabel).containsExactly("DE", "United States");
        assertThat(top).extracting(TopEntry::getSecondaryMetric).containsExactly(1L, 1L);
    }

    @Test
    @DisplayName("Filter round-trip: only views matching both the country and the date condition count")
    void filterRoundTrip() throws Exception {
        insertViews(blogA, 2, "2024-12-31T23:00:00Z");
        insertViews(blogA, 3, "2025-01-02T09:00:00Z");
        insertViews(blogB, 4, "2025-01-02T09:00:00Z");

        List<TopEntry> top = topAnalyticsService.top("blog", objectMapper.readTree("""
                {"and": [
                  {"eq":  {"field": "country.code", "value": "US"}},
                  {"gte": {"field": "created_at",   "value": "2025-01-01"}}
                ]}
                """), null, null, 10);

        assertThat(top).hasSize(1);
        assertThat(top.get(0).getLabel()).isEqualTo("Blog A");
        assertThat(top.get(0).getTotalViews()).isEqualTo(3);
    }

    @Test
    @DisplayName("Hourly aggregation twice leaves identical rows, and the totals row sums the dimension rows")
    void aggregationIsIdempotentInStorage() {
        insertViews(blogA, 3, "2025-03-13T13:05:00Z");
        insertViews(blogB, 2, "2025-03-13T13:20:00Z");
        insertViews(blogC, 1, "2025-03-13T13:55:00Z");
        insertViews(blogC, 1, "2025-03-13T14:05:00Z");

        int first = aggregationService.aggregateViews("hour");
        List<Map<String, Object>> afterFirst = rollupSnapshot();
        int second = aggregationService.aggregateViews("hour");
        List<Map<String, Object>> afterSecond = rollupSnapshot();

        assertThat(first).isEqualTo(4).isEqualTo(second);
        assertThat(afterSecond).isEqualTo(afterFirst);

        List<ViewRollup> rows = viewRollupRepository.findInWindow(Granularity.HOUR,
                PeriodBounds.builder()
                        .start(Instant.parse("2025-03-13T13:00:00Z"))
                        .end(Instant.parse("2025-03-13T14:00:00Z"))
                        .build());
        ViewRollup total = rows.stream().filter(ViewRollup::isTotal).findFirst().orElseThrow();
        assertThat(total.getViewCount())
                .isEqualTo(6)
                .isEqualTo(rows.stream().filter(r -> !r.isTotal()).mapToLong(ViewRollup::getViewCount).sum());
        assertThat(total.getUniqueBlogsViewed()).isEqualTo(3);
    }

    @Test
    @DisplayName("Performance reads backfilled monthly rollups, with and without a dimension filter")
    void performanceFromBackfilledRollups() throws Exception {
        insertViews(blogA, 4, "2025-02-21T09:00:00Z");
        insertViews(blogA, 2, "2025-03-03T09:00:00Z");
        insertViews(blogB, 4, "2025-03-04T09:00:00Z");

        aggregationService.backfill("month", LocalDate.of(2025, 2, 1), LocalDate.of(2025, 3, 31), false);

        List<PerformancePoint> all = performanceAnalyticsService.performance("month", null, null, null, null);
        assertThat(all).extracting(PerformancePoint::getPeriod).containsExactly("2025-02", "2025-03");
        assertThat(all).extracting(PerformancePoint::getViews).containsExactly(4L, 6L);
        assertThat(all).extracting(PerformancePoint::getBlogsCreated).containsExactly(1L, 2L);
        assertThat(all).extracting(PerformancePoint::getGrowth).containsExactly(null, 50.0);

        List<PerformancePoint> us = performanceAnalyticsService.performance("month",
                objectMapper.readTree("{\"eq\": {\"field\": \"country.code\", \"value\": \"US\"}}"),
                null, null, null);
        assertThat(us).extracting(PerformancePoint::getViews).containsExactly(4L, 2L);
        assertThat(us).extracting(PerformancePoint::getGrowth).containsExactly(null, -50.0);
    }

    @Test
    @DisplayName("Single-row upserts of the all-null totals row replace it instead of inserting a duplicate")
    void singleRowUpsertReplacesTotals() {
        Instant bucket = Instant.parse("2025-03-12T00:00:00Z");
        viewRollupRepository.upsert(new ViewRollup(Granularity.DAY, bucket, null, null, null, 5, 2, 3));
        viewRollupRepository.upsert(new ViewRollup(Granularity.DAY, bucket, null, null, null, 8, 3, 4));
        creationRollupRepository.upsert(new CreationRollup(Granularity.DAY, bucket, null, null, 1));
        creationRollupRepository.upsert(new CreationRollup(Granularity.DAY, bucket, null, null, 2));

        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM blog_view_rollups", Long.class)).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject("SELECT view_count FROM blog_view_rollups", Long.class)).isEqualTo(8);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM blog_creation_rollups", Long.class)).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject("SELECT blog_count FROM blog_creation_rollups", Long.class)).isEqualTo(2);
    }

    @Test
    @DisplayName("Performance with a blog.id filter counts that blog's views and its own creation")
    void performanceFilteredByBlog() throws Exception {
        insertViews(blogA, 4, "2025-02-21T09:00:00Z");
        insertViews(blogA, 2, "2025-03-03T09:00:00Z");
        insertViews(blogB, 4, "2025-03-04T09:00:00Z");
        aggregationService.backfill("month", LocalDate.of(2025, 2, 1), LocalDate.of(2025, 3, 31), false);

        List<PerformancePoint> points = performanceAnalyticsService.performance("month",
                objectMapper.readTree("{\"eq\": {\"field\": \"blog.id\", \"value\": " + blogA + "}}"),
                null, null, null);

        assertThat(points).extracting(PerformancePoint::getPeriod).containsExactly("2025-02", "2025-03");
        assertThat(points).extracting(PerformancePoint::getViews).containsExactly(4L, 2L);
        assertThat(points).extracting(PerformancePoint::getBlogsCreated).containsExactly(1L, 0L);
    }

    private List<Map<String, Object>> rollupSnapshot() {
        return jdbcTemplate.queryForList("""
                SELECT id, granularity, time_bucket, blog_id, country_id, author_id,
                       view_count, unique_blogs_viewed, unique_users
                FROM blog_view_rollups ORDER BY id
                """);
    }

    private long insertCountry(String code, String name) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO countries (code, name, continent) VALUES (?, ?, 'Test') RETURNING id",
                Long.class, code, name);
    }

    private long insertAuthor(String username) {
        Long userId = jdbcTemplate.queryForObject(
                "INSERT INTO users (username) VALUES (?) RETURNING id", Long.class, username);
        return jdbcTemplate.queryForObject(
                "INSERT INTO authors (user_id) VALUES (?) RETURNING id", Long.class, userId);
    }

    private long insertBlog(String title, long authorId, long countryId, String createdAt) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO blogs (title, author_id, country_id, created_at) VALUES (?, ?, ?, ?) RETURNING id",
                Long.class, title, authorId, countryId, Timestamp.from(Instant.parse(createdAt)));
    }

    private void insertViews(long blogId, int count, String viewedAt) {
        for (int i = 0; i < count; i++) {
            jdbcTemplate.update("INSERT INTO blog_views (blog_id, viewed_at) VALUES (?, ?)",
                    blogId, Timestamp.from(Instant.parse(viewedAt)));
        }
    }
}
