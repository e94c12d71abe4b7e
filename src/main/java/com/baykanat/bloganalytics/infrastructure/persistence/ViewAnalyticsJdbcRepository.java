package com.baykanat.bloganalytics.infrastructure.persistence;

import com.baykanat.bloganalytics.domain.model.AnalyticsDimension;
import com.baykanat.bloganalytics.domain.model.BreakdownEntry;
import com.baykanat.bloganalytics.domain.model.Granularity;
import com.baykanat.bloganalytics.domain.model.TimeRange;
import com.baykanat.bloganalytics.domain.model.TimeSeriesPoint;
import com.baykanat.bloganalytics.domain.model.TopEntry;
import com.baykanat.bloganalytics.domain.time.TimeBuckets;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.SqlFragment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ham blog_views üzerinden Top-N, breakdown ve zaman serisi sorguları. Dimension'a özgü kolon ve etiketler
 * AnalyticsDimension'dan gelir; tek bir parametreli sorgu tüm dimension'lara hizmet eder.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ViewAnalyticsJdbcRepository {

    private static final String BASE_FROM = """
            FROM blog_views v
            JOIN blogs b ON b.id = v.blog_id
            JOIN authors a ON a.id = b.author_id
            JOIN users u ON u.id = a.user_id
            LEFT JOIN countries c ON c.id = b.country_id
            """;

    private final JdbcTemplate jdbcTemplate;

    /** Toplam view'a göre azalan; eşitlikte dimension id'si artan. */
    public List<TopEntry> findTop(AnalyticsDimension dimension, SqlFragment filter, TimeRange range, int limit) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder()
                .append("SELECT ").append(dimension.getKeyExpression()).append(" AS dim_key, ")
                .append(dimension.getLabelExpression()).append(" AS label, ")
                .append(dimension.getSecondaryExpression()).append(" AS secondary, ")
                .append("COUNT(*) AS total_views\n")
                .append(BASE_FROM)
                .append(where(filter, range, params))
                .append(dimension.isSecondaryAggregated() ? "GROUP BY 1, 2\n" : "GROUP BY 1, 2, 3\n")
                .append("ORDER BY total_views DESC, dim_key ASC NULLS LAST\n")
                .append("LIMIT ?");
        params.add(limit);

        log.debug("Top query: dimension={}, range={}, limit={}", dimension, range, limit);
        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> TopEntry.builder()
                .label(rs.getString("label"))
                .secondaryMetric(rs.getLong("secondary"))
                .totalViews(rs.getLong("total_views"))
                .build(), params.toArray());
    }

    /** Dimension değeri × periyot; periyot artan, periyot içinde toplam view azalan. */
    public List<BreakdownEntry> findBreakdown(AnalyticsDimension dimension, Granularity granularity,
                                              SqlFragment filter, TimeRange range) {
        String bucket = JdbcTimes.truncUtc(granularity.sqlTruncUnit(), "v.viewed_at");
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder()
                .append("SELECT ").append(dimension.getKeyExpression()).append(" AS dim_key, ")
                .append(dimension.getQualifiedLabelExpression()).append(" AS label, ")
                .append(bucket).append(" AS period_start, ")
                .append("COUNT(DISTINCT v.blog_id) AS distinct_blogs, ")
                .append("COUNT(*) AS total_views\n")
                .append(BASE_FROM)
                .append(where(filter, range, params))
                .append("GROUP BY 1, 2, 3\n")
                .append("ORDER BY period_start ASC, total_views DESC, dim_key ASC NULLS LAST");

        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> {
            Instant periodStart = JdbcTimes.instant(rs, "period_start");
            return BreakdownEntry.builder()
                    .label(rs.getString("label"))
                    .periodStart(periodStart)
                    .period(TimeBuckets.formatPeriod(periodStart, granularity))
                    .distinctBlogs(rs.getLong("distinct_blogs"))
                    .totalViews(rs.getLong("total_views"))
                    .build();
        }, params.toArray());
    }

    public List<TimeSeriesPoint> findTimeSeries(Granularity granularity, SqlFragment filter, TimeRange range) {
        String bucket = JdbcTimes.truncUtc(granularity.sqlTruncUnit(), "v.viewed_at");
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder()
                .append("SELECT ").append(bucket).append(" AS period_start, ")
                .append("COUNT(*) AS views, COUNT(DISTINCT v.blog_id) AS distinct_blogs\n")
                .append(BASE_FROM)
                .append(where(filter, range, params))
                .append("GROUP BY 1\n")
                .append("ORDER BY 1");

        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> {
            Instant periodStart = JdbcTimes.instant(rs, "period_start");
            return TimeSeriesPoint.builder()
                    .periodStart(periodStart)
                    .period(TimeBuckets.formatPeriod(periodStart, granularity))
                    .views(rs.getLong("views"))
                    .distinctBlogs(rs.getLong("distinct_blogs"))
                    .build();
        }, params.toArray());
    }

    private static String where(SqlFragment filter, TimeRange range, List<Object> params) {
        StringBuilder where = new StringBuilder("WHERE TRUE\n");
        if (range != null && range.getStart() != null) {
            where.append("  AND v.viewed_at >= ?\n");
            params.add(JdbcTimes.toDb(range.startInclusive()));
        }
        if (range != null && range.getEnd() != null) {
            where.append("  AND v.viewed_at < ?\n");
            params.add(JdbcTimes.toDb(range.endExclusive()));
        }
        if (filter != null) {
            where.append("  AND ").append(filter.getSql()).append('\n');
            params.addAll(filter.getParams());
        }
        return where.toString();
    }
}
