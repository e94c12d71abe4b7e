package com.baykanat.bloganalytics.infrastructure.persistence;

import com.baykanat.bloganalytics.domain.model.BucketTotal;
import com.baykanat.bloganalytics.domain.model.CreationFact;
import com.baykanat.bloganalytics.domain.model.Granularity;
import com.baykanat.bloganalytics.domain.model.PeriodBounds;
import com.baykanat.bloganalytics.domain.model.ViewFact;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.SqlFragment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/** Aggregation engine için ham blog_views / blogs okumaları; satırlar bellekte biriktirilmeden akıtılır. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class EventSourceJdbcRepository {

    private static final String VIEW_FACTS_SQL = """
            SELECT v.id, v.blog_id, b.country_id, b.author_id, v.user_id, v.viewed_at
            FROM blog_views v
            JOIN blogs b ON b.id = v.blog_id
            WHERE v.viewed_at >= ?
              AND v.viewed_at < ?
            """;

    private static final String CREATION_FACTS_SQL = """
            SELECT b.id, b.country_id, b.author_id, b.created_at
            FROM blogs b
            WHERE b.created_at >= ?
              AND b.created_at < ?
            """;

    private final JdbcTemplate jdbcTemplate;

    /** [start, end) penceresindeki view'ları blog'un country/author'ı ile birlikte consumer'a verir. */
    public void streamViewFacts(PeriodBounds window, Consumer<ViewFact> consumer) {
        jdbcTemplate.query(VIEW_FACTS_SQL, (RowCallbackHandler) rs -> {
            consumer.accept(ViewFact.builder()
                    .viewId(rs.getLong("id"))
                    .blogId(rs.getLong("blog_id"))
                    .countryId(JdbcTimes.nullableLong(rs, "country_id"))
                    .authorId(rs.getLong("author_id"))
                    .userId(JdbcTimes.nullableLong(rs, "user_id"))
                    .viewedAt(JdbcTimes.instant(rs, "viewed_at"))
                    .build());
        }, JdbcTimes.toDb(window.getStart()), JdbcTimes.toDb(window.getEnd()));
    }

    /** [start, end) penceresinde oluşturulan blog'ları consumer'a verir. */
    public void streamCreationFacts(PeriodBounds window, Consumer<CreationFact> consumer) {
        jdbcTemplate.query(CREATION_FACTS_SQL, (RowCallbackHandler) rs -> {
            consumer.accept(CreationFact.builder()
                    .blogId(rs.getLong("id"))
                    .countryId(JdbcTimes.nullableLong(rs, "country_id"))
                    .authorId(rs.getLong("author_id"))
                    .createdAt(JdbcTimes.instant(rs, "created_at"))
                    .build());
        }, JdbcTimes.toDb(window.getStart()), JdbcTimes.toDb(window.getEnd()));
    }

    /**
     * Ham blogs tablosundan bucket başına oluşturulan blog sayısı. Bucket sınırları rollup okumasıyla aynıdır:
     * from ve to bucket başlangıcına uygulanır. Filtre BLOGS registry'sine göre render edilmiş olmalıdır.
     */
    public List<BucketTotal> countCreationsByBucket(Granularity granularity, Instant from, Instant to,
                                                    SqlFragment filter) {
        String bucket = JdbcTimes.truncUtc(granularity.sqlTruncUnit(), "b.created_at");
        StringBuilder sql = new StringBuilder()
                .append("SELECT ").append(bucket).append(" AS time_bucket, COUNT(*) AS total\n")
                .append("""
                        FROM blogs b
                        JOIN authors a ON a.id = b.author_id
                        JOIN users u ON u.id = a.user_id
                        LEFT JOIN countries c ON c.id = b.country_id
                        WHERE TRUE
                        """);
        List<Object> params = new ArrayList<>();
        if (from != null) {
            sql.append("  AND ").append(bucket).append(" >= ?\n");
            params.add(JdbcTimes.toDb(from));
        }
        if (to != null) {
            sql.append("  AND ").append(bucket).append(" < ?\n");
            params.add(JdbcTimes.toDb(to));
        }
        if (filter != null) {
            sql.append("  AND ").append(filter.getSql()).append('\n');
            params.addAll(filter.getParams());
        }
        sql.append("GROUP BY 1 ORDER BY 1");

        log.debug("Raw creation series: granularity={}, from={}, to={}", granularity.getToken(), from, to);
        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> BucketTotal.builder()
                .timeBucket(JdbcTimes.instant(rs, "time_bucket"))
                .total(rs.getLong("total"))
                .build(), params.toArray());
    }

    /** En eski view ya da blog zamanı; backfill başlangıcı verilmediğinde kullanılır. */
    public Optional<Instant> findEarliestEventTime() {
        Instant earliest = jdbcTemplate.queryForObject("""
                SELECT LEAST((SELECT MIN(viewed_at) FROM blog_views),
                             (SELECT MIN(created_at) FROM blogs)) AS earliest
                """, (rs, rowNum) -> JdbcTimes.instant(rs, "earliest"));
        return Optional.ofNullable(earliest);
    }
}
