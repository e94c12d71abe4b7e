package com.baykanat.bloganalytics.infrastructure.persistence;

import com.baykanat.bloganalytics.domain.model.BucketTotal;
import com.baykanat.bloganalytics.domain.model.CreationRollup;
import com.baykanat.bloganalytics.domain.model.Granularity;
import com.baykanat.bloganalytics.domain.model.PeriodBounds;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.SqlFragment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** blog_creation_rollups tablosu; ViewRollupJdbcRepository ile aynı upsert ve pencere sözleşmesi. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class CreationRollupJdbcRepository {

    private static final String UPSERT_SQL = """
            INSERT INTO blog_creation_rollups (granularity, time_bucket, country_id, author_id,
                                               blog_count, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, NOW(), NOW())
            ON CONFLICT (granularity, time_bucket, country_id, author_id)
            DO UPDATE SET
              blog_count = EXCLUDED.blog_count,
              updated_at = NOW()
            """;

    private final JdbcTemplate jdbcTemplate;

    public int upsertAll(List<CreationRollup> rollups) {
        if (rollups.isEmpty()) {
            return 0;
        }
        jdbcTemplate.batchUpdate(UPSERT_SQL, rollups, rollups.size(), (ps, rollup) -> {
            ps.setString(1, rollup.getGranularity().getToken());
            ps.setObject(2, JdbcTimes.toDb(rollup.getTimeBucket()));
            if (rollup.getCountryId() != null) {
                ps.setLong(3, rollup.getCountryId());
            } else {
                ps.setNull(3, Types.BIGINT);
            }
            if (rollup.getAuthorId() != null) {
                ps.setLong(4, rollup.getAuthorId());
            } else {
                ps.setNull(4, Types.BIGINT);
            }
            ps.setLong(5, rollup.getBlogCount());
        });
        return rollups.size();
    }

    public void upsert(CreationRollup rollup) {
        upsertAll(List.of(rollup));
    }

    public List<CreationRollup> findInWindow(Granularity granularity, PeriodBounds window) {
        return jdbcTemplate.query("""
                SELECT granularity, time_bucket, country_id, author_id, blog_count
                FROM blog_creation_rollups
                WHERE granularity = ? AND time_bucket >= ? AND time_bucket < ?
                ORDER BY time_bucket, id
                """, (rs, rowNum) -> CreationRollup.builder()
                        .granularity(Granularity.fromToken(rs.getString("granularity")))
                        .timeBucket(JdbcTimes.instant(rs, "time_bucket"))
                        .countryId(JdbcTimes.nullableLong(rs, "country_id"))
                        .authorId(JdbcTimes.nullableLong(rs, "author_id"))
                        .blogCount(rs.getLong("blog_count"))
                        .build(),
                granularity.getToken(), JdbcTimes.toDb(window.getStart()), JdbcTimes.toDb(window.getEnd()));
    }

    /** Bucket başına blog_count toplamı; filtre null ise sadece toplam satırları okunur. */
    public List<BucketTotal> sumBlogsByBucket(Granularity granularity, Instant from, Instant to, SqlFragment filter) {
        StringBuilder sql = new StringBuilder("""
                SELECT r.time_bucket AS time_bucket, SUM(r.blog_count) AS total
                FROM blog_creation_rollups r
                LEFT JOIN countries c ON c.id = r.country_id
                LEFT JOIN authors a ON a.id = r.author_id
                LEFT JOIN users u ON u.id = a.user_id
                WHERE r.granularity = ?
                """);
        List<Object> params = new ArrayList<>();
        params.add(granularity.getToken());

        if (from != null) {
            sql.append("  AND r.time_bucket >= ?\n");
            params.add(JdbcTimes.toDb(from));
        }
        if (to != null) {
            sql.append("  AND r.time_bucket < ?\n");
            params.add(JdbcTimes.toDb(to));
        }
        if (filter == null) {
            sql.append("  AND r.country_id IS NULL AND r.author_id IS NULL\n");
        } else {
            sql.append("  AND NOT (r.country_id IS NULL AND r.author_id IS NULL)\n");
            sql.append("  AND ").append(filter.getSql()).append('\n');
            params.addAll(filter.getParams());
        }
        sql.append("GROUP BY r.time_bucket ORDER BY r.time_bucket");

        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> BucketTotal.builder()
                .timeBucket(JdbcTimes.instant(rs, "time_bucket"))
                .total(rs.getLong("total"))
                .build(), params.toArray());
    }

    public int deleteInWindow(Granularity granularity, PeriodBounds window) {
        int deleted = jdbcTemplate.update(
                "DELETE FROM blog_creation_rollups WHERE granularity = ? AND time_bucket >= ? AND time_bucket < ?",
                granularity.getToken(), JdbcTimes.toDb(window.getStart()), JdbcTimes.toDb(window.getEnd()));
        log.info("Deleted {} {} creation rollups in [{}, {})", deleted, granularity.getToken(),
                window.getStart(), window.getEnd());
        return deleted;
    }
}
