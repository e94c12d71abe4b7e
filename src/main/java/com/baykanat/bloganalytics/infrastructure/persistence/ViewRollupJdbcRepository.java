package com.baykanat.bloganalytics.infrastructure.persistence;

import com.baykanat.bloganalytics.domain.model.BucketTotal;
import com.baykanat.bloganalytics.domain.model.Granularity;
import com.baykanat.bloganalytics.domain.model.PeriodBounds;
import com.baykanat.bloganalytics.domain.model.ViewRollup;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.SqlFragment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * blog_view_rollups tablosu. Tek yazma yolu upsert: INSERT ... ON CONFLICT DO UPDATE (NULLS NOT DISTINCT unique key),
 * yani aynı anahtara eşzamanlı yazımlar da tek satırda son metriklerle biter.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ViewRollupJdbcRepository {

    private static final String UPSERT_SQL = """
            INSERT INTO blog_view_rollups (granularity, time_bucket, blog_id, country_id, author_id,
                                           view_count, unique_blogs_viewed, unique_users, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, NOW(), NOW())
            ON CONFLICT (granularity, time_bucket, blog_id, country_id, author_id)
            DO UPDATE SET
              view_count = EXCLUDED.view_count,
              unique_blogs_viewed = EXCLUDED.unique_blogs_viewed,
              unique_users = EXCLUDED.unique_users,
              updated_at = NOW()
            """;

    private static final String FILTERED_FROM = """
            FROM blog_view_rollups r
            LEFT JOIN countries c ON c.id = r.country_id
            LEFT JOIN authors a ON a.id = r.author_id
            LEFT JOIN users u ON u.id = a.user_id
            """;

    private final JdbcTemplate jdbcTemplate;

    /** Satırları batch upsert eder (üzerine yazma, artırma değil); yazılan satır sayısını döner. */
    public int upsertAll(List<ViewRollup> rollups) {
        if (rollups.isEmpty()) {
            return 0;
        }
        jdbcTemplate.batchUpdate(UPSERT_SQL, rollups, rollups.size(), (ps, rollup) -> {
            ps.setString(1, rollup.getGranularity().getToken());
            ps.setObject(2, JdbcTimes.toDb(rollup.getTimeBucket()));
            setNullableLong(ps, 3, rollup.getBlogId());
            setNullableLong(ps, 4, rollup.getCountryId());
            setNullableLong(ps, 5, rollup.getAuthorId());
            ps.setLong(6, rollup.getViewCount());
            ps.setLong(7, rollup.getUniqueBlogsViewed());
            ps.setLong(8, rollup.getUniqueUsers());
        });
        return rollups.size();
    }

    /** Tek satır upsert. */
    public void upsert(ViewRollup rollup) {
        upsertAll(List.of(rollup));
    }

    public List<ViewRollup> findInWindow(Granularity granularity, PeriodBounds window) {
        return jdbcTemplate.query("""
                SELECT granularity, time_bucket, blog_id, country_id, author_id,
                       view_count, unique_blogs_viewed, unique_users
                FROM blog_view_rollups
                WHERE granularity = ? AND time_bucket >= ? AND time_bucket < ?
                ORDER BY time_bucket, id
                """, (rs, rowNum) -> ViewRollup.builder()
                        .granularity(Granularity.fromToken(rs.getString("granularity")))
                        .timeBucket(JdbcTimes.instant(rs, "time_bucket"))
                        .blogId(JdbcTimes.nullableLong(rs, "blog_id"))
                        .countryId(JdbcTimes.nullableLong(rs, "country_id"))
                        .authorId(JdbcTimes.nullableLong(rs, "author_id"))
                        .viewCount(rs.getLong("view_count"))
                        .uniqueBlogsViewed(rs.getLong("unique_blogs_viewed"))
                        .uniqueUsers(rs.getLong("unique_users"))
                        .build(),
                granularity.getToken(), JdbcTimes.toDb(window.getStart()), JdbcTimes.toDb(window.getEnd()));
    }

    /**
     * Bucket başına view_count toplamı. Filtre yoksa sadece toplam satırları (tüm dimension'lar null),
     * filtre varsa filtreye uyan dimension satırları toplanır; toplam satırı hiçbir zaman ikinci kez sayılmaz.
     */
    public List<BucketTotal> sumViewsByBucket(Granularity granularity, Instant from, Instant to, SqlFragment filter) {
        StringBuilder sql = new StringBuilder("SELECT r.time_bucket AS time_bucket, SUM(r.view_count) AS total\n")
                .append(FILTERED_FROM)
                .append("WHERE r.granularity = ?\n");
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
            sql.append("  AND r.blog_id IS NULL AND r.country_id IS NULL AND r.author_id IS NULL\n");
        } else {
            sql.append("  AND NOT (r.blog_id IS NULL AND r.country_id IS NULL AND r.author_id IS NULL)\n");
            sql.append("  AND ").append(filter.getSql()).append('\n');
            params.addAll(filter.getParams());
        }
        sql.append("GROUP BY r.time_bucket ORDER BY r.time_bucket");

        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> BucketTotal.builder()
                .timeBucket(JdbcTimes.instant(rs, "time_bucket"))
                .total(rs.getLong("total"))
                .build(), params.toArray());
    }

    /** Backfill --clear: penceredeki bu granularity satırlarını siler. */
    public int deleteInWindow(Granularity granularity, PeriodBounds window) {
        int deleted = jdbcTemplate.update(
                "DELETE FROM blog_view_rollups WHERE granularity = ? AND time_bucket >= ? AND time_bucket < ?",
                granularity.getToken(), JdbcTimes.toDb(window.getStart()), JdbcTimes.toDb(window.getEnd()));
        log.info("Deleted {} {} view rollups in [{}, {})", deleted, granularity.getToken(),
                window.getStart(), window.getEnd());
        return deleted;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value != null) {
            ps.setLong(index, value);
        } else {
            ps.setNull(index, Types.BIGINT);
        }
    }
}
