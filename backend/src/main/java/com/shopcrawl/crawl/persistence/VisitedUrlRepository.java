package com.shopcrawl.crawl.persistence;

import com.shopcrawl.crawl.model.VisitedRecord;
import com.shopcrawl.crawl.util.HashUtils;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.shopcrawl.crawl.persistence.JdbcDialect.toInstant;
import static com.shopcrawl.crawl.persistence.JdbcDialect.toTimestamp;

@Repository
public class VisitedUrlRepository {
    private final NamedParameterJdbcTemplate jdbc;
    private final JdbcDialect dialect;

    public VisitedUrlRepository(NamedParameterJdbcTemplate jdbc, JdbcDialect dialect) {
        this.jdbc = jdbc;
        this.dialect = dialect;
    }

    /**
     * Write-once insert keyed by (job, URL hash). Returns true only for the caller whose row landed.
     */
    public boolean insertIfAbsent(String jobId, String normalizedUrl, int depth, Instant seenAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("urlHash", HashUtils.urlKey(normalizedUrl))
            .addValue("url", normalizedUrl)
            .addValue("depth", depth)
            .addValue("seenAt", toTimestamp(seenAt));
        if (dialect.isPostgres()) {
            int inserted = jdbc.update(
                """
                    INSERT INTO visited_urls (job_id, url_hash, url, first_depth, first_seen_at)
                    VALUES (:jobId, :urlHash, :url, :depth, :seenAt)
                    ON CONFLICT (job_id, url_hash) DO NOTHING
                    """,
                params
            );
            return inserted == 1;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO visited_urls (job_id, url_hash, url, first_depth, first_seen_at)
                    VALUES (:jobId, :urlHash, :url, :depth, :seenAt)
                    """,
                params
            );
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public VisitedRecord find(String jobId, String normalizedUrl) {
        List<VisitedRecord> rows = jdbc.query(
            """
                SELECT job_id, url, first_depth, first_seen_at
                FROM visited_urls
                WHERE job_id = :jobId
                  AND url_hash = :urlHash
                """,
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("urlHash", HashUtils.urlKey(normalizedUrl)),
            (rs, rowNum) -> new VisitedRecord(
                rs.getString("job_id"),
                rs.getString("url"),
                rs.getInt("first_depth"),
                toInstant(rs.getTimestamp("first_seen_at"))
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public long countForJob(String jobId) {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM visited_urls WHERE job_id = :jobId",
            new MapSqlParameterSource("jobId", jobId),
            Long.class
        );
        return value == null ? 0L : value;
    }
}
