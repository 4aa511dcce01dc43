package com.shopcrawl.crawl.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopcrawl.crawl.model.CrawlJob;
import com.shopcrawl.crawl.model.CrawlJobStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.shopcrawl.crawl.persistence.JdbcDialect.toInstant;
import static com.shopcrawl.crawl.persistence.JdbcDialect.toTimestamp;

@Repository
public class CrawlJobRepository {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final int MAX_DETAIL_LENGTH = 500;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public CrawlJobRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("crawl_jobs", countTable("crawl_jobs"));
        counts.put("frontier_entries", countTable("frontier_entries"));
        counts.put("visited_urls", countTable("visited_urls"));
        counts.put("crawl_results", countTable("crawl_results"));
        counts.put("domain_state", countTable("domain_state"));
        return counts;
    }

    public void insertJob(CrawlJob job) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", job.id())
            .addValue("seedDomains", writeSeeds(job.seedDomains()))
            .addValue("maxDepth", job.maxDepth())
            .addValue("status", job.status().name())
            .addValue("createdAt", toTimestamp(job.createdAt()));
        jdbc.update(
            """
                INSERT INTO crawl_jobs (id, seed_domains, max_depth, status, created_at, updated_at)
                VALUES (:id, :seedDomains, :maxDepth, :status, :createdAt, :createdAt)
                """,
            params
        );
    }

    public CrawlJob findJob(String jobId) {
        List<CrawlJob> rows = jdbc.query(
            """
                SELECT id, seed_domains, max_depth, status, status_detail, created_at, finished_at
                FROM crawl_jobs
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", jobId),
            jobMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<CrawlJob> findRecentJobs(int limit) {
        return jdbc.query(
            """
                SELECT id, seed_domains, max_depth, status, status_detail, created_at, finished_at
                FROM crawl_jobs
                ORDER BY created_at DESC, id
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            jobMapper()
        );
    }

    public List<String> findJobIdsByStatus(CrawlJobStatus status) {
        return jdbc.query(
            """
                SELECT id
                FROM crawl_jobs
                WHERE status = :status
                ORDER BY created_at
                """,
            new MapSqlParameterSource("status", status.name()),
            (rs, rowNum) -> rs.getString("id")
        );
    }

    /**
     * Moves the job from {@code expected} to {@code next}; false when another caller got there first.
     */
    public boolean transitionStatus(
        String jobId,
        CrawlJobStatus expected,
        CrawlJobStatus next,
        Instant at,
        String detail
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("expected", expected.name())
            .addValue("next", next.name())
            .addValue("finishedAt", next.isTerminal() ? toTimestamp(at) : null)
            .addValue("detail", truncate(detail))
            .addValue("now", toTimestamp(at));
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = :next,
                    finished_at = :finishedAt,
                    status_detail = :detail,
                    updated_at = :now
                WHERE id = :id
                  AND status = :expected
                """,
            params
        );
        return updated == 1;
    }

    private RowMapper<CrawlJob> jobMapper() {
        return (rs, rowNum) -> new CrawlJob(
            rs.getString("id"),
            readSeeds(rs.getString("seed_domains")),
            rs.getInt("max_depth"),
            CrawlJobStatus.valueOf(rs.getString("status")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("finished_at")),
            rs.getString("status_detail")
        );
    }

    private String writeSeeds(List<String> seeds) {
        try {
            return objectMapper.writeValueAsString(seeds == null ? List.of() : seeds);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize seed domains", e);
        }
    }

    private List<String> readSeeds(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt seed_domains column: " + json, e);
        }
    }

    private long countTable(String table) {
        Long value = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return value == null ? 0L : value;
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= MAX_DETAIL_LENGTH) {
            return detail;
        }
        return detail.substring(0, MAX_DETAIL_LENGTH);
    }
}
