package com.shopcrawl.crawl.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopcrawl.crawl.model.CrawlResult;
import com.shopcrawl.crawl.model.CrawlResultStatus;
import com.shopcrawl.crawl.util.HashUtils;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.shopcrawl.crawl.persistence.JdbcDialect.toInstant;
import static com.shopcrawl.crawl.persistence.JdbcDialect.toTimestamp;

@Repository
public class CrawlResultRepository {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final JdbcDialect dialect;
    private final ObjectMapper objectMapper;

    public CrawlResultRepository(NamedParameterJdbcTemplate jdbc, JdbcDialect dialect, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.dialect = dialect;
        this.objectMapper = objectMapper;
    }

    /**
     * One row per (job, URL); recording the same outcome again overwrites it.
     */
    public void upsert(CrawlResult result) {
        List<String> links = result.links() == null ? List.of() : result.links();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", result.jobId())
            .addValue("urlHash", HashUtils.urlKey(result.url()))
            .addValue("url", result.url())
            .addValue("domain", result.domain())
            .addValue("depth", result.depth())
            .addValue("status", result.status().name())
            .addValue("httpStatus", result.httpStatus())
            .addValue("errorClass", result.errorClass())
            .addValue("linksFound", links.size())
            .addValue("links", writeLinks(links))
            .addValue("durationMs", result.fetchDurationMs())
            .addValue("attempt", result.attempt())
            .addValue("recordedAt", toTimestamp(result.recordedAt()));

        if (dialect.isPostgres()) {
            jdbc.update(
                """
                    INSERT INTO crawl_results (
                        job_id, url_hash, url, domain, depth, status, http_status, error_class,
                        links_found, links, fetch_duration_ms, attempt, recorded_at
                    )
                    VALUES (
                        :jobId, :urlHash, :url, :domain, :depth, :status, :httpStatus, :errorClass,
                        :linksFound, :links, :durationMs, :attempt, :recordedAt
                    )
                    ON CONFLICT (job_id, url_hash)
                    DO UPDATE SET
                        status = EXCLUDED.status,
                        http_status = EXCLUDED.http_status,
                        error_class = EXCLUDED.error_class,
                        links_found = EXCLUDED.links_found,
                        links = EXCLUDED.links,
                        fetch_duration_ms = EXCLUDED.fetch_duration_ms,
                        attempt = EXCLUDED.attempt,
                        recorded_at = EXCLUDED.recorded_at
                    """,
                params
            );
            return;
        }

        jdbc.update(
            """
                MERGE INTO crawl_results (
                    job_id, url_hash, url, domain, depth, status, http_status, error_class,
                    links_found, links, fetch_duration_ms, attempt, recorded_at
                )
                KEY(job_id, url_hash)
                VALUES (
                    :jobId, :urlHash, :url, :domain, :depth, :status, :httpStatus, :errorClass,
                    :linksFound, :links, :durationMs, :attempt, :recordedAt
                )
                """,
            params
        );
    }

    public List<CrawlResult> findResults(String jobId, CrawlResultStatus status, String domain, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 5000));
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("limit", safeLimit);
        StringBuilder sql = new StringBuilder(
            """
                SELECT job_id, url, domain, depth, status, http_status, error_class, links,
                       fetch_duration_ms, attempt, recorded_at
                FROM crawl_results
                WHERE job_id = :jobId
                """
        );
        if (status != null) {
            sql.append("  AND status = :status\n");
            params.addValue("status", status.name());
        }
        if (domain != null && !domain.isBlank()) {
            sql.append("  AND domain = :domain\n");
            params.addValue("domain", domain.trim());
        }
        sql.append("ORDER BY depth, recorded_at, url\nLIMIT :limit");
        return jdbc.query(sql.toString(), params, resultMapper());
    }

    public Map<CrawlResultStatus, Long> countByStatus(String jobId) {
        Map<CrawlResultStatus, Long> counts = new EnumMap<>(CrawlResultStatus.class);
        for (CrawlResultStatus status : CrawlResultStatus.values()) {
            counts.put(status, 0L);
        }
        jdbc.query(
            """
                SELECT status, COUNT(*) AS cnt
                FROM crawl_results
                WHERE job_id = :jobId
                GROUP BY status
                """,
            new MapSqlParameterSource("jobId", jobId),
            rs -> {
                counts.put(CrawlResultStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
            }
        );
        return counts;
    }

    private RowMapper<CrawlResult> resultMapper() {
        return (rs, rowNum) -> new CrawlResult(
            rs.getString("job_id"),
            rs.getString("url"),
            rs.getString("domain"),
            rs.getInt("depth"),
            CrawlResultStatus.valueOf(rs.getString("status")),
            readLinks(rs.getString("links")),
            rs.getObject("http_status", Integer.class),
            rs.getString("error_class"),
            rs.getLong("fetch_duration_ms"),
            rs.getInt("attempt"),
            toInstant(rs.getTimestamp("recorded_at"))
        );
    }

    private String writeLinks(List<String> links) {
        try {
            return objectMapper.writeValueAsString(links);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize links", e);
        }
    }

    private List<String> readLinks(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt links column", e);
        }
    }
}
