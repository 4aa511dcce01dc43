package com.shopcrawl.crawl.persistence;

import com.shopcrawl.crawl.model.CrawlJobStatus;
import com.shopcrawl.crawl.model.FrontierEntry;
import com.shopcrawl.crawl.model.FrontierEntryState;
import com.shopcrawl.crawl.model.FrontierStats;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.shopcrawl.crawl.persistence.JdbcDialect.toInstant;
import static com.shopcrawl.crawl.persistence.JdbcDialect.toTimestamp;

@Repository
public class FrontierRepository {
    private static final int MAX_ERROR_CLASS_LENGTH = 64;

    private final NamedParameterJdbcTemplate jdbc;

    public FrontierRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insertQueued(String jobId, String url, String domain, int depth, Instant discoveredAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("url", url)
            .addValue("domain", domain)
            .addValue("depth", depth)
            .addValue("state", FrontierEntryState.QUEUED.name())
            .addValue("now", toTimestamp(discoveredAt));
        jdbc.update(
            """
                INSERT INTO frontier_entries (
                    job_id, url, domain, depth, discovered_at, attempt_count,
                    state, next_attempt_at, updated_at
                )
                VALUES (:jobId, :url, :domain, :depth, :now, 0, :state, :now, :now)
                """,
            params
        );
    }


    public List<FrontierEntry> findEntriesForJob(String jobId) {
        return jdbc.query(
            """
                SELECT *
                FROM frontier_entries
                WHERE job_id = :jobId
                ORDER BY discovered_at, id
                """,
            new MapSqlParameterSource("jobId", jobId),
            entryMapper()
        );
    }

    /**
     * RETRYING entries whose backoff elapsed become QUEUED again. Safe to run from any number of workers.
     */
    public int promoteDueRetries(Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("retrying", FrontierEntryState.RETRYING.name())
            .addValue("queued", FrontierEntryState.QUEUED.name())
            .addValue("now", toTimestamp(now));
        return jdbc.update(
            """
                UPDATE frontier_entries
                SET state = :queued,
                    updated_at = :now
                WHERE state = :retrying
                  AND next_attempt_at <= :now
                """,
            params
        );
    }

    public List<String> findReadyDomains(Instant now, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("queued", FrontierEntryState.QUEUED.name())
            .addValue("running", CrawlJobStatus.RUNNING.name())
            .addValue("now", toTimestamp(now))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT DISTINCT fe.domain
                FROM frontier_entries fe
                JOIN crawl_jobs cj ON cj.id = fe.job_id
                WHERE fe.state = :queued
                  AND fe.next_attempt_at <= :now
                  AND cj.status = :running
                ORDER BY fe.domain
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> rs.getString("domain")
        );
    }

    /**
     * Oldest ready entries of a domain, FIFO by discovery time.
     */
    public List<FrontierEntry> findReadyForDomain(String domain, Instant now, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("domain", domain)
            .addValue("queued", FrontierEntryState.QUEUED.name())
            .addValue("running", CrawlJobStatus.RUNNING.name())
            .addValue("now", toTimestamp(now))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT fe.*
                FROM frontier_entries fe
                JOIN crawl_jobs cj ON cj.id = fe.job_id
                WHERE fe.domain = :domain
                  AND fe.state = :queued
                  AND fe.next_attempt_at <= :now
                  AND cj.status = :running
                ORDER BY fe.discovered_at, fe.id
                LIMIT :limit
                """,
            params,
            entryMapper()
        );
    }

    /**
     * QUEUED to IN_FLIGHT, only if nobody else moved the entry first.
     */
    public boolean claim(long id, String owner, Instant now, Instant leaseExpiresAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("owner", owner)
            .addValue("queued", FrontierEntryState.QUEUED.name())
            .addValue("inFlight", FrontierEntryState.IN_FLIGHT.name())
            .addValue("leaseExpiresAt", toTimestamp(leaseExpiresAt))
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE frontier_entries
                SET state = :inFlight,
                    lease_owner = :owner,
                    lease_expires_at = :leaseExpiresAt,
                    attempt_count = attempt_count + 1,
                    updated_at = :now
                WHERE id = :id
                  AND state = :queued
                """,
            params
        );
        return updated == 1;
    }

    /**
     * Removes an IN_FLIGHT entry held by {@code owner} at {@code attempt}. False when the lease was lost.
     */
    public boolean deleteLeased(long id, String owner, int attempt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("owner", owner)
            .addValue("attempt", attempt)
            .addValue("inFlight", FrontierEntryState.IN_FLIGHT.name());
        int deleted = jdbc.update(
            """
                DELETE FROM frontier_entries
                WHERE id = :id
                  AND state = :inFlight
                  AND lease_owner = :owner
                  AND attempt_count = :attempt
                """,
            params
        );
        return deleted == 1;
    }

    public boolean markRetrying(
        long id,
        String owner,
        int attempt,
        Instant nextAttemptAt,
        String errorClass,
        Integer httpStatus,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("owner", owner)
            .addValue("attempt", attempt)
            .addValue("inFlight", FrontierEntryState.IN_FLIGHT.name())
            .addValue("retrying", FrontierEntryState.RETRYING.name())
            .addValue("nextAttemptAt", toTimestamp(nextAttemptAt))
            .addValue("errorClass", truncate(errorClass))
            .addValue("httpStatus", httpStatus)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE frontier_entries
                SET state = :retrying,
                    next_attempt_at = :nextAttemptAt,
                    lease_owner = NULL,
                    lease_expires_at = NULL,
                    last_error_class = :errorClass,
                    last_http_status = :httpStatus,
                    updated_at = :now
                WHERE id = :id
                  AND state = :inFlight
                  AND lease_owner = :owner
                  AND attempt_count = :attempt
                """,
            params
        );
        return updated == 1;
    }

    public List<FrontierEntry> findExpiredLeases(Instant now, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("inFlight", FrontierEntryState.IN_FLIGHT.name())
            .addValue("now", toTimestamp(now))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT *
                FROM frontier_entries
                WHERE state = :inFlight
                  AND lease_expires_at < :now
                ORDER BY lease_expires_at, id
                LIMIT :limit
                """,
            params,
            entryMapper()
        );
    }

    /**
     * Requeues an entry whose lease expired. Matching on the observed lease makes the recovery happen once.
     */
    public boolean requeueExpired(
        long id,
        String owner,
        int attempt,
        Instant nextAttemptAt,
        String errorClass,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("owner", owner)
            .addValue("attempt", attempt)
            .addValue("inFlight", FrontierEntryState.IN_FLIGHT.name())
            .addValue("retrying", FrontierEntryState.RETRYING.name())
            .addValue("nextAttemptAt", toTimestamp(nextAttemptAt))
            .addValue("errorClass", truncate(errorClass))
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE frontier_entries
                SET state = :retrying,
                    next_attempt_at = :nextAttemptAt,
                    lease_owner = NULL,
                    lease_expires_at = NULL,
                    last_error_class = :errorClass,
                    last_http_status = NULL,
                    updated_at = :now
                WHERE id = :id
                  AND state = :inFlight
                  AND lease_owner = :owner
                  AND attempt_count = :attempt
                  AND lease_expires_at < :now
                """,
            params
        );
        return updated == 1;
    }

    public boolean deleteExpired(long id, String owner, int attempt, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("owner", owner)
            .addValue("attempt", attempt)
            .addValue("inFlight", FrontierEntryState.IN_FLIGHT.name())
            .addValue("now", toTimestamp(now));
        int deleted = jdbc.update(
            """
                DELETE FROM frontier_entries
                WHERE id = :id
                  AND state = :inFlight
                  AND lease_owner = :owner
                  AND attempt_count = :attempt
                  AND lease_expires_at < :now
                """,
            params
        );
        return deleted == 1;
    }

    public int deletePending(String jobId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("queued", FrontierEntryState.QUEUED.name())
            .addValue("retrying", FrontierEntryState.RETRYING.name());
        return jdbc.update(
            """
                DELETE FROM frontier_entries
                WHERE job_id = :jobId
                  AND state IN (:queued, :retrying)
                """,
            params
        );
    }

    /**
     * Pending entries left behind by jobs that are no longer running (a cancel racing an enqueue).
     */
    public int deletePendingOfInactiveJobs() {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("queued", FrontierEntryState.QUEUED.name())
            .addValue("retrying", FrontierEntryState.RETRYING.name())
            .addValue("running", CrawlJobStatus.RUNNING.name());
        return jdbc.update(
            """
                DELETE FROM frontier_entries
                WHERE state IN (:queued, :retrying)
                  AND job_id IN (
                      SELECT id FROM crawl_jobs WHERE status <> :running
                  )
                """,
            params
        );
    }

    public FrontierStats stats(String jobId) {
        MapSqlParameterSource params = new MapSqlParameterSource("jobId", jobId);
        long[] counts = new long[3];
        jdbc.query(
            """
                SELECT state, COUNT(*) AS cnt
                FROM frontier_entries
                WHERE job_id = :jobId
                GROUP BY state
                """,
            params,
            rs -> {
                FrontierEntryState state = FrontierEntryState.valueOf(rs.getString("state"));
                long count = rs.getLong("cnt");
                switch (state) {
                    case QUEUED -> counts[0] += count;
                    case IN_FLIGHT -> counts[1] += count;
                    case RETRYING -> counts[2] += count;
                    default -> {
                        // DONE and DEAD rows are deleted on transition
                    }
                }
            }
        );
        return new FrontierStats(counts[0], counts[1], counts[2]);
    }

    public long countInFlightForDomain(String domain) {
        Long value = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM frontier_entries
                WHERE domain = :domain
                  AND state = :inFlight
                """,
            new MapSqlParameterSource()
                .addValue("domain", domain)
                .addValue("inFlight", FrontierEntryState.IN_FLIGHT.name()),
            Long.class
        );
        return value == null ? 0L : value;
    }

    private RowMapper<FrontierEntry> entryMapper() {
        return (rs, rowNum) -> {
            int httpStatus = rs.getInt("last_http_status");
            Integer lastHttpStatus = rs.wasNull() ? null : httpStatus;
            return new FrontierEntry(
                rs.getLong("id"),
                rs.getString("job_id"),
                rs.getString("url"),
                rs.getString("domain"),
                rs.getInt("depth"),
                toInstant(rs.getTimestamp("discovered_at")),
                rs.getInt("attempt_count"),
                FrontierEntryState.valueOf(rs.getString("state")),
                toInstant(rs.getTimestamp("next_attempt_at")),
                rs.getString("lease_owner"),
                toInstant(rs.getTimestamp("lease_expires_at")),
                rs.getString("last_error_class"),
                lastHttpStatus
            );
        };
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_CLASS_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_CLASS_LENGTH);
    }
}
