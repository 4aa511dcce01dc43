package com.shopcrawl.crawl.persistence;

import com.shopcrawl.crawl.model.BreakerState;
import com.shopcrawl.crawl.model.DomainState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.shopcrawl.crawl.persistence.JdbcDialect.toInstant;
import static com.shopcrawl.crawl.persistence.JdbcDialect.toTimestamp;

@Repository
public class DomainStateRepository {
    private static final Logger log = LoggerFactory.getLogger(DomainStateRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final JdbcDialect dialect;

    public DomainStateRepository(NamedParameterJdbcTemplate jdbc, JdbcDialect dialect) {
        this.jdbc = jdbc;
        this.dialect = dialect;
    }

    public void insertIfAbsent(String domain, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("domain", domain)
            .addValue("closed", BreakerState.CLOSED.name())
            .addValue("now", toTimestamp(now));
        if (dialect.isPostgres()) {
            jdbc.update(
                """
                    INSERT INTO domain_state (domain, in_flight, consecutive_failures, breaker_state, updated_at)
                    VALUES (:domain, 0, 0, :closed, :now)
                    ON CONFLICT (domain) DO NOTHING
                    """,
                params
            );
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO domain_state (domain, in_flight, consecutive_failures, breaker_state, updated_at)
                    VALUES (:domain, 0, 0, :closed, :now)
                    """,
                params
            );
        } catch (DuplicateKeyException e) {
            log.debug("Domain state for {} already present", domain);
        }
    }

    public DomainState find(String domain) {
        List<DomainState> rows = jdbc.query(
            """
                SELECT domain, last_dispatch_at, in_flight, consecutive_failures, breaker_state, open_until
                FROM domain_state
                WHERE domain = :domain
                """,
            new MapSqlParameterSource("domain", domain),
            domainMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Row-locks the domain for the rest of the surrounding transaction.
     */
    public DomainState findForUpdate(String domain) {
        List<DomainState> rows = jdbc.query(
            """
                SELECT domain, last_dispatch_at, in_flight, consecutive_failures, breaker_state, open_until
                FROM domain_state
                WHERE domain = :domain
                FOR UPDATE
                """,
            new MapSqlParameterSource("domain", domain),
            domainMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public void update(DomainState state, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("domain", state.domain())
            .addValue("lastDispatchAt", toTimestamp(state.lastDispatchAt()))
            .addValue("inFlight", Math.max(0, state.inFlight()))
            .addValue("failures", Math.max(0, state.consecutiveFailures()))
            .addValue("breakerState", state.breakerState().name())
            .addValue("openUntil", toTimestamp(state.openUntil()))
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                UPDATE domain_state
                SET last_dispatch_at = :lastDispatchAt,
                    in_flight = :inFlight,
                    consecutive_failures = :failures,
                    breaker_state = :breakerState,
                    open_until = :openUntil,
                    updated_at = :now
                WHERE domain = :domain
                """,
            params
        );
    }

    private RowMapper<DomainState> domainMapper() {
        return (rs, rowNum) -> new DomainState(
            rs.getString("domain"),
            toInstant(rs.getTimestamp("last_dispatch_at")),
            rs.getInt("in_flight"),
            rs.getInt("consecutive_failures"),
            BreakerState.valueOf(rs.getString("breaker_state")),
            toInstant(rs.getTimestamp("open_until"))
        );
    }
}
