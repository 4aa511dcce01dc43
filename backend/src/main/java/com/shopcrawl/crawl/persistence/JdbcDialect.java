package com.shopcrawl.crawl.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Locale;

/**
 * Postgres in production, H2 in tests. Upsert syntax is the only place the two differ.
 */
@Component
public class JdbcDialect {
    private static final Logger log = LoggerFactory.getLogger(JdbcDialect.class);

    private final boolean postgres;

    public JdbcDialect(NamedParameterJdbcTemplate jdbc) {
        this.postgres = detectPostgres(jdbc);
    }

    public boolean isPostgres() {
        return postgres;
    }

    static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    static Instant toInstant(Timestamp value) {
        return value == null ? null : value.toInstant();
    }

    private static boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to portable upserts", e);
            return false;
        }
    }
}
