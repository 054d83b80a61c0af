package com.schedulinglinks.aggregator.crawl.persistence;

import com.schedulinglinks.aggregator.crawl.model.FetchAttempt;
import com.schedulinglinks.aggregator.crawl.model.ResourceCacheEntry;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class ResourceCacheJdbcRepository {
    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public ResourceCacheJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
    }

    public ResourceCacheEntry findCacheEntry(String url) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", url);
        List<ResourceCacheEntry> rows = jdbc.query(
            """
                SELECT url,
                       fetch_sec,
                       expires_at_sec,
                       etag,
                       data
                FROM resource_cache
                WHERE url = :url
                """,
            params,
            (rs, rowNum) -> new ResourceCacheEntry(
                rs.getString("url"),
                JdbcSupport.toInstant(rs.getLong("fetch_sec")),
                JdbcSupport.toInstant(rs.getLong("expires_at_sec")),
                rs.getString("etag"),
                rs.getString("data")
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public void upsertCacheEntry(ResourceCacheEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", entry.url())
            .addValue("fetchSec", JdbcSupport.toEpochSecond(entry.fetchAt()))
            .addValue("expiresAtSec", JdbcSupport.toEpochSecond(entry.expiresAt()))
            .addValue("etag", entry.etag())
            .addValue("data", entry.body());
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO resource_cache (url, fetch_sec, expires_at_sec, etag, data)
                    VALUES (:url, :fetchSec, :expiresAtSec, :etag, :data)
                    ON CONFLICT (url)
                    DO UPDATE SET
                        fetch_sec = EXCLUDED.fetch_sec,
                        expires_at_sec = EXCLUDED.expires_at_sec,
                        etag = EXCLUDED.etag,
                        data = EXCLUDED.data
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO resource_cache (url, fetch_sec, expires_at_sec, etag, data)
                KEY(url)
                VALUES (:url, :fetchSec, :expiresAtSec, :etag, :data)
                """,
            params
        );
    }

    /**
     * Moves the freshness window of an existing entry after a 304, leaving body and ETag untouched.
     */
    public int refreshCacheEntry(String url, Instant fetchAt, Instant expiresAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", url)
            .addValue("fetchSec", JdbcSupport.toEpochSecond(fetchAt))
            .addValue("expiresAtSec", JdbcSupport.toEpochSecond(expiresAt));
        return jdbc.update(
            """
                UPDATE resource_cache
                SET fetch_sec = :fetchSec,
                    expires_at_sec = :expiresAtSec
                WHERE url = :url
                """,
            params
        );
    }

    public void insertFetchAttempt(FetchAttempt attempt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", attempt.url())
            .addValue("fetchSec", JdbcSupport.toEpochSecond(attempt.fetchAt()))
            .addValue("statusCode", attempt.statusCode());
        jdbc.update(
            """
                INSERT INTO fetch_attempts (url, fetch_sec, status_code)
                VALUES (:url, :fetchSec, :statusCode)
                """,
            params
        );
    }

    public FetchAttempt findLastFetchAttempt(String url) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", url);
        List<FetchAttempt> rows = jdbc.query(
            """
                SELECT url, fetch_sec, status_code
                FROM fetch_attempts
                WHERE url = :url
                ORDER BY fetch_sec DESC, id DESC
                LIMIT 1
                """,
            params,
            (rs, rowNum) -> new FetchAttempt(
                rs.getString("url"),
                JdbcSupport.toInstant(rs.getLong("fetch_sec")),
                rs.getInt("status_code")
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public int countFetchAttempts(String url) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM fetch_attempts WHERE url = :url",
            new MapSqlParameterSource().addValue("url", url),
            Integer.class
        );
        return count == null ? 0 : count;
    }
}
