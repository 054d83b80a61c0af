package com.schedulinglinks.aggregator.crawl.persistence;

import com.schedulinglinks.aggregator.crawl.model.FileType;
import com.schedulinglinks.aggregator.crawl.model.KnownManifest;
import com.schedulinglinks.aggregator.crawl.model.LeafFetch;
import com.schedulinglinks.aggregator.crawl.model.ManifestFetch;
import com.schedulinglinks.aggregator.crawl.model.UsState;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class CrawlJdbcRepository {
    private static final RowMapper<KnownManifest> KNOWN_MANIFEST_MAPPER = (rs, rowNum) -> new KnownManifest(
        rs.getLong("id"),
        rs.getString("url")
    );
    private static final RowMapper<ManifestFetch> MANIFEST_FETCH_MAPPER = (rs, rowNum) -> new ManifestFetch(
        rs.getLong("id"),
        rs.getString("url"),
        rs.getLong("known_manifest_id"),
        JdbcSupport.toInstant(rs.getLong("read_sec")),
        rs.getInt("fetch_status_code"),
        JdbcSupport.nullableLong(rs, "polling_hint_sec"),
        rs.getString("contents"),
        rs.getString("error_code")
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public CrawlJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("known_manifests", countTable("known_manifests"));
        counts.put("manifest_fetches", countTable("manifest_fetches"));
        counts.put("location_fetches", countTable("location_fetches"));
        counts.put("schedule_fetches", countTable("schedule_fetches"));
        counts.put("slot_fetches", countTable("slot_fetches"));
        counts.put("resource_cache", countTable("resource_cache"));
        counts.put("fetch_attempts", countTable("fetch_attempts"));
        return counts;
    }

    public List<KnownManifest> findKnownManifests() {
        return jdbc.query(
            "SELECT id, url FROM known_manifests ORDER BY id",
            new MapSqlParameterSource(),
            KNOWN_MANIFEST_MAPPER
        );
    }

    public KnownManifest findKnownManifestByUrl(String url) {
        List<KnownManifest> rows = jdbc.query(
            "SELECT id, url FROM known_manifests WHERE url = :url",
            new MapSqlParameterSource().addValue("url", url),
            KNOWN_MANIFEST_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public KnownManifest insertKnownManifestIfAbsent(String url) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", url);
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO known_manifests (url)
                    VALUES (:url)
                    ON CONFLICT (url) DO NOTHING
                    """,
                params
            );
        } else {
            jdbc.update(
                """
                    MERGE INTO known_manifests (url)
                    KEY(url)
                    VALUES (:url)
                    """,
                params
            );
        }
        return findKnownManifestByUrl(url);
    }

    public ManifestFetch findLastManifestFetch(long knownManifestId, boolean onlySuccess) {
        String successFilter = onlySuccess ? "AND contents IS NOT NULL" : "";
        List<ManifestFetch> rows = jdbc.query(
            """
                SELECT id,
                       url,
                       known_manifest_id,
                       read_sec,
                       fetch_status_code,
                       polling_hint_sec,
                       contents,
                       error_code
                FROM manifest_fetches
                WHERE known_manifest_id = :knownManifestId
                %s
                ORDER BY read_sec DESC, id DESC
                LIMIT 1
                """.formatted(successFilter),
            new MapSqlParameterSource().addValue("knownManifestId", knownManifestId),
            MANIFEST_FETCH_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<ManifestFetch> findManifestFetches(long knownManifestId) {
        return jdbc.query(
            """
                SELECT id,
                       url,
                       known_manifest_id,
                       read_sec,
                       fetch_status_code,
                       polling_hint_sec,
                       contents,
                       error_code
                FROM manifest_fetches
                WHERE known_manifest_id = :knownManifestId
                ORDER BY id
                """,
            new MapSqlParameterSource().addValue("knownManifestId", knownManifestId),
            MANIFEST_FETCH_MAPPER
        );
    }

    public long insertManifestFetch(ManifestFetch fetch) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", fetch.url())
            .addValue("knownManifestId", fetch.knownManifestId())
            .addValue("readSec", JdbcSupport.toEpochSecond(fetch.readAt()))
            .addValue("statusCode", fetch.statusCode())
            .addValue("pollingHintSec", fetch.pollingHintSec())
            .addValue("contents", fetch.contents())
            .addValue("errorCode", fetch.errorCode());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO manifest_fetches (
                    url,
                    known_manifest_id,
                    read_sec,
                    fetch_status_code,
                    polling_hint_sec,
                    contents,
                    error_code
                )
                VALUES (
                    :url,
                    :knownManifestId,
                    :readSec,
                    :statusCode,
                    :pollingHintSec,
                    :contents,
                    :errorCode
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        return requireKey(keyHolder, "manifest_fetches");
    }

    @Transactional
    public long recordLeafFetch(LeafFetch fetch, List<UsState> states) {
        long leafFetchId = insertLeafFetch(fetch);
        for (UsState state : states) {
            insertJurisdictionTag(fetch.fileType(), leafFetchId, state);
        }
        return leafFetchId;
    }

    public long insertLeafFetch(LeafFetch fetch) {
        FileType type = fetch.fileType();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", fetch.url())
            .addValue("manifestFetchId", fetch.manifestFetchId())
            .addValue("readSec", JdbcSupport.toEpochSecond(fetch.readAt()))
            .addValue("statusCode", fetch.statusCode())
            .addValue("pollingHintSec", fetch.pollingHintSec())
            .addValue("contents", fetch.contents())
            .addValue("errorCode", fetch.errorCode());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO %s (
                    url,
                    manifest_fetch_id,
                    read_sec,
                    fetch_status_code,
                    polling_hint_sec,
                    contents,
                    error_code
                )
                VALUES (
                    :url,
                    :manifestFetchId,
                    :readSec,
                    :statusCode,
                    :pollingHintSec,
                    :contents,
                    :errorCode
                )
                """.formatted(type.fetchTable()),
            params,
            keyHolder,
            new String[]{"id"}
        );
        return requireKey(keyHolder, type.fetchTable());
    }

    public void insertJurisdictionTag(FileType type, long leafFetchId, UsState state) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("leafFetchId", leafFetchId)
            .addValue("stateId", state.id());
        jdbc.update(
            "INSERT INTO " + type.stateJoinTable() + " (" + type.stateJoinColumn() + ", state_id) "
                + "VALUES (:leafFetchId, :stateId)",
            params
        );
    }

    public List<LeafFetch> findLeafFetches(FileType type, long manifestFetchId) {
        return jdbc.query(
            """
                SELECT id,
                       url,
                       manifest_fetch_id,
                       read_sec,
                       fetch_status_code,
                       polling_hint_sec,
                       contents,
                       error_code
                FROM %s
                WHERE manifest_fetch_id = :manifestFetchId
                ORDER BY id
                """.formatted(type.fetchTable()),
            new MapSqlParameterSource().addValue("manifestFetchId", manifestFetchId),
            (rs, rowNum) -> new LeafFetch(
                rs.getLong("id"),
                type,
                rs.getString("url"),
                rs.getLong("manifest_fetch_id"),
                JdbcSupport.toInstant(rs.getLong("read_sec")),
                rs.getInt("fetch_status_code"),
                JdbcSupport.nullableLong(rs, "polling_hint_sec"),
                rs.getString("contents"),
                rs.getString("error_code")
            )
        );
    }

    public List<String> findStateCodes(FileType type, long leafFetchId) {
        return jdbc.queryForList(
            "SELECT s.name FROM " + type.stateJoinTable() + " j "
                + "JOIN states s ON s.state_id = j.state_id "
                + "WHERE j." + type.stateJoinColumn() + " = :leafFetchId "
                + "ORDER BY s.state_id",
            new MapSqlParameterSource().addValue("leafFetchId", leafFetchId),
            String.class
        );
    }

    public Map<Integer, String> findStates() {
        Map<Integer, String> states = new LinkedHashMap<>();
        jdbc.query(
            "SELECT state_id, name FROM states ORDER BY state_id",
            new MapSqlParameterSource(),
            rs -> {
                states.put(rs.getInt("state_id"), rs.getString("name"));
            }
        );
        return states;
    }

    private long requireKey(KeyHolder keyHolder, String table) {
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No generated id returned for insert into " + table);
        }
        return key.longValue();
    }

    private long countTable(String table) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0L : count;
    }
}
